package com.ryuqq.protocheck.core.spi.noop;

import com.ryuqq.protocheck.core.outcome.FailureReason;
import com.ryuqq.protocheck.core.outcome.VerificationFailure;
import com.ryuqq.protocheck.core.outcome.VerificationObligation;
import com.ryuqq.protocheck.core.outcome.VerificationOutcome;
import com.ryuqq.protocheck.core.spi.FormalVerifier;

/**
 * FormalVerifier NoOp 구현.
 *
 * <p>어떤 의무도 판정하지 않습니다. 증명기 없이 그래프 분석만 실행할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>verifyProperty(): 항상 {@link FailureReason#UNKNOWN} 반환</li>
 * </ul>
 *
 * <p>활성 성질은 그래프에서 반례를 찾은 경우 REFUTED, 그 외에는 UNVERIFIED로 보고됩니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class NoOpFormalVerifier implements FormalVerifier {

    @Override
    public VerificationOutcome verifyProperty(VerificationObligation obligation) {
        if (obligation == null) {
            throw new IllegalArgumentException("obligation cannot be null");
        }
        return VerificationFailure.unknown(obligation.obligationId(), "no formal verifier configured");
    }
}
