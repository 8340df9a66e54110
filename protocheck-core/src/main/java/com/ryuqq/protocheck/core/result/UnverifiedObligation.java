package com.ryuqq.protocheck.core.result;

import com.ryuqq.protocheck.core.outcome.FailureReason;
import com.ryuqq.protocheck.core.outcome.VerificationObligation;

/**
 * 판정되지 않은 검증 의무.
 *
 * <p>오라클이 UNKNOWN, UNSUPPORTED, TIMEOUT, ERROR를 반환했거나 예외를 던진 경우입니다.
 * 재시도하지 않고 사유와 함께 기록됩니다.</p>
 *
 * @param obligation 의무
 * @param reason 실패 사유
 * @param message 오라클 메시지 또는 예외 메시지
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record UnverifiedObligation(
    VerificationObligation obligation,
    FailureReason reason,
    String message
) {

    public UnverifiedObligation {
        if (obligation == null) {
            throw new IllegalArgumentException("obligation cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (reason == FailureReason.REFUTED) {
            throw new IllegalArgumentException("a refuted obligation is a violation, not unverified");
        }
        if (message == null) {
            message = reason.name();
        }
    }
}
