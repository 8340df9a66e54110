package com.ryuqq.protocheck.core.spi.noop;

import com.ryuqq.protocheck.core.outcome.FailureReason;
import com.ryuqq.protocheck.core.outcome.VerificationFailure;
import com.ryuqq.protocheck.core.outcome.VerificationObligation;
import com.ryuqq.protocheck.core.outcome.VerificationOutcome;
import com.ryuqq.protocheck.core.spi.TemporalLogicSolver;

/**
 * TemporalLogicSolver NoOp 구현.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>solve(): 항상 {@link FailureReason#UNSUPPORTED} 반환</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class NoOpTemporalLogicSolver implements TemporalLogicSolver {

    @Override
    public VerificationOutcome solve(VerificationObligation obligation) {
        if (obligation == null) {
            throw new IllegalArgumentException("obligation cannot be null");
        }
        return VerificationFailure.of(obligation.obligationId(), FailureReason.UNSUPPORTED,
            "temporal formula not supported: " + obligation.formula().render());
    }
}
