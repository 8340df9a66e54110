package com.ryuqq.protocheck.core.spi;

import com.ryuqq.protocheck.core.outcome.VerificationObligation;
import com.ryuqq.protocheck.core.outcome.VerificationOutcome;

/**
 * Temporal logic solver SPI (optional).
 *
 * <p>Receives obligations whose formula contains a temporal operator
 * ({@code □}, {@code ◇}, {@code U}). When no solver is configured the engine records
 * such obligations as unverified with reason {@code UNSUPPORTED}.</p>
 *
 * <p>The outcome contract and threading requirements are those of {@link FormalVerifier}.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public interface TemporalLogicSolver {

    /**
     * Solves one temporal obligation.
     *
     * @param obligation the obligation whose formula is temporal
     * @return the verification outcome, never null
     * @throws IllegalArgumentException if obligation is null
     */
    VerificationOutcome solve(VerificationObligation obligation);
}
