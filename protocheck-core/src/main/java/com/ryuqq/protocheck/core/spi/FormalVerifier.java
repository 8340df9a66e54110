package com.ryuqq.protocheck.core.spi;

import com.ryuqq.protocheck.core.outcome.VerificationObligation;
import com.ryuqq.protocheck.core.outcome.VerificationOutcome;

/**
 * Formal verification oracle SPI.
 *
 * <p>Discharges safety and liveness obligations shaped by the liveness analyzer. The
 * engine never interprets formulas itself; it only forwards them here.</p>
 *
 * <p><strong>Outcome Contract:</strong></p>
 * <ul>
 *   <li>{@code Proof}: the obligation holds</li>
 *   <li>{@code VerificationFailure(REFUTED)}: the obligation is false; a counterexample
 *       trace should be attached when available</li>
 *   <li>{@code VerificationFailure(UNKNOWN | UNSUPPORTED | TIMEOUT | ERROR)}: undecided;
 *       the engine records the obligation as unverified</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: one verifier instance is shared by all analysis calls of an engine</li>
 *   <li>Bounded: implementations should enforce their own time limit and answer
 *       {@code TIMEOUT} rather than block indefinitely</li>
 *   <li>No retries are expected; a thrown exception is recorded as {@code ERROR}</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public interface FormalVerifier {

    /**
     * Verifies one obligation.
     *
     * @param obligation the obligation (formula plus machine, state, kind and witness trace)
     * @return the verification outcome, never null
     * @throws IllegalArgumentException if obligation is null
     */
    VerificationOutcome verifyProperty(VerificationObligation obligation);
}
