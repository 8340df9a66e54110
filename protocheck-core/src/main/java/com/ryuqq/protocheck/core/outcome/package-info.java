/**
 * Verification obligation and outcome package.
 *
 * <p>This package defines what the engine sends to an oracle
 * ({@link com.ryuqq.protocheck.core.outcome.VerificationObligation}) and the sealed result it gets back.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.outcome.VerificationOutcome} - Sealed interface (permits Proof, VerificationFailure)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.outcome.Proof} - Obligation discharged</li>
 *   <li>{@link com.ryuqq.protocheck.core.outcome.VerificationFailure} - Refuted, unknown, unsupported, timed out or errored</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>No retries:</strong> A failed obligation is recorded as unverified with its reason</li>
 *   <li><strong>Refutation only:</strong> Only {@code REFUTED} produces a violation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.core.outcome;
