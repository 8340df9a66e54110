/**
 * Service Provider Interfaces for the analysis engine's external collaborators.
 *
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.spi.Extractor} - Document to state machines</li>
 *   <li>{@link com.ryuqq.protocheck.core.spi.FormalVerifier} - Safety and liveness oracle</li>
 *   <li>{@link com.ryuqq.protocheck.core.spi.TemporalLogicSolver} - Optional oracle for temporal formulas</li>
 * </ul>
 *
 * <p>No-op oracles live in {@code spi.noop} for development and for engines run
 * without a prover.</p>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.core.spi;
