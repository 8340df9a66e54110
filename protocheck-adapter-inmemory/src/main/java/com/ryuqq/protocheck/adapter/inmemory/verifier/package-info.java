/**
 * Scripted in-memory verification oracle.
 *
 * <p>{@link com.ryuqq.protocheck.adapter.inmemory.verifier.InMemoryFormalVerifier} answers
 * obligations from rules keyed by rendered formula or obligation kind and records every call.
 * It is not a prover.</p>
 *
 * @see com.ryuqq.protocheck.core.spi.FormalVerifier
 * @see com.ryuqq.protocheck.core.spi.TemporalLogicSolver
 * @author Protocheck Team
 * @since 1.0.0
 */
package com.ryuqq.protocheck.adapter.inmemory.verifier;
