/**
 * Engine phase state machine and cooperative cancellation.
 *
 * <p>Each {@code analyzeDocument} call walks {@link com.ryuqq.protocheck.core.phase.AnalysisPhase}
 * forward only, validated by {@link com.ryuqq.protocheck.core.phase.PhaseTransition}, and polls a
 * {@link com.ryuqq.protocheck.core.phase.Deadline} at phase boundaries.</p>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.core.phase;
