/**
 * Analysis result package.
 *
 * <p>Immutable per-machine results produced by the analyzers and the typed warnings
 * attached to an analysis. Every result is freshly allocated per call.</p>
 *
 * <h2>Per-Machine Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.result.ReachabilityResult} - BFS distances, witness paths, SCCs, bounded cycles</li>
 *   <li>{@link com.ryuqq.protocheck.core.result.LivenessResult} - Deadlocks, livelocks, safety, liveness, fairness</li>
 *   <li>{@link com.ryuqq.protocheck.core.result.ComplianceResult} - Rule-based score, mergeable across machines</li>
 *   <li>{@link com.ryuqq.protocheck.core.result.PerformanceMetrics} - Size and complexity, aggregatable</li>
 * </ul>
 *
 * <h2>Warnings</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.result.AnalysisWarning} - Non-fatal problem with its {@link com.ryuqq.protocheck.core.result.WarningKind}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.core.result;
