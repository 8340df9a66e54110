/**
 * Analysis engine port, configuration and aggregate result.
 *
 * <h2>Port</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.application.engine.AnalysisEngine} - Document in, analysis out</li>
 * </ul>
 *
 * <h2>Configuration and Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.application.engine.StateMachineConfig} - Immutable, validated engine settings</li>
 *   <li>{@link com.ryuqq.protocheck.application.engine.StateMachineAnalysis} - Per-call aggregate result</li>
 *   <li>{@link com.ryuqq.protocheck.application.engine.AnalysisStatistics} - Caller-owned atomic accumulator</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.application.engine;
