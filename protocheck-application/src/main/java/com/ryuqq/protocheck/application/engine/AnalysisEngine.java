package com.ryuqq.protocheck.application.engine;

import com.ryuqq.protocheck.core.document.ProtocolDocument;

/**
 * Protocol state-machine analysis engine.
 *
 * <p>Extracts the automata a document declares and runs the analyzers over them in
 * dependency order, enforcing the configured time and state-space bounds.</p>
 *
 * <p><strong>Analysis Flow:</strong></p>
 * <pre>
 * IDLE
 *   ↓ extract (Extractor) and validate each machine
 * EXTRACTING
 *   ↓ per phase, over every valid machine
 * REACHABILITY → LIVENESS → COMPLIANCE → PERFORMANCE   (disabled phases are skipped)
 *   ↓
 * AGGREGATING → DONE
 *
 * timeout or extraction failure → ABORTED (partial result)
 * </pre>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Structurally invalid machine → STRUCTURAL_ERROR warning, machine skipped</li>
 *   <li>Analyzer exception for one machine → ANALYSIS_ERROR warning, siblings continue</li>
 *   <li>Oracle failure → obligation recorded as unverified, never retried</li>
 *   <li>Timeout → TIMEOUT warning, final phase ABORTED, partial result returned</li>
 * </ul>
 *
 * <p><strong>Threading:</strong> implementations hold only configuration and oracle
 * handles, so one engine may serve concurrent calls.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * AnalysisEngine engine = new DefaultAnalysisEngine(new StateMachineConfig(), extractor, verifier);
 * StateMachineAnalysis analysis = engine.analyzeDocument(document);
 *
 * if (!analysis.isComplete()) {
 *     log.warn("partial analysis: {}", analysis.warnings());
 * }
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public interface AnalysisEngine {

    /**
     * Analyzes every state machine declared by a document.
     *
     * @param document the parsed protocol document
     * @return the analysis, never null; never throws for bad machines or failing oracles
     * @throws IllegalArgumentException if document is null
     */
    StateMachineAnalysis analyzeDocument(ProtocolDocument document);

    /**
     * Analyzes a document and records the outcome in caller-owned statistics.
     *
     * @param document the parsed protocol document
     * @param statistics accumulator updated atomically after the analysis
     * @return the analysis, never null
     * @throws IllegalArgumentException if document or statistics is null
     */
    StateMachineAnalysis analyzeDocument(ProtocolDocument document, AnalysisStatistics statistics);

    /**
     * Returns the engine configuration.
     *
     * @return the immutable configuration
     */
    StateMachineConfig getConfig();
}
