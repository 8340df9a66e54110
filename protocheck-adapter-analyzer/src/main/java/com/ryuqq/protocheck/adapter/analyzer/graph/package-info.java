/**
 * Graph algorithms over a {@link com.ryuqq.protocheck.core.model.ProtocolStateMachine}.
 *
 * <p>All algorithms are iterative and operate on the integer-indexed
 * {@link com.ryuqq.protocheck.adapter.analyzer.graph.StateGraph}:</p>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.graph.TarjanScc} - strongly connected components</li>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.graph.ElementaryCycles} - bounded Johnson enumeration</li>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.graph.Condensation} - longest path of the condensation DAG</li>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.graph.WeakComponents} - union-find component count</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
package com.ryuqq.protocheck.adapter.analyzer.graph;
