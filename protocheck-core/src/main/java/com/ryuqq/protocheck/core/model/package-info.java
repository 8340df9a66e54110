/**
 * Core domain model package containing the automaton data type and its value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.model.MachineId} - State machine identifier</li>
 *   <li>{@link com.ryuqq.protocheck.core.model.StateTransition} - Transition with trigger, guard, priority and timing</li>
 *   <li>{@link com.ryuqq.protocheck.core.model.TimingConstraint} - Optional min/max delay and deadline</li>
 *   <li>{@link com.ryuqq.protocheck.core.model.FairnessConstraint} - Structural fairness declaration</li>
 * </ul>
 *
 * <h2>Aggregate</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.model.ProtocolStateMachine} - Immutable automaton with structural validation</li>
 * </ul>
 *
 * <h2>Structural Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.model.StructuralError} - Invariant violation reported as a value</li>
 *   <li>{@link com.ryuqq.protocheck.core.model.StructuralException} - Raised by analyzers handed an invalid machine</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All model objects are immutable after construction</li>
 *   <li><strong>Determinism:</strong> Insertion-ordered collections make traversal order reproducible</li>
 *   <li><strong>Report, don't crash:</strong> Invalid machines are representable and validated into errors</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.core.model;
