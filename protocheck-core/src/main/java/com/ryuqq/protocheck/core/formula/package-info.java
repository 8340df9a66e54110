/**
 * Property formula AST.
 *
 * <p>This package defines the sealed formula hierarchy used for state invariants,
 * transition guards and verification obligations. The engine never evaluates formulas;
 * it only shapes them and forwards them to the injected oracles.</p>
 *
 * <h2>Node Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.core.formula.Atom} - Atomic proposition P(t1, ..., tn)</li>
 *   <li>{@link com.ryuqq.protocheck.core.formula.Not}, {@link com.ryuqq.protocheck.core.formula.And},
 *       {@link com.ryuqq.protocheck.core.formula.Or}, {@link com.ryuqq.protocheck.core.formula.Implies} - Propositional connectives</li>
 *   <li>{@link com.ryuqq.protocheck.core.formula.Always}, {@link com.ryuqq.protocheck.core.formula.Eventually},
 *       {@link com.ryuqq.protocheck.core.formula.Until} - Temporal operators</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.core.formula;
