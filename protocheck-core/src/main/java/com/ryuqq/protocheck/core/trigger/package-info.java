/**
 * Transition trigger package.
 *
 * <p>{@link com.ryuqq.protocheck.core.trigger.TransitionTrigger} is a sealed interface with one
 * record per trigger kind (event, timeout, condition, signal, completion, error). Value equality
 * of the records makes {@code (fromState, trigger)} usable as a grouping key for priority ordering.</p>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.core.trigger;
