/**
 * Test kit for {@link com.ryuqq.protocheck.application.engine.AnalysisEngine} implementations.
 *
 * <ul>
 *   <li>{@code fixture} - reference state machines shared by unit and contract tests</li>
 *   <li>{@code contract} - abstract JUnit 5 suites an engine must pass; subclass them with
 *       {@code @Nested} classes that supply the engine under test</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
package com.ryuqq.protocheck.testkit;
