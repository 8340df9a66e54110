package com.ryuqq.protocheck.testkit.contract;

import com.ryuqq.protocheck.adapter.inmemory.extractor.InMemoryExtractor;
import com.ryuqq.protocheck.adapter.inmemory.verifier.InMemoryFormalVerifier;
import com.ryuqq.protocheck.application.engine.AnalysisEngine;
import com.ryuqq.protocheck.application.engine.StateMachineAnalysis;
import com.ryuqq.protocheck.application.engine.StateMachineConfig;
import com.ryuqq.protocheck.core.document.ProtocolDocument;
import com.ryuqq.protocheck.core.model.MachineId;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.phase.AnalysisPhase;
import com.ryuqq.protocheck.core.result.LivenessResult;
import com.ryuqq.protocheck.core.result.ReachabilityResult;
import com.ryuqq.protocheck.core.result.WarningKind;
import com.ryuqq.protocheck.core.spi.Extractor;
import com.ryuqq.protocheck.core.spi.FormalVerifier;
import com.ryuqq.protocheck.core.spi.TemporalLogicSolver;
import com.ryuqq.protocheck.testkit.fixture.StateMachineFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract base class for {@link AnalysisEngine} contract tests.
 *
 * <p>Implementations provide the engine under test through
 * {@link #createEngine(StateMachineConfig, Extractor, FormalVerifier, TemporalLogicSolver)};
 * the base class supplies in-memory collaborators and helper assertions.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryExtractor: document name to registered machines</li>
 *   <li>InMemoryFormalVerifier: scripted oracle, also used as the temporal logic solver</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyEngineContractTest {
 *     {@literal @}Nested
 *     class Reachability extends ReachabilityContractTest {
 *         {@literal @}Override
 *         protected AnalysisEngine createEngine(StateMachineConfig config, Extractor extractor,
 *                                               FormalVerifier verifier, TemporalLogicSolver solver) {
 *             return new MyEngine(config, extractor, verifier, solver);
 *         }
 *     }
 * }
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public abstract class AbstractAnalysisContractTest {

    private final AtomicInteger documentSequence = new AtomicInteger();

    protected InMemoryExtractor extractor;
    protected InMemoryFormalVerifier verifier;

    /**
     * Creates the engine under test.
     *
     * @param config analysis configuration
     * @param extractor machine extractor
     * @param verifier formal verifier
     * @param solver temporal logic solver, may be null
     * @return engine under test
     */
    protected abstract AnalysisEngine createEngine(StateMachineConfig config, Extractor extractor,
                                                   FormalVerifier verifier, TemporalLogicSolver solver);

    @BeforeEach
    protected void setUpCollaborators() {
        extractor = new InMemoryExtractor();
        verifier = new InMemoryFormalVerifier();
    }

    @AfterEach
    protected void tearDownCollaborators() {
        if (extractor != null) {
            extractor.clear();
        }
        if (verifier != null) {
            verifier.reset();
        }
    }

    /**
     * Registers the machines under a fresh document name and analyzes that document.
     *
     * @param config analysis configuration
     * @param machines machines the extractor returns
     * @return analysis result
     */
    protected StateMachineAnalysis analyze(StateMachineConfig config, ProtocolStateMachine... machines) {
        return engine(config).analyzeDocument(registerDocument(machines));
    }

    /**
     * Same as {@link #analyze(StateMachineConfig, ProtocolStateMachine...)} with default configuration.
     */
    protected StateMachineAnalysis analyze(ProtocolStateMachine... machines) {
        return analyze(new StateMachineConfig(), machines);
    }

    protected AnalysisEngine engine(StateMachineConfig config) {
        return createEngine(config, extractor, verifier, verifier);
    }

    protected ProtocolDocument registerDocument(ProtocolStateMachine... machines) {
        String name = "contract-doc-" + documentSequence.incrementAndGet();
        extractor.register(name, machines);
        return StateMachineFixtures.document(name);
    }

    protected ReachabilityResult reachabilityOf(StateMachineAnalysis analysis, ProtocolStateMachine machine) {
        ReachabilityResult result = analysis.reachability().get(machine.getId());
        assertThat(result)
            .as("reachability result for %s", machine.getId())
            .isNotNull();
        return result;
    }

    protected LivenessResult livenessOf(StateMachineAnalysis analysis, ProtocolStateMachine machine) {
        LivenessResult result = analysis.livenessAnalysis().get(machine.getId());
        assertThat(result)
            .as("liveness result for %s", machine.getId())
            .isNotNull();
        return result;
    }

    protected void assertCompleted(StateMachineAnalysis analysis) {
        assertThat(analysis.finalPhase())
            .as("final phase (warnings: %s)", analysis.warnings())
            .isEqualTo(AnalysisPhase.DONE);
    }

    protected void assertWarning(StateMachineAnalysis analysis, WarningKind kind) {
        assertThat(analysis.hasWarning(kind))
            .as("expected %s warning in %s", kind, analysis.warnings())
            .isTrue();
    }

    protected void assertWarning(StateMachineAnalysis analysis, WarningKind kind, MachineId machineId) {
        assertThat(analysis.warningsOf(kind))
            .as("expected %s warning for %s in %s", kind, machineId, analysis.warnings())
            .anyMatch(warning -> warning.machine().filter(machineId::equals).isPresent());
    }

    protected void assertNoWarning(StateMachineAnalysis analysis, WarningKind kind) {
        assertThat(analysis.hasWarning(kind))
            .as("unexpected %s warning in %s", kind, analysis.warnings())
            .isFalse();
    }
}
