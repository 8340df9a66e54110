package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.application.engine.AnalysisEngine;
import com.ryuqq.protocheck.application.engine.StateMachineConfig;
import com.ryuqq.protocheck.core.spi.Extractor;
import com.ryuqq.protocheck.core.spi.FormalVerifier;
import com.ryuqq.protocheck.core.spi.TemporalLogicSolver;
import com.ryuqq.protocheck.testkit.contract.ComplianceContractTest;
import com.ryuqq.protocheck.testkit.contract.LivenessContractTest;
import com.ryuqq.protocheck.testkit.contract.ReachabilityContractTest;
import com.ryuqq.protocheck.testkit.contract.RobustnessContractTest;
import com.ryuqq.protocheck.testkit.contract.TimeBudgetContractTest;
import org.junit.jupiter.api.Nested;

/**
 * Contract Tests for {@link DefaultAnalysisEngine}.
 *
 * <p>Runs every testkit contract suite against the default engine wired with
 * the in-memory extractor and verifier supplied by the suites.</p>
 *
 * <p><strong>Test Coverage:</strong></p>
 * <ul>
 *   <li>Reachability ({@link ReachabilityContractTest})</li>
 *   <li>Liveness, safety and fairness ({@link LivenessContractTest})</li>
 *   <li>Compliance scoring ({@link ComplianceContractTest})</li>
 *   <li>Time budget ({@link TimeBudgetContractTest})</li>
 *   <li>Robustness ({@link RobustnessContractTest})</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
class DefaultAnalysisEngineContractTest {

    private static AnalysisEngine defaultEngine(StateMachineConfig config, Extractor extractor,
                                                FormalVerifier verifier, TemporalLogicSolver solver) {
        return new DefaultAnalysisEngine(config, extractor, verifier, solver);
    }

    @Nested
    class Reachability extends ReachabilityContractTest {
        @Override
        protected AnalysisEngine createEngine(StateMachineConfig config, Extractor extractor,
                                              FormalVerifier verifier, TemporalLogicSolver solver) {
            return defaultEngine(config, extractor, verifier, solver);
        }
    }

    @Nested
    class Liveness extends LivenessContractTest {
        @Override
        protected AnalysisEngine createEngine(StateMachineConfig config, Extractor extractor,
                                              FormalVerifier verifier, TemporalLogicSolver solver) {
            return defaultEngine(config, extractor, verifier, solver);
        }
    }

    @Nested
    class Compliance extends ComplianceContractTest {
        @Override
        protected AnalysisEngine createEngine(StateMachineConfig config, Extractor extractor,
                                              FormalVerifier verifier, TemporalLogicSolver solver) {
            return defaultEngine(config, extractor, verifier, solver);
        }
    }

    @Nested
    class TimeBudget extends TimeBudgetContractTest {
        @Override
        protected AnalysisEngine createEngine(StateMachineConfig config, Extractor extractor,
                                              FormalVerifier verifier, TemporalLogicSolver solver) {
            return defaultEngine(config, extractor, verifier, solver);
        }
    }

    @Nested
    class Robustness extends RobustnessContractTest {
        @Override
        protected AnalysisEngine createEngine(StateMachineConfig config, Extractor extractor,
                                              FormalVerifier verifier, TemporalLogicSolver solver) {
            return defaultEngine(config, extractor, verifier, solver);
        }
    }
}
