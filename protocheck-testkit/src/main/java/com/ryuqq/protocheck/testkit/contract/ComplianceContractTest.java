package com.ryuqq.protocheck.testkit.contract;

import com.ryuqq.protocheck.application.engine.StateMachineAnalysis;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.result.ComplianceResult;
import com.ryuqq.protocheck.core.result.ProtocolViolation;
import com.ryuqq.protocheck.core.result.ViolationSeverity;
import com.ryuqq.protocheck.testkit.fixture.StateMachineFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

/**
 * Contract Test: rule-based compliance scoring and feature detection.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Scenario E: single state without transitions scores 0.6</li>
 *   <li>Compliant machines score 1.0</li>
 *   <li>Timing and determinism rules</li>
 *   <li>Per-machine results are merged into one document-level result</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public abstract class ComplianceContractTest extends AbstractAnalysisContractTest {

    @Test
    void testCompliance_SingleStateNoTransitions_TwoViolationsScore06() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.scenarioE();

        // When
        ComplianceResult result = analyze(machine).protocolCompliance();

        // Then
        assertThat(result.violations())
            .extracting(ProtocolViolation::rule, ProtocolViolation::severity)
            .containsExactly(
                tuple("minimum_complexity", ViolationSeverity.LOW),
                tuple("connectivity", ViolationSeverity.MEDIUM));
        assertThat(result.complianceScore()).isCloseTo(0.6, within(1e-9));
        assertThat(result.compliant()).isFalse();
    }

    @Test
    void testCompliance_WellFormedChain_CompliantWithFullScore() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.scenarioA();

        // When
        ComplianceResult result = analyze(machine).protocolCompliance();

        // Then
        assertThat(result.compliant()).isTrue();
        assertThat(result.complianceScore()).isEqualTo(1.0);
        assertThat(result.supportedFeatures()).contains("state_machines", "transitions", "final_states");
        assertThat(result.missingFeatures()).contains("guards", "fairness_constraints");
    }

    @Test
    void testCompliance_InconsistentTiming_HighSeverity() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.inconsistentTiming();

        // When
        ComplianceResult result = analyze(machine).protocolCompliance();

        // Then
        assertThat(result.violations())
            .extracting(ProtocolViolation::rule, ProtocolViolation::severity)
            .containsExactly(tuple("timing_consistency", ViolationSeverity.HIGH));
        assertThat(result.complianceScore()).isCloseTo(0.4, within(1e-9));
        assertThat(result.supportedFeatures()).contains("timing_constraints");
    }

    @Test
    void testCompliance_EqualPriorityChoice_DeterminismViolation() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.nondeterministicChoice();

        // When
        ComplianceResult result = analyze(machine).protocolCompliance();

        // Then
        assertThat(result.violations())
            .extracting(ProtocolViolation::rule)
            .containsExactly("determinism");
    }

    @Test
    void testCompliance_PriorityResolvedChoice_Compliant() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.prioritizedChoice();

        // When
        ComplianceResult result = analyze(machine).protocolCompliance();

        // Then
        assertThat(result.compliant()).isTrue();
        assertThat(result.supportedFeatures()).contains("priorities", "guards");
    }

    @Test
    void testCompliance_MultipleMachines_MergedAndRescored() {
        // Given
        ProtocolStateMachine compliant = StateMachineFixtures.scenarioA();
        ProtocolStateMachine degenerate = StateMachineFixtures.scenarioE();
        ProtocolStateMachine fair = StateMachineFixtures.withFairness();

        // When
        StateMachineAnalysis analysis = analyze(compliant, degenerate, fair);

        // Then
        ComplianceResult result = analysis.protocolCompliance();
        assertThat(result.violations()).hasSize(2);
        assertThat(result.complianceScore()).isCloseTo(0.6, within(1e-9));
        assertThat(result.supportedFeatures()).contains("fairness_constraints", "final_states");
        assertThat(result.missingFeatures()).doesNotContainAnyElementsOf(result.supportedFeatures());
    }

    @Test
    void testCompliance_Score_AlwaysWithinUnitInterval() {
        // Given: four degenerate machines accumulate more than 1.0 of penalty
        ProtocolStateMachine[] machines = {
            StateMachineFixtures.scenarioD(),
            StateMachineFixtures.scenarioE(),
            StateMachineFixtures.inconsistentTiming(),
            StateMachineFixtures.nondeterministicChoice()
        };

        // When
        ComplianceResult result = analyze(machines).protocolCompliance();

        // Then
        assertThat(result.complianceScore()).isBetween(0.0, 1.0);
        assertThat(result.complianceScore()).isEqualTo(0.0);
        assertThat(result.compliant()).isEqualTo(result.violations().isEmpty());
    }
}
