package com.ryuqq.protocheck.testkit.contract;

import com.ryuqq.protocheck.application.engine.StateMachineAnalysis;
import com.ryuqq.protocheck.application.engine.StateMachineConfig;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.model.StateTransition;
import com.ryuqq.protocheck.core.result.ReachabilityResult;
import com.ryuqq.protocheck.core.result.WarningKind;
import com.ryuqq.protocheck.testkit.fixture.StateMachineFixtures;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: reachability, distances, SCCs and bounded cycle enumeration.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Scenario A: linear chain distances</li>
 *   <li>Witness paths realise the reported distances</li>
 *   <li>Reachable and unreachable sets partition the states</li>
 *   <li>Cycle enumeration on a complete digraph stops at the cap</li>
 *   <li>Invalid machines do not prevent analysis of valid siblings</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public abstract class ReachabilityContractTest extends AbstractAnalysisContractTest {

    @Test
    void testReachability_LinearChain_DistancesFromInitialState() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.scenarioA();

        // When
        StateMachineAnalysis analysis = analyze(machine);

        // Then
        assertCompleted(analysis);
        ReachabilityResult result = reachabilityOf(analysis, machine);
        assertThat(result.reachableStates()).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(result.unreachableStates()).isEmpty();
        assertThat(result.stateDistances()).containsExactlyInAnyOrderEntriesOf(Map.of("A", 0, "B", 1, "C", 2));
        assertThat(result.witnessPathTo("C")).containsExactly("A", "B", "C");
    }

    @Test
    void testReachability_WitnessPath_HasExactlyDistanceTransitions() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.livelockTrap();

        // When
        ReachabilityResult result = reachabilityOf(analyze(machine), machine);

        // Then: every witness path starts at the initial state and follows real transitions
        for (String state : result.reachableStates()) {
            List<String> path = result.witnessPathTo(state);
            assertThat(path).hasSize(result.stateDistances().get(state) + 1);
            assertThat(path.get(0)).isEqualTo(machine.getInitialState());
            assertThat(path.get(path.size() - 1)).isEqualTo(state);
            for (int i = 0; i + 1 < path.size(); i++) {
                String from = path.get(i);
                String to = path.get(i + 1);
                assertThat(machine.outgoing(from))
                    .extracting(StateTransition::toState)
                    .as("edge %s -> %s", from, to)
                    .contains(to);
            }
        }
    }

    @Test
    void testReachability_UnreachableStates_PartitionDeclaredStates() {
        // Given: D is declared but nothing leads to it
        ProtocolStateMachine machine = StateMachineFixtures.scenarioA().toBuilder()
            .state("D")
            .transition("D", "A", StateMachineFixtures.event("restart"))
            .build();

        // When
        ReachabilityResult result = reachabilityOf(analyze(machine), machine);

        // Then
        assertThat(result.unreachableStates()).containsExactly("D");
        assertThat(result.reachableStates()).doesNotContainAnyElementsOf(result.unreachableStates());
        Set<String> union = new HashSet<>(result.reachableStates());
        union.addAll(result.unreachableStates());
        assertThat(union).isEqualTo(machine.getStates());
        assertThat(result.reachabilityGraph()).doesNotContainKey("D");
    }

    @Test
    void testReachability_SingleState_OnlyInitialReachable() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.scenarioD();

        // When
        ReachabilityResult result = reachabilityOf(analyze(machine), machine);

        // Then
        assertThat(result.reachableStates()).containsExactly("A");
        assertThat(result.stateDistances()).containsExactlyEntriesOf(Map.of("A", 0));
        assertThat(result.cycles()).isEmpty();
    }

    @Test
    void testReachability_TwoStateLoop_SingleComponentAndCycle() {
        // Given
        ProtocolStateMachine machine = StateMachineFixtures.scenarioC();

        // When
        ReachabilityResult result = reachabilityOf(analyze(machine), machine);

        // Then
        assertThat(result.stronglyConnectedComponents()).containsExactly(List.of("A", "B"));
        assertThat(result.cycles()).containsExactly(List.of("A", "B"));
        assertThat(result.cyclesTruncated()).isFalse();
    }

    @Test
    void testReachability_CompleteDigraphWithSmallCap_TruncatesWithWarning() {
        // Given: K6 has hundreds of elementary cycles
        ProtocolStateMachine machine = StateMachineFixtures.completeDigraph(6);
        StateMachineConfig config = new StateMachineConfig().withMaxStateSpace(10);

        // When
        StateMachineAnalysis analysis = analyze(config, machine);

        // Then
        ReachabilityResult result = reachabilityOf(analysis, machine);
        assertThat(result.cyclesTruncated()).isTrue();
        assertThat(result.cycles()).hasSize(10);
        assertWarning(analysis, WarningKind.RESOURCE_BOUND_EXCEEDED, machine.getId());
        assertCompleted(analysis);
    }

    @Test
    void testReachability_InvalidSibling_ValidMachineStillAnalyzed() {
        // Given
        ProtocolStateMachine invalid = StateMachineFixtures.invalidMachine();
        ProtocolStateMachine valid = StateMachineFixtures.scenarioA();

        // When
        StateMachineAnalysis analysis = analyze(invalid, valid);

        // Then
        assertCompleted(analysis);
        assertWarning(analysis, WarningKind.STRUCTURAL_ERROR, invalid.getId());
        assertThat(analysis.reachability()).containsOnlyKeys(valid.getId());
        assertThat(analysis.stateMachines()).containsExactly(invalid, valid);
    }

    @Test
    void testReachability_Disabled_LivenessSkippedWithWarning() {
        // Given
        StateMachineConfig config = new StateMachineConfig().withEnableReachability(false);

        // When
        StateMachineAnalysis analysis = analyze(config, StateMachineFixtures.scenarioB());

        // Then
        assertCompleted(analysis);
        assertThat(analysis.reachability()).isEmpty();
        assertThat(analysis.livenessAnalysis()).isEmpty();
        assertWarning(analysis, WarningKind.PHASE_SKIPPED);
    }
}
