package com.ryuqq.protocheck.testkit.fixture;

import com.ryuqq.protocheck.core.document.MetaBlock;
import com.ryuqq.protocheck.core.document.ProtocolDocument;
import com.ryuqq.protocheck.core.formula.PropertyFormula;
import com.ryuqq.protocheck.core.formula.Term;
import com.ryuqq.protocheck.core.model.FairnessConstraint;
import com.ryuqq.protocheck.core.model.FairnessType;
import com.ryuqq.protocheck.core.model.MachineId;
import com.ryuqq.protocheck.core.model.MachineType;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.model.StateTransition;
import com.ryuqq.protocheck.core.model.TimingConstraint;
import com.ryuqq.protocheck.core.trigger.EventTrigger;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Shared state machine fixtures for analyzer and contract tests.
 *
 * <p>Scenario fixtures (A to E) follow the reference scenarios every engine must reproduce:</p>
 * <ul>
 *   <li>A: linear chain {@code A → B → C}, final C</li>
 *   <li>B: {@code A → B}, no final states (B deadlocks)</li>
 *   <li>C: {@code A ⇄ B}, no final states (closed SCC, livelock)</li>
 *   <li>D/E: single state, no transitions</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class StateMachineFixtures {

    public static final String HOLDS_LOCK = "holds_lock";

    private StateMachineFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static EventTrigger event(String name) {
        return new EventTrigger(name);
    }

    public static ProtocolDocument document(String name) {
        return ProtocolDocument.empty(name);
    }

    public static ProtocolDocument documentInDomain(String name, String domain) {
        return ProtocolDocument.of(name, new MetaBlock(Map.of(ProtocolDocument.DOMAIN_ENTRY, domain)));
    }

    /**
     * Scenario A: {@code A → B → C}, initial A, final C.
     */
    public static ProtocolStateMachine scenarioA() {
        return ProtocolStateMachine.builder(MachineId.of("scenario-a"))
            .states("A", "B", "C")
            .initialState("A")
            .finalStates("C")
            .transition("A", "B", event("next"))
            .transition("B", "C", event("next"))
            .build();
    }

    /**
     * Scenario B: {@code A → B}, no final states.
     */
    public static ProtocolStateMachine scenarioB() {
        return ProtocolStateMachine.builder(MachineId.of("scenario-b"))
            .states("A", "B")
            .initialState("A")
            .transition("A", "B", event("next"))
            .build();
    }

    /**
     * Scenario C: {@code A → B}, {@code B → A}, no final states.
     */
    public static ProtocolStateMachine scenarioC() {
        return ProtocolStateMachine.builder(MachineId.of("scenario-c"))
            .states("A", "B")
            .initialState("A")
            .transition("A", "B", event("ping"))
            .transition("B", "A", event("pong"))
            .build();
    }

    /**
     * Scenario D: single state A, no transitions.
     */
    public static ProtocolStateMachine scenarioD() {
        return singleState("scenario-d");
    }

    /**
     * Scenario E: single state A, no transitions (compliance view of scenario D).
     */
    public static ProtocolStateMachine scenarioE() {
        return singleState("scenario-e");
    }

    private static ProtocolStateMachine singleState(String id) {
        return ProtocolStateMachine.builder(MachineId.of(id))
            .states("A")
            .initialState("A")
            .build();
    }

    /**
     * Complete digraph without self-loops over {@code S0..S(n-1)}, initial S0.
     *
     * <p>The number of elementary cycles grows factorially with n.</p>
     *
     * @param n number of states (at least 1)
     * @return complete digraph machine
     */
    public static ProtocolStateMachine completeDigraph(int n) {
        ProtocolStateMachine.Builder builder = ProtocolStateMachine.builder(MachineId.of("complete-" + n))
            .initialState("S0");
        for (int i = 0; i < n; i++) {
            builder.state("S" + i);
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    builder.transition("S" + i, "S" + j, event("to-S" + j));
                }
            }
        }
        return builder.build();
    }

    /**
     * Linear chain {@code S0 → S1 → ... → S(n-1)}, final S(n-1).
     *
     * @param n number of states (at least 1)
     * @return chain machine
     */
    public static ProtocolStateMachine chain(String id, int n) {
        ProtocolStateMachine.Builder builder = ProtocolStateMachine.builder(MachineId.of(id))
            .initialState("S0")
            .finalStates("S" + (n - 1));
        for (int i = 0; i < n; i++) {
            builder.state("S" + i);
        }
        for (int i = 0; i + 1 < n; i++) {
            builder.transition("S" + i, "S" + (i + 1), event("step"));
        }
        return builder.build();
    }

    /**
     * Structurally invalid machine: the initial state and one transition target are undeclared.
     */
    public static ProtocolStateMachine invalidMachine() {
        return ProtocolStateMachine.builder(MachineId.of("invalid"))
            .states("A", "B")
            .initialState("Z")
            .transition("A", "GHOST", event("vanish"))
            .build();
    }

    /**
     * Machine whose final state set names an undeclared state (non-blocking error).
     */
    public static ProtocolStateMachine unknownFinalState() {
        return ProtocolStateMachine.builder(MachineId.of("unknown-final"))
            .states("A", "B")
            .initialState("A")
            .finalStates("B", "NOWHERE")
            .transition("A", "B", event("next"))
            .build();
    }

    public static PropertyFormula holdsLock(String state) {
        return PropertyFormula.atom(HOLDS_LOCK, Term.constant(state, "State"));
    }

    /**
     * {@code A → B → C}, final C, with a non-temporal invariant on A and on B.
     */
    public static ProtocolStateMachine withInvariants() {
        return ProtocolStateMachine.builder(MachineId.of("invariants"))
            .states("A", "B", "C")
            .initialState("A")
            .finalStates("C")
            .transition("A", "B", event("acquire"))
            .transition("B", "C", event("release"))
            .invariant("A", holdsLock("A"))
            .invariant("B", holdsLock("B"))
            .build();
    }

    /**
     * {@code A → B}, final B, with the temporal invariant {@code □(holds_lock('A'))} on A.
     */
    public static ProtocolStateMachine withTemporalInvariant() {
        return ProtocolStateMachine.builder(MachineId.of("temporal"))
            .states("A", "B")
            .initialState("A")
            .finalStates("B")
            .transition("A", "B", event("next"))
            .invariant("A", PropertyFormula.always(holdsLock("A")))
            .build();
    }

    /**
     * {@code A → B}, {@code B → C}, {@code C → B}, {@code A → D}, final D.
     *
     * <p>The closed SCC {B, C} traps every run that takes {@code A → B}, so
     * "eventually reaches D" has the counterexample {@code [A, B, C, B]}.</p>
     */
    public static ProtocolStateMachine livelockTrap() {
        return ProtocolStateMachine.builder(MachineId.of("trap"))
            .states("A", "B", "C", "D")
            .initialState("A")
            .finalStates("D")
            .transition("A", "B", event("enter"))
            .transition("B", "C", event("spin"))
            .transition("C", "B", event("spin"))
            .transition("A", "D", event("finish"))
            .build();
    }

    /**
     * {@code A ⇄ B} with exit {@code A → C}, final C, and two fairness constraints.
     *
     * <ul>
     *   <li>WEAK "progress": element B, enabled only in C (violated by cycle [A, B])</li>
     *   <li>STRONG "service": element A, unconditionally enabled (never violated)</li>
     * </ul>
     */
    public static ProtocolStateMachine withFairness() {
        return ProtocolStateMachine.builder(MachineId.of("fairness"))
            .states("A", "B", "C")
            .initialState("A")
            .finalStates("C")
            .transition("A", "B", event("work"))
            .transition("B", "A", event("retry"))
            .transition("A", "C", event("done"))
            .fairness(new FairnessConstraint("progress", Set.of("B"), FairnessType.WEAK, Set.of("C")))
            .fairness(new FairnessConstraint("service", Set.of("A"), FairnessType.STRONG, Set.of()))
            .build();
    }

    /**
     * Deterministic machine with two equal-priority choices on the same trigger from A.
     */
    public static ProtocolStateMachine nondeterministicChoice() {
        return ProtocolStateMachine.builder(MachineId.of("choice"))
            .states("A", "B", "C")
            .initialState("A")
            .finalStates("B", "C")
            .transition("A", "B", event("go"))
            .transition("A", "C", event("go"))
            .build();
    }

    /**
     * Same choice as {@link #nondeterministicChoice()} but resolved by priority and guarded.
     */
    public static ProtocolStateMachine prioritizedChoice() {
        return ProtocolStateMachine.builder(MachineId.of("prioritized"))
            .states("A", "B", "C")
            .initialState("A")
            .finalStates("B", "C")
            .transition(StateTransition.of("A", "B", event("go")).withPriority(10)
                .withGuard(PropertyFormula.atom("ready")))
            .transition(StateTransition.of("A", "C", event("go")))
            .build();
    }

    /**
     * {@code A → B} whose timing has {@code maxDelay > deadline}.
     */
    public static ProtocolStateMachine inconsistentTiming() {
        return ProtocolStateMachine.builder(MachineId.of("timing"))
            .states("A", "B")
            .initialState("A")
            .finalStates("B")
            .transition(StateTransition.of("A", "B", event("reply"))
                .withTiming(TimingConstraint.within(Duration.ofSeconds(5), Duration.ofSeconds(2))))
            .machineType(MachineType.TIMED_AUTOMATON)
            .build();
    }
}
