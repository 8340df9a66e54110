package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.core.model.MachineType;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.model.StateTransition;
import com.ryuqq.protocheck.core.result.ComplianceResult;
import com.ryuqq.protocheck.core.result.ProtocolViolation;
import com.ryuqq.protocheck.core.result.ViolationSeverity;
import com.ryuqq.protocheck.core.trigger.TransitionTrigger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 프로토콜 준수(compliance) 검사기.
 *
 * <p>도달성과 무관하게 구조 규칙만으로 점수를 매깁니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>{@code minimum_complexity}: 상태가 2개 이상 (위반 시 LOW)</li>
 *   <li>{@code connectivity}: 전이가 1개 이상 (위반 시 MEDIUM)</li>
 *   <li>{@code timing_consistency}: {@code minDelay <= maxDelay <= deadline} (위반 전이마다 HIGH)</li>
 *   <li>{@code determinism}: DETERMINISTIC_FINITE 기계에서 (from, trigger, priority)가 같은 전이 없음 (위반 시 MEDIUM)</li>
 * </ul>
 *
 * <p>점수는 {@link ComplianceResult#scoreOf(List)}로 계산합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class ComplianceChecker {

    public static final String MINIMUM_COMPLEXITY = "minimum_complexity";
    public static final String CONNECTIVITY = "connectivity";
    public static final String TIMING_CONSISTENCY = "timing_consistency";
    public static final String DETERMINISM = "determinism";

    /**
     * 준수 검사.
     *
     * @param machine 상태 기계
     * @return ComplianceResult
     * @throws IllegalArgumentException machine이 null인 경우
     */
    public ComplianceResult check(ProtocolStateMachine machine) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        List<ProtocolViolation> violations = new ArrayList<>();

        if (machine.getStates().size() < 2) {
            violations.add(new ProtocolViolation(machine.getId(), MINIMUM_COMPLEXITY,
                "State machine should have at least 2 states",
                List.copyOf(machine.getStates()), ViolationSeverity.LOW));
        }

        if (machine.getTransitions().isEmpty()) {
            violations.add(new ProtocolViolation(machine.getId(), CONNECTIVITY,
                "State machine should have transitions",
                List.of(machine.getInitialState()), ViolationSeverity.MEDIUM));
        }

        for (StateTransition transition : machine.getTransitions()) {
            if (transition.timing() != null && !transition.timing().isConsistent()) {
                violations.add(new ProtocolViolation(machine.getId(), TIMING_CONSISTENCY,
                    "Inconsistent timing on " + transition.id() + ": " + transition.timing(),
                    List.of(transition.fromState(), transition.toState()), ViolationSeverity.HIGH));
            }
        }

        if (machine.getMachineType() == MachineType.DETERMINISTIC_FINITE) {
            checkDeterminism(machine, violations);
        }

        return ComplianceResult.of(violations, detectFeatures(machine));
    }

    private void checkDeterminism(ProtocolStateMachine machine, List<ProtocolViolation> violations) {
        Map<Choice, List<StateTransition>> groups = new LinkedHashMap<>();
        for (StateTransition transition : machine.getTransitions()) {
            Choice key = new Choice(transition.fromState(), transition.trigger(), transition.priority());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(transition);
        }
        groups.forEach((choice, transitions) -> {
            if (transitions.size() < 2) {
                return;
            }
            Set<String> states = new LinkedHashSet<>();
            states.add(choice.fromState());
            transitions.forEach(transition -> states.add(transition.toState()));
            violations.add(new ProtocolViolation(machine.getId(), DETERMINISM,
                String.format("%d transitions from '%s' on %s share priority %d",
                    transitions.size(), choice.fromState(), choice.trigger().describe(), choice.priority()),
                List.copyOf(states), ViolationSeverity.MEDIUM));
        });
    }

    private Set<String> detectFeatures(ProtocolStateMachine machine) {
        Set<String> features = new LinkedHashSet<>();
        features.add("state_machines");
        List<StateTransition> transitions = machine.getTransitions();
        if (!transitions.isEmpty()) {
            features.add("transitions");
        }
        if (!machine.getFinalStates().isEmpty()) {
            features.add("final_states");
        }
        if (!machine.getTransitionConditions().isEmpty()
            || transitions.stream().map(StateTransition::guard).anyMatch(Objects::nonNull)) {
            features.add("guards");
        }
        if (transitions.stream().map(StateTransition::timing).anyMatch(Objects::nonNull)) {
            features.add("timing_constraints");
        }
        if (!machine.getStateInvariants().isEmpty()) {
            features.add("state_invariants");
        }
        if (!machine.getFairnessConstraints().isEmpty()) {
            features.add("fairness_constraints");
        }
        if (transitions.stream().anyMatch(transition -> transition.priority() > StateTransition.MIN_PRIORITY)) {
            features.add("priorities");
        }
        return features;
    }

    private record Choice(String fromState, TransitionTrigger trigger, int priority) {
    }
}
