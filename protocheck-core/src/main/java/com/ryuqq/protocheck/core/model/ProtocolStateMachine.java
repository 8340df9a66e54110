package com.ryuqq.protocheck.core.model;

import com.ryuqq.protocheck.core.formula.PropertyFormula;
import com.ryuqq.protocheck.core.trigger.TransitionTrigger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 분석 대상 프로토콜 상태 머신.
 *
 * <p>Extractor가 분석 요청마다 한 번 생성하며, 이후에는 불변입니다.
 * 모든 컬렉션은 방어적으로 복사되고 삽입 순서를 유지하여 분석 결과가 결정적이 됩니다.</p>
 *
 * <p><strong>구조 불변식</strong> (분석 전 {@link #validate()}로 확인):</p>
 * <ol>
 *   <li>initialState ∈ states</li>
 *   <li>모든 전이의 fromState, toState ∈ states</li>
 *   <li>finalStates ⊆ states</li>
 *   <li>같은 (fromState, trigger)를 공유하는 전이는 priority 내림차순, 그다음 선언 순서로 정렬
 *       ({@link #outgoing(String)}이 보장)</li>
 * </ol>
 *
 * <p>생성자는 null만 거부합니다. 불변식을 위반한 머신도 표현 가능해야
 * 호출자를 중단시키지 않고 구조 오류로 보고할 수 있기 때문입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProtocolStateMachine machine = ProtocolStateMachine.builder(MachineId.of("handshake"))
 *     .states("Idle", "Syn", "Established")
 *     .initialState("Idle")
 *     .finalStates("Established")
 *     .transition("Idle", "Syn", new EventTrigger("syn"))
 *     .transition("Syn", "Established", new EventTrigger("ack"))
 *     .build();
 *
 * List&lt;StructuralError&gt; errors = machine.validate(); // 비어 있음
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class ProtocolStateMachine {

    private static final Comparator<StateTransition> BY_PRIORITY_DESC =
        Comparator.comparingInt(StateTransition::priority).reversed();

    private final MachineId id;
    private final String name;
    private final Set<String> states;
    private final String initialState;
    private final Set<String> finalStates;
    private final List<StateTransition> transitions;
    private final Map<String, List<PropertyFormula>> stateInvariants;
    private final Map<String, PropertyFormula> transitionConditions;
    private final List<FairnessConstraint> fairnessConstraints;
    private final MachineType machineType;
    private final String protocolDomain;
    private final Map<String, List<StateTransition>> outgoingByState;

    private ProtocolStateMachine(Builder builder) {
        if (builder.initialState == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id.getValue();
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(builder.states));
        this.initialState = builder.initialState;
        this.finalStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.finalStates));
        this.transitions = List.copyOf(builder.transitions);
        this.stateInvariants = copyInvariants(builder.stateInvariants);
        this.transitionConditions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.transitionConditions));
        this.fairnessConstraints = List.copyOf(builder.fairnessConstraints);
        this.machineType = builder.machineType;
        this.protocolDomain = builder.protocolDomain;
        this.outgoingByState = indexOutgoing(this.transitions);
    }

    /**
     * Builder 생성.
     *
     * @param id 머신 ID
     * @return 새 Builder
     * @throws IllegalArgumentException id가 null인 경우
     */
    public static Builder builder(MachineId id) {
        return new Builder(id);
    }

    /**
     * 현재 값을 복사한 Builder 생성.
     *
     * @return 이 머신의 값으로 채워진 Builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder(id)
            .name(name)
            .initialState(initialState)
            .machineType(machineType)
            .protocolDomain(protocolDomain);
        builder.states.addAll(states);
        builder.finalStates.addAll(finalStates);
        builder.transitions.addAll(transitions);
        stateInvariants.forEach((state, formulas) ->
            builder.stateInvariants.put(state, new ArrayList<>(formulas)));
        builder.transitionConditions.putAll(transitionConditions);
        builder.fairnessConstraints.addAll(fairnessConstraints);
        return builder;
    }

    /**
     * 구조 불변식 1~3 검증.
     *
     * <p>예외를 던지지 않고 발견된 모든 위반을 반환합니다.</p>
     *
     * @return 구조 오류 목록 (유효하면 빈 목록)
     */
    public List<StructuralError> validate() {
        List<StructuralError> errors = new ArrayList<>();

        if (states.isEmpty()) {
            errors.add(new StructuralError(id, StructuralErrorKind.EMPTY_STATE_SET, null,
                "State machine has no states"));
        }
        if (!states.contains(initialState)) {
            errors.add(new StructuralError(id, StructuralErrorKind.UNKNOWN_INITIAL_STATE, initialState,
                "Initial state '" + initialState + "' is not a declared state"));
        }

        for (int i = 0; i < transitions.size(); i++) {
            StateTransition transition = transitions.get(i);
            if (!states.contains(transition.fromState())) {
                errors.add(new StructuralError(id, StructuralErrorKind.UNKNOWN_TRANSITION_SOURCE, transition.id(),
                    String.format("Transition #%d (%s) starts from undeclared state '%s'", i, transition.id(), transition.fromState())));
            }
            if (!states.contains(transition.toState())) {
                errors.add(new StructuralError(id, StructuralErrorKind.UNKNOWN_TRANSITION_TARGET, transition.id(),
                    String.format("Transition #%d (%s) targets undeclared state '%s'", i, transition.id(), transition.toState())));
            }
        }

        for (String finalState : finalStates) {
            if (!states.contains(finalState)) {
                errors.add(new StructuralError(id, StructuralErrorKind.UNKNOWN_FINAL_STATE, finalState,
                    "Final state '" + finalState + "' is not a declared state"));
            }
        }

        return errors;
    }

    /**
     * 구조 불변식을 모두 만족하는지 확인.
     *
     * @return 유효하면 true
     */
    public boolean isValid() {
        return validate().isEmpty();
    }

    /**
     * 상태의 나가는 전이 (결정적 순회 순서).
     *
     * <p>priority 내림차순, 같은 priority는 선언 순서입니다.
     * 따라서 같은 (fromState, trigger)를 공유하는 전이도 같은 순서로 정렬됩니다.</p>
     *
     * @param state 상태 이름
     * @return 나가는 전이 목록 (없으면 빈 목록)
     */
    public List<StateTransition> outgoing(String state) {
        return outgoingByState.getOrDefault(state, List.of());
    }

    /**
     * 같은 (fromState, trigger)를 공유하는 전이 (결정적 순회 순서).
     *
     * @param state 출발 상태
     * @param trigger 트리거
     * @return 해당 전이 목록
     */
    public List<StateTransition> outgoing(String state, TransitionTrigger trigger) {
        return outgoing(state).stream()
            .filter(transition -> transition.trigger().equals(trigger))
            .toList();
    }

    public boolean hasOutgoing(String state) {
        return !outgoing(state).isEmpty();
    }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    /**
     * 상태 불변식 조회.
     *
     * @param state 상태 이름
     * @return 불변식 목록 (없으면 빈 목록)
     */
    public List<PropertyFormula> invariantsOf(String state) {
        return stateInvariants.getOrDefault(state, List.of());
    }

    public MachineId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<String> getStates() {
        return states;
    }

    public String getInitialState() {
        return initialState;
    }

    public Set<String> getFinalStates() {
        return finalStates;
    }

    public List<StateTransition> getTransitions() {
        return transitions;
    }

    public Map<String, List<PropertyFormula>> getStateInvariants() {
        return stateInvariants;
    }

    public Map<String, PropertyFormula> getTransitionConditions() {
        return transitionConditions;
    }

    public List<FairnessConstraint> getFairnessConstraints() {
        return fairnessConstraints;
    }

    public MachineType getMachineType() {
        return machineType;
    }

    public Optional<String> getProtocolDomain() {
        return Optional.ofNullable(protocolDomain);
    }

    @Override
    public String toString() {
        return "ProtocolStateMachine{id=" + id.getValue()
            + ", states=" + states.size()
            + ", transitions=" + transitions.size()
            + ", type=" + machineType + "}";
    }

    private static Map<String, List<PropertyFormula>> copyInvariants(Map<String, List<PropertyFormula>> source) {
        Map<String, List<PropertyFormula>> copy = new LinkedHashMap<>();
        source.forEach((state, formulas) -> copy.put(state, List.copyOf(formulas)));
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, List<StateTransition>> indexOutgoing(List<StateTransition> transitions) {
        Map<String, List<StateTransition>> index = new LinkedHashMap<>();
        for (StateTransition transition : transitions) {
            index.computeIfAbsent(transition.fromState(), key -> new ArrayList<>()).add(transition);
        }
        // List.sort는 안정 정렬: 같은 priority는 선언 순서 유지
        Map<String, List<StateTransition>> sorted = new LinkedHashMap<>();
        index.forEach((state, list) -> {
            list.sort(BY_PRIORITY_DESC);
            sorted.put(state, List.copyOf(list));
        });
        return Collections.unmodifiableMap(sorted);
    }

    /**
     * ProtocolStateMachine Builder.
     */
    public static final class Builder {

        private final MachineId id;
        private String name;
        private final Set<String> states = new LinkedHashSet<>();
        private String initialState;
        private final Set<String> finalStates = new LinkedHashSet<>();
        private final List<StateTransition> transitions = new ArrayList<>();
        private final Map<String, List<PropertyFormula>> stateInvariants = new LinkedHashMap<>();
        private final Map<String, PropertyFormula> transitionConditions = new LinkedHashMap<>();
        private final List<FairnessConstraint> fairnessConstraints = new ArrayList<>();
        private MachineType machineType = MachineType.DETERMINISTIC_FINITE;
        private String protocolDomain;

        private Builder(MachineId id) {
            if (id == null) {
                throw new IllegalArgumentException("id cannot be null");
            }
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder states(String... states) {
            for (String state : states) {
                state(state);
            }
            return this;
        }

        public Builder state(String state) {
            if (state == null) {
                throw new IllegalArgumentException("state cannot be null");
            }
            this.states.add(state);
            return this;
        }

        public Builder initialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder finalStates(String... finalStates) {
            for (String finalState : finalStates) {
                if (finalState == null) {
                    throw new IllegalArgumentException("final state cannot be null");
                }
                this.finalStates.add(finalState);
            }
            return this;
        }

        public Builder transition(StateTransition transition) {
            if (transition == null) {
                throw new IllegalArgumentException("transition cannot be null");
            }
            this.transitions.add(transition);
            return this;
        }

        public Builder transition(String fromState, String toState, TransitionTrigger trigger) {
            return transition(StateTransition.of(fromState, toState, trigger));
        }

        public Builder invariant(String state, PropertyFormula formula) {
            if (state == null || formula == null) {
                throw new IllegalArgumentException("state and formula cannot be null");
            }
            this.stateInvariants.computeIfAbsent(state, key -> new ArrayList<>()).add(formula);
            return this;
        }

        public Builder transitionCondition(String transitionId, PropertyFormula guard) {
            if (transitionId == null || guard == null) {
                throw new IllegalArgumentException("transitionId and guard cannot be null");
            }
            this.transitionConditions.put(transitionId, guard);
            return this;
        }

        public Builder fairness(FairnessConstraint constraint) {
            if (constraint == null) {
                throw new IllegalArgumentException("constraint cannot be null");
            }
            this.fairnessConstraints.add(constraint);
            return this;
        }

        public Builder machineType(MachineType machineType) {
            if (machineType == null) {
                throw new IllegalArgumentException("machineType cannot be null");
            }
            this.machineType = machineType;
            return this;
        }

        public Builder protocolDomain(String protocolDomain) {
            this.protocolDomain = protocolDomain;
            return this;
        }

        /**
         * ProtocolStateMachine 생성.
         *
         * @return 불변 ProtocolStateMachine
         * @throws IllegalArgumentException initialState가 지정되지 않은 경우
         */
        public ProtocolStateMachine build() {
            return new ProtocolStateMachine(this);
        }
    }
}
