package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.adapter.analyzer.graph.SccDecomposition;
import com.ryuqq.protocheck.adapter.analyzer.graph.StateGraph;
import com.ryuqq.protocheck.application.engine.StateMachineConfig;
import com.ryuqq.protocheck.core.formula.PropertyFormula;
import com.ryuqq.protocheck.core.formula.Term;
import com.ryuqq.protocheck.core.model.FairnessConstraint;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.model.StateTransition;
import com.ryuqq.protocheck.core.outcome.FailureReason;
import com.ryuqq.protocheck.core.outcome.VerificationFailure;
import com.ryuqq.protocheck.core.outcome.VerificationObligation;
import com.ryuqq.protocheck.core.outcome.VerificationOutcome;
import com.ryuqq.protocheck.core.result.FairnessAnalysis;
import com.ryuqq.protocheck.core.result.FairnessViolation;
import com.ryuqq.protocheck.core.result.LivelockCycle;
import com.ryuqq.protocheck.core.result.LivenessProperty;
import com.ryuqq.protocheck.core.result.LivenessPropertyType;
import com.ryuqq.protocheck.core.result.LivenessResult;
import com.ryuqq.protocheck.core.result.ReachabilityResult;
import com.ryuqq.protocheck.core.result.SafetyViolation;
import com.ryuqq.protocheck.core.result.SafetyViolationType;
import com.ryuqq.protocheck.core.result.UnverifiedObligation;
import com.ryuqq.protocheck.core.result.ViolationSeverity;
import com.ryuqq.protocheck.core.spi.FormalVerifier;
import com.ryuqq.protocheck.core.spi.TemporalLogicSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 활성(liveness) 분석기.
 *
 * <p><strong>분석 항목:</strong></p>
 * <ul>
 *   <li>Deadlock: 나가는 전이가 없는, 도달 가능한 비종료 상태</li>
 *   <li>Livelock: 순환을 포함하고 닫혀 있으며 종료 상태가 없는 SCC ({@link SccDecomposition} 기준)</li>
 *   <li>Safety: 도달 가능한 상태의 불변식을 검증 의무로 만들어 Oracle에 위임</li>
 *   <li>Liveness: 종료 상태마다 {@code eventually_reaches} 의무를 Oracle에 위임</li>
 *   <li>Fairness: 계산된 순환에 대한 공정성 제약 멤버십 검사</li>
 * </ul>
 *
 * <p><strong>Oracle 위임 규칙:</strong></p>
 * <ul>
 *   <li>시간 연산자가 없는 식: {@link FormalVerifier}</li>
 *   <li>시간 연산자가 있는 식: {@link TemporalLogicSolver} (없으면 UNSUPPORTED로 미검증 처리)</li>
 *   <li>Oracle 예외: ERROR로 미검증 처리, 재시도 없음</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class LivenessAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LivenessAnalyzer.class);

    static final String EVENTUALLY_REACHES = "eventually_reaches";
    private static final String STATE_SORT = "State";

    private final FormalVerifier verifier;
    private final TemporalLogicSolver solver;

    /**
     * 생성자.
     *
     * @param verifier 정형 검증기
     * @param solver 시간 논리 솔버 (null 허용, 없으면 시간 논리 의무는 UNSUPPORTED)
     * @throws IllegalArgumentException verifier가 null인 경우
     */
    public LivenessAnalyzer(FormalVerifier verifier, TemporalLogicSolver solver) {
        if (verifier == null) {
            throw new IllegalArgumentException("verifier cannot be null");
        }
        this.verifier = verifier;
        this.solver = solver;
    }

    /**
     * 활성 분석.
     *
     * @param machine 상태 기계
     * @param reachability 도달성 분석 결과
     * @param config 분석 설정 (deadlock/liveness 플래그)
     * @return LivenessResult
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public LivenessResult analyze(ProtocolStateMachine machine, ReachabilityResult reachability, StateMachineConfig config) {
        if (machine == null || reachability == null || config == null) {
            throw new IllegalArgumentException("machine, reachability and config cannot be null");
        }

        SccDecomposition components = SccDecomposition.fromComponents(
            StateGraph.of(machine), reachability.stronglyConnectedComponents());

        Set<String> deadlocks = Set.of();
        List<LivelockCycle> livelocks = List.of();
        if (config.enableDeadlockDetection()) {
            deadlocks = findDeadlocks(machine, reachability);
            livelocks = findLivelocks(machine, reachability, components);
        }

        List<SafetyViolation> safetyViolations = new ArrayList<>();
        List<LivenessProperty> properties = new ArrayList<>();
        List<UnverifiedObligation> unverified = new ArrayList<>();
        FairnessAnalysis fairness = FairnessAnalysis.empty();
        if (config.enableLivenessVerification()) {
            verifySafety(machine, reachability, safetyViolations, unverified);
            verifyLiveness(machine, reachability, components, properties, unverified);
            fairness = analyzeFairness(machine, reachability);
        }

        log.debug("Liveness of {}: {} deadlocks, {} livelocks, {} safety violations, {} unverified",
            machine.getId(), deadlocks.size(), livelocks.size(), safetyViolations.size(), unverified.size());

        return new LivenessResult(deadlocks, livelocks, safetyViolations, properties, fairness, unverified);
    }

    // ============================================================
    // Deadlock / Livelock
    // ============================================================

    private Set<String> findDeadlocks(ProtocolStateMachine machine, ReachabilityResult reachability) {
        Set<String> deadlocks = new LinkedHashSet<>();
        for (String state : reachability.reachableStates()) {
            if (!machine.hasOutgoing(state) && !machine.isFinal(state)) {
                deadlocks.add(state);
            }
        }
        return deadlocks;
    }

    private List<LivelockCycle> findLivelocks(ProtocolStateMachine machine, ReachabilityResult reachability,
                                              SccDecomposition components) {
        List<LivelockCycle> livelocks = new ArrayList<>();
        for (int c = 0; c < components.componentCount(); c++) {
            if (!components.isCyclic(c) || !components.isClosed(c)) {
                continue;
            }
            List<String> component = components.graph().namesOf(components.members(c));
            if (component.stream().anyMatch(machine::isFinal)) {
                continue;
            }
            boolean reachable = component.stream().anyMatch(reachability::isReachable);
            livelocks.add(new LivelockCycle(component, reachable));
        }
        return livelocks;
    }

    // ============================================================
    // Safety
    // ============================================================

    private void verifySafety(ProtocolStateMachine machine, ReachabilityResult reachability,
                              List<SafetyViolation> violations, List<UnverifiedObligation> unverified) {
        for (String state : reachability.reachableStates()) {
            List<PropertyFormula> invariants = machine.invariantsOf(state);
            for (int i = 0; i < invariants.size(); i++) {
                VerificationObligation obligation = VerificationObligation.safety(
                    machine.getId(), state, i, invariants.get(i), reachability.witnessPathTo(state));
                VerificationOutcome outcome = discharge(obligation);
                if (!(outcome instanceof VerificationFailure failure)) {
                    continue;
                }
                if (failure.reason().isRefutation()) {
                    violations.add(toSafetyViolation(machine, obligation, failure));
                } else {
                    unverified.add(new UnverifiedObligation(obligation, failure.reason(), failure.message()));
                }
            }
        }
    }

    private SafetyViolation toSafetyViolation(ProtocolStateMachine machine, VerificationObligation obligation,
                                              VerificationFailure failure) {
        String state = obligation.state();
        List<String> trace = failure.hasCounterexample() ? failure.counterexample() : obligation.witnessTrace();
        ViolationSeverity severity = state.equals(machine.getInitialState())
            ? ViolationSeverity.CRITICAL
            : ViolationSeverity.HIGH;
        List<String> suggestions = List.of(
            "Strengthen the guards of transitions entering '" + state + "'",
            "Review the invariant " + obligation.formula().render() + " declared for '" + state + "'"
        );
        return new SafetyViolation(obligation.obligationId(), SafetyViolationType.INVARIANT_VIOLATION,
            List.of(state), trace, severity, suggestions);
    }

    // ============================================================
    // Liveness
    // ============================================================

    private void verifyLiveness(ProtocolStateMachine machine, ReachabilityResult reachability,
                                SccDecomposition components, List<LivenessProperty> properties,
                                List<UnverifiedObligation> unverified) {
        for (String finalState : machine.getFinalStates()) {
            PropertyFormula formula = eventuallyReaches(finalState);
            VerificationObligation obligation = VerificationObligation.liveness(machine.getId(), finalState, formula);
            String description = "Eventually reaches " + finalState;

            VerificationOutcome outcome = discharge(obligation);
            if (!(outcome instanceof VerificationFailure failure)) {
                properties.add(LivenessProperty.verified(description, formula, LivenessPropertyType.EVENTUALLY));
                continue;
            }
            if (failure.reason().isRefutation() && failure.hasCounterexample()) {
                properties.add(LivenessProperty.refuted(description, formula, LivenessPropertyType.EVENTUALLY,
                    failure.counterexample(), FailureReason.REFUTED));
                continue;
            }

            Optional<List<String>> counterexample = findTrapAvoiding(reachability, components, finalState);
            if (counterexample.isPresent()) {
                properties.add(LivenessProperty.refuted(description, formula, LivenessPropertyType.EVENTUALLY,
                    counterexample.get(), FailureReason.REFUTED));
                continue;
            }

            // 반례 없는 REFUTED는 UNKNOWN으로 기록
            FailureReason reason = failure.reason().isRefutation() ? FailureReason.UNKNOWN : failure.reason();
            String message = failure.reason().isRefutation()
                ? "refuted without counterexample: " + failure.message()
                : failure.message();
            properties.add(LivenessProperty.unverified(description, formula, LivenessPropertyType.EVENTUALLY, reason));
            unverified.add(new UnverifiedObligation(obligation, reason, message));
        }
    }

    static PropertyFormula eventuallyReaches(String finalState) {
        return PropertyFormula.atom(EVENTUALLY_REACHES,
            Term.variable("current_state", STATE_SORT),
            Term.constant(finalState, STATE_SORT));
    }

    /**
     * 종료 상태 f를 포함하지 않는, 도달 가능한 닫힌 SCC를 찾아 반례 경로 구성.
     *
     * <p>반례 = 진입 상태까지의 증인 경로 + 진입 상태를 지나는 순환 한 바퀴 (있는 경우).</p>
     */
    private Optional<List<String>> findTrapAvoiding(ReachabilityResult reachability, SccDecomposition components,
                                                    String finalState) {
        for (int c = 0; c < components.componentCount(); c++) {
            List<String> component = components.graph().namesOf(components.members(c));
            if (component.contains(finalState) || !components.isClosed(c)) {
                continue;
            }
            Optional<String> entry = component.stream()
                .filter(reachability::isReachable)
                .min((a, b) -> Integer.compare(reachability.stateDistances().get(a), reachability.stateDistances().get(b)));
            if (entry.isEmpty()) {
                continue;
            }
            List<String> trace = new ArrayList<>(reachability.witnessPathTo(entry.get()));
            lapThrough(reachability.cycles(), entry.get()).ifPresent(trace::addAll);
            return Optional.of(trace);
        }
        return Optional.empty();
    }

    private Optional<List<String>> lapThrough(List<List<String>> cycles, String state) {
        for (List<String> cycle : cycles) {
            int position = cycle.indexOf(state);
            if (position < 0) {
                continue;
            }
            List<String> lap = new ArrayList<>(cycle.size());
            for (int i = 1; i <= cycle.size(); i++) {
                lap.add(cycle.get((position + i) % cycle.size()));
            }
            return Optional.of(lap);
        }
        return Optional.empty();
    }

    // ============================================================
    // Fairness
    // ============================================================

    private FairnessAnalysis analyzeFairness(ProtocolStateMachine machine, ReachabilityResult reachability) {
        List<FairnessConstraint> strong = new ArrayList<>();
        List<FairnessConstraint> weak = new ArrayList<>();
        List<FairnessViolation> violations = new ArrayList<>();

        for (FairnessConstraint constraint : machine.getFairnessConstraints()) {
            if (constraint.fairnessType().isStrong()) {
                strong.add(constraint);
            } else {
                weak.add(constraint);
            }
            if (constraint.isUnconditional()) {
                continue;
            }
            for (List<String> cycle : reachability.cycles()) {
                if (cycle.stream().anyMatch(constraint.enablingStates()::contains)) {
                    continue;
                }
                visitedElement(machine, constraint, cycle)
                    .ifPresent(element -> violations.add(new FairnessViolation(constraint, cycle, element)));
            }
        }
        return new FairnessAnalysis(strong, weak, violations);
    }

    private Optional<String> visitedElement(ProtocolStateMachine machine, FairnessConstraint constraint,
                                            List<String> cycle) {
        Set<String> onCycle = new HashSet<>(cycle);
        Set<String> cycleEdges = new HashSet<>();
        for (int i = 0; i < cycle.size(); i++) {
            String from = cycle.get(i);
            String to = cycle.get((i + 1) % cycle.size());
            for (StateTransition transition : machine.outgoing(from)) {
                if (transition.toState().equals(to)) {
                    cycleEdges.add(transition.id());
                }
            }
        }
        for (String element : constraint.elements()) {
            if (onCycle.contains(element) || cycleEdges.contains(element)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    // ============================================================
    // Oracle
    // ============================================================

    private VerificationOutcome discharge(VerificationObligation obligation) {
        if (obligation.requiresTemporalSolver() && solver == null) {
            return VerificationFailure.of(obligation.obligationId(), FailureReason.UNSUPPORTED,
                "no temporal logic solver configured for " + obligation.formula().render());
        }
        try {
            VerificationOutcome outcome = obligation.requiresTemporalSolver()
                ? solver.solve(obligation)
                : verifier.verifyProperty(obligation);
            if (outcome == null) {
                return VerificationFailure.of(obligation.obligationId(), FailureReason.ERROR, "oracle returned no outcome");
            }
            return outcome;
        } catch (Exception e) {
            log.error("Oracle failed on obligation {}", obligation.obligationId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return VerificationFailure.of(obligation.obligationId(), FailureReason.ERROR, "oracle failure: " + message);
        }
    }
}
