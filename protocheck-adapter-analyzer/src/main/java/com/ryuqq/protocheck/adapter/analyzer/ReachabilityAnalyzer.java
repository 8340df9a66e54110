package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.adapter.analyzer.graph.ElementaryCycles;
import com.ryuqq.protocheck.adapter.analyzer.graph.SccDecomposition;
import com.ryuqq.protocheck.adapter.analyzer.graph.StateGraph;
import com.ryuqq.protocheck.adapter.analyzer.graph.TarjanScc;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.model.StateTransition;
import com.ryuqq.protocheck.core.model.StructuralError;
import com.ryuqq.protocheck.core.model.StructuralException;
import com.ryuqq.protocheck.core.phase.Deadline;
import com.ryuqq.protocheck.core.result.ReachabilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 도달성 분석기.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>구조 검증: {@link StructuralError}가 하나라도 있으면 {@link StructuralException}</li>
 *   <li>초기 상태에서 BFS (전이는 {@link ProtocolStateMachine#outgoing(String)} 순서)</li>
 *   <li>상태별 최단 거리와 BFS 증인 경로(witness path) 기록</li>
 *   <li>전체 상태에 대해 Tarjan SCC 분해</li>
 *   <li>maxCycles와 Deadline으로 제한된 기본 순환 열거</li>
 * </ol>
 *
 * <p>상태를 갖지 않으므로 thread-safe합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class ReachabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    /**
     * 도달성 분석.
     *
     * @param machine 상태 기계
     * @param maxCycles 열거할 최대 순환 수
     * @param deadline 협력적 취소용 Deadline
     * @return ReachabilityResult
     * @throws IllegalArgumentException 인자가 null이거나 maxCycles가 양수가 아닌 경우
     * @throws StructuralException 구조 불변식을 위반한 경우
     */
    public ReachabilityResult analyze(ProtocolStateMachine machine, int maxCycles, Deadline deadline) {
        if (machine == null || deadline == null) {
            throw new IllegalArgumentException("machine and deadline cannot be null");
        }
        requireValid(machine);

        Map<String, Integer> distances = new LinkedHashMap<>();
        Map<String, String> parents = new HashMap<>();
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        breadthFirst(machine, distances, parents, graph);

        Set<String> reachable = new LinkedHashSet<>(distances.keySet());
        Set<String> unreachable = new LinkedHashSet<>(machine.getStates());
        unreachable.removeAll(reachable);

        Map<String, List<String>> witnessPaths = new LinkedHashMap<>();
        for (String state : reachable) {
            witnessPaths.put(state, pathTo(state, parents));
        }

        SccDecomposition decomposition = TarjanScc.decompose(StateGraph.of(machine));
        ElementaryCycles.Enumeration enumeration = ElementaryCycles.enumerate(decomposition, maxCycles, deadline);

        log.debug("Reachability of {}: {} reachable, {} unreachable, {} SCCs, {} cycles (truncated={})",
            machine.getId(), reachable.size(), unreachable.size(), decomposition.componentCount(),
            enumeration.cycles().size(), enumeration.truncated());

        return new ReachabilityResult(
            reachable,
            unreachable,
            graph,
            distances,
            witnessPaths,
            decomposition.asStateNames(),
            enumeration.cycles(),
            enumeration.truncated()
        );
    }

    private void requireValid(ProtocolStateMachine machine) {
        List<StructuralError> errors = machine.validate();
        if (!errors.isEmpty()) {
            throw new StructuralException(machine.getId(), errors);
        }
    }

    private void breadthFirst(ProtocolStateMachine machine, Map<String, Integer> distances,
                              Map<String, String> parents, Map<String, Set<String>> graph) {
        Deque<String> queue = new ArrayDeque<>();
        distances.put(machine.getInitialState(), 0);
        queue.add(machine.getInitialState());

        while (!queue.isEmpty()) {
            String current = queue.poll();
            Set<String> successors = new LinkedHashSet<>();
            for (StateTransition transition : machine.outgoing(current)) {
                String next = transition.toState();
                successors.add(next);
                if (!distances.containsKey(next)) {
                    distances.put(next, distances.get(current) + 1);
                    parents.put(next, current);
                    queue.add(next);
                }
            }
            graph.put(current, successors);
        }
    }

    private List<String> pathTo(String state, Map<String, String> parents) {
        List<String> path = new ArrayList<>();
        String cursor = state;
        while (cursor != null) {
            path.add(cursor);
            cursor = parents.get(cursor);
        }
        Collections.reverse(path);
        return path;
    }
}
