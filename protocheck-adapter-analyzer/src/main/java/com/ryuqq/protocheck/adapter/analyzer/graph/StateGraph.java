package com.ryuqq.protocheck.adapter.analyzer.graph;

import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.model.StateTransition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 상태 기계의 정수 인덱스 인접 리스트 표현.
 *
 * <p>상태는 선언 순서대로 {@code 0..N-1} 인덱스를 부여받고,
 * 각 상태의 후속 목록은 {@link ProtocolStateMachine#outgoing(String)} 순서
 * (priority 내림차순, 같은 priority는 선언 순서)를 따릅니다.</p>
 *
 * <p>선언되지 않은 상태를 가리키는 전이(dangling transition)는 무시합니다.
 * 같은 후속 상태로 가는 중복 간선은 한 번만 기록합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class StateGraph {

    private final List<String> states;
    private final Map<String, Integer> indexByState;
    private final int[][] successors;
    private final int edgeCount;

    private StateGraph(List<String> states, Map<String, Integer> indexByState, int[][] successors, int edgeCount) {
        this.states = states;
        this.indexByState = indexByState;
        this.successors = successors;
        this.edgeCount = edgeCount;
    }

    /**
     * 상태 기계로부터 그래프 생성.
     *
     * @param machine 상태 기계
     * @return StateGraph
     * @throws IllegalArgumentException machine이 null인 경우
     */
    public static StateGraph of(ProtocolStateMachine machine) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        List<String> states = List.copyOf(machine.getStates());
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < states.size(); i++) {
            index.put(states.get(i), i);
        }

        int[][] successors = new int[states.size()][];
        int edges = 0;
        for (int i = 0; i < states.size(); i++) {
            Set<Integer> targets = new LinkedHashSet<>();
            for (StateTransition transition : machine.outgoing(states.get(i))) {
                Integer target = index.get(transition.toState());
                if (target != null) {
                    targets.add(target);
                }
            }
            successors[i] = targets.stream().mapToInt(Integer::intValue).toArray();
            edges += successors[i].length;
        }
        return new StateGraph(states, index, successors, edges);
    }

    public int size() {
        return states.size();
    }

    /**
     * 서로 다른 (from, to) 간선 수.
     */
    public int edgeCount() {
        return edgeCount;
    }

    public String stateAt(int index) {
        return states.get(index);
    }

    /**
     * 상태 이름의 인덱스 조회.
     *
     * @param state 상태 이름
     * @return 인덱스, 선언되지 않은 상태면 -1
     */
    public int indexOf(String state) {
        Integer index = indexByState.get(state);
        return index == null ? -1 : index;
    }

    public int[] successors(int index) {
        return successors[index];
    }

    public boolean hasEdge(int from, int to) {
        for (int successor : successors[from]) {
            if (successor == to) {
                return true;
            }
        }
        return false;
    }

    /**
     * 인덱스 목록을 상태 이름 목록으로 변환.
     *
     * @param indices 상태 인덱스 목록
     * @return 상태 이름 목록
     */
    public List<String> namesOf(List<Integer> indices) {
        List<String> names = new ArrayList<>(indices.size());
        for (int index : indices) {
            names.add(states.get(index));
        }
        return names;
    }
}
