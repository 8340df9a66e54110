package com.ryuqq.protocheck.adapter.analyzer.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 강연결 요소 분해 결과.
 *
 * <p>{@link TarjanScc}가 만든 결과는 응축 DAG의 위상 순서(소스 먼저)로 나열됩니다.
 * 각 요소의 멤버는 상태 선언 순서로 정렬됩니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class SccDecomposition {

    private final StateGraph graph;
    private final List<List<Integer>> components;
    private final int[] componentOf;

    SccDecomposition(StateGraph graph, List<List<Integer>> components, int[] componentOf) {
        this.graph = graph;
        this.components = Collections.unmodifiableList(components);
        this.componentOf = componentOf;
    }

    /**
     * 이미 계산된 요소 목록(상태 이름)으로부터 분해 결과 복원.
     *
     * <p>그래프에 없는 상태 이름은 무시하고, 어느 요소에도 속하지 않은 상태는
     * 단독 요소로 추가합니다.</p>
     *
     * @param graph 상태 그래프
     * @param components 상태 이름으로 표현한 요소 목록
     * @return SccDecomposition
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static SccDecomposition fromComponents(StateGraph graph, List<List<String>> components) {
        if (graph == null || components == null) {
            throw new IllegalArgumentException("graph and components cannot be null");
        }
        int[] componentOf = new int[graph.size()];
        Arrays.fill(componentOf, -1);
        List<List<Integer>> indexed = new ArrayList<>();
        for (List<String> component : components) {
            List<Integer> members = new ArrayList<>();
            for (String state : component) {
                int index = graph.indexOf(state);
                if (index >= 0 && componentOf[index] == -1) {
                    componentOf[index] = indexed.size();
                    members.add(index);
                }
            }
            if (!members.isEmpty()) {
                Collections.sort(members);
                indexed.add(List.copyOf(members));
            }
        }
        for (int state = 0; state < graph.size(); state++) {
            if (componentOf[state] == -1) {
                componentOf[state] = indexed.size();
                indexed.add(List.of(state));
            }
        }
        return new SccDecomposition(graph, indexed, componentOf);
    }

    public StateGraph graph() {
        return graph;
    }

    public int componentCount() {
        return components.size();
    }

    public List<Integer> members(int component) {
        return components.get(component);
    }

    public int componentOf(int state) {
        return componentOf[state];
    }

    /**
     * 요소가 순환을 포함하는지 여부 (멤버 2개 이상 또는 self-loop).
     *
     * @param component 요소 인덱스
     * @return 순환 포함 여부
     */
    public boolean isCyclic(int component) {
        List<Integer> members = components.get(component);
        if (members.size() > 1) {
            return true;
        }
        int state = members.get(0);
        return graph.hasEdge(state, state);
    }

    /**
     * 요소가 닫혀 있는지 여부 (모든 멤버의 모든 후속 상태가 요소 내부).
     *
     * @param component 요소 인덱스
     * @return 닫힘 여부
     */
    public boolean isClosed(int component) {
        for (int state : components.get(component)) {
            for (int successor : graph.successors(state)) {
                if (componentOf[successor] != component) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * 상태 이름으로 표현한 요소 목록.
     *
     * @return 요소별 상태 이름 목록
     */
    public List<List<String>> asStateNames() {
        List<List<String>> names = new ArrayList<>(components.size());
        for (List<Integer> component : components) {
            names.add(List.copyOf(graph.namesOf(component)));
        }
        return names;
    }
}
