package com.ryuqq.protocheck.adapter.analyzer.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * SCC 응축 DAG 위의 최장 경로 계산.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>요소 간 간선만 모아 응축 DAG 구성 (요소 내부 간선 제외)</li>
 *   <li>Kahn 알고리즘으로 위상 순서 계산</li>
 *   <li>위상 역순으로 {@code longest[c] = max(longest[d] + 1)} 동적 계획법</li>
 * </ol>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class Condensation {

    private Condensation() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 응축 DAG의 최장 경로 길이 (간선 수).
     *
     * @param decomposition SCC 분해 결과
     * @return 최장 경로 길이, 요소가 없으면 0
     * @throws IllegalArgumentException decomposition이 null인 경우
     */
    public static int longestPath(SccDecomposition decomposition) {
        if (decomposition == null) {
            throw new IllegalArgumentException("decomposition cannot be null");
        }
        List<Set<Integer>> dag = buildDag(decomposition);
        List<Integer> order = topologicalOrder(dag);

        int[] longest = new int[dag.size()];
        int best = 0;
        for (int i = order.size() - 1; i >= 0; i--) {
            int component = order.get(i);
            for (int target : dag.get(component)) {
                longest[component] = Math.max(longest[component], longest[target] + 1);
            }
            best = Math.max(best, longest[component]);
        }
        return best;
    }

    private static List<Set<Integer>> buildDag(SccDecomposition decomposition) {
        StateGraph graph = decomposition.graph();
        int count = decomposition.componentCount();
        List<Set<Integer>> dag = new ArrayList<>(count);
        for (int c = 0; c < count; c++) {
            Set<Integer> targets = new LinkedHashSet<>();
            for (int state : decomposition.members(c)) {
                for (int successor : graph.successors(state)) {
                    int target = decomposition.componentOf(successor);
                    if (target != c) {
                        targets.add(target);
                    }
                }
            }
            dag.add(targets);
        }
        return dag;
    }

    private static List<Integer> topologicalOrder(List<Set<Integer>> dag) {
        int[] inDegree = new int[dag.size()];
        for (Set<Integer> targets : dag) {
            for (int target : targets) {
                inDegree[target]++;
            }
        }
        Deque<Integer> ready = new ArrayDeque<>();
        for (int c = 0; c < dag.size(); c++) {
            if (inDegree[c] == 0) {
                ready.add(c);
            }
        }
        List<Integer> order = new ArrayList<>(dag.size());
        while (!ready.isEmpty()) {
            int component = ready.poll();
            order.add(component);
            for (int target : dag.get(component)) {
                if (--inDegree[target] == 0) {
                    ready.add(target);
                }
            }
        }
        return order;
    }
}
