package com.ryuqq.protocheck.adapter.analyzer.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Tarjan 강연결 요소 알고리즘 (반복 구현).
 *
 * <p>재귀 대신 명시적 호출 스택을 사용하므로 상태 수에 관계없이 스택 오버플로가 발생하지 않습니다.
 * 모든 상태(도달 불가능한 상태 포함)를 대상으로 합니다.</p>
 *
 * <p><strong>시간 복잡도:</strong> O(N + E)</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class TarjanScc {

    private TarjanScc() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 그래프를 강연결 요소로 분해.
     *
     * @param graph 상태 그래프
     * @return 위상 순서로 정렬된 분해 결과
     * @throws IllegalArgumentException graph가 null인 경우
     */
    public static SccDecomposition decompose(StateGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        int n = graph.size();
        int[] order = new int[n];
        int[] low = new int[n];
        int[] edgeCursor = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(order, -1);

        Deque<Integer> sccStack = new ArrayDeque<>();
        Deque<Integer> callStack = new ArrayDeque<>();
        List<List<Integer>> emitted = new ArrayList<>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (order[root] != -1) {
                continue;
            }
            order[root] = low[root] = counter++;
            sccStack.push(root);
            onStack[root] = true;
            callStack.push(root);

            while (!callStack.isEmpty()) {
                int v = callStack.peek();
                int[] successors = graph.successors(v);

                if (edgeCursor[v] < successors.length) {
                    int w = successors[edgeCursor[v]++];
                    if (order[w] == -1) {
                        order[w] = low[w] = counter++;
                        sccStack.push(w);
                        onStack[w] = true;
                        callStack.push(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], order[w]);
                    }
                    continue;
                }

                callStack.pop();
                if (low[v] == order[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = sccStack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    Collections.sort(component);
                    emitted.add(component);
                }
                if (!callStack.isEmpty()) {
                    int parent = callStack.peek();
                    low[parent] = Math.min(low[parent], low[v]);
                }
            }
        }

        // Tarjan은 싱크 요소부터 방출하므로 뒤집으면 위상 순서
        Collections.reverse(emitted);
        int[] componentOf = new int[n];
        List<List<Integer>> components = new ArrayList<>(emitted.size());
        for (int c = 0; c < emitted.size(); c++) {
            List<Integer> members = List.copyOf(emitted.get(c));
            for (int state : members) {
                componentOf[state] = c;
            }
            components.add(members);
        }
        return new SccDecomposition(graph, components, componentOf);
    }
}
