package com.ryuqq.protocheck.adapter.analyzer.graph;

/**
 * 약연결 요소 개수 계산 (union-find).
 *
 * <p>간선 방향을 무시한 무향 그래프에서 연결 요소 수를 셉니다.
 * 고립된 상태도 하나의 요소입니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class WeakComponents {

    private WeakComponents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 약연결 요소 수.
     *
     * @param graph 상태 그래프
     * @return 요소 수 (상태가 없으면 0)
     * @throws IllegalArgumentException graph가 null인 경우
     */
    public static int count(StateGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        int n = graph.size();
        int[] parent = new int[n];
        int[] rank = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }

        int components = n;
        for (int v = 0; v < n; v++) {
            for (int w : graph.successors(v)) {
                int rootV = find(parent, v);
                int rootW = find(parent, w);
                if (rootV == rootW) {
                    continue;
                }
                if (rank[rootV] < rank[rootW]) {
                    parent[rootV] = rootW;
                } else if (rank[rootV] > rank[rootW]) {
                    parent[rootW] = rootV;
                } else {
                    parent[rootW] = rootV;
                    rank[rootV]++;
                }
                components--;
            }
        }
        return components;
    }

    private static int find(int[] parent, int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        // 경로 압축
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }
}
