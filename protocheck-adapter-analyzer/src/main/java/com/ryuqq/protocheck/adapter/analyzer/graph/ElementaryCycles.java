package com.ryuqq.protocheck.adapter.analyzer.graph;

import com.ryuqq.protocheck.core.phase.Deadline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 기본 순환(elementary cycle) 열거 (Johnson 알고리즘, 반복 구현).
 *
 * <p><strong>열거 순서:</strong></p>
 * <ol>
 *   <li>self-loop를 상태 선언 순서로 먼저 수집 ({@code [s]})</li>
 *   <li>나머지 순환은 가장 작은 인덱스의 상태를 시작점으로 하여
 *       시작점 오름차순, 후속 순서대로 수집 ({@code [s, ..., t]}, 시작점 반복 없음)</li>
 * </ol>
 *
 * <p><strong>상한:</strong> 순환 수는 최악의 경우 상태 수에 대해 지수적이므로
 * {@code maxCycles}에 도달하거나 {@link Deadline}이 만료되면 열거를 중단하고
 * {@link Enumeration#truncated()}를 true로 표시합니다. Deadline은 매 단계마다 확인합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class ElementaryCycles {

    private ElementaryCycles() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 열거 결과.
     *
     * @param cycles 발견된 순환 (상태 이름 목록)
     * @param truncated 상한 또는 Deadline으로 중단되었는지 여부
     */
    public record Enumeration(List<List<String>> cycles, boolean truncated) {

        public Enumeration {
            if (cycles == null) {
                throw new IllegalArgumentException("cycles cannot be null");
            }
            cycles = List.copyOf(cycles);
        }
    }

    /**
     * 기본 순환 열거.
     *
     * @param decomposition SCC 분해 결과 (같은 요소 안에서만 순환을 탐색)
     * @param maxCycles 최대 순환 수 (양수)
     * @param deadline 협력적 취소용 Deadline
     * @return 열거 결과
     * @throws IllegalArgumentException 인자가 null이거나 maxCycles가 양수가 아닌 경우
     */
    public static Enumeration enumerate(SccDecomposition decomposition, int maxCycles, Deadline deadline) {
        if (decomposition == null || deadline == null) {
            throw new IllegalArgumentException("decomposition and deadline cannot be null");
        }
        if (maxCycles <= 0) {
            throw new IllegalArgumentException("maxCycles must be positive (current: " + maxCycles + ")");
        }
        return new Search(decomposition, maxCycles, deadline).run();
    }

    private static final class Frame {
        final int vertex;
        int cursor;
        boolean closedCycle;

        Frame(int vertex) {
            this.vertex = vertex;
        }
    }

    private static final class Search {

        private final SccDecomposition decomposition;
        private final StateGraph graph;
        private final int maxCycles;
        private final Deadline deadline;
        private final List<List<String>> cycles = new ArrayList<>();
        private final boolean[] blocked;
        private final List<Set<Integer>> blockedBy;
        private boolean truncated;

        Search(SccDecomposition decomposition, int maxCycles, Deadline deadline) {
            this.decomposition = decomposition;
            this.graph = decomposition.graph();
            this.maxCycles = maxCycles;
            this.deadline = deadline;
            this.blocked = new boolean[graph.size()];
            this.blockedBy = new ArrayList<>(graph.size());
            for (int i = 0; i < graph.size(); i++) {
                blockedBy.add(new HashSet<>());
            }
        }

        Enumeration run() {
            for (int v = 0; v < graph.size() && !truncated; v++) {
                if (graph.hasEdge(v, v)) {
                    emit(List.of(graph.stateAt(v)));
                }
            }
            for (int start = 0; start < graph.size() && !truncated; start++) {
                if (decomposition.members(decomposition.componentOf(start)).size() > 1) {
                    circuitsFrom(start);
                }
            }
            return new Enumeration(cycles, truncated);
        }

        private boolean allowed(int start, int from, int to) {
            return to >= start
                && to != from
                && decomposition.componentOf(to) == decomposition.componentOf(start);
        }

        private void circuitsFrom(int start) {
            for (int v = start; v < graph.size(); v++) {
                blocked[v] = false;
                blockedBy.get(v).clear();
            }

            Deque<Frame> frames = new ArrayDeque<>();
            List<Integer> path = new ArrayList<>();
            frames.push(new Frame(start));
            path.add(start);
            blocked[start] = true;

            while (!frames.isEmpty()) {
                if (deadline.isExpired()) {
                    truncated = true;
                    return;
                }
                Frame frame = frames.peek();
                int[] successors = graph.successors(frame.vertex);

                if (frame.cursor < successors.length) {
                    int next = successors[frame.cursor++];
                    if (!allowed(start, frame.vertex, next)) {
                        continue;
                    }
                    if (next == start) {
                        frame.closedCycle = true;
                        emit(List.copyOf(graph.namesOf(path)));
                        if (truncated) {
                            return;
                        }
                    } else if (!blocked[next]) {
                        frames.push(new Frame(next));
                        path.add(next);
                        blocked[next] = true;
                    }
                    continue;
                }

                frames.pop();
                path.remove(path.size() - 1);
                if (frame.closedCycle) {
                    unblock(frame.vertex);
                } else {
                    for (int successor : successors) {
                        if (allowed(start, frame.vertex, successor)) {
                            blockedBy.get(successor).add(frame.vertex);
                        }
                    }
                }
                if (frame.closedCycle && !frames.isEmpty()) {
                    frames.peek().closedCycle = true;
                }
            }
        }

        private void unblock(int vertex) {
            Deque<Integer> pending = new ArrayDeque<>();
            pending.push(vertex);
            while (!pending.isEmpty()) {
                int current = pending.pop();
                blocked[current] = false;
                Set<Integer> waiting = blockedBy.get(current);
                for (int waiter : waiting) {
                    if (blocked[waiter]) {
                        pending.push(waiter);
                    }
                }
                waiting.clear();
            }
        }

        private void emit(List<String> cycle) {
            if (cycles.size() >= maxCycles) {
                truncated = true;
                return;
            }
            cycles.add(cycle);
        }
    }
}
