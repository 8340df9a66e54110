package com.ryuqq.protocheck.core.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 단일 상태 머신의 도달성 분석 결과.
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>reachableStates ∩ unreachableStates = ∅, 합집합 = 머신의 전체 상태</li>
 *   <li>도달 가능한 모든 상태 s에 대해 witnessPaths[s]는 길이 stateDistances[s]의 경로
 *       (전이 수 기준, 초기 상태 포함)</li>
 *   <li>cycles는 최대 maxStateSpace개로 제한되며, 제한 또는 타임아웃으로 중단되면
 *       cyclesTruncated = true</li>
 * </ul>
 *
 * <p>모든 컬렉션은 불변이며 BFS 방문 순서를 유지합니다.</p>
 *
 * @param reachableStates 초기 상태에서 도달 가능한 상태 (BFS 방문 순서)
 * @param unreachableStates 도달 불가능한 상태
 * @param reachabilityGraph 도달 가능한 상태별 후속 상태 집합
 * @param stateDistances 초기 상태로부터의 최소 전이 수
 * @param witnessPaths BFS 최단 경로 [initial, ..., s]
 * @param stronglyConnectedComponents 전체 상태에 대한 SCC (응축 DAG의 위상 순서, 구성원은 선언 순서)
 * @param cycles 기본 사이클 (각 사이클은 시작 상태를 반복하지 않음)
 * @param cyclesTruncated 사이클 열거가 제한에 의해 중단되었는지 여부
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record ReachabilityResult(
    Set<String> reachableStates,
    Set<String> unreachableStates,
    Map<String, Set<String>> reachabilityGraph,
    Map<String, Integer> stateDistances,
    Map<String, List<String>> witnessPaths,
    List<List<String>> stronglyConnectedComponents,
    List<List<String>> cycles,
    boolean cyclesTruncated
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 컬렉션이 null인 경우
     */
    public ReachabilityResult {
        if (reachableStates == null || unreachableStates == null) {
            throw new IllegalArgumentException("state sets cannot be null");
        }
        if (reachabilityGraph == null || stateDistances == null || witnessPaths == null) {
            throw new IllegalArgumentException("graph, distances and witness paths cannot be null");
        }
        if (stronglyConnectedComponents == null || cycles == null) {
            throw new IllegalArgumentException("components and cycles cannot be null");
        }
        reachableStates = Collections.unmodifiableSet(new LinkedHashSet<>(reachableStates));
        unreachableStates = Collections.unmodifiableSet(new LinkedHashSet<>(unreachableStates));
        reachabilityGraph = copyGraph(reachabilityGraph);
        stateDistances = Collections.unmodifiableMap(new LinkedHashMap<>(stateDistances));
        witnessPaths = copyPaths(witnessPaths);
        stronglyConnectedComponents = copyLists(stronglyConnectedComponents);
        cycles = copyLists(cycles);
    }

    /**
     * 상태가 없는 빈 결과.
     *
     * @return 빈 ReachabilityResult
     */
    public static ReachabilityResult empty() {
        return new ReachabilityResult(Set.of(), Set.of(), Map.of(), Map.of(), Map.of(), List.of(), List.of(), false);
    }

    public boolean isReachable(String state) {
        return reachableStates.contains(state);
    }

    /**
     * 초기 상태로부터의 최소 전이 수.
     *
     * @param state 상태 이름
     * @return 거리 (도달 불가능하면 empty)
     */
    public Optional<Integer> distanceTo(String state) {
        return Optional.ofNullable(stateDistances.get(state));
    }

    /**
     * 초기 상태에서 state까지의 BFS 증인 경로.
     *
     * @param state 상태 이름
     * @return 경로 (도달 불가능하면 빈 목록)
     */
    public List<String> witnessPathTo(String state) {
        return witnessPaths.getOrDefault(state, List.of());
    }

    /**
     * 상태가 속한 SCC.
     *
     * @param state 상태 이름
     * @return SCC (알 수 없는 상태면 empty)
     */
    public Optional<List<String>> componentOf(String state) {
        return stronglyConnectedComponents.stream()
            .filter(component -> component.contains(state))
            .findFirst();
    }

    private static Map<String, Set<String>> copyGraph(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((state, successors) ->
            copy.put(state, Collections.unmodifiableSet(new LinkedHashSet<>(successors))));
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, List<String>> copyPaths(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((state, path) -> copy.put(state, List.copyOf(path)));
        return Collections.unmodifiableMap(copy);
    }

    private static List<List<String>> copyLists(List<List<String>> source) {
        List<List<String>> copy = new ArrayList<>(source.size());
        for (List<String> list : source) {
            copy.add(List.copyOf(list));
        }
        return Collections.unmodifiableList(copy);
    }
}
