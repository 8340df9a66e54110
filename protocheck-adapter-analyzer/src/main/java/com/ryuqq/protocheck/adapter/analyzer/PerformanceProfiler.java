package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.adapter.analyzer.graph.Condensation;
import com.ryuqq.protocheck.adapter.analyzer.graph.SccDecomposition;
import com.ryuqq.protocheck.adapter.analyzer.graph.StateGraph;
import com.ryuqq.protocheck.adapter.analyzer.graph.TarjanScc;
import com.ryuqq.protocheck.adapter.analyzer.graph.WeakComponents;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.result.PerformanceMetrics;
import com.ryuqq.protocheck.core.result.ReachabilityResult;

import java.time.Duration;

/**
 * 크기와 복잡도 지표 계산기.
 *
 * <ul>
 *   <li>{@code cyclomaticComplexity = E - N + 2P} (P: 약연결 요소 수)</li>
 *   <li>{@code maxPathLength}: SCC 응축 DAG의 최장 경로 (간선 수)</li>
 *   <li>{@code memoryUsageEstimate = bytesPerState * N + bytesPerTransition * E} (추정치)</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class PerformanceProfiler {

    public static final long DEFAULT_BYTES_PER_STATE = 1000;
    public static final long DEFAULT_BYTES_PER_TRANSITION = 500;

    private final long bytesPerState;
    private final long bytesPerTransition;

    /**
     * 생성자 (기본 메모리 추정 계수 1000 / 500 바이트).
     */
    public PerformanceProfiler() {
        this(DEFAULT_BYTES_PER_STATE, DEFAULT_BYTES_PER_TRANSITION);
    }

    /**
     * 생성자 (메모리 추정 계수 커스터마이징).
     *
     * @param bytesPerState 상태당 추정 바이트
     * @param bytesPerTransition 전이당 추정 바이트
     * @throws IllegalArgumentException 계수가 음수인 경우
     */
    public PerformanceProfiler(long bytesPerState, long bytesPerTransition) {
        if (bytesPerState < 0 || bytesPerTransition < 0) {
            throw new IllegalArgumentException(
                String.format("byte estimates must be non-negative (state: %d, transition: %d)",
                    bytesPerState, bytesPerTransition));
        }
        this.bytesPerState = bytesPerState;
        this.bytesPerTransition = bytesPerTransition;
    }

    /**
     * 지표 계산.
     *
     * @param machine 상태 기계
     * @param reachability 도달성 분석 결과 (null이면 SCC를 직접 계산)
     * @param elapsed 엔진이 측정한 분석 시간
     * @return PerformanceMetrics
     * @throws IllegalArgumentException machine 또는 elapsed가 null인 경우
     */
    public PerformanceMetrics profile(ProtocolStateMachine machine, ReachabilityResult reachability, Duration elapsed) {
        if (machine == null || elapsed == null) {
            throw new IllegalArgumentException("machine and elapsed cannot be null");
        }
        StateGraph graph = StateGraph.of(machine);
        SccDecomposition decomposition = reachability != null
            ? SccDecomposition.fromComponents(graph, reachability.stronglyConnectedComponents())
            : TarjanScc.decompose(graph);

        long states = machine.getStates().size();
        long transitions = machine.getTransitions().size();
        long complexity = cyclomaticComplexity(machine, graph);
        int maxPath = Condensation.longestPath(decomposition);
        long memory = bytesPerState * states + bytesPerTransition * transitions;

        return new PerformanceMetrics(states, transitions, complexity, maxPath, memory, elapsed);
    }

    /**
     * 순환 복잡도 {@code E - N + 2P}.
     *
     * @param machine 상태 기계
     * @return 순환 복잡도 (상태가 없으면 0)
     */
    public long cyclomaticComplexity(ProtocolStateMachine machine) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        return cyclomaticComplexity(machine, StateGraph.of(machine));
    }

    private long cyclomaticComplexity(ProtocolStateMachine machine, StateGraph graph) {
        if (graph.size() == 0) {
            return 0;
        }
        long edges = machine.getTransitions().stream()
            .filter(transition -> graph.indexOf(transition.fromState()) >= 0 && graph.indexOf(transition.toState()) >= 0)
            .count();
        return edges - graph.size() + 2L * WeakComponents.count(graph);
    }
}
