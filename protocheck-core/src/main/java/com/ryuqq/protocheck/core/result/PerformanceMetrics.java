package com.ryuqq.protocheck.core.result;

import java.time.Duration;
import java.util.Collection;

/**
 * 크기 및 복잡도 지표.
 *
 * <p>memoryUsageEstimate는 상태/전이당 고정 바이트 수로 계산한 추정치이며
 * 실제 힙 사용량이 아닙니다.</p>
 *
 * @param stateSpaceSize 상태 수
 * @param transitionCount 전이 수
 * @param cyclomaticComplexity E − N + 2P (P: 약연결 요소 수)
 * @param maxPathLength SCC 축약 DAG의 최장 경로 (간선 수)
 * @param memoryUsageEstimate 메모리 추정치 (바이트)
 * @param analysisTime 분석 소요 시간
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record PerformanceMetrics(
    long stateSpaceSize,
    long transitionCount,
    long cyclomaticComplexity,
    int maxPathLength,
    long memoryUsageEstimate,
    Duration analysisTime
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 크기가 음수이거나 analysisTime이 null인 경우
     */
    public PerformanceMetrics {
        if (stateSpaceSize < 0 || transitionCount < 0) {
            throw new IllegalArgumentException("sizes must be non-negative");
        }
        if (maxPathLength < 0) {
            throw new IllegalArgumentException("maxPathLength must be non-negative (current: " + maxPathLength + ")");
        }
        if (memoryUsageEstimate < 0) {
            throw new IllegalArgumentException("memoryUsageEstimate must be non-negative");
        }
        if (analysisTime == null) {
            throw new IllegalArgumentException("analysisTime cannot be null");
        }
    }

    public static PerformanceMetrics empty() {
        return new PerformanceMetrics(0, 0, 0, 0, 0, Duration.ZERO);
    }

    /**
     * 머신별 지표 집계.
     *
     * <p>크기, 전이 수, 순환 복잡도, 메모리는 합산하고 최장 경로는 최댓값을 사용합니다.
     * analysisTime은 머신별 시간의 합이 아니라 호출자가 측정한 전체 경과 시간입니다.</p>
     *
     * @param metrics 머신별 지표
     * @param wallClock 분석 전체의 경과 시간
     * @return 집계 지표 (metrics가 비어 있으면 {@link #empty()})
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static PerformanceMetrics aggregate(Collection<PerformanceMetrics> metrics, Duration wallClock) {
        if (metrics == null || wallClock == null) {
            throw new IllegalArgumentException("metrics and wallClock cannot be null");
        }
        if (metrics.isEmpty()) {
            return empty();
        }
        long states = 0;
        long transitions = 0;
        long complexity = 0;
        int maxPath = 0;
        long memory = 0;
        for (PerformanceMetrics m : metrics) {
            states += m.stateSpaceSize();
            transitions += m.transitionCount();
            complexity += m.cyclomaticComplexity();
            maxPath = Math.max(maxPath, m.maxPathLength());
            memory += m.memoryUsageEstimate();
        }
        return new PerformanceMetrics(states, transitions, complexity, maxPath, memory, wallClock);
    }
}
