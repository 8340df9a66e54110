package com.ryuqq.protocheck.core.result;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PerformanceMetrics 테스트.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
class PerformanceMetricsTest {

    @Test
    void aggregate_SumsSizesAndUsesWallClockTime() {
        // Given
        PerformanceMetrics first = new PerformanceMetrics(3, 2, 1, 2, 4000, Duration.ofMillis(5));
        PerformanceMetrics second = new PerformanceMetrics(2, 2, 2, 1, 3000, Duration.ofMillis(7));

        // When
        PerformanceMetrics total = PerformanceMetrics.aggregate(List.of(first, second), Duration.ofMillis(40));

        // Then
        assertEquals(5, total.stateSpaceSize());
        assertEquals(4, total.transitionCount());
        assertEquals(3, total.cyclomaticComplexity());
        assertEquals(2, total.maxPathLength());
        assertEquals(7000, total.memoryUsageEstimate());
        assertEquals(Duration.ofMillis(40), total.analysisTime());
    }

    @Test
    void aggregate_Empty_ReturnsEmptyMetrics() {
        // When & Then
        assertEquals(PerformanceMetrics.empty(), PerformanceMetrics.aggregate(List.of(), Duration.ofMillis(40)));
    }

    @Test
    void constructor_NegativeSize_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new PerformanceMetrics(-1, 0, 0, 0, 0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> new PerformanceMetrics(0, 0, 0, 0, 0, null));
    }
}
