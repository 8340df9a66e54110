package com.ryuqq.protocheck.core.model;

import java.time.Duration;

/**
 * 전이 타이밍 제약.
 *
 * <p>모든 필드는 선택(null 허용)입니다. 생성 시 값 사이의 일관성
 * (예: minDelay &lt;= maxDelay)은 검증하지 않으며, 불일치는 준수성 검사에서
 * {@code timing_consistency} 위반으로 보고됩니다.</p>
 *
 * @param minDelay 전이가 발생하기 전 최소 대기 시간 (null 가능)
 * @param maxDelay 전이가 반드시 발생해야 하는 최대 시간 (null 가능)
 * @param deadline 전이 완료 기한 (null 가능)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record TimingConstraint(
    Duration minDelay,
    Duration maxDelay,
    Duration deadline
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 음수 Duration인 경우
     */
    public TimingConstraint {
        requireNonNegative("minDelay", minDelay);
        requireNonNegative("maxDelay", maxDelay);
        requireNonNegative("deadline", deadline);
    }

    /**
     * 최대 지연과 기한만 가진 제약 생성.
     *
     * @param maxDelay 최대 지연
     * @param deadline 기한
     * @return TimingConstraint 인스턴스
     */
    public static TimingConstraint within(Duration maxDelay, Duration deadline) {
        return new TimingConstraint(null, maxDelay, deadline);
    }

    /**
     * minDelay &lt;= maxDelay &lt;= deadline (양쪽 값이 있는 경우에 한해) 여부.
     *
     * @return 일관성이 있으면 true
     */
    public boolean isConsistent() {
        if (minDelay != null && maxDelay != null && minDelay.compareTo(maxDelay) > 0) {
            return false;
        }
        if (maxDelay != null && deadline != null && maxDelay.compareTo(deadline) > 0) {
            return false;
        }
        return true;
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value != null && value.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative (current: " + value + ")");
        }
    }
}
