package com.ryuqq.protocheck.core.trigger;

import java.time.Duration;

/**
 * 시간 기반 트리거.
 *
 * @param duration 전이가 발생하기까지의 시간 (0 이상)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record TimeoutTrigger(Duration duration) implements TransitionTrigger {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException duration이 null이거나 음수인 경우
     */
    public TimeoutTrigger {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative (current: " + duration + ")");
        }
    }

    @Override
    public String describe() {
        return "timeout:" + duration;
    }
}
