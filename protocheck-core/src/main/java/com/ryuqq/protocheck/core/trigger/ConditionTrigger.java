package com.ryuqq.protocheck.core.trigger;

import com.ryuqq.protocheck.core.formula.PropertyFormula;

/**
 * 조건식 기반 트리거.
 *
 * @param condition 충족 시 전이가 발생하는 공식
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record ConditionTrigger(PropertyFormula condition) implements TransitionTrigger {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException condition이 null인 경우
     */
    public ConditionTrigger {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
    }

    @Override
    public String describe() {
        return "condition:" + condition.render();
    }
}
