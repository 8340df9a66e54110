package com.ryuqq.protocheck.core.trigger;

/**
 * 오류 조건 트리거.
 *
 * @param name error 이름
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record ErrorTrigger(String name) implements TransitionTrigger {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public ErrorTrigger {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    @Override
    public String describe() {
        return "error:" + name;
    }
}
