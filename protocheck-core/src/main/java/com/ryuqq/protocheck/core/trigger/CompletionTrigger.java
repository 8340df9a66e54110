package com.ryuqq.protocheck.core.trigger;

/**
 * 내부 계산 완료 트리거.
 *
 * <p>필드가 없으므로 모든 인스턴스가 동등합니다. {@link #INSTANCE} 사용을 권장합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record CompletionTrigger() implements TransitionTrigger {

    public static final CompletionTrigger INSTANCE = new CompletionTrigger();

    @Override
    public String describe() {
        return "completion";
    }
}
