package com.ryuqq.protocheck.core.model;

import com.ryuqq.protocheck.core.formula.PropertyFormula;
import com.ryuqq.protocheck.core.trigger.TransitionTrigger;

/**
 * 상태 전이 정의.
 *
 * <p>fromState/toState가 소속 머신의 상태 집합에 포함되는지는 생성 시 검증하지 않습니다.
 * 구조 검증은 {@link ProtocolStateMachine#validate()}가 담당합니다.</p>
 *
 * <p><strong>우선순위:</strong> 0~255, 값이 클수록 먼저 발생합니다.
 * 같은 (fromState, trigger)를 공유하는 전이는 우선순위 내림차순, 그다음 선언 순서로 정렬됩니다.</p>
 *
 * @param fromState 출발 상태
 * @param toState 도착 상태
 * @param trigger 전이 트리거
 * @param guard 추가 가드 조건 (null 가능)
 * @param action 전이 시 수행되는 동작 설명 (null 가능, 실행되지 않음)
 * @param priority 우선순위 (0~255)
 * @param timing 타이밍 제약 (null 가능)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record StateTransition(
    String fromState,
    String toState,
    TransitionTrigger trigger,
    PropertyFormula guard,
    String action,
    int priority,
    TimingConstraint timing
) {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 255;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 priority가 범위를 벗어난 경우
     */
    public StateTransition {
        if (fromState == null || toState == null) {
            throw new IllegalArgumentException("fromState and toState cannot be null (from: " + fromState + ", to: " + toState + ")");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException(
                String.format("priority must be between %d and %d (current: %d)", MIN_PRIORITY, MAX_PRIORITY, priority));
        }
        // guard, action, timing은 null 허용
    }

    /**
     * 가드/동작/타이밍 없이 기본 우선순위(0)로 전이 생성.
     *
     * @param fromState 출발 상태
     * @param toState 도착 상태
     * @param trigger 트리거
     * @return StateTransition 인스턴스
     */
    public static StateTransition of(String fromState, String toState, TransitionTrigger trigger) {
        return new StateTransition(fromState, toState, trigger, null, null, MIN_PRIORITY, null);
    }

    /**
     * 전이 식별자.
     *
     * <p>{@code transitionConditions}의 키와 공정성 제약의 원소로 사용됩니다.</p>
     *
     * @return {@code from->to[trigger]} 형식 문자열
     */
    public String id() {
        return fromState + "->" + toState + "[" + trigger.describe() + "]";
    }

    /**
     * 자기 자신으로 돌아오는 전이인지 확인.
     *
     * @return fromState와 toState가 같으면 true
     */
    public boolean isSelfLoop() {
        return fromState.equals(toState);
    }

    public StateTransition withPriority(int priority) {
        return new StateTransition(fromState, toState, trigger, guard, action, priority, timing);
    }

    public StateTransition withGuard(PropertyFormula guard) {
        return new StateTransition(fromState, toState, trigger, guard, action, priority, timing);
    }

    public StateTransition withAction(String action) {
        return new StateTransition(fromState, toState, trigger, guard, action, priority, timing);
    }

    public StateTransition withTiming(TimingConstraint timing) {
        return new StateTransition(fromState, toState, trigger, guard, action, priority, timing);
    }
}
