package com.ryuqq.protocheck.core.trigger;

/**
 * 전이 트리거.
 *
 * <p>전이를 발생시키는 원인을 나타내는 태그 유니온입니다:</p>
 * <ul>
 *   <li>{@link EventTrigger}: 이름 있는 이벤트</li>
 *   <li>{@link TimeoutTrigger}: 시간 경과</li>
 *   <li>{@link ConditionTrigger}: 조건식 충족</li>
 *   <li>{@link SignalTrigger}: 외부 신호</li>
 *   <li>{@link CompletionTrigger}: 내부 계산 완료</li>
 *   <li>{@link ErrorTrigger}: 오류 조건</li>
 * </ul>
 *
 * <p>각 구현은 record이므로 값 동등성을 가지며, 같은 (출발 상태, 트리거)를 공유하는
 * 전이를 우선순위로 정렬할 때 그룹 키로 사용됩니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public sealed interface TransitionTrigger
    permits EventTrigger, TimeoutTrigger, ConditionTrigger, SignalTrigger, CompletionTrigger, ErrorTrigger {

    /**
     * 전이 식별자에 사용되는 짧은 설명.
     *
     * @return 예: {@code event:start}, {@code timeout:PT30S}, {@code completion}
     */
    String describe();
}
