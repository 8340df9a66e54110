package com.ryuqq.protocheck.core.model;

/**
 * 상태 머신 분류.
 *
 * <p>분류 정보일 뿐이며, 분석 알고리즘 선택에는 영향을 주지 않습니다.
 * 단, {@link #DETERMINISTIC_FINITE}는 준수성 검사의 결정성 규칙 적용 대상입니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum MachineType {

    /**
     * 결정적 유한 오토마톤.
     */
    DETERMINISTIC_FINITE,

    /**
     * 비결정적 유한 오토마톤.
     */
    NON_DETERMINISTIC_FINITE,

    /**
     * 실시간 제약을 가진 시간 오토마톤.
     */
    TIMED_AUTOMATON,

    /**
     * 연속 동역학을 가진 하이브리드 오토마톤.
     */
    HYBRID_AUTOMATON,

    /**
     * 확률 오토마톤.
     */
    PROBABILISTIC_AUTOMATON,

    /**
     * 통신 순차 프로세스 (CSP).
     */
    COMMUNICATING_SEQUENTIAL
}
