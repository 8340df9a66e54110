package com.ryuqq.protocheck.core.model;

/**
 * 구조 오류 종류.
 *
 * <p>모든 종류가 해당 머신에 치명적입니다. 오류가 하나라도 있는 머신은 분석에서 제외됩니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum StructuralErrorKind {

    /**
     * 상태 집합이 비어 있음.
     */
    EMPTY_STATE_SET,

    /**
     * 초기 상태가 상태 집합에 없음.
     */
    UNKNOWN_INITIAL_STATE,

    /**
     * 전이의 출발 상태가 상태 집합에 없음.
     */
    UNKNOWN_TRANSITION_SOURCE,

    /**
     * 전이의 도착 상태가 상태 집합에 없음.
     */
    UNKNOWN_TRANSITION_TARGET,

    /**
     * 최종 상태가 상태 집합에 없음.
     */
    UNKNOWN_FINAL_STATE
}
