package com.ryuqq.protocheck.core.outcome;

/**
 * 검증 의무 종류.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum ObligationKind {

    /**
     * 안전성: 상태 불변식이 위반되지 않는다.
     */
    SAFETY,

    /**
     * 활성: 최종 상태에 결국 도달한다.
     */
    LIVENESS
}
