package com.ryuqq.protocheck.core.outcome;

/**
 * 검증 실패 사유.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum FailureReason {

    /**
     * 오라클이 성질을 반증함 (반례 제공 가능).
     */
    REFUTED,

    /**
     * 오라클이 판정하지 못함.
     */
    UNKNOWN,

    /**
     * 오라클이 지원하지 않는 공식.
     */
    UNSUPPORTED,

    /**
     * 오라클 자체 타임아웃.
     */
    TIMEOUT,

    /**
     * 오라클 호출 중 오류 (예외 포함).
     */
    ERROR;

    /**
     * 실제 위반을 의미하는지 확인.
     *
     * <p>REFUTED 외의 사유는 의무를 "미검증"으로 남깁니다.</p>
     *
     * @return REFUTED인 경우 true
     */
    public boolean isRefutation() {
        return this == REFUTED;
    }
}
