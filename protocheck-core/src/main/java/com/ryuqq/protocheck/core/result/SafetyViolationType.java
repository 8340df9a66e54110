package com.ryuqq.protocheck.core.result;

/**
 * 안전성 위반 종류.
 *
 * <p>현재 분석기는 {@link #INVARIANT_VIOLATION}만 생성합니다.
 * 나머지 값은 오라클 또는 상위 도구가 분류할 때 사용합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum SafetyViolationType {
    INVARIANT_VIOLATION,
    MUTUAL_EXCLUSION_VIOLATION,
    RESOURCE_VIOLATION,
    TEMPORAL_VIOLATION,
    PROTOCOL_VIOLATION
}
