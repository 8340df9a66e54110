package com.ryuqq.protocheck.core.result;

/**
 * 성질 검증 상태.
 *
 * <p>UNVERIFIED는 "거짓"이 아닙니다. 오라클이 판정하지 못했고
 * 그래프에서도 반례를 찾지 못했음을 의미합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum PropertyStatus {
    VERIFIED,
    REFUTED,
    UNVERIFIED
}
