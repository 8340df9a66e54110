package com.ryuqq.protocheck.core.model;

/**
 * 공정성 제약 종류.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum FairnessType {

    /**
     * 약한 공정성: 계속 활성화되어 있으면 결국 수행된다.
     */
    WEAK,

    /**
     * 강한 공정성: 무한히 자주 활성화되면 무한히 자주 수행된다.
     */
    STRONG,

    /**
     * Compassion: 강한 공정성의 상태 기반 형태.
     */
    COMPASSION;

    /**
     * 강한 공정성 계열인지 확인.
     *
     * @return STRONG 또는 COMPASSION인 경우 true
     */
    public boolean isStrong() {
        return this == STRONG || this == COMPASSION;
    }
}
