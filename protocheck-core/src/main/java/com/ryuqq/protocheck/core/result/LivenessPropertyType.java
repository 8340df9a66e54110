package com.ryuqq.protocheck.core.result;

/**
 * 활성 성질 종류.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum LivenessPropertyType {

    /**
     * 좋은 일이 결국 일어난다 (◇p).
     */
    EVENTUALLY,

    /**
     * 무한히 자주 일어난다 (□◇p).
     */
    INFINITELY_OFTEN,

    /**
     * p가 일어나면 결국 q가 일어난다 (p ⇝ q).
     */
    LEADS_TO,

    /**
     * 진행(progress) 성질.
     */
    PROGRESS
}
