package com.ryuqq.protocheck.core.result;

/**
 * 분석 경고 종류.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum WarningKind {

    /**
     * 문서에서 상태 머신을 찾지 못함.
     */
    NO_STATE_MACHINES,

    /**
     * Extractor가 예외를 던짐 (분석 중단).
     */
    EXTRACTION_FAILED,

    /**
     * 구조 불변식 위반으로 머신을 건너뜀.
     */
    STRUCTURAL_ERROR,

    /**
     * 사이클 열거가 상한에 도달함.
     */
    RESOURCE_BOUND_EXCEEDED,

    /**
     * 시간 예산 초과 (부분 결과).
     */
    TIMEOUT,

    /**
     * 오라클이 의무를 판정하지 못함.
     */
    VERIFIER_FAILURE,

    /**
     * 전체 상태 수가 maxStateSpace를 초과함.
     */
    STATE_SPACE_EXCEEDED,

    /**
     * 선행 단계가 비활성화되어 단계를 건너뜀.
     */
    PHASE_SKIPPED,

    /**
     * 분석기가 머신 하나에 대해 예외를 던짐.
     */
    ANALYSIS_ERROR
}
