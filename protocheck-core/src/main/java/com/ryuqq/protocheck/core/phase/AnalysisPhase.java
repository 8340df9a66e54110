package com.ryuqq.protocheck.core.phase;

/**
 * 분석 호출 한 번의 진행 단계.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>IDLE → EXTRACTING (시작)</li>
 *   <li>EXTRACTING → 분석 단계 또는 AGGREGATING</li>
 *   <li>분석 단계는 순서대로만 진행 (건너뛰기 허용)</li>
 *   <li>AGGREGATING → DONE</li>
 *   <li>종료 상태가 아닌 모든 단계 → ABORTED</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *  │
 *  ▼
 * EXTRACTING
 *  │
 *  ├─► REACHABILITY ─► LIVENESS ─► COMPLIANCE ─► PERFORMANCE
 *  │   (각 단계는 건너뛸 수 있음)                      │
 *  ▼                                                  ▼
 * AGGREGATING ◄───────────────────────────────────────┘
 *  │
 *  ▼
 * DONE
 *
 * 종료 상태가 아닌 모든 단계 ─► ABORTED (타임아웃, 추출 실패)
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum AnalysisPhase {

    IDLE,
    EXTRACTING,
    REACHABILITY,
    LIVENESS,
    COMPLIANCE,
    PERFORMANCE,
    AGGREGATING,

    /**
     * 정상 완료.
     */
    DONE,

    /**
     * 중단 (부분 결과).
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE 또는 ABORTED인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }

    /**
     * 머신별 분석 단계인지 확인.
     *
     * @return REACHABILITY, LIVENESS, COMPLIANCE, PERFORMANCE인 경우 true
     */
    public boolean isAnalyzing() {
        return this == REACHABILITY || this == LIVENESS || this == COMPLIANCE || this == PERFORMANCE;
    }
}
