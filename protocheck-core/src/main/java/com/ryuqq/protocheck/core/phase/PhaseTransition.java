package com.ryuqq.protocheck.core.phase;

/**
 * 분석 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → EXTRACTING</li>
 *   <li>EXTRACTING 또는 분석 단계 → 뒤쪽의 분석 단계 또는 AGGREGATING</li>
 *   <li>AGGREGATING → DONE</li>
 *   <li>종료 상태가 아닌 단계 → ABORTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(DONE, ABORTED)에서는 어떤 단계로도 전이 불가</li>
 *   <li>역방향 및 제자리 전이 불가</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(AnalysisPhase from, AnalysisPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        if (to == AnalysisPhase.ABORTED) {
            return;
        }

        boolean valid = switch (from) {
            case IDLE -> to == AnalysisPhase.EXTRACTING;
            case EXTRACTING, REACHABILITY, LIVENESS, COMPLIANCE, PERFORMANCE ->
                (to.isAnalyzing() || to == AnalysisPhase.AGGREGATING) && to.ordinal() > from.ordinal();
            case AGGREGATING -> to == AnalysisPhase.DONE;
            case DONE, ABORTED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static AnalysisPhase transition(AnalysisPhase current, AnalysisPhase next) {
        validate(current, next);
        return next;
    }
}
