package com.ryuqq.protocheck.core.result;

import java.util.List;

/**
 * 반증된 안전성 의무.
 *
 * @param obligationId 반증된 의무 ID
 * @param violationType 위반 종류
 * @param involvedStates 위반이 발생한 상태
 * @param violationTrace 초기 상태에서 위반 상태까지의 트레이스 (오라클 반례 우선, 없으면 BFS 증인 경로)
 * @param severity 심각도
 * @param suggestions 수정 제안
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record SafetyViolation(
    String obligationId,
    SafetyViolationType violationType,
    List<String> involvedStates,
    List<String> violationTrace,
    ViolationSeverity severity,
    List<String> suggestions
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public SafetyViolation {
        if (obligationId == null || obligationId.isBlank()) {
            throw new IllegalArgumentException("obligationId cannot be null or blank");
        }
        if (violationType == null) {
            throw new IllegalArgumentException("violationType cannot be null");
        }
        if (involvedStates == null || violationTrace == null || suggestions == null) {
            throw new IllegalArgumentException("states, trace and suggestions cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        involvedStates = List.copyOf(involvedStates);
        violationTrace = List.copyOf(violationTrace);
        suggestions = List.copyOf(suggestions);
    }
}
