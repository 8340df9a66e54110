package com.ryuqq.protocheck.core.model;

/**
 * 상태 머신 구조 불변식 위반.
 *
 * <p>예외가 아닌 값으로 보고되며, 엔진은 해당 머신만 건너뛰고 경고를 기록합니다.</p>
 *
 * @param machineId 위반이 발생한 머신
 * @param kind 오류 종류
 * @param element 문제가 된 상태 또는 전이 식별자
 * @param message 사람이 읽을 수 있는 설명
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record StructuralError(
    MachineId machineId,
    StructuralErrorKind kind,
    String element,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public StructuralError {
        if (machineId == null) {
            throw new IllegalArgumentException("machineId cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // element는 null 허용 (EMPTY_STATE_SET)
    }
}
