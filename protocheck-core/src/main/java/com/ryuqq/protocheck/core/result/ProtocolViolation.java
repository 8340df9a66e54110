package com.ryuqq.protocheck.core.result;

import com.ryuqq.protocheck.core.model.MachineId;

import java.util.List;

/**
 * 준수성 규칙 위반.
 *
 * @param machineId 위반이 발생한 머신
 * @param rule 위반된 규칙 이름 (예: minimum_complexity, connectivity)
 * @param description 설명
 * @param states 관련 상태
 * @param severity 심각도
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record ProtocolViolation(
    MachineId machineId,
    String rule,
    String description,
    List<String> states,
    ViolationSeverity severity
) {

    public ProtocolViolation {
        if (machineId == null) {
            throw new IllegalArgumentException("machineId cannot be null");
        }
        if (rule == null || rule.isBlank()) {
            throw new IllegalArgumentException("rule cannot be null or blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        states = states == null ? List.of() : List.copyOf(states);
    }
}
