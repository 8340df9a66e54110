package com.ryuqq.protocheck.core.result;

import com.ryuqq.protocheck.core.model.MachineId;

import java.util.Optional;

/**
 * 분석 경고.
 *
 * <p>경고는 분석을 중단시키지 않는 문제를 기록합니다. 분석 결과와 함께 반환됩니다.</p>
 *
 * @param kind 경고 종류
 * @param machineId 관련 머신 (문서 수준 경고면 null)
 * @param message 설명
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record AnalysisWarning(
    WarningKind kind,
    MachineId machineId,
    String message
) {

    public AnalysisWarning {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // machineId는 null 허용
    }

    public static AnalysisWarning of(WarningKind kind, String message) {
        return new AnalysisWarning(kind, null, message);
    }

    public static AnalysisWarning of(WarningKind kind, MachineId machineId, String message) {
        return new AnalysisWarning(kind, machineId, message);
    }

    public Optional<MachineId> machine() {
        return Optional.ofNullable(machineId);
    }
}
