package com.ryuqq.protocheck.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 구조 불변식을 위반한 머신을 분석하려 할 때 발생하는 예외.
 *
 * <p>분석기는 이 예외로 실패를 알리고, 엔진은 이를 잡아 해당 머신을 건너뜁니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public class StructuralException extends RuntimeException {

    private final MachineId machineId;
    private final List<StructuralError> errors;

    /**
     * 생성자.
     *
     * @param machineId 머신 ID
     * @param errors 구조 오류 목록 (1개 이상)
     * @throws IllegalArgumentException errors가 null이거나 비어 있는 경우
     */
    public StructuralException(MachineId machineId, List<StructuralError> errors) {
        super(buildMessage(machineId, errors));
        this.machineId = machineId;
        this.errors = List.copyOf(errors);
    }

    private static String buildMessage(MachineId machineId, List<StructuralError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        return "State machine " + machineId + " is structurally invalid: "
            + errors.stream().map(StructuralError::message).collect(Collectors.joining("; "));
    }

    public MachineId getMachineId() {
        return machineId;
    }

    public List<StructuralError> getErrors() {
        return errors;
    }
}
