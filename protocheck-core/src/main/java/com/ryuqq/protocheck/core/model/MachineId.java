package com.ryuqq.protocheck.core.model;

/**
 * 상태 머신의 고유 식별자.
 *
 * <p>MachineId는 하나의 문서에서 추출된 여러 상태 머신을 구분하며,
 * 분석 결과를 머신별로 집계할 때 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>그 외 내용은 불투명(opaque) 문자열로 취급</li>
 * </ul>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class MachineId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private MachineId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MachineId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("MachineId length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * MachineId 생성.
     *
     * @param value MachineId 값
     * @return MachineId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MachineId of(String value) {
        return new MachineId(value);
    }

    /**
     * MachineId 값 조회.
     *
     * @return MachineId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MachineId machineId = (MachineId) o;
        return value.equals(machineId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MachineId{" + value + '}';
    }
}
