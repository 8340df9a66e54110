package com.ryuqq.protocheck.core.result;

import com.ryuqq.protocheck.core.formula.PropertyFormula;
import com.ryuqq.protocheck.core.outcome.FailureReason;

import java.util.List;

/**
 * 활성 성질 검증 결과.
 *
 * <p><strong>상태별 필드:</strong></p>
 * <ul>
 *   <li>VERIFIED: counterexample 비어 있음, failureReason null</li>
 *   <li>REFUTED: counterexample 존재</li>
 *   <li>UNVERIFIED: counterexample 비어 있음, failureReason 존재</li>
 * </ul>
 *
 * @param description 설명 (예: "Eventually reaches Done")
 * @param property 검증한 공식
 * @param status 검증 상태
 * @param counterexample 반례 상태 트레이스
 * @param propertyType 성질 종류
 * @param failureReason 오라클 실패 사유 (VERIFIED면 null)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record LivenessProperty(
    String description,
    PropertyFormula property,
    PropertyStatus status,
    List<String> counterexample,
    LivenessPropertyType propertyType,
    FailureReason failureReason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 REFUTED에 반례가 없는 경우
     */
    public LivenessProperty {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (propertyType == null) {
            throw new IllegalArgumentException("propertyType cannot be null");
        }
        counterexample = counterexample == null ? List.of() : List.copyOf(counterexample);
        if (status == PropertyStatus.REFUTED && counterexample.isEmpty()) {
            throw new IllegalArgumentException("REFUTED property requires a counterexample");
        }
    }

    public static LivenessProperty verified(String description, PropertyFormula property, LivenessPropertyType type) {
        return new LivenessProperty(description, property, PropertyStatus.VERIFIED, List.of(), type, null);
    }

    public static LivenessProperty refuted(String description, PropertyFormula property, LivenessPropertyType type,
                                           List<String> counterexample, FailureReason reason) {
        return new LivenessProperty(description, property, PropertyStatus.REFUTED, counterexample, type, reason);
    }

    public static LivenessProperty unverified(String description, PropertyFormula property, LivenessPropertyType type,
                                              FailureReason reason) {
        return new LivenessProperty(description, property, PropertyStatus.UNVERIFIED, List.of(), type, reason);
    }

    public boolean isVerified() {
        return status == PropertyStatus.VERIFIED;
    }
}
