package com.ryuqq.protocheck.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 공정성 제약 선언.
 *
 * <p>구조적 선언이며 솔버를 사용하지 않습니다. 원소(elements)는 상태 이름 또는
 * 전이 식별자({@link StateTransition#id()})입니다. 활성화 조건은 그 조건이 성립하는
 * 상태 집합(enablingStates)으로 표현하며, 빈 집합은 "무조건 활성화"를 의미합니다.</p>
 *
 * @param description 제약 설명
 * @param elements 제약 대상 상태/전이 식별자
 * @param fairnessType 공정성 종류
 * @param enablingStates 활성화 조건이 성립하는 상태 집합 (빈 집합 허용)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record FairnessConstraint(
    String description,
    Set<String> elements,
    FairnessType fairnessType,
    Set<String> enablingStates
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 elements가 비어 있는 경우
     */
    public FairnessConstraint {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (elements == null || elements.isEmpty()) {
            throw new IllegalArgumentException("elements cannot be null or empty");
        }
        if (fairnessType == null) {
            throw new IllegalArgumentException("fairnessType cannot be null");
        }
        if (enablingStates == null) {
            throw new IllegalArgumentException("enablingStates cannot be null");
        }
        elements = Collections.unmodifiableSet(new LinkedHashSet<>(elements));
        enablingStates = Collections.unmodifiableSet(new LinkedHashSet<>(enablingStates));
    }

    /**
     * 활성화 조건이 없는(무조건 활성화된) 제약인지 확인.
     *
     * @return enablingStates가 비어 있으면 true
     */
    public boolean isUnconditional() {
        return enablingStates.isEmpty();
    }
}
