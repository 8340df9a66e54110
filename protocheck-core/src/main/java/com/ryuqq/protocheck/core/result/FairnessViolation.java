package com.ryuqq.protocheck.core.result;

import com.ryuqq.protocheck.core.model.FairnessConstraint;

import java.util.List;

/**
 * 공정성 위반.
 *
 * <p>사이클이 제약의 요소를 포함하지만, 사이클 위의 어떤 상태에서도
 * 제약의 활성화 조건이 성립하지 않는 경우입니다.</p>
 *
 * @param constraint 위반된 제약
 * @param cycle 위반이 발견된 기본 사이클
 * @param element 사이클에 포함된 제약 요소 (상태 이름 또는 전이 ID)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record FairnessViolation(
    FairnessConstraint constraint,
    List<String> cycle,
    String element
) {

    public FairnessViolation {
        if (constraint == null) {
            throw new IllegalArgumentException("constraint cannot be null");
        }
        if (cycle == null || cycle.isEmpty()) {
            throw new IllegalArgumentException("cycle cannot be null or empty");
        }
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
        cycle = List.copyOf(cycle);
    }

    /**
     * 사람이 읽을 수 있는 설명.
     *
     * @return 설명 문자열
     */
    public String describe() {
        return String.format("%s fairness '%s' violated: cycle %s visits '%s' but never enables it",
            constraint.fairnessType(), constraint.description(), cycle, element);
    }
}
