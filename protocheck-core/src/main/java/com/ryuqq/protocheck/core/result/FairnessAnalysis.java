package com.ryuqq.protocheck.core.result;

import com.ryuqq.protocheck.core.model.FairnessConstraint;

import java.util.List;

/**
 * 공정성 분석 결과.
 *
 * @param strongFairness STRONG, COMPASSION 제약
 * @param weakFairness WEAK 제약
 * @param violations 계산된 사이클에서 발견된 위반
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record FairnessAnalysis(
    List<FairnessConstraint> strongFairness,
    List<FairnessConstraint> weakFairness,
    List<FairnessViolation> violations
) {

    public FairnessAnalysis {
        if (strongFairness == null || weakFairness == null || violations == null) {
            throw new IllegalArgumentException("fairness lists cannot be null");
        }
        strongFairness = List.copyOf(strongFairness);
        weakFairness = List.copyOf(weakFairness);
        violations = List.copyOf(violations);
    }

    public static FairnessAnalysis empty() {
        return new FairnessAnalysis(List.of(), List.of(), List.of());
    }

    public boolean isFair() {
        return violations.isEmpty();
    }
}
