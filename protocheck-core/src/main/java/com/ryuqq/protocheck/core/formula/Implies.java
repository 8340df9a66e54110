package com.ryuqq.protocheck.core.formula;

/**
 * 함의 P → Q.
 *
 * @param premise 전제
 * @param conclusion 결론
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record Implies(PropertyFormula premise, PropertyFormula conclusion) implements PropertyFormula {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException premise 또는 conclusion이 null인 경우
     */
    public Implies {
        if (premise == null || conclusion == null) {
            throw new IllegalArgumentException("premise and conclusion cannot be null");
        }
    }

    @Override
    public boolean isTemporal() {
        return premise.isTemporal() || conclusion.isTemporal();
    }

    @Override
    public String render() {
        return "(" + premise.render() + " → " + conclusion.render() + ")";
    }
}
