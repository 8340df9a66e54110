package com.ryuqq.protocheck.core.formula;

/**
 * 부정 ¬P.
 *
 * @param operand 피연산자
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record Not(PropertyFormula operand) implements PropertyFormula {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operand가 null인 경우
     */
    public Not {
        if (operand == null) {
            throw new IllegalArgumentException("operand cannot be null");
        }
    }

    @Override
    public boolean isTemporal() {
        return operand.isTemporal();
    }

    @Override
    public String render() {
        return "¬(" + operand.render() + ")";
    }
}
