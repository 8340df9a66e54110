package com.ryuqq.protocheck.core.formula;

/**
 * 시간 연산자 항상(□P): 모든 미래 상태에서 P가 성립.
 *
 * @param operand 피연산자
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record Always(PropertyFormula operand) implements PropertyFormula {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operand가 null인 경우
     */
    public Always {
        if (operand == null) {
            throw new IllegalArgumentException("operand cannot be null");
        }
    }

    @Override
    public boolean isTemporal() {
        return true;
    }

    @Override
    public String render() {
        return "□(" + operand.render() + ")";
    }
}
