package com.ryuqq.protocheck.core.formula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 논리합 P ∨ Q ∨ ...
 *
 * @param operands 피연산자 목록 (1개 이상)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record Or(List<PropertyFormula> operands) implements PropertyFormula {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operands가 null이거나 비어 있는 경우
     */
    public Or {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("operands cannot be null or empty");
        }
        operands = List.copyOf(operands);
    }

    @Override
    public boolean isTemporal() {
        return operands.stream().anyMatch(PropertyFormula::isTemporal);
    }

    @Override
    public String render() {
        return operands.stream()
            .map(PropertyFormula::render)
            .collect(Collectors.joining(" ∨ ", "(", ")"));
    }
}
