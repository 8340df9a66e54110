package com.ryuqq.protocheck.core.formula;

/**
 * 시간 연산자 까지(P U Q): Q가 성립할 때까지 P가 계속 성립.
 *
 * @param hold 유지되어야 하는 공식 P
 * @param release 결국 성립해야 하는 공식 Q
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record Until(PropertyFormula hold, PropertyFormula release) implements PropertyFormula {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException hold 또는 release가 null인 경우
     */
    public Until {
        if (hold == null || release == null) {
            throw new IllegalArgumentException("hold and release cannot be null");
        }
    }

    @Override
    public boolean isTemporal() {
        return true;
    }

    @Override
    public String render() {
        return "(" + hold.render() + " U " + release.render() + ")";
    }
}
