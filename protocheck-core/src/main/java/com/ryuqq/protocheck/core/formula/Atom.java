package com.ryuqq.protocheck.core.formula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 원자 명제 P(t1, ..., tn).
 *
 * @param predicate 술어 이름
 * @param terms 인자 항 목록 (빈 목록 허용)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record Atom(
    String predicate,
    List<Term> terms
) implements PropertyFormula {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException predicate가 null/blank이거나 terms가 null인 경우
     */
    public Atom {
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("predicate cannot be null or blank");
        }
        if (terms == null) {
            throw new IllegalArgumentException("terms cannot be null");
        }
        terms = List.copyOf(terms);
    }

    @Override
    public boolean isTemporal() {
        return false;
    }

    @Override
    public String render() {
        if (terms.isEmpty()) {
            return predicate;
        }
        return predicate + terms.stream().map(Term::render).collect(Collectors.joining(", ", "(", ")"));
    }
}
