package com.ryuqq.protocheck.core.formula;

/**
 * 공식의 항(term).
 *
 * @param name 변수 이름 또는 상수 값
 * @param sort 타입 이름 (예: State), null 가능
 * @param variable 변수이면 true, 상수이면 false
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record Term(
    String name,
    String sort,
    boolean variable
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public Term {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    public static Term variable(String name, String sort) {
        return new Term(name, sort, true);
    }

    public static Term constant(String value, String sort) {
        return new Term(value, sort, false);
    }

    /**
     * 렌더링된 항.
     *
     * @return 변수는 이름 그대로, 상수는 따옴표로 감싼 값
     */
    public String render() {
        return variable ? name : "'" + name + "'";
    }
}
