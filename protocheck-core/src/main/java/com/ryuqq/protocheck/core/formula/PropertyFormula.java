package com.ryuqq.protocheck.core.formula;

import java.util.List;

/**
 * 성질(property) 공식.
 *
 * <p>상태 불변식, 전이 가드, 검증 의무(obligation)에 사용되는 논리식의 추상 구문 트리입니다.
 * 엔진은 공식을 해석하지 않으며, 형태만 구성하여 외부 검증기에 전달합니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 노드 종류가 컴파일 타임에 고정됩니다:</p>
 * <ul>
 *   <li>명제/논리: {@link Atom}, {@link Not}, {@link And}, {@link Or}, {@link Implies}</li>
 *   <li>시간 논리: {@link Always}, {@link Eventually}, {@link Until}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PropertyFormula invariant = PropertyFormula.always(
 *     PropertyFormula.atom("holds_lock", Term.variable("session", "Session")));
 *
 * boolean temporal = invariant.isTemporal(); // true
 * String text = invariant.render();          // "□(holds_lock(session))"
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public sealed interface PropertyFormula permits Atom, Not, And, Or, Implies, Always, Eventually, Until {

    /**
     * 시간 연산자(□, ◇, U)가 공식 어딘가에 포함되어 있는지 확인.
     *
     * <p>시간 연산자를 포함한 공식은 단순 도달성으로 표현할 수 없으므로
     * TemporalLogicSolver로 전달됩니다.</p>
     *
     * @return 시간 연산자 포함 여부
     */
    boolean isTemporal();

    /**
     * 안정적인 텍스트 표현.
     *
     * @return 렌더링된 공식
     */
    String render();

    static Atom atom(String predicate, Term... terms) {
        return new Atom(predicate, List.of(terms));
    }

    static Not not(PropertyFormula operand) {
        return new Not(operand);
    }

    static And and(PropertyFormula... operands) {
        return new And(List.of(operands));
    }

    static Or or(PropertyFormula... operands) {
        return new Or(List.of(operands));
    }

    static Implies implies(PropertyFormula premise, PropertyFormula conclusion) {
        return new Implies(premise, conclusion);
    }

    static Always always(PropertyFormula operand) {
        return new Always(operand);
    }

    static Eventually eventually(PropertyFormula operand) {
        return new Eventually(operand);
    }

    static Until until(PropertyFormula hold, PropertyFormula release) {
        return new Until(hold, release);
    }
}
