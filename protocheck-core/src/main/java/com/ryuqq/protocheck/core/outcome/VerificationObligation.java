package com.ryuqq.protocheck.core.outcome;

import com.ryuqq.protocheck.core.formula.PropertyFormula;
import com.ryuqq.protocheck.core.model.MachineId;

import java.util.List;

/**
 * 오라클에 전달되는 검증 의무.
 *
 * <p>공식 자체와 함께 맥락(머신, 대상 상태, 초기 상태로부터의 증인 경로)을 담습니다.
 * 오라클은 증인 경로를 반례 구성이나 bounded 검사의 힌트로 사용할 수 있습니다.</p>
 *
 * @param obligationId 의무 ID (머신 내에서 고유)
 * @param machineId 대상 머신
 * @param kind 의무 종류
 * @param state 의무가 걸린 상태 (SAFETY: 불변식 상태, LIVENESS: 목표 최종 상태)
 * @param formula 검증할 공식
 * @param witnessTrace 초기 상태에서 state까지의 BFS 경로 (없으면 빈 목록)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record VerificationObligation(
    String obligationId,
    MachineId machineId,
    ObligationKind kind,
    String state,
    PropertyFormula formula,
    List<String> witnessTrace
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public VerificationObligation {
        if (obligationId == null || obligationId.isBlank()) {
            throw new IllegalArgumentException("obligationId cannot be null or blank");
        }
        if (machineId == null) {
            throw new IllegalArgumentException("machineId cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (formula == null) {
            throw new IllegalArgumentException("formula cannot be null");
        }
        witnessTrace = witnessTrace == null ? List.of() : List.copyOf(witnessTrace);
    }

    /**
     * 상태 불변식에 대한 안전성 의무 생성.
     *
     * @param machineId 머신 ID
     * @param state 불변식이 선언된 상태
     * @param index 해당 상태 불변식 목록 내 위치
     * @param formula 불변식
     * @param witnessTrace 증인 경로
     * @return 안전성 의무
     */
    public static VerificationObligation safety(MachineId machineId, String state, int index,
                                                PropertyFormula formula, List<String> witnessTrace) {
        String id = "safety:" + machineId.getValue() + ":" + state + "#" + index;
        return new VerificationObligation(id, machineId, ObligationKind.SAFETY, state, formula, witnessTrace);
    }

    /**
     * 최종 상태 도달에 대한 활성 의무 생성.
     *
     * @param machineId 머신 ID
     * @param finalState 목표 최종 상태
     * @param formula eventually_reaches 공식
     * @return 활성 의무
     */
    public static VerificationObligation liveness(MachineId machineId, String finalState, PropertyFormula formula) {
        String id = "liveness:" + machineId.getValue() + ":" + finalState;
        return new VerificationObligation(id, machineId, ObligationKind.LIVENESS, finalState, formula, List.of());
    }

    /**
     * 시간 논리 솔버가 필요한 의무인지 확인.
     *
     * @return 공식에 시간 연산자가 포함되면 true
     */
    public boolean requiresTemporalSolver() {
        return formula.isTemporal();
    }
}
