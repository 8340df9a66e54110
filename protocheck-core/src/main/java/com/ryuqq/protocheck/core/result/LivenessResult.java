package com.ryuqq.protocheck.core.result;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 단일 상태 머신의 활성/안전성 분석 결과.
 *
 * @param deadlockStates 나가는 전이가 없는 도달 가능한 비최종 상태
 * @param livelockCycles 닫힌 비최종 SCC
 * @param safetyViolations 반증된 상태 불변식
 * @param livenessProperties 최종 상태별 활성 성질
 * @param fairnessAnalysis 공정성 분석
 * @param unverifiedObligations 오라클이 판정하지 못한 의무
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record LivenessResult(
    Set<String> deadlockStates,
    List<LivelockCycle> livelockCycles,
    List<SafetyViolation> safetyViolations,
    List<LivenessProperty> livenessProperties,
    FairnessAnalysis fairnessAnalysis,
    List<UnverifiedObligation> unverifiedObligations
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public LivenessResult {
        if (deadlockStates == null || livelockCycles == null || safetyViolations == null) {
            throw new IllegalArgumentException("deadlocks, livelocks and safety violations cannot be null");
        }
        if (livenessProperties == null || fairnessAnalysis == null || unverifiedObligations == null) {
            throw new IllegalArgumentException("liveness properties, fairness and unverified obligations cannot be null");
        }
        deadlockStates = Collections.unmodifiableSet(new LinkedHashSet<>(deadlockStates));
        livelockCycles = List.copyOf(livelockCycles);
        safetyViolations = List.copyOf(safetyViolations);
        livenessProperties = List.copyOf(livenessProperties);
        unverifiedObligations = List.copyOf(unverifiedObligations);
    }

    public static LivenessResult empty() {
        return new LivenessResult(Set.of(), List.of(), List.of(), List.of(), FairnessAnalysis.empty(), List.of());
    }

    /**
     * 데드락, 라이브락, 안전성 위반, 반증된 활성 성질, 공정성 위반이 모두 없는지 확인.
     *
     * <p>미검증 의무는 결함으로 보지 않습니다.</p>
     *
     * @return 발견된 결함이 없으면 true
     */
    public boolean isClean() {
        return deadlockStates.isEmpty()
            && livelockCycles.isEmpty()
            && safetyViolations.isEmpty()
            && livenessProperties.stream().noneMatch(p -> p.status() == PropertyStatus.REFUTED)
            && fairnessAnalysis.isFair();
    }
}
