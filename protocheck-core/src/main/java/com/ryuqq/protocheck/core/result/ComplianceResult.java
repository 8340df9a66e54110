package com.ryuqq.protocheck.core.result;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 준수성 검사 결과.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>complianceScore ∈ [0, 1]</li>
 *   <li>compliant ⇔ violations가 비어 있음</li>
 *   <li>missingFeatures = {@link #FEATURE_CATALOG} − supportedFeatures</li>
 * </ul>
 *
 * <p>직접 생성하기보다 {@link #of(List, Collection)}와 {@link #merge(Collection)}를 사용하세요.
 * 점수와 누락 기능이 항상 일관되게 계산됩니다.</p>
 *
 * @param compliant 위반이 없는지 여부
 * @param complianceScore max(0, 1 − Σ severity weight)
 * @param violations 위반 목록
 * @param supportedFeatures 머신이 사용하는 기능
 * @param missingFeatures 카탈로그 중 사용하지 않는 기능
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record ComplianceResult(
    boolean compliant,
    double complianceScore,
    List<ProtocolViolation> violations,
    Set<String> supportedFeatures,
    Set<String> missingFeatures
) {

    /**
     * 기능 카탈로그 (순서 고정).
     */
    public static final List<String> FEATURE_CATALOG = List.of(
        "state_machines",
        "transitions",
        "final_states",
        "guards",
        "timing_constraints",
        "state_invariants",
        "fairness_constraints",
        "priorities"
    );

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 점수가 범위를 벗어나거나 compliant가 위반 목록과 일치하지 않는 경우
     */
    public ComplianceResult {
        if (violations == null || supportedFeatures == null || missingFeatures == null) {
            throw new IllegalArgumentException("violations and feature sets cannot be null");
        }
        if (Double.isNaN(complianceScore) || complianceScore < 0.0 || complianceScore > 1.0) {
            throw new IllegalArgumentException("complianceScore must be within [0, 1] (current: " + complianceScore + ")");
        }
        if (compliant != violations.isEmpty()) {
            throw new IllegalArgumentException("compliant must be true exactly when there are no violations");
        }
        violations = List.copyOf(violations);
        supportedFeatures = Collections.unmodifiableSet(new LinkedHashSet<>(supportedFeatures));
        missingFeatures = Collections.unmodifiableSet(new LinkedHashSet<>(missingFeatures));
    }

    /**
     * 위반 목록과 지원 기능으로 결과 생성.
     *
     * @param violations 위반 목록
     * @param supportedFeatures 지원 기능
     * @return 점수와 누락 기능이 계산된 결과
     */
    public static ComplianceResult of(List<ProtocolViolation> violations, Collection<String> supportedFeatures) {
        Set<String> supported = new LinkedHashSet<>();
        for (String feature : FEATURE_CATALOG) {
            if (supportedFeatures.contains(feature)) {
                supported.add(feature);
            }
        }
        Set<String> missing = new LinkedHashSet<>(FEATURE_CATALOG);
        missing.removeAll(supported);
        return new ComplianceResult(violations.isEmpty(), scoreOf(violations), violations, supported, missing);
    }

    /**
     * 머신이 없을 때의 결과 (준수, 점수 1.0).
     *
     * @return 빈 준수 결과
     */
    public static ComplianceResult empty() {
        return of(List.of(), List.of());
    }

    /**
     * 머신별 결과 병합.
     *
     * <p>위반은 입력 순서대로 이어 붙이고, 점수는 전체 위반에 대해 다시 계산하며,
     * 지원 기능은 합집합입니다.</p>
     *
     * @param results 머신별 결과
     * @return 병합된 결과 (입력이 비어 있으면 {@link #empty()})
     */
    public static ComplianceResult merge(Collection<ComplianceResult> results) {
        List<ProtocolViolation> violations = new ArrayList<>();
        Set<String> supported = new LinkedHashSet<>();
        for (ComplianceResult result : results) {
            violations.addAll(result.violations());
            supported.addAll(result.supportedFeatures());
        }
        return of(violations, supported);
    }

    /**
     * 위반 목록의 준수 점수.
     *
     * @param violations 위반 목록
     * @return max(0, 1 − Σ weight)
     */
    public static double scoreOf(List<ProtocolViolation> violations) {
        double penalty = 0.0;
        for (ProtocolViolation violation : violations) {
            penalty += violation.severity().weight();
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - penalty));
    }
}
