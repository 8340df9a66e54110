package com.ryuqq.protocheck.core.result;

/**
 * 위반 심각도.
 *
 * <p>준수성 점수 계산 시 가중치로 사용됩니다:
 * {@code score = max(0, 1 - Σ weight)}.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum ViolationSeverity {

    LOW(0.1),
    MEDIUM(0.3),
    HIGH(0.6),
    CRITICAL(1.0);

    private final double weight;

    ViolationSeverity(double weight) {
        this.weight = weight;
    }

    /**
     * 점수 감점 가중치.
     *
     * @return 가중치 (0.1 ~ 1.0)
     */
    public double weight() {
        return weight;
    }
}
