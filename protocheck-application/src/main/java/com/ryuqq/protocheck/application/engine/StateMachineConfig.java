package com.ryuqq.protocheck.application.engine;

import java.time.Duration;

/**
 * AnalysisEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enableReachability: 도달성 분석 (기본 true)</li>
 *   <li>enableDeadlockDetection: 데드락/라이브락 탐지 (기본 true)</li>
 *   <li>enableLivenessVerification: 안전성/활성/공정성 검증 (기본 true)</li>
 *   <li>maxStateSpace: 사이클 열거 상한 및 상태 공간 경고 기준 (기본 10000)</li>
 *   <li>timeout: 분석 호출당 시간 예산 (기본 60초)</li>
 *   <li>enableProfiling: 성능 지표 계산 (기본 false)</li>
 * </ul>
 *
 * <p>활성 분석 단계는 도달성 결과가 필요하므로, enableReachability가 false이면
 * 두 활성 플래그와 관계없이 건너뜁니다 (PHASE_SKIPPED 경고).</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 * @param enableReachability 도달성 분석 활성화 여부
 * @param enableDeadlockDetection 데드락/라이브락 탐지 활성화 여부
 * @param enableLivenessVerification 안전성/활성/공정성 검증 활성화 여부
 * @param maxStateSpace 상태 공간 상한 (1 이상)
 * @param timeout 시간 예산 (0 이상, 0이면 즉시 타임아웃)
 * @param enableProfiling 성능 지표 활성화 여부
 */
public record StateMachineConfig(
    boolean enableReachability,
    boolean enableDeadlockDetection,
    boolean enableLivenessVerification,
    int maxStateSpace,
    Duration timeout,
    boolean enableProfiling
) {

    public static final int DEFAULT_MAX_STATE_SPACE = 10_000;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: 모든 분석 활성화, maxStateSpace=10000, timeout=60s, 프로파일링 비활성화</p>
     */
    public StateMachineConfig() {
        this(true, true, true, DEFAULT_MAX_STATE_SPACE, DEFAULT_TIMEOUT, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StateMachineConfig {
        if (maxStateSpace <= 0) {
            throw new IllegalArgumentException(
                "maxStateSpace must be positive (current: " + maxStateSpace + ")"
            );
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException(
                "timeout must be non-negative (current: " + timeout + ")"
            );
        }
    }

    /**
     * 활성 분석 단계를 실행할 플래그가 하나라도 켜져 있는지 확인.
     *
     * @return enableDeadlockDetection 또는 enableLivenessVerification
     */
    public boolean isLivenessPhaseRequested() {
        return enableDeadlockDetection || enableLivenessVerification;
    }

    public StateMachineConfig withEnableReachability(boolean enableReachability) {
        return new StateMachineConfig(enableReachability, enableDeadlockDetection, enableLivenessVerification, maxStateSpace, timeout, enableProfiling);
    }

    public StateMachineConfig withEnableDeadlockDetection(boolean enableDeadlockDetection) {
        return new StateMachineConfig(enableReachability, enableDeadlockDetection, enableLivenessVerification, maxStateSpace, timeout, enableProfiling);
    }

    public StateMachineConfig withEnableLivenessVerification(boolean enableLivenessVerification) {
        return new StateMachineConfig(enableReachability, enableDeadlockDetection, enableLivenessVerification, maxStateSpace, timeout, enableProfiling);
    }

    /**
     * maxStateSpace만 변경한 새 인스턴스 생성.
     */
    public StateMachineConfig withMaxStateSpace(int maxStateSpace) {
        return new StateMachineConfig(enableReachability, enableDeadlockDetection, enableLivenessVerification, maxStateSpace, timeout, enableProfiling);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public StateMachineConfig withTimeout(Duration timeout) {
        return new StateMachineConfig(enableReachability, enableDeadlockDetection, enableLivenessVerification, maxStateSpace, timeout, enableProfiling);
    }

    public StateMachineConfig withEnableProfiling(boolean enableProfiling) {
        return new StateMachineConfig(enableReachability, enableDeadlockDetection, enableLivenessVerification, maxStateSpace, timeout, enableProfiling);
    }
}
