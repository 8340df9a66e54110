package com.ryuqq.protocheck.core.outcome;

import java.util.List;

/**
 * 검증 실패.
 *
 * <p>{@link FailureReason#REFUTED}만 실제 위반이며, 나머지 사유는 의무를
 * 미검증으로 남깁니다. 엔진은 실패한 의무를 재시도하지 않습니다.</p>
 *
 * @param obligationId 의무 ID
 * @param reason 실패 사유
 * @param message 설명
 * @param counterexample 오라클이 제공한 반례 상태 트레이스 (없으면 빈 목록)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record VerificationFailure(
    String obligationId,
    FailureReason reason,
    String message,
    List<String> counterexample
) implements VerificationOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public VerificationFailure {
        if (obligationId == null || obligationId.isBlank()) {
            throw new IllegalArgumentException("obligationId cannot be null or blank");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        counterexample = counterexample == null ? List.of() : List.copyOf(counterexample);
    }

    public static VerificationFailure of(String obligationId, FailureReason reason, String message) {
        return new VerificationFailure(obligationId, reason, message, List.of());
    }

    public static VerificationFailure refuted(String obligationId, String message, List<String> counterexample) {
        return new VerificationFailure(obligationId, FailureReason.REFUTED, message, counterexample);
    }

    public static VerificationFailure unknown(String obligationId, String message) {
        return of(obligationId, FailureReason.UNKNOWN, message);
    }

    /**
     * 오라클이 반례를 제공했는지 확인.
     *
     * @return 반례가 비어 있지 않으면 true
     */
    public boolean hasCounterexample() {
        return !counterexample.isEmpty();
    }
}
