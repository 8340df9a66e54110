package com.ryuqq.protocheck.core.outcome;

/**
 * 증명 성공.
 *
 * @param obligationId 증명된 의무 ID
 * @param method 증명 방법 (예: smt, bounded-model-checking)
 * @param detail 부가 설명 (선택, null 가능)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record Proof(
    String obligationId,
    String method,
    String detail
) implements VerificationOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException obligationId 또는 method가 null이거나 빈 문자열인 경우
     */
    public Proof {
        if (obligationId == null || obligationId.isBlank()) {
            throw new IllegalArgumentException("obligationId cannot be null or blank");
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        // detail은 null 허용
    }

    /**
     * 부가 설명 없이 Proof 생성.
     *
     * @param obligationId 의무 ID
     * @param method 증명 방법
     * @return Proof 인스턴스
     */
    public static Proof of(String obligationId, String method) {
        return new Proof(obligationId, method, null);
    }
}
