package com.ryuqq.protocheck.core.outcome;

/**
 * 검증 의무(obligation)에 대한 오라클 결과.
 *
 * <p>VerificationOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Proof}: 의무가 증명됨</li>
 *   <li>{@link VerificationFailure}: 반증, 판정 불가, 미지원, 타임아웃 또는 오류</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * VerificationOutcome outcome = verifier.verifyProperty(obligation);
 * if (outcome instanceof VerificationFailure failure) {
 *     if (failure.reason() == FailureReason.REFUTED) {
 *         // 위반 기록
 *     } else {
 *         // 미검증으로 기록 (재시도하지 않음)
 *     }
 * }
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public sealed interface VerificationOutcome permits Proof, VerificationFailure {

    /**
     * 결과가 가리키는 의무 ID.
     *
     * @return obligation ID
     */
    String obligationId();

    /**
     * 결과가 증명인지 확인.
     *
     * @return 증명 여부
     */
    default boolean isProof() {
        return this instanceof Proof;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof VerificationFailure;
    }
}
