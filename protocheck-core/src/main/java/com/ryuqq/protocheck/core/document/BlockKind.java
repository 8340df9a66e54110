package com.ryuqq.protocheck.core.document;

/**
 * 문서 블록 종류.
 *
 * <p>{@link DocumentBlock}의 구현마다 정확히 하나의 상수가 대응됩니다.
 * 이 enum에 대한 switch 식은 default 없이 작성하여, 블록 종류가 추가되면
 * 컴파일 오류로 누락된 분기를 드러내도록 합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public enum BlockKind {
    META,
    TYPES,
    RULES,
    FUNCTIONS,
    ERRORS,
    EVIDENCE
}
