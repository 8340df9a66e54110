package com.ryuqq.protocheck.core.document;

import java.util.List;

/**
 * 오류 정의 블록.
 *
 * @param errors 항목 목록 (선언 순서)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record ErrorsBlock(List<String> errors) implements DocumentBlock {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errors가 null인 경우
     */
    public ErrorsBlock {
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        errors = List.copyOf(errors);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.ERRORS;
    }
}
