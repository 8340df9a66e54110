package com.ryuqq.protocheck.core.document;

import java.util.List;

/**
 * 함수 정의 블록.
 *
 * @param functions 항목 목록 (선언 순서)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record FunctionsBlock(List<String> functions) implements DocumentBlock {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException functions가 null인 경우
     */
    public FunctionsBlock {
        if (functions == null) {
            throw new IllegalArgumentException("functions cannot be null");
        }
        functions = List.copyOf(functions);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.FUNCTIONS;
    }
}
