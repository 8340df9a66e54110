package com.ryuqq.protocheck.core.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 타입 정의 블록.
 *
 * @param definitions 항목 (이름 → 내용, 삽입 순서 유지)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record TypesBlock(Map<String, String> definitions) implements DocumentBlock {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException definitions가 null인 경우
     */
    public TypesBlock {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    @Override
    public BlockKind kind() {
        return BlockKind.TYPES;
    }
}
