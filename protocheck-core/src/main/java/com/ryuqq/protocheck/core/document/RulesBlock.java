package com.ryuqq.protocheck.core.document;

import java.util.List;

/**
 * 규칙 블록.
 *
 * @param rules 항목 목록 (선언 순서)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record RulesBlock(List<String> rules) implements DocumentBlock {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException rules가 null인 경우
     */
    public RulesBlock {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        rules = List.copyOf(rules);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.RULES;
    }
}
