package com.ryuqq.protocheck.core.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 근거(evidence) 블록.
 *
 * @param entries 항목 (이름 → 내용, 삽입 순서 유지)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record EvidenceBlock(Map<String, String> entries) implements DocumentBlock {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException entries가 null인 경우
     */
    public EvidenceBlock {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public BlockKind kind() {
        return BlockKind.EVIDENCE;
    }
}
