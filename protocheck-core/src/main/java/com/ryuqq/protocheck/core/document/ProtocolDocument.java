package com.ryuqq.protocheck.core.document;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 분석 대상 프로토콜 문서.
 *
 * <p>파서가 생성한 문서를 Extractor에 전달하기 위한 불투명 입력입니다.
 * 엔진은 문서 이름과 블록 구성 정보만 로깅/요약에 사용합니다.</p>
 *
 * @param name 문서 이름
 * @param blocks 블록 목록 (선언 순서)
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record ProtocolDocument(
    String name,
    List<DocumentBlock> blocks
) {

    public static final String DOMAIN_ENTRY = "domain";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null/blank이거나 blocks가 null인 경우
     */
    public ProtocolDocument {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (blocks == null) {
            throw new IllegalArgumentException("blocks cannot be null");
        }
        blocks = List.copyOf(blocks);
    }

    /**
     * 블록이 없는 문서 생성.
     *
     * @param name 문서 이름
     * @return ProtocolDocument 인스턴스
     */
    public static ProtocolDocument empty(String name) {
        return new ProtocolDocument(name, List.of());
    }

    public static ProtocolDocument of(String name, DocumentBlock... blocks) {
        return new ProtocolDocument(name, List.of(blocks));
    }

    /**
     * 첫 번째 메타 블록에 선언된 도메인.
     *
     * @return {@code domain} 항목 값 (없으면 empty)
     */
    public Optional<String> declaredDomain() {
        for (DocumentBlock block : blocks) {
            if (block instanceof MetaBlock meta && meta.entries().containsKey(DOMAIN_ENTRY)) {
                return Optional.of(meta.entries().get(DOMAIN_ENTRY));
            }
        }
        return Optional.empty();
    }

    /**
     * 블록 종류별 개수.
     *
     * @return 종류 → 개수 (없는 종류는 0)
     */
    public Map<BlockKind, Integer> blockCounts() {
        Map<BlockKind, Integer> counts = new EnumMap<>(BlockKind.class);
        for (BlockKind kind : BlockKind.values()) {
            counts.put(kind, 0);
        }
        for (DocumentBlock block : blocks) {
            counts.merge(block.kind(), 1, Integer::sum);
        }
        return counts;
    }
}
