package com.ryuqq.protocheck.core.document;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProtocolDocument 테스트.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
class ProtocolDocumentTest {

    @Test
    void declaredDomain_FirstMetaBlockWithDomain() {
        // Given
        ProtocolDocument document = ProtocolDocument.of("handshake",
            new MetaBlock(Map.of("version", "1")),
            new RulesBlock(List.of("∀s:State→reachable(s)")),
            new MetaBlock(Map.of(ProtocolDocument.DOMAIN_ENTRY, "network")),
            new MetaBlock(Map.of(ProtocolDocument.DOMAIN_ENTRY, "ignored")));

        // When & Then
        assertEquals("network", document.declaredDomain().orElseThrow());
    }

    @Test
    void declaredDomain_NoMetaBlock_ReturnsEmpty() {
        // When & Then
        assertTrue(ProtocolDocument.empty("bare").declaredDomain().isEmpty());
    }

    @Test
    void blockCounts_CountsEveryKind() {
        // Given
        ProtocolDocument document = ProtocolDocument.of("doc",
            new TypesBlock(Map.of("State", "{A, B}")),
            new RulesBlock(List.of("r1")),
            new RulesBlock(List.of("r2")),
            new EvidenceBlock(Map.of("δ", "0.9")));

        // When
        Map<BlockKind, Integer> counts = document.blockCounts();

        // Then
        assertEquals(BlockKind.values().length, counts.size());
        assertEquals(2, (int) counts.get(BlockKind.RULES));
        assertEquals(1, (int) counts.get(BlockKind.TYPES));
        assertEquals(1, (int) counts.get(BlockKind.EVIDENCE));
        assertEquals(0, (int) counts.get(BlockKind.META));
        assertEquals(0, (int) counts.get(BlockKind.FUNCTIONS));
        assertEquals(0, (int) counts.get(BlockKind.ERRORS));
    }

    @Test
    void kind_EachBlockReportsItsKind() {
        // When & Then
        assertEquals(BlockKind.FUNCTIONS, new FunctionsBlock(List.of("f")).kind());
        assertEquals(BlockKind.ERRORS, new ErrorsBlock(List.of("e")).kind());
        assertEquals(BlockKind.META, new MetaBlock(Map.of()).kind());
    }

    @Test
    void constructor_BlankName_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ProtocolDocument.empty(""));
    }
}
