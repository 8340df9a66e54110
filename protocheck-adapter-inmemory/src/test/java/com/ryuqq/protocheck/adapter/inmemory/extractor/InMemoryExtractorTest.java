package com.ryuqq.protocheck.adapter.inmemory.extractor;

import com.ryuqq.protocheck.core.document.MetaBlock;
import com.ryuqq.protocheck.core.document.ProtocolDocument;
import com.ryuqq.protocheck.core.document.RulesBlock;
import com.ryuqq.protocheck.core.model.MachineId;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.trigger.EventTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryExtractor 유닛 테스트.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
class InMemoryExtractorTest {

    private InMemoryExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new InMemoryExtractor();
    }

    private static ProtocolStateMachine machine(String id) {
        return ProtocolStateMachine.builder(MachineId.of(id))
            .states("A", "B")
            .initialState("A")
            .transition("A", "B", new EventTrigger("go"))
            .build();
    }

    @Test
    void 등록된_머신을_등록_순서대로_반환() {
        // given
        extractor.register("doc", machine("first"), machine("second"));

        // when
        List<ProtocolStateMachine> machines = extractor.extract(ProtocolDocument.empty("doc"));

        // then
        assertThat(machines).extracting(m -> m.getId().getValue()).containsExactly("first", "second");
        assertThat(extractor.getExtractCount()).isEqualTo(1);
    }

    @Test
    void 미등록_문서는_빈_목록() {
        // when & then
        assertThat(extractor.extract(ProtocolDocument.empty("unknown"))).isEmpty();
    }

    @Test
    void 메타_블록의_도메인을_도메인_없는_머신에_부여() {
        // given
        ProtocolStateMachine tagged = machine("tagged").toBuilder().protocolDomain("storage").build();
        extractor.register("doc", machine("plain"), tagged);
        ProtocolDocument document = ProtocolDocument.of("doc",
            new RulesBlock(List.of("r")),
            new MetaBlock(Map.of(ProtocolDocument.DOMAIN_ENTRY, "network")));

        // when
        List<ProtocolStateMachine> machines = extractor.extract(document);

        // then
        assertThat(machines.get(0).getProtocolDomain()).contains("network");
        assertThat(machines.get(1).getProtocolDomain()).contains("storage");
    }

    @Test
    void 재등록시_이전_등록을_대체() {
        // given
        extractor.register("doc", machine("old"));

        // when
        extractor.register("doc", machine("new"));

        // then
        assertThat(extractor.extract(ProtocolDocument.empty("doc")))
            .extracting(m -> m.getId().getValue())
            .containsExactly("new");
    }

    @Test
    void failOn_지정한_예외를_던짐() {
        // given
        extractor.failOn("broken", new IllegalStateException("unparseable"));

        // when & then
        assertThatThrownBy(() -> extractor.extract(ProtocolDocument.empty("broken")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("unparseable");
    }

    @Test
    void null_문서는_거부() {
        // when & then
        assertThatThrownBy(() -> extractor.extract(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clear_후에는_빈_목록() {
        // given
        extractor.register("doc", machine("m"));

        // when
        extractor.clear();

        // then
        assertThat(extractor.extract(ProtocolDocument.empty("doc"))).isEmpty();
    }
}
