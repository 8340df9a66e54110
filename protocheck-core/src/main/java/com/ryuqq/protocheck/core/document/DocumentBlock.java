package com.ryuqq.protocheck.core.document;

/**
 * 프로토콜 문서의 블록.
 *
 * <p>블록 종류마다 하나의 구현을 가지는 sealed interface입니다.
 * 블록 내용은 엔진에게 불투명하며, 상태 머신으로의 매핑은 Extractor가 담당합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public sealed interface DocumentBlock
    permits MetaBlock, TypesBlock, RulesBlock, FunctionsBlock, ErrorsBlock, EvidenceBlock {

    /**
     * 블록 종류.
     *
     * @return 이 블록에 대응하는 {@link BlockKind}
     */
    BlockKind kind();
}
