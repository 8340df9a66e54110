package com.ryuqq.protocheck.core.spi;

import com.ryuqq.protocheck.core.document.ProtocolDocument;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;

import java.util.List;

/**
 * State machine extraction SPI.
 *
 * <p>Maps a parsed protocol document to the automata it declares. Parsing the source
 * text and the mapping rules from document syntax to states and transitions are owned
 * by the implementation.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: may be called concurrently by several analysis calls</li>
 *   <li>Report, don't reject: structurally invalid machines should be returned as-is;
 *       the engine validates and reports them</li>
 *   <li>Deterministic: the same document yields machines in the same order</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * List&lt;ProtocolStateMachine&gt; machines = extractor.extract(document);
 * for (ProtocolStateMachine machine : machines) {
 *     List&lt;StructuralError&gt; errors = machine.validate();
 *     ...
 * }
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public interface Extractor {

    /**
     * Extracts the state machines declared by a document.
     *
     * @param document the parsed protocol document
     * @return extracted machines in declaration order (may be empty)
     * @throws IllegalArgumentException if document is null
     * @throws RuntimeException if the document cannot be mapped; the engine reports this
     *         as an extraction failure and aborts the call
     */
    List<ProtocolStateMachine> extract(ProtocolDocument document);
}
