package com.ryuqq.protocheck.adapter.inmemory.extractor;

import com.ryuqq.protocheck.core.document.DocumentBlock;
import com.ryuqq.protocheck.core.document.MetaBlock;
import com.ryuqq.protocheck.core.document.ProtocolDocument;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.spi.Extractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link Extractor} SPI for testing and reference purposes.
 *
 * <p>Machines are registered ahead of time under a document name; {@link #extract(ProtocolDocument)}
 * looks them up by {@link ProtocolDocument#name()}. No document syntax is parsed.</p>
 *
 * <p><strong>Document Handling:</strong></p>
 * <ul>
 *   <li>META blocks: the first {@code domain} entry is stamped onto registered machines
 *       that declare no protocol domain of their own</li>
 *   <li>All other block kinds are accepted and ignored</li>
 *   <li>Unknown document name: no machines (empty list)</li>
 * </ul>
 *
 * <p><strong>Failure Scripting:</strong> {@link #failOn(String, RuntimeException)} makes
 * extraction of a document throw, to exercise the engine's extraction-failure path.</p>
 *
 * <p><strong>Thread Safety:</strong> registrations live in a {@link ConcurrentHashMap}
 * and are stored as immutable lists.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryExtractor extractor = new InMemoryExtractor();
 * extractor.register("handshake", handshakeMachine, teardownMachine);
 *
 * List&lt;ProtocolStateMachine&gt; machines = extractor.extract(ProtocolDocument.empty("handshake"));
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public class InMemoryExtractor implements Extractor {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExtractor.class);

    private final ConcurrentHashMap<String, List<ProtocolStateMachine>> machinesByDocument;
    private final ConcurrentHashMap<String, RuntimeException> failuresByDocument;
    private final AtomicLong extractCount;

    /**
     * Creates an extractor with no registrations.
     */
    public InMemoryExtractor() {
        this.machinesByDocument = new ConcurrentHashMap<>();
        this.failuresByDocument = new ConcurrentHashMap<>();
        this.extractCount = new AtomicLong();
    }

    /**
     * Registers the machines a document declares, replacing any previous registration.
     *
     * @param documentName the document name
     * @param machines machines in declaration order
     * @return this extractor
     * @throws IllegalArgumentException if documentName is blank or a machine is null
     */
    public InMemoryExtractor register(String documentName, ProtocolStateMachine... machines) {
        return register(documentName, List.of(machines));
    }

    /**
     * Registers the machines a document declares, replacing any previous registration.
     *
     * @param documentName the document name
     * @param machines machines in declaration order
     * @return this extractor
     * @throws IllegalArgumentException if documentName is blank or machines is null
     */
    public InMemoryExtractor register(String documentName, List<ProtocolStateMachine> machines) {
        if (documentName == null || documentName.isBlank()) {
            throw new IllegalArgumentException("documentName cannot be null or blank");
        }
        if (machines == null) {
            throw new IllegalArgumentException("machines cannot be null");
        }
        machinesByDocument.put(documentName, List.copyOf(machines));
        log.debug("Registered {} machine(s) for document '{}'", machines.size(), documentName);
        return this;
    }

    /**
     * Makes extraction of a document throw the given exception.
     *
     * @param documentName the document name
     * @param failure the exception to throw
     * @return this extractor
     */
    public InMemoryExtractor failOn(String documentName, RuntimeException failure) {
        if (documentName == null || failure == null) {
            throw new IllegalArgumentException("documentName and failure cannot be null");
        }
        failuresByDocument.put(documentName, failure);
        return this;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Returns the registered machines in registration order</li>
     *   <li>Machines without a protocol domain inherit the document's declared domain</li>
     * </ul>
     */
    @Override
    public List<ProtocolStateMachine> extract(ProtocolDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        extractCount.incrementAndGet();

        RuntimeException failure = failuresByDocument.get(document.name());
        if (failure != null) {
            throw failure;
        }

        List<ProtocolStateMachine> registered = machinesByDocument.get(document.name());
        if (registered == null) {
            log.debug("No machines registered for document '{}'", document.name());
            return List.of();
        }

        Optional<String> domain = resolveDomain(document);
        if (domain.isEmpty()) {
            return registered;
        }
        List<ProtocolStateMachine> stamped = new ArrayList<>(registered.size());
        for (ProtocolStateMachine machine : registered) {
            stamped.add(machine.getProtocolDomain().isPresent()
                ? machine
                : machine.toBuilder().protocolDomain(domain.get()).build());
        }
        return List.copyOf(stamped);
    }

    /**
     * Number of {@link #extract(ProtocolDocument)} calls so far.
     *
     * @return call count
     */
    public long getExtractCount() {
        return extractCount.get();
    }

    /**
     * Removes every registration and scripted failure.
     */
    public void clear() {
        machinesByDocument.clear();
        failuresByDocument.clear();
    }

    private static Optional<String> resolveDomain(ProtocolDocument document) {
        for (DocumentBlock block : document.blocks()) {
            Optional<String> domain = switch (block.kind()) {
                case META -> Optional.ofNullable(((MetaBlock) block).entries().get(ProtocolDocument.DOMAIN_ENTRY));
                case TYPES, RULES, FUNCTIONS, ERRORS, EVIDENCE -> Optional.empty();
            };
            if (domain.isPresent()) {
                return domain;
            }
        }
        return Optional.empty();
    }
}
