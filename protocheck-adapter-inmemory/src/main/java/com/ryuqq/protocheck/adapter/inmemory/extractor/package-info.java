/**
 * In-memory Extractor adapter.
 *
 * <p>{@link com.ryuqq.protocheck.adapter.inmemory.extractor.InMemoryExtractor} serves
 * pre-registered state machines by document name. Suitable for contract tests and as a
 * reference for real extractors; it parses nothing.</p>
 *
 * @see com.ryuqq.protocheck.core.spi.Extractor
 * @author Protocheck Team
 * @since 1.0.0
 */
package com.ryuqq.protocheck.adapter.inmemory.extractor;
