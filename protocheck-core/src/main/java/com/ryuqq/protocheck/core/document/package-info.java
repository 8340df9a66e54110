/**
 * Protocol document input package.
 *
 * <p>{@link com.ryuqq.protocheck.core.document.ProtocolDocument} is the opaque input handed to the
 * {@link com.ryuqq.protocheck.core.spi.Extractor}. Its blocks form a sealed hierarchy with one case per
 * block kind (Meta, Types, Rules, Functions, Errors, Evidence); dispatch over
 * {@link com.ryuqq.protocheck.core.document.BlockKind} is written as an exhaustive switch expression.</p>
 *
 * @since 1.0.0
 * @author Protocheck Team
 */
package com.ryuqq.protocheck.core.document;
