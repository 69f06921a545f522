/**
 * In-memory StateStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the StateStore SPI
 * for tests and for embedding the handler without a ledger node.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.transferchain.adapter.inmemory.store.InMemoryStateStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.transferchain.core.spi.StateStore}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.transferchain.core.spi.StateStore
 * @author Transfer Chain Team
 * @since 1.0.0
 */
package com.ryuqq.transferchain.adapter.inmemory.store;
