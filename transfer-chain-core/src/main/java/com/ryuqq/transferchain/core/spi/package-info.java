/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the port through which the transition core reads ledger state,
 * and the exception adapters raise when that state cannot be accessed.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transferchain.core.spi.StateStore} - Address → bytes read and atomic batch write</li>
 *   <li>{@link com.ryuqq.transferchain.core.spi.StateStoreException} - Fatal I/O error or write conflict</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., transfer-chain-adapter-inmemory, or the ledger node's own state view)
 * are responsible for providing concrete implementations of this SPI.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on the persistence engine</li>
 *   <li><strong>Determinism:</strong> Adapters never reorder or partially apply a batch</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Transfer Chain Team
 */
package com.ryuqq.transferchain.core.spi;
