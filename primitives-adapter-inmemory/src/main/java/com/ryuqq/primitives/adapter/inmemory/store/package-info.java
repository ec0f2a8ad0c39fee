/**
 * In-memory RemoteStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.primitives.core.spi.RemoteStore} SPI for tests and local development.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.primitives.adapter.inmemory.store.InMemoryRemoteStore}:
 *       Thread-safe key-value store with TTL, keyword search and outage simulation</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and degraded-mode tests of Cache and Memory</li>
 * </ul>
 *
 * @see com.ryuqq.primitives.core.spi.RemoteStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.adapter.inmemory.store;
