/**
 * In-memory entry store adapter.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.directory.adapter.inmemory.store.InMemoryEntryStore}:
 *       Thread-safe implementation of {@link com.ryuqq.directory.core.spi.EntryStore}
 *       with a recycle bin</li>
 *   <li>{@link com.ryuqq.directory.adapter.inmemory.store.FilterMatcher}:
 *       Filter evaluation over a single entry</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No indexes: every evaluation scans all entries</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @see com.ryuqq.directory.core.spi.EntryStore
 * @author Directory Team
 * @since 1.0.0
 */
package com.ryuqq.directory.adapter.inmemory.store;
