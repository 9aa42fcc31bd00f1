/**
 * In-memory authentication session store.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.directory.adapter.inmemory.session.InMemorySessionStore}:
 *       Thread-safe implementation of {@link com.ryuqq.directory.core.spi.SessionStore}</li>
 * </ul>
 *
 * @see com.ryuqq.directory.core.spi.SessionStore
 * @author Directory Team
 * @since 1.0.0
 */
package com.ryuqq.directory.adapter.inmemory.session;
