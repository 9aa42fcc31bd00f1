/**
 * Service Provider Interfaces for external collaborators.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.directory.core.spi.EntryStore} - storage and query engine</li>
 *   <li>{@link com.ryuqq.directory.core.spi.SchemaValidator} - entry shape validation</li>
 *   <li>{@link com.ryuqq.directory.core.spi.CredentialVerifier} - credential checks and token issuance</li>
 *   <li>{@link com.ryuqq.directory.core.spi.SessionStore} - authentication session records</li>
 * </ul>
 *
 * <p>Reference implementations live in the {@code directory-adapter-inmemory} module.</p>
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.spi;
