/**
 * In-memory credential verifier.
 *
 * @see com.ryuqq.directory.core.spi.CredentialVerifier
 * @author Directory Team
 * @since 1.0.0
 */
package com.ryuqq.directory.adapter.inmemory.auth;
