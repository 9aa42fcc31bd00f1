package com.ryuqq.directory.core.spi;

import com.ryuqq.directory.core.auth.AuthAllowed;
import com.ryuqq.directory.core.auth.AuthCredential;
import com.ryuqq.directory.core.identity.UserAuthToken;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Credential verification SPI.
 *
 * <p>The negotiation state machine holds no secrets: every check of a supplied
 * credential and every decision about which mechanisms a principal needs is
 * delegated here.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe</li>
 *   <li>Unknown and locked principals are indistinguishable to callers
 *       (both return an empty mechanism set)</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public interface CredentialVerifier {

    /**
     * Returns every mechanism the principal must satisfy.
     *
     * @param principal principal name
     * @return required mechanisms, empty if the principal is unknown or locked
     */
    Set<AuthAllowed> requiredMechanisms(String principal);

    /**
     * Verifies supplied credentials.
     *
     * @param principal principal name
     * @param credentials credentials supplied in one step
     * @return true only if every credential is valid for the principal
     */
    boolean verify(String principal, List<AuthCredential> credentials);

    /**
     * Builds the token issued once all mechanisms are satisfied.
     *
     * @param principal principal name
     * @param applicationId application the session was opened for, null if none
     * @return the token, empty if the principal can no longer be resolved
     */
    Optional<UserAuthToken> issueToken(String principal, String applicationId);
}
