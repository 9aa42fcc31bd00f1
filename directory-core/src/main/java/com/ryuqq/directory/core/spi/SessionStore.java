package com.ryuqq.directory.core.spi;

import com.ryuqq.directory.core.auth.AuthSession;
import com.ryuqq.directory.core.auth.SessionId;

import java.util.List;
import java.util.Optional;

/**
 * Authentication session store SPI.
 *
 * <p>Holds the server-side record behind every {@link SessionId}. Many negotiations
 * may run concurrently; each session admits at most one state transition in flight.</p>
 *
 * <p><strong>Acquire/Release Pattern:</strong></p>
 * <pre>
 * 1. tryAcquire(id)   → claims the session (empty if unknown, terminal or already claimed)
 * 2. compute next record (validated by AuthTransition)
 * 3. release(next)    → stores the record and frees the claim
 * </pre>
 *
 * <p>A second {@code Creds} step racing on the same id therefore observes an empty
 * {@code tryAcquire} and is answered with {@code InvalidSessionState}; it can never
 * re-evaluate a session that the first step already moved to SUCCESS.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods callable from multiple threads</li>
 *   <li>Atomic claim: two concurrent tryAcquire calls never both succeed</li>
 *   <li>Expiry never touches a claimed session</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public interface SessionStore {

    /**
     * Registers a new session.
     *
     * @param session the initial record
     * @throws IllegalArgumentException if session is null
     * @throws IllegalStateException if the id is already registered
     */
    void create(AuthSession session);

    /**
     * Reads the current record without claiming it.
     *
     * @param sessionId the session id
     * @return the record, empty if unknown
     * @throws IllegalArgumentException if sessionId is null
     */
    Optional<AuthSession> find(SessionId sessionId);

    /**
     * Claims a live session for one transition.
     *
     * @param sessionId the session id
     * @return the record, empty if the session is unknown, terminal or already claimed
     * @throws IllegalArgumentException if sessionId is null
     */
    Optional<AuthSession> tryAcquire(SessionId sessionId);

    /**
     * Stores the next record of a claimed session and frees the claim.
     *
     * @param next the next record (same session id)
     * @throws IllegalArgumentException if next is null
     * @throws IllegalStateException if the session is not claimed or the phase change is illegal
     */
    void release(AuthSession next);

    /**
     * Moves unresolved CONTINUE sessions idle for longer than the timeout to DENIED.
     *
     * @param inactivityTimeoutMs allowed inactivity in milliseconds
     * @param now current time in epoch milliseconds
     * @param batchSize maximum number of sessions to expire
     * @return ids of expired sessions, oldest first
     * @throws IllegalArgumentException if inactivityTimeoutMs or batchSize is not positive
     */
    List<SessionId> expireIdle(long inactivityTimeoutMs, long now, int batchSize);

    /**
     * Removes terminal sessions whose last activity is older than the ttl.
     *
     * @param ttlMs retention for terminal sessions in milliseconds
     * @param now current time in epoch milliseconds
     * @return number of removed sessions
     * @throws IllegalArgumentException if ttlMs is not positive
     */
    int purgeTerminal(long ttlMs, long now);
}
