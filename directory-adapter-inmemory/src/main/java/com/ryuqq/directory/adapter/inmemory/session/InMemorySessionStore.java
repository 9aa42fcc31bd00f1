package com.ryuqq.directory.adapter.inmemory.session;

import com.ryuqq.directory.core.auth.AuthSession;
import com.ryuqq.directory.core.auth.SessionId;
import com.ryuqq.directory.core.spi.SessionStore;
import com.ryuqq.directory.core.statemachine.AuthPhase;
import com.ryuqq.directory.core.statemachine.AuthTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SessionStore} SPI.
 *
 * <p>Each session lives in a slot holding the current immutable {@link AuthSession}
 * and an {@link AtomicBoolean} claim flag. {@link #tryAcquire(SessionId)} flips the flag
 * with compare-and-set, so at most one transition per session is ever in flight.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>sessions:</strong> ConcurrentHashMap&lt;SessionId, Slot&gt; - O(1) lookup, concurrent negotiations</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>create / find / tryAcquire / release:</strong> O(1)</li>
 *   <li><strong>expireIdle:</strong> O(N log N) - full scan, sorted by last activity</li>
 *   <li><strong>purgeTerminal:</strong> O(N)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Sessions are lost on process restart</li>
 *   <li>Not shared between server instances</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    /**
     * Session slots.
     * Key: SessionId, Value: Slot (current record + claim flag)
     */
    private final ConcurrentHashMap<SessionId, Slot> sessions;

    /**
     * Creates a new InMemorySessionStore with empty storage.
     */
    public InMemorySessionStore() {
        this.sessions = new ConcurrentHashMap<>();
    }

    @Override
    public void create(AuthSession session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }

        Slot existing = sessions.putIfAbsent(session.sessionId(), new Slot(session));
        if (existing != null) {
            throw new IllegalStateException("Session already exists: " + session.sessionId());
        }
        log.debug("Session {} created in phase {}", session.sessionId(), session.phase());
    }

    @Override
    public Optional<AuthSession> find(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }

        Slot slot = sessions.get(sessionId);
        return slot == null ? Optional.empty() : Optional.of(slot.session);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Claim is a compare-and-set on the slot flag</li>
     *   <li>A terminal session is released immediately and reported as empty</li>
     * </ul>
     */
    @Override
    public Optional<AuthSession> tryAcquire(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }

        Slot slot = sessions.get(sessionId);
        if (slot == null) {
            return Optional.empty();
        }
        if (!slot.claimed.compareAndSet(false, true)) {
            log.debug("Session {} already has a transition in flight", sessionId);
            return Optional.empty();
        }

        AuthSession current = slot.session;
        if (current.isTerminal()) {
            slot.claimed.set(false);
            return Optional.empty();
        }
        return Optional.of(current);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The claim is freed even when the phase change is rejected.</p>
     */
    @Override
    public void release(AuthSession next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }

        Slot slot = sessions.get(next.sessionId());
        if (slot == null) {
            throw new IllegalStateException("Session not found: " + next.sessionId());
        }
        if (!slot.claimed.get()) {
            throw new IllegalStateException("Session is not claimed: " + next.sessionId());
        }

        try {
            AuthTransition.validate(slot.session.phase(), next.phase());
            slot.session = next;
        } finally {
            slot.claimed.set(false);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Claimed sessions are skipped; they are re-examined on the next scan</li>
     *   <li>The idle check is repeated under the claim</li>
     * </ul>
     */
    @Override
    public List<SessionId> expireIdle(long inactivityTimeoutMs, long now, int batchSize) {
        if (inactivityTimeoutMs <= 0) {
            throw new IllegalArgumentException("inactivityTimeoutMs must be positive, but was: " + inactivityTimeoutMs);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<Slot> candidates = sessions.values().stream()
                .filter(slot -> isExpirable(slot.session, inactivityTimeoutMs, now))
                .sorted(Comparator.comparingLong(slot -> slot.session.lastActivityAt()))
                .collect(Collectors.toList());

        List<SessionId> expired = new ArrayList<>();
        for (Slot slot : candidates) {
            if (expired.size() >= batchSize) {
                break;
            }
            if (!slot.claimed.compareAndSet(false, true)) {
                continue;
            }
            try {
                AuthSession current = slot.session;
                if (isExpirable(current, inactivityTimeoutMs, now)) {
                    slot.session = current.deny(now);
                    expired.add(current.sessionId());
                }
            } finally {
                slot.claimed.set(false);
            }
        }
        return expired;
    }

    @Override
    public int purgeTerminal(long ttlMs, long now) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive, but was: " + ttlMs);
        }

        int removed = 0;
        for (Map.Entry<SessionId, Slot> entry : sessions.entrySet()) {
            Slot slot = entry.getValue();
            if (slot.session.isTerminal()
                    && slot.session.isIdleLongerThan(ttlMs, now)
                    && !slot.claimed.get()
                    && sessions.remove(entry.getKey(), slot)) {
                removed++;
            }
        }
        return removed;
    }

    private static boolean isExpirable(AuthSession session, long inactivityTimeoutMs, long now) {
        return session.phase() == AuthPhase.CONTINUE && session.isIdleLongerThan(inactivityTimeoutMs, now);
    }

    /**
     * Clears all sessions.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        sessions.clear();
    }

    /**
     * Returns the number of stored sessions.
     *
     * @return session count
     */
    public int size() {
        return sessions.size();
    }

    /**
     * Session record plus claim flag.
     */
    private static final class Slot {
        private volatile AuthSession session;
        private final AtomicBoolean claimed = new AtomicBoolean(false);

        Slot(AuthSession session) {
            this.session = session;
        }
    }
}
