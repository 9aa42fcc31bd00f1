package com.ryuqq.directory.core.auth;

import com.ryuqq.directory.core.identity.UserAuthToken;
import com.ryuqq.directory.core.statemachine.AuthPhase;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AuthSession 테스트.
 *
 * <ul>
 *   <li>INIT → CONTINUE → SUCCESS / DENIED 전이와 활동 시각 갱신</li>
 *   <li>남은 방식 계산</li>
 *   <li>종료 세션 전이 거부</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
class AuthSessionTest {

    private static final SessionId ID = SessionId.random();
    private static final UserAuthToken TOKEN = UserAuthToken.of("alice", "Alice", "u-1");

    @Test
    void start_InitPhase_NothingSatisfied() {
        // When
        AuthSession session = AuthSession.start(ID, "alice", null, Set.of(AuthAllowed.PASSWORD), 100L);

        // Then
        assertEquals(AuthPhase.INIT, session.phase());
        assertEquals(List.of(AuthAllowed.PASSWORD), session.remaining());
        assertNull(session.token());
        assertEquals(100L, session.lastActivityAt());
    }

    @Test
    void proceed_PartialCredentials_RemainingShrinks() {
        // Given
        AuthSession session = AuthSession.start(ID, "alice", null,
            EnumSet.of(AuthAllowed.ANONYMOUS, AuthAllowed.PASSWORD), 100L).proceed(Set.of(), 100L);

        // When
        AuthSession next = session.proceed(Set.of(AuthAllowed.ANONYMOUS), 200L);

        // Then
        assertEquals(AuthPhase.CONTINUE, next.phase());
        assertEquals(List.of(AuthAllowed.PASSWORD), next.remaining());
        assertEquals(200L, next.lastActivityAt());
        assertEquals(List.of(AuthAllowed.ANONYMOUS, AuthAllowed.PASSWORD), session.remaining());
    }

    @Test
    void succeed_FromContinue_BindsToken() {
        // Given
        AuthSession session = AuthSession.start(ID, "alice", null, Set.of(AuthAllowed.ANONYMOUS), 100L)
            .proceed(Set.of(), 100L);

        // When
        AuthSession done = session.succeed(TOKEN, 150L);

        // Then
        assertEquals(AuthPhase.SUCCESS, done.phase());
        assertEquals(TOKEN, done.token());
        assertTrue(done.isTerminal());
        assertTrue(done.remaining().isEmpty());
    }

    @Test
    void succeed_FromInit_ThrowsException() {
        // Given
        AuthSession session = AuthSession.start(ID, "alice", null, Set.of(AuthAllowed.ANONYMOUS), 100L);

        // When & Then
        assertThrows(IllegalStateException.class, () -> session.succeed(TOKEN, 150L));
    }

    @Test
    void terminalSession_AnyTransition_ThrowsException() {
        // Given
        AuthSession denied = AuthSession.start(ID, "bob", null, Set.of(), 100L).deny(100L);

        // When & Then
        assertEquals(AuthPhase.DENIED, denied.phase());
        assertThrows(IllegalStateException.class, () -> denied.proceed(Set.of(), 200L));
        assertThrows(IllegalStateException.class, () -> denied.deny(200L));
        assertThrows(IllegalStateException.class, () -> denied.succeed(TOKEN, 200L));
    }

    @Test
    void isIdleLongerThan_StrictlyGreater() {
        // Given
        AuthSession session = AuthSession.start(ID, "alice", null, Set.of(AuthAllowed.ANONYMOUS), 1_000L);

        // When & Then
        assertFalse(session.isIdleLongerThan(500L, 1_500L));
        assertTrue(session.isIdleLongerThan(500L, 1_501L));
    }

    @Test
    void constructor_TokenPhaseMismatch_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new AuthSession(
            ID, "alice", null, AuthPhase.CONTINUE, Set.of(), Set.of(), TOKEN, 0L));
        assertThrows(IllegalArgumentException.class, () -> new AuthSession(
            ID, "alice", null, AuthPhase.SUCCESS, Set.of(), Set.of(), null, 0L));
    }

    @Test
    void start_NullRequired_TreatedAsEmpty() {
        // When
        AuthSession session = AuthSession.start(ID, "bob", null, null, 0L);

        // Then
        assertTrue(session.required().isEmpty());
        assertTrue(session.remaining().isEmpty());
    }
}
