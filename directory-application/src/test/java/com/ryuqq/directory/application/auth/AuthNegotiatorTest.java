package com.ryuqq.directory.application.auth;

import com.ryuqq.directory.core.auth.AuthAllowed;
import com.ryuqq.directory.core.auth.AuthCredential;
import com.ryuqq.directory.core.auth.AuthRequest;
import com.ryuqq.directory.core.auth.AuthResponse;
import com.ryuqq.directory.core.auth.AuthSession;
import com.ryuqq.directory.core.auth.AuthState;
import com.ryuqq.directory.core.auth.AuthStep;
import com.ryuqq.directory.core.auth.SessionId;
import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.identity.UserAuthToken;
import com.ryuqq.directory.core.outcome.Result;
import com.ryuqq.directory.core.spi.CredentialVerifier;
import com.ryuqq.directory.core.spi.SessionStore;
import com.ryuqq.directory.core.statemachine.AuthPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * AuthNegotiator 유닛 테스트.
 *
 * <p>세션 저장소와 자격 증명 검증기를 Mock으로 두고 상태 전이를 검증합니다:</p>
 * <ul>
 *   <li>Init: Continue 또는 Denied</li>
 *   <li>Creds: Success / Continue / Denied / InvalidSessionState</li>
 *   <li>점유 해제 보장</li>
 *   <li>토큰 조회와 지연 만료</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AuthNegotiatorTest {

    private static final long START = 1_000_000L;

    @Mock
    private SessionStore sessionStore;

    @Mock
    private CredentialVerifier verifier;

    private AtomicLong now;
    private NegotiatorConfig config;
    private AuthNegotiator negotiator;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(START);
        config = new NegotiatorConfig();
        negotiator = new AuthNegotiator(sessionStore, verifier, config, now::get);
    }

    // ============================================================
    // 1. Init
    // ============================================================

    @Test
    void begin_요구_방식이_있으면_CONTINUE_세션을_기록하고_Continue_응답() {
        // given
        when(verifier.requiredMechanisms("alice")).thenReturn(Set.of(AuthAllowed.ANONYMOUS));

        // when
        AuthResponse response = negotiator.begin(new AuthStep.Init("alice", null));

        // then
        assertThat(response.state()).isEqualTo(new AuthState.Continue(List.of(AuthAllowed.ANONYMOUS)));

        ArgumentCaptor<AuthSession> captor = ArgumentCaptor.forClass(AuthSession.class);
        verify(sessionStore).create(captor.capture());
        AuthSession created = captor.getValue();
        assertThat(created.sessionId()).isEqualTo(response.sessionId());
        assertThat(created.phase()).isEqualTo(AuthPhase.CONTINUE);
        assertThat(created.principal()).isEqualTo("alice");
        assertThat(created.satisfied()).isEmpty();
        assertThat(created.lastActivityAt()).isEqualTo(START);
    }

    @Test
    void begin_미등록_주체는_DENIED_세션과_일반_사유로_거부() {
        // given
        when(verifier.requiredMechanisms("bob")).thenReturn(Set.of());

        // when
        AuthResponse response = negotiator.begin(new AuthStep.Init("bob", null));

        // then
        assertThat(response.state()).isEqualTo(new AuthState.Denied(AuthNegotiator.DENIED_REASON));

        ArgumentCaptor<AuthSession> captor = ArgumentCaptor.forClass(AuthSession.class);
        verify(sessionStore).create(captor.capture());
        assertThat(captor.getValue().phase()).isEqualTo(AuthPhase.DENIED);
    }

    @Test
    void begin_Continue는_요구_방식을_선언_순서로_나열() {
        // given
        when(verifier.requiredMechanisms("carol"))
            .thenReturn(EnumSet.of(AuthAllowed.PASSWORD, AuthAllowed.ANONYMOUS));

        // when
        AuthResponse response = negotiator.begin(new AuthStep.Init("carol", "app-1"));

        // then
        assertThat(response.state())
            .isEqualTo(new AuthState.Continue(List.of(AuthAllowed.ANONYMOUS, AuthAllowed.PASSWORD)));
    }

    @Test
    void handle_기존_세션_ID로_Init을_보내면_InvalidAuthState() {
        // given
        AuthRequest request = new AuthRequest(SessionId.random(), new AuthStep.Init("alice", null));

        // when
        Result<AuthResponse, OperationError> result = negotiator.handle(request);

        // then
        assertThat(result.isErr()).isTrue();
        assertThat(result.getError().getKind()).isEqualTo(OperationError.Kind.INVALID_AUTH_STATE);
        verifyNoInteractions(sessionStore, verifier);
    }

    @Test
    void handle_세션_ID_없는_Creds는_InvalidSessionState() {
        // given
        AuthRequest request = new AuthRequest(null, new AuthStep.Creds(List.of(AuthCredential.anonymous())));

        // when
        Result<AuthResponse, OperationError> result = negotiator.handle(request);

        // then
        assertThat(result.getError().getKind()).isEqualTo(OperationError.Kind.INVALID_SESSION_STATE);
        verifyNoInteractions(sessionStore, verifier);
    }

    @Test
    void handle_null_요청은_예외() {
        assertThatThrownBy(() -> negotiator.handle(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("request cannot be null");
    }

    // ============================================================
    // 2. Creds
    // ============================================================

    @Test
    void step_모든_방식이_충족되면_Success와_토큰_바인딩() {
        // given
        AuthSession session = continueSession("alice", AuthAllowed.ANONYMOUS);
        List<AuthCredential> credentials = List.of(AuthCredential.anonymous());
        UserAuthToken token = UserAuthToken.of("alice", "Alice", "uuid-alice");

        when(sessionStore.tryAcquire(session.sessionId())).thenReturn(Optional.of(session));
        when(verifier.verify("alice", credentials)).thenReturn(true);
        when(verifier.issueToken("alice", null)).thenReturn(Optional.of(token));

        // when
        Result<AuthResponse, OperationError> result =
            negotiator.step(session.sessionId(), new AuthStep.Creds(credentials));

        // then
        assertThat(result.get().state()).isEqualTo(new AuthState.Success(token));

        AuthSession released = captureRelease();
        assertThat(released.phase()).isEqualTo(AuthPhase.SUCCESS);
        assertThat(released.token()).isEqualTo(token);
    }

    @Test
    void step_남은_방식이_있으면_Continue() {
        // given
        AuthSession session = continueSession("carol", AuthAllowed.ANONYMOUS, AuthAllowed.PASSWORD);
        List<AuthCredential> credentials = List.of(AuthCredential.password("s3cret"));

        when(sessionStore.tryAcquire(session.sessionId())).thenReturn(Optional.of(session));
        when(verifier.verify("carol", credentials)).thenReturn(true);

        // when
        Result<AuthResponse, OperationError> result =
            negotiator.step(session.sessionId(), new AuthStep.Creds(credentials));

        // then
        assertThat(result.get().state()).isEqualTo(new AuthState.Continue(List.of(AuthAllowed.ANONYMOUS)));

        AuthSession released = captureRelease();
        assertThat(released.phase()).isEqualTo(AuthPhase.CONTINUE);
        assertThat(released.satisfied()).containsExactly(AuthAllowed.PASSWORD);
        verify(verifier, never()).issueToken(anyString(), any());
    }

    @Test
    void step_남은_방식_외_자격_증명은_검증_없이_Denied() {
        // given
        AuthSession session = continueSession("alice", AuthAllowed.ANONYMOUS);
        when(sessionStore.tryAcquire(session.sessionId())).thenReturn(Optional.of(session));

        // when
        Result<AuthResponse, OperationError> result = negotiator.step(
            session.sessionId(), new AuthStep.Creds(List.of(AuthCredential.password("guess"))));

        // then
        assertThat(result.get().state()).isEqualTo(new AuthState.Denied(AuthNegotiator.DENIED_REASON));
        assertThat(captureRelease().phase()).isEqualTo(AuthPhase.DENIED);
        verify(verifier, never()).verify(anyString(), anyList());
    }

    @Test
    void step_빈_자격_증명_목록은_Denied() {
        // given
        AuthSession session = continueSession("alice", AuthAllowed.ANONYMOUS);
        when(sessionStore.tryAcquire(session.sessionId())).thenReturn(Optional.of(session));

        // when
        Result<AuthResponse, OperationError> result =
            negotiator.step(session.sessionId(), new AuthStep.Creds(List.of()));

        // then
        assertThat(result.get().state()).isInstanceOf(AuthState.Denied.class);
        assertThat(captureRelease().phase()).isEqualTo(AuthPhase.DENIED);
    }

    @Test
    void step_검증_실패는_Denied() {
        // given
        AuthSession session = continueSession("carol", AuthAllowed.PASSWORD);
        List<AuthCredential> credentials = List.of(AuthCredential.password("wrong"));

        when(sessionStore.tryAcquire(session.sessionId())).thenReturn(Optional.of(session));
        when(verifier.verify("carol", credentials)).thenReturn(false);

        // when
        Result<AuthResponse, OperationError> result =
            negotiator.step(session.sessionId(), new AuthStep.Creds(credentials));

        // then
        assertThat(result.get().state()).isEqualTo(new AuthState.Denied(AuthNegotiator.DENIED_REASON));
        assertThat(captureRelease().phase()).isEqualTo(AuthPhase.DENIED);
    }

    @Test
    void step_토큰을_발급하지_못하면_Denied() {
        // given
        AuthSession session = continueSession("alice", AuthAllowed.ANONYMOUS);
        List<AuthCredential> credentials = List.of(AuthCredential.anonymous());

        when(sessionStore.tryAcquire(session.sessionId())).thenReturn(Optional.of(session));
        when(verifier.verify("alice", credentials)).thenReturn(true);
        when(verifier.issueToken("alice", null)).thenReturn(Optional.empty());

        // when
        Result<AuthResponse, OperationError> result =
            negotiator.step(session.sessionId(), new AuthStep.Creds(credentials));

        // then
        assertThat(result.get().state()).isInstanceOf(AuthState.Denied.class);
        assertThat(captureRelease().phase()).isEqualTo(AuthPhase.DENIED);
    }

    @Test
    void step_점유_실패는_InvalidSessionState이고_release_안_함() {
        // given
        SessionId sessionId = SessionId.random();
        when(sessionStore.tryAcquire(sessionId)).thenReturn(Optional.empty());

        // when
        Result<AuthResponse, OperationError> result =
            negotiator.step(sessionId, new AuthStep.Creds(List.of(AuthCredential.anonymous())));

        // then
        assertThat(result.getError().getKind()).isEqualTo(OperationError.Kind.INVALID_SESSION_STATE);
        verify(sessionStore, never()).release(any());
        verifyNoInteractions(verifier);
    }

    @Test
    void step_비활성_시간을_넘긴_세션은_DENIED로_전이하고_InvalidSessionState() {
        // given
        AuthSession session = continueSession("alice", AuthAllowed.ANONYMOUS);
        when(sessionStore.tryAcquire(session.sessionId())).thenReturn(Optional.of(session));
        now.addAndGet(config.sessionTimeoutMs() + 1);

        // when
        Result<AuthResponse, OperationError> result =
            negotiator.step(session.sessionId(), new AuthStep.Creds(List.of(AuthCredential.anonymous())));

        // then
        assertThat(result.getError().getKind()).isEqualTo(OperationError.Kind.INVALID_SESSION_STATE);
        assertThat(captureRelease().phase()).isEqualTo(AuthPhase.DENIED);
        verifyNoInteractions(verifier);
    }

    @Test
    void step_검증기_예외가_발생해도_점유를_해제함() {
        // given
        AuthSession session = continueSession("alice", AuthAllowed.ANONYMOUS);
        List<AuthCredential> credentials = List.of(AuthCredential.anonymous());

        when(sessionStore.tryAcquire(session.sessionId())).thenReturn(Optional.of(session));
        when(verifier.verify("alice", credentials)).thenThrow(new IllegalStateException("directory offline"));

        // when & then
        assertThatThrownBy(() -> negotiator.step(session.sessionId(), new AuthStep.Creds(credentials)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("directory offline");
        assertThat(captureRelease()).isEqualTo(session);
    }

    // ============================================================
    // 3. 토큰 조회
    // ============================================================

    @Test
    void tokenFor_SUCCESS_세션의_토큰_반환() {
        // given
        UserAuthToken token = UserAuthToken.of("alice", "Alice", "uuid-alice");
        AuthSession success = continueSession("alice", AuthAllowed.ANONYMOUS).succeed(token, START);
        when(sessionStore.find(success.sessionId())).thenReturn(Optional.of(success));

        // when
        Result<UserAuthToken, OperationError> result = negotiator.tokenFor(success.sessionId());

        // then
        assertThat(result.get()).isEqualTo(token);
    }

    @Test
    void tokenFor_토큰_유효_시간이_지나면_NotAuthenticated() {
        // given
        UserAuthToken token = UserAuthToken.of("alice", "Alice", "uuid-alice");
        AuthSession success = continueSession("alice", AuthAllowed.ANONYMOUS).succeed(token, START);
        when(sessionStore.find(success.sessionId())).thenReturn(Optional.of(success));
        now.addAndGet(config.tokenTtlMs() + 1);

        // when
        Result<UserAuthToken, OperationError> result = negotiator.tokenFor(success.sessionId());

        // then
        assertThat(result.getError().getKind()).isEqualTo(OperationError.Kind.NOT_AUTHENTICATED);
    }

    @Test
    void tokenFor_CONTINUE_세션이나_null은_NotAuthenticated() {
        // given
        AuthSession session = continueSession("alice", AuthAllowed.ANONYMOUS);
        when(sessionStore.find(session.sessionId())).thenReturn(Optional.of(session));

        // when & then
        assertThat(negotiator.tokenFor(session.sessionId()).getError().getKind())
            .isEqualTo(OperationError.Kind.NOT_AUTHENTICATED);
        assertThat(negotiator.tokenFor(null).getError().getKind())
            .isEqualTo(OperationError.Kind.NOT_AUTHENTICATED);
    }

    @Test
    void currentPhase_비활성_CONTINUE_세션은_DENIED로_보임() {
        // given
        AuthSession session = continueSession("alice", AuthAllowed.ANONYMOUS);
        when(sessionStore.find(session.sessionId())).thenReturn(Optional.of(session));

        // when
        Optional<AuthPhase> fresh = negotiator.currentPhase(session.sessionId());
        now.addAndGet(config.sessionTimeoutMs() + 1);
        Optional<AuthPhase> stale = negotiator.currentPhase(session.sessionId());

        // then
        assertThat(fresh).contains(AuthPhase.CONTINUE);
        assertThat(stale).contains(AuthPhase.DENIED);
    }

    @Test
    void 생성자_null_의존성은_예외() {
        assertThatThrownBy(() -> new AuthNegotiator(null, verifier, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sessionStore");
        assertThatThrownBy(() -> new AuthNegotiator(sessionStore, null, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("credentialVerifier");
        assertThatThrownBy(() -> new AuthNegotiator(sessionStore, verifier, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }

    // ============================================================
    // Helper Methods
    // ============================================================

    private AuthSession continueSession(String principal, AuthAllowed... required) {
        return AuthSession.start(SessionId.random(), principal, null, List.of(required), START)
            .proceed(Set.of(), START);
    }

    private AuthSession captureRelease() {
        ArgumentCaptor<AuthSession> captor = ArgumentCaptor.forClass(AuthSession.class);
        verify(sessionStore).release(captor.capture());
        return captor.getValue();
    }
}
