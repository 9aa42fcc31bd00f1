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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * 인증 협상 상태 기계 구동기.
 *
 * <p>클라이언트의 {@link AuthStep}을 받아 {@link SessionStore}의 세션 레코드를 전이시키고
 * {@link AuthState}로 응답합니다. 자격 증명 검증과 토큰 발급은 모두
 * {@link CredentialVerifier}에 위임합니다.</p>
 *
 * <p><strong>협상 흐름:</strong></p>
 * <pre>
 * 1. Init(name, appId)  → 새 SessionId 발급
 *    - 요구 방식 없음 (미등록/잠금) → DENIED 세션 기록 + Denied
 *    - 요구 방식 있음              → CONTINUE 세션 기록 + Continue(요구 방식)
 * 2. Creds([...])       → tryAcquire로 세션 점유
 *    - 점유 실패 (미등록/종료/진행 중) → InvalidSessionState
 *    - 비활성 시간 초과               → DENIED + InvalidSessionState
 *    - 빈 목록 / 남은 방식 외 자격 증명 / 검증 실패 → Denied
 *    - 남은 방식 있음 → Continue(남은 방식)
 *    - 모두 충족     → issueToken → Success(token)
 * 3. release(next)      → 세션 점유 해제
 * </pre>
 *
 * <p>거부 사유는 항상 {@value #DENIED_REASON}이며, 미등록 주체와 잘못된 자격 증명을
 * 클라이언트가 구분할 수 없습니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class AuthNegotiator {

    /**
     * 모든 거부 응답에 사용되는 사유.
     */
    public static final String DENIED_REASON = "authentication denied";

    private static final Logger log = LoggerFactory.getLogger(AuthNegotiator.class);
    private final SessionStore sessionStore;
    private final CredentialVerifier credentialVerifier;
    private final NegotiatorConfig config;
    private final LongSupplier clock;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param sessionStore 세션 저장소
     * @param credentialVerifier 자격 증명 검증기
     * @param config 설정
     */
    public AuthNegotiator(SessionStore sessionStore, CredentialVerifier credentialVerifier, NegotiatorConfig config) {
        this(sessionStore, credentialVerifier, config, System::currentTimeMillis);
    }

    /**
     * 생성자.
     *
     * @param sessionStore 세션 저장소
     * @param credentialVerifier 자격 증명 검증기
     * @param config 설정
     * @param clock 현재 시각 공급자 (epoch millis)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AuthNegotiator(SessionStore sessionStore, CredentialVerifier credentialVerifier,
                          NegotiatorConfig config, LongSupplier clock) {
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore cannot be null");
        }
        if (credentialVerifier == null) {
            throw new IllegalArgumentException("credentialVerifier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.sessionStore = sessionStore;
        this.credentialVerifier = credentialVerifier;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 요청 분기.
     *
     * <p>Init은 세션 ID 없이, Creds는 세션 ID와 함께 보내야 합니다.</p>
     *
     * @param request 인증 요청
     * @return 응답 또는 InvalidAuthState / InvalidSessionState
     * @throws IllegalArgumentException request가 null인 경우
     */
    public Result<AuthResponse, OperationError> handle(AuthRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        Optional<SessionId> sessionId = request.findSessionId();
        if (request.step() instanceof AuthStep.Init init) {
            if (sessionId.isPresent()) {
                log.warn("Init step rejected for existing session {}", sessionId.get());
                return Result.err(OperationError.withDetail(
                    OperationError.Kind.INVALID_AUTH_STATE, "init on existing session"));
            }
            return Result.ok(begin(init));
        }

        AuthStep.Creds creds = (AuthStep.Creds) request.step();
        if (sessionId.isEmpty()) {
            log.warn("Creds step rejected: no session id");
            return Result.err(OperationError.of(OperationError.Kind.INVALID_SESSION_STATE));
        }
        return step(sessionId.get(), creds);
    }

    /**
     * 새 협상 시작.
     *
     * @param init Init 단계
     * @return 새 세션 ID와 Continue 또는 Denied
     * @throws IllegalArgumentException init이 null인 경우
     */
    public AuthResponse begin(AuthStep.Init init) {
        if (init == null) {
            throw new IllegalArgumentException("init cannot be null");
        }

        long now = clock.getAsLong();
        SessionId sessionId = SessionId.random();
        Set<AuthAllowed> required = credentialVerifier.requiredMechanisms(init.name());
        AuthSession started = AuthSession.start(sessionId, init.name(), init.applicationId(), required, now);

        if (required.isEmpty()) {
            sessionStore.create(started.deny(now));
            log.info("Session {} denied at init", sessionId);
            return new AuthResponse(sessionId, new AuthState.Denied(DENIED_REASON));
        }

        AuthSession continued = started.proceed(Set.of(), now);
        sessionStore.create(continued);
        log.info("Session {} started, awaiting {}", sessionId, continued.remaining());
        return new AuthResponse(sessionId, new AuthState.Continue(continued.remaining()));
    }

    /**
     * 자격 증명 단계 처리.
     *
     * <p>세션을 점유한 동안에만 상태를 계산하며, 예외가 발생해도 점유는 해제됩니다.</p>
     *
     * @param sessionId 세션 ID
     * @param creds Creds 단계
     * @return 응답 또는 InvalidSessionState
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Result<AuthResponse, OperationError> step(SessionId sessionId, AuthStep.Creds creds) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (creds == null) {
            throw new IllegalArgumentException("creds cannot be null");
        }

        Optional<AuthSession> claimed = sessionStore.tryAcquire(sessionId);
        if (claimed.isEmpty()) {
            log.warn("Creds step rejected for session {}: unknown, finished or busy", sessionId);
            return Result.err(OperationError.of(OperationError.Kind.INVALID_SESSION_STATE));
        }

        AuthSession session = claimed.get();
        AuthSession next = session;
        try {
            long now = clock.getAsLong();
            if (session.isIdleLongerThan(config.sessionTimeoutMs(), now)) {
                next = session.deny(now);
                log.info("Session {} expired after inactivity", sessionId);
                return Result.err(OperationError.of(OperationError.Kind.INVALID_SESSION_STATE));
            }

            List<AuthCredential> credentials = creds.credentials();
            List<AuthAllowed> remaining = session.remaining();
            if (credentials.isEmpty() || !remaining.containsAll(mechanismsOf(credentials))) {
                next = session.deny(now);
                log.warn("Session {} denied: credentials do not match remaining mechanisms", sessionId);
                return denied(sessionId);
            }
            if (!credentialVerifier.verify(session.principal(), credentials)) {
                next = session.deny(now);
                log.warn("Session {} denied: verification failed", sessionId);
                return denied(sessionId);
            }

            AuthSession progressed = session.proceed(mechanismsOf(credentials), now);
            if (!progressed.remaining().isEmpty()) {
                next = progressed;
                log.debug("Session {} continues, awaiting {}", sessionId, progressed.remaining());
                return Result.ok(new AuthResponse(sessionId, new AuthState.Continue(progressed.remaining())));
            }

            Optional<UserAuthToken> token = credentialVerifier.issueToken(session.principal(), session.applicationId());
            if (token.isEmpty()) {
                next = session.deny(now);
                log.warn("Session {} denied: no token issued", sessionId);
                return denied(sessionId);
            }

            next = session.succeed(token.get(), now);
            log.info("Session {} succeeded", sessionId);
            return Result.ok(new AuthResponse(sessionId, new AuthState.Success(token.get())));
        } finally {
            sessionStore.release(next);
        }
    }

    /**
     * 세션에 바인딩된 토큰 조회.
     *
     * @param sessionId 세션 ID (null이면 NotAuthenticated)
     * @return 토큰 또는 NotAuthenticated (미등록, SUCCESS 아님, 토큰 만료)
     */
    public Result<UserAuthToken, OperationError> tokenFor(SessionId sessionId) {
        if (sessionId == null) {
            return Result.err(OperationError.of(OperationError.Kind.NOT_AUTHENTICATED));
        }

        Optional<AuthSession> session = sessionStore.find(sessionId);
        if (session.isEmpty() || session.get().phase() != AuthPhase.SUCCESS
            || session.get().isIdleLongerThan(config.tokenTtlMs(), clock.getAsLong())) {
            return Result.err(OperationError.of(OperationError.Kind.NOT_AUTHENTICATED));
        }
        return Result.ok(session.get().token());
    }

    /**
     * 클라이언트가 관찰하는 세션 단계.
     *
     * <p>비활성 시간을 넘긴 CONTINUE 세션은 아직 저장소에서 전이되지 않았더라도 DENIED로 보입니다.</p>
     *
     * @param sessionId 세션 ID
     * @return 단계, 미등록이면 empty
     * @throws IllegalArgumentException sessionId가 null인 경우
     */
    public Optional<AuthPhase> currentPhase(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        long now = clock.getAsLong();
        return sessionStore.find(sessionId).map(session ->
            session.phase() == AuthPhase.CONTINUE && session.isIdleLongerThan(config.sessionTimeoutMs(), now)
                ? AuthPhase.DENIED
                : session.phase());
    }

    private static Set<AuthAllowed> mechanismsOf(List<AuthCredential> credentials) {
        Set<AuthAllowed> mechanisms = EnumSet.noneOf(AuthAllowed.class);
        for (AuthCredential credential : credentials) {
            mechanisms.add(credential.mechanism());
        }
        return mechanisms;
    }

    private static Result<AuthResponse, OperationError> denied(SessionId sessionId) {
        return Result.ok(new AuthResponse(sessionId, new AuthState.Denied(DENIED_REASON)));
    }
}
