package com.ryuqq.directory.core.auth;

import com.ryuqq.directory.core.identity.UserAuthToken;
import com.ryuqq.directory.core.statemachine.AuthPhase;
import com.ryuqq.directory.core.statemachine.AuthTransition;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 서버 측 인증 세션 레코드.
 *
 * <p>세션은 불투명한 {@link SessionId}와 이 레코드로만 표현되며, 전송 계층 쿠키와의
 * 연결은 외부 관심사입니다. 레코드는 불변이며 상태 변경은 {@link AuthTransition}으로
 * 검증된 새 레코드를 만듭니다.</p>
 *
 * @param sessionId 세션 ID
 * @param principal 주체 이름
 * @param applicationId 애플리케이션 ID (null 허용)
 * @param phase 현재 단계
 * @param required 주체에게 요구되는 방식 전체
 * @param satisfied 지금까지 충족된 방식
 * @param token SUCCESS 단계에서 발급된 토큰 (그 외 null)
 * @param lastActivityAt 마지막 활동 시각 (epoch millis)
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record AuthSession(
    SessionId sessionId,
    String principal,
    String applicationId,
    AuthPhase phase,
    Set<AuthAllowed> required,
    Set<AuthAllowed> satisfied,
    UserAuthToken token,
    long lastActivityAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드 누락 또는 단계와 토큰이 맞지 않는 경우
     */
    public AuthSession {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("principal cannot be null or blank");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if ((phase == AuthPhase.SUCCESS) != (token != null)) {
            throw new IllegalArgumentException("token must be present exactly when phase is SUCCESS (phase: " + phase + ")");
        }
        if (lastActivityAt < 0) {
            throw new IllegalArgumentException("lastActivityAt must be non-negative (current: " + lastActivityAt + ")");
        }
        required = immutableEnumSet(required);
        satisfied = immutableEnumSet(satisfied);
    }

    /**
     * INIT 단계의 새 세션 생성.
     *
     * @param sessionId 세션 ID
     * @param principal 주체 이름
     * @param applicationId 애플리케이션 ID (null 허용)
     * @param required 요구 방식
     * @param now 현재 시각
     * @return INIT 세션
     */
    public static AuthSession start(SessionId sessionId, String principal, String applicationId,
                                    Collection<AuthAllowed> required, long now) {
        return new AuthSession(sessionId, principal, applicationId, AuthPhase.INIT,
            required == null ? Set.of() : Set.copyOf(required), Set.of(), null, now);
    }

    /**
     * 아직 충족되지 않은 방식 (선언 순서).
     *
     * @return 남은 방식
     */
    public List<AuthAllowed> remaining() {
        EnumSet<AuthAllowed> remaining = EnumSet.noneOf(AuthAllowed.class);
        remaining.addAll(required);
        remaining.removeAll(satisfied);
        return List.copyOf(remaining);
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    /**
     * 비활성 시간이 기준을 넘었는지 확인.
     *
     * @param timeoutMs 허용 비활성 시간 (밀리초)
     * @param now 현재 시각
     * @return 만료 여부
     */
    public boolean isIdleLongerThan(long timeoutMs, long now) {
        return now - lastActivityAt > timeoutMs;
    }

    /**
     * CONTINUE로 전이 (충족 방식 추가).
     *
     * @param newlySatisfied 이번 단계에서 충족된 방식
     * @param now 현재 시각
     * @return 새 세션 레코드
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public AuthSession proceed(Collection<AuthAllowed> newlySatisfied, long now) {
        AuthPhase next = AuthTransition.transition(phase, AuthPhase.CONTINUE);
        EnumSet<AuthAllowed> merged = EnumSet.noneOf(AuthAllowed.class);
        merged.addAll(satisfied);
        merged.addAll(newlySatisfied);
        return new AuthSession(sessionId, principal, applicationId, next, required, merged, null, now);
    }

    /**
     * SUCCESS로 전이하고 토큰을 세션에 바인딩.
     *
     * @param issued 발급된 토큰
     * @param now 현재 시각
     * @return 새 세션 레코드
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public AuthSession succeed(UserAuthToken issued, long now) {
        AuthPhase next = AuthTransition.transition(phase, AuthPhase.SUCCESS);
        return new AuthSession(sessionId, principal, applicationId, next, required, required, issued, now);
    }

    /**
     * DENIED로 전이.
     *
     * @param now 현재 시각
     * @return 새 세션 레코드
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public AuthSession deny(long now) {
        AuthPhase next = AuthTransition.transition(phase, AuthPhase.DENIED);
        return new AuthSession(sessionId, principal, applicationId, next, required, satisfied, null, now);
    }

    private static Set<AuthAllowed> immutableEnumSet(Set<AuthAllowed> source) {
        EnumSet<AuthAllowed> copy = EnumSet.noneOf(AuthAllowed.class);
        if (source != null) {
            copy.addAll(source);
        }
        return Collections.unmodifiableSet(copy);
    }
}
