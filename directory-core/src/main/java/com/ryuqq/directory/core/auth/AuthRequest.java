package com.ryuqq.directory.core.auth;

import java.util.Arrays;
import java.util.Optional;

/**
 * 인증 요청.
 *
 * <p>{@code Init} 단계는 세션 ID 없이 보내고, {@code Creds} 단계는 {@code Init} 응답으로
 * 받은 세션 ID와 함께 보냅니다.</p>
 *
 * @param sessionId 세션 ID (Init 단계에서는 null)
 * @param step 인증 단계
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record AuthRequest(SessionId sessionId, AuthStep step) {

    public AuthRequest {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        // sessionId는 null 허용
    }

    public static AuthRequest init(String name, String applicationId) {
        return new AuthRequest(null, new AuthStep.Init(name, applicationId));
    }

    public static AuthRequest creds(SessionId sessionId, AuthCredential... credentials) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return new AuthRequest(sessionId, new AuthStep.Creds(Arrays.asList(credentials)));
    }

    public Optional<SessionId> findSessionId() {
        return Optional.ofNullable(sessionId);
    }
}
