package com.ryuqq.directory.core.auth;

/**
 * 인증 응답.
 *
 * @param sessionId 협상 세션 ID
 * @param state 현재 상태
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record AuthResponse(SessionId sessionId, AuthState state) {

    public AuthResponse {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }
}
