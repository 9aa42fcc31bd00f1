package com.ryuqq.directory.core.auth;

import com.ryuqq.directory.core.identity.UserAuthToken;
import com.ryuqq.directory.core.statemachine.AuthPhase;

import java.util.List;

/**
 * 서버가 각 인증 단계에 대해 응답하는 상태.
 *
 * <ul>
 *   <li>{@link Success}: 인증 완료, 토큰 발급</li>
 *   <li>{@link Denied}: 거부, 세션 종료</li>
 *   <li>{@link Continue}: 계속 진행, 허용된 방식 목록</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public sealed interface AuthState permits AuthState.Success, AuthState.Denied, AuthState.Continue {

    /**
     * 이 상태에 대응하는 세션 단계.
     *
     * @return AuthPhase
     */
    AuthPhase phase();

    /**
     * @param token 발급된 토큰
     */
    record Success(UserAuthToken token) implements AuthState {
        public Success {
            if (token == null) {
                throw new IllegalArgumentException("token cannot be null");
            }
        }

        @Override
        public AuthPhase phase() {
            return AuthPhase.SUCCESS;
        }
    }

    /**
     * @param reason 사람이 읽을 수 있는 거부 사유 (어느 검사가 실패했는지는 드러내지 않음)
     */
    record Denied(String reason) implements AuthState {
        public Denied {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }

        @Override
        public AuthPhase phase() {
            return AuthPhase.DENIED;
        }
    }

    /**
     * @param allowed 현재 수락 가능한 방식
     */
    record Continue(List<AuthAllowed> allowed) implements AuthState {
        public Continue {
            if (allowed == null || allowed.isEmpty()) {
                throw new IllegalArgumentException("allowed cannot be null or empty");
            }
            allowed = List.copyOf(allowed);
        }

        @Override
        public AuthPhase phase() {
            return AuthPhase.CONTINUE;
        }
    }
}
