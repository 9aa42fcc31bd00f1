package com.ryuqq.directory.core.auth;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 클라이언트 인증 단계.
 *
 * <ul>
 *   <li>{@link Init}: 인증할 주체 이름과 선택적 애플리케이션 ID 제시</li>
 *   <li>{@link Creds}: 발급된 세션에 자격 증명 제출</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public sealed interface AuthStep permits AuthStep.Init, AuthStep.Creds {

    /**
     * 협상 시작.
     *
     * @param name 주체 이름
     * @param applicationId 애플리케이션 ID (null 허용)
     */
    record Init(String name, String applicationId) implements AuthStep {
        public Init {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            // applicationId는 null 허용
        }

        public Optional<String> findApplicationId() {
            return Optional.ofNullable(applicationId);
        }
    }

    /**
     * 자격 증명 제출.
     *
     * @param credentials 자격 증명 목록 (순서 유지)
     */
    record Creds(List<AuthCredential> credentials) implements AuthStep {
        public Creds {
            if (credentials == null) {
                throw new IllegalArgumentException("credentials cannot be null");
            }
            for (AuthCredential credential : credentials) {
                if (credential == null) {
                    throw new IllegalArgumentException("credentials cannot contain null");
                }
            }
            credentials = List.copyOf(credentials);
        }
    }

    static AuthStep init(String name) {
        return new Init(name, null);
    }

    static AuthStep init(String name, String applicationId) {
        return new Init(name, applicationId);
    }

    static AuthStep creds(AuthCredential... credentials) {
        return new Creds(Arrays.asList(credentials));
    }
}
