package com.ryuqq.directory.core.auth;

/**
 * 클라이언트가 제출하는 자격 증명.
 *
 * <p>검증은 외부 {@code CredentialVerifier}가 담당하며, 이 타입은 방식과 값만 전달합니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public sealed interface AuthCredential permits AuthCredential.Anonymous, AuthCredential.Password {

    /**
     * 이 자격 증명이 충족하는 방식.
     *
     * @return AuthAllowed
     */
    AuthAllowed mechanism();

    static AuthCredential anonymous() {
        return new Anonymous();
    }

    static AuthCredential password(String secret) {
        return new Password(secret);
    }

    /**
     * 익명 자격 증명.
     */
    record Anonymous() implements AuthCredential {
        @Override
        public AuthAllowed mechanism() {
            return AuthAllowed.ANONYMOUS;
        }
    }

    /**
     * 비밀번호 자격 증명.
     *
     * @param secret 비밀번호 (toString에 노출되지 않음)
     */
    record Password(String secret) implements AuthCredential {
        public Password {
            if (secret == null) {
                throw new IllegalArgumentException("secret cannot be null");
            }
        }

        @Override
        public AuthAllowed mechanism() {
            return AuthAllowed.PASSWORD;
        }

        @Override
        public String toString() {
            return "Password[****]";
        }
    }
}
