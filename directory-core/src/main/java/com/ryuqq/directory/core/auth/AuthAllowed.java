package com.ryuqq.directory.core.auth;

/**
 * 서버가 현재 주체에 대해 수락하는 자격 증명 방식.
 *
 * @author Directory Team
 * @since 1.0.0
 */
public enum AuthAllowed {

    /**
     * 익명 인증.
     */
    ANONYMOUS("Anonymous"),

    /**
     * 비밀번호 인증.
     */
    PASSWORD("Password");

    private final String wireName;

    AuthAllowed(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 와이어 태그로 방식 조회.
     *
     * @param wireName 태그 (예: "Password")
     * @return AuthAllowed
     * @throws IllegalArgumentException 알 수 없는 태그인 경우
     */
    public static AuthAllowed fromWireName(String wireName) {
        for (AuthAllowed allowed : values()) {
            if (allowed.wireName.equals(wireName)) {
                return allowed;
            }
        }
        throw new IllegalArgumentException("Unknown auth mechanism: " + wireName);
    }
}
