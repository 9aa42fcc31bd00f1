package com.ryuqq.directory.core.auth;

import java.util.UUID;

/**
 * 인증 협상 세션 식별자.
 *
 * <p>협상마다 새로 할당되는 불투명한 128비트 무작위 식별자입니다.
 * 하나의 협상에서만 사용되며, 종료 후에는 재사용되지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class SessionId {

    private final UUID value;

    private SessionId(UUID value) {
        if (value == null) {
            throw new IllegalArgumentException("SessionId cannot be null");
        }
        this.value = value;
    }

    /**
     * 새 무작위 SessionId 생성.
     *
     * @return SessionId
     */
    public static SessionId random() {
        return new SessionId(UUID.randomUUID());
    }

    public static SessionId of(UUID value) {
        return new SessionId(value);
    }

    /**
     * 문자열에서 SessionId 생성.
     *
     * @param value UUID 문자열
     * @return SessionId
     * @throws IllegalArgumentException null이거나 UUID 형식이 아닌 경우
     */
    public static SessionId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId cannot be null or blank");
        }
        try {
            return new SessionId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("SessionId is not a valid UUID: " + value, e);
        }
    }

    public UUID getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionId sessionId = (SessionId) o;
        return value.equals(sessionId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
