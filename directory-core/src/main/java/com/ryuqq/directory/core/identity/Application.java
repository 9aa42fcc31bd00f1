package com.ryuqq.directory.core.identity;

/**
 * 토큰이 발급된 애플리케이션 컨텍스트.
 *
 * @param name 이름
 * @param uuid UUID 문자열
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record Application(String name, String uuid) {

    public Application {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid cannot be null or blank");
        }
    }
}
