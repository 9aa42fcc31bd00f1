package com.ryuqq.directory.core.identity;

/**
 * 그룹 멤버십.
 *
 * @param name 이름
 * @param uuid UUID 문자열
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record Group(String name, String uuid) {

    public Group {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid cannot be null or blank");
        }
    }
}
