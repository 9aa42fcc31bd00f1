package com.ryuqq.directory.core.identity;

import java.util.List;

/**
 * 인증된 사용자에 대한 신원 주장 (user authentication token).
 *
 * <p>인증 협상이 {@code Success}로 끝날 때만 발급되며, 발급된 세션이 유효한 동안만
 * 의미가 있습니다. 이후 모든 연산의 암묵적 인가 컨텍스트로 사용됩니다.</p>
 *
 * @param name 주체 이름
 * @param displayName 표시 이름
 * @param uuid 주체 UUID
 * @param application 애플리케이션 컨텍스트 (null 허용)
 * @param groups 그룹 멤버십
 * @param claims 세션 범위 claim
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record UserAuthToken(
    String name,
    String displayName,
    String uuid,
    Application application,
    List<Group> groups,
    List<Claim> claims
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public UserAuthToken {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (displayName == null) {
            throw new IllegalArgumentException("displayName cannot be null");
        }
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid cannot be null or blank");
        }
        // application은 null 허용
        groups = groups == null ? List.of() : List.copyOf(groups);
        claims = claims == null ? List.of() : List.copyOf(claims);
    }

    /**
     * 그룹, claim, 애플리케이션 없이 토큰 생성.
     *
     * @param name 주체 이름
     * @param displayName 표시 이름
     * @param uuid 주체 UUID
     * @return UserAuthToken
     */
    public static UserAuthToken of(String name, String displayName, String uuid) {
        return new UserAuthToken(name, displayName, uuid, null, List.of(), List.of());
    }

    public boolean isMemberOf(String groupName) {
        return groups.stream().anyMatch(group -> group.name().equals(groupName));
    }

    @Override
    public String toString() {
        return "name: " + name + '\n'
            + "display: " + displayName + '\n'
            + "uuid: " + uuid + '\n'
            + "groups: " + groups + '\n'
            + "claims: " + claims + '\n';
    }
}
