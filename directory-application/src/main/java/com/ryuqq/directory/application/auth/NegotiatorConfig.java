package com.ryuqq.directory.application.auth;

/**
 * AuthNegotiator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>sessionTimeoutMs: CONTINUE 세션의 허용 비활성 시간 (기본 300000ms = 5분)</li>
 *   <li>tokenTtlMs: SUCCESS 세션에 바인딩된 토큰의 유효 시간 (기본 3600000ms = 1시간)</li>
 * </ul>
 *
 * <p>비활성 시간을 넘긴 CONTINUE 세션은 다음 요청 시 DENIED로 전이되며,
 * {@code SessionReaper}의 inactivityTimeoutMs와 같은 값으로 맞추는 것을 권장합니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 * @param sessionTimeoutMs 세션 비활성 타임아웃 (밀리초, 양수여야 함)
 * @param tokenTtlMs 토큰 유효 시간 (밀리초, 양수여야 함)
 */
public record NegotiatorConfig(
    long sessionTimeoutMs,
    long tokenTtlMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: sessionTimeoutMs=300000ms (5분), tokenTtlMs=3600000ms (1시간)</p>
     */
    public NegotiatorConfig() {
        this(300000, 3600000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public NegotiatorConfig {
        if (sessionTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "sessionTimeoutMs must be positive (current: " + sessionTimeoutMs + ")"
            );
        }
        if (tokenTtlMs <= 0) {
            throw new IllegalArgumentException(
                "tokenTtlMs must be positive (current: " + tokenTtlMs + ")"
            );
        }
    }

    /**
     * sessionTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public NegotiatorConfig withSessionTimeoutMs(long sessionTimeoutMs) {
        return new NegotiatorConfig(sessionTimeoutMs, tokenTtlMs);
    }

    /**
     * tokenTtlMs만 변경한 새 인스턴스 생성.
     */
    public NegotiatorConfig withTokenTtlMs(long tokenTtlMs) {
        return new NegotiatorConfig(sessionTimeoutMs, tokenTtlMs);
    }
}
