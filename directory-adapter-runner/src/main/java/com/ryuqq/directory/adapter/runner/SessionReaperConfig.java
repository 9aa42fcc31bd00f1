package com.ryuqq.directory.adapter.runner;

/**
 * SessionReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>inactivityTimeoutMs: CONTINUE 세션 비활성 허용 시간 (기본 300000ms = 5분)</li>
 *   <li>successTtlMs: 종료 세션 보관 시간 (기본 3600000ms = 1시간)</li>
 *   <li>batchSize: 한 번에 만료시킬 세션 수 (기본 100)</li>
 * </ul>
 *
 * <p>successTtlMs는 발급 토큰의 유효 시간보다 짧으면 안 됩니다. 세션이 제거되면
 * 그 세션에 바인딩된 토큰도 더 이상 조회되지 않습니다. 두 설정을 함께 조립하는 쪽에서
 * {@link #requireRetainsTokens(long)}로 검증합니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param inactivityTimeoutMs 비활성 타임아웃 (밀리초, 양수여야 함)
 * @param successTtlMs 종료 세션 보관 시간 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record SessionReaperConfig(
    long scanIntervalMs,
    long inactivityTimeoutMs,
    long successTtlMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), inactivityTimeoutMs=300000ms (5분),
     * successTtlMs=3600000ms (1시간), batchSize=100</p>
     */
    public SessionReaperConfig() {
        this(60000, 300000, 3600000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SessionReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (inactivityTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "inactivityTimeoutMs must be positive (current: " + inactivityTimeoutMs + ")"
            );
        }
        if (successTtlMs <= 0) {
            throw new IllegalArgumentException(
                "successTtlMs must be positive (current: " + successTtlMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * 종료 세션 보관 시간이 토큰 유효 시간 이상인지 검증합니다.
     *
     * @param tokenTtlMs 협상기가 발급하는 토큰의 유효 시간 (밀리초)
     * @return this
     * @throws IllegalArgumentException successTtlMs가 tokenTtlMs보다 짧은 경우
     */
    public SessionReaperConfig requireRetainsTokens(long tokenTtlMs) {
        if (successTtlMs < tokenTtlMs) {
            throw new IllegalArgumentException(
                "successTtlMs must not be shorter than tokenTtlMs (successTtlMs: "
                    + successTtlMs + ", tokenTtlMs: " + tokenTtlMs + ")"
            );
        }
        return this;
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public SessionReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new SessionReaperConfig(scanIntervalMs, inactivityTimeoutMs, successTtlMs, batchSize);
    }

    /**
     * inactivityTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SessionReaperConfig withInactivityTimeoutMs(long inactivityTimeoutMs) {
        return new SessionReaperConfig(scanIntervalMs, inactivityTimeoutMs, successTtlMs, batchSize);
    }

    /**
     * successTtlMs만 변경한 새 인스턴스 생성.
     */
    public SessionReaperConfig withSuccessTtlMs(long successTtlMs) {
        return new SessionReaperConfig(scanIntervalMs, inactivityTimeoutMs, successTtlMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public SessionReaperConfig withBatchSize(int batchSize) {
        return new SessionReaperConfig(scanIntervalMs, inactivityTimeoutMs, successTtlMs, batchSize);
    }
}
