package com.ryuqq.directory.adapter.runner;

import com.ryuqq.directory.core.auth.SessionId;
import com.ryuqq.directory.core.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * SessionReaper 컴포넌트.
 *
 * <p>비활성 시간을 넘긴 미해결 CONTINUE 세션을 DENIED로 전이시키고,
 * 보관 시간이 지난 종료 세션을 저장소에서 제거합니다.</p>
 *
 * <p><strong>만료 시나리오:</strong></p>
 * <pre>
 * 1. Init → Continue([Password]) 응답 후 클라이언트 이탈
 * 2. 세션은 CONTINUE 상태로 남음
 * 3. SessionReaper가 주기적 스캔 (예: 1분마다)
 * 4. inactivityTimeoutMs 초과 CONTINUE 세션 발견 (예: 5분 이상)
 * 5. DENIED로 전이 → 이후 Creds 요청은 InvalidSessionState
 * 6. successTtlMs가 지난 SUCCESS/DENIED 세션 제거
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>진행 중인 전이가 있는 세션은 건너뛰고 다음 스캔에서 다시 검사</li>
 *   <li>여러 인스턴스가 같은 저장소를 스캔해도 각 세션은 한 번만 만료됨</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class SessionReaper {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);
    private final SessionStore sessionStore;
    private final SessionReaperConfig config;
    private final LongSupplier clock;
    private ScheduledExecutorService scheduler;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param sessionStore 세션 저장소
     * @param config 설정
     */
    public SessionReaper(SessionStore sessionStore, SessionReaperConfig config) {
        this(sessionStore, config, System::currentTimeMillis);
    }

    /**
     * 생성자.
     *
     * @param sessionStore 세션 저장소
     * @param config 설정
     * @param clock 현재 시각 공급자 (epoch millis)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SessionReaper(SessionStore sessionStore, SessionReaperConfig config, LongSupplier clock) {
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.sessionStore = sessionStore;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 비활성 세션 만료 및 종료 세션 정리.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. expireIdle(inactivityTimeoutMs, now, batchSize) → [SessionId1, ...]
     * 2. purgeTerminal(successTtlMs, now) → 제거 수
     * 3. 결과 로깅
     * </pre>
     *
     * <p>각 단계의 예외는 로깅 후 다음 단계로 진행합니다.</p>
     */
    public void scan() {
        log.info("SessionReaper scan started");
        long now = clock.getAsLong();

        // 1. 비활성 CONTINUE 세션 만료
        int expired = tryExpire(now);

        // 2. 종료 세션 정리
        int purged = tryPurge(now);

        // 3. 결과 로깅
        log.info("SessionReaper scan completed: {} expired, {} purged", expired, purged);
    }

    /**
     * 주기적 스캔 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("SessionReaper is already running");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "session-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::scan, config.scanIntervalMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("SessionReaper started with interval {}ms", config.scanIntervalMs());
    }

    /**
     * 주기적 스캔 중지.
     *
     * <p>진행 중인 스캔은 최대 scanIntervalMs 동안 완료를 기다립니다.</p>
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(config.scanIntervalMs(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("SessionReaper stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private int tryExpire(long now) {
        try {
            List<SessionId> expired = sessionStore.expireIdle(config.inactivityTimeoutMs(), now, config.batchSize());
            for (SessionId sessionId : expired) {
                log.info("SessionReaper expired {} after inactivity", sessionId);
            }
            return expired.size();
        } catch (Exception e) {
            log.error("Failed to expire idle sessions in SessionReaper scan", e);
            return 0;
        }
    }

    private int tryPurge(long now) {
        try {
            return sessionStore.purgeTerminal(config.successTtlMs(), now);
        } catch (Exception e) {
            log.error("Failed to purge terminal sessions in SessionReaper scan", e);
            return 0;
        }
    }
}
