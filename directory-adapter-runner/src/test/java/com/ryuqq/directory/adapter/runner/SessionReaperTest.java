package com.ryuqq.directory.adapter.runner;

import com.ryuqq.directory.core.auth.SessionId;
import com.ryuqq.directory.core.spi.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SessionReaper 유닛 테스트.
 *
 * <p>SessionReaper의 스캔 동작을 검증합니다:</p>
 * <ul>
 *   <li>설정값 전달 (타임아웃, 배치 크기, 보관 시간)</li>
 *   <li>예외 발생 시에도 다음 단계 진행</li>
 *   <li>스케줄 시작/중지</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SessionReaperTest {

    private static final long NOW = 10_000_000L;

    @Mock
    private SessionStore sessionStore;

    private SessionReaperConfig config;
    private SessionReaper reaper;

    @BeforeEach
    void setUp() {
        config = new SessionReaperConfig(); // inactivityTimeoutMs=300000, successTtlMs=3600000, batchSize=100
        reaper = new SessionReaper(sessionStore, config, () -> NOW);
    }

    // ============================================================
    // 1. scan
    // ============================================================

    @Test
    void scan_설정값으로_만료와_정리를_수행함() {
        // given
        when(sessionStore.expireIdle(300000, NOW, 100))
            .thenReturn(List.of(SessionId.random(), SessionId.random()));
        when(sessionStore.purgeTerminal(3600000, NOW)).thenReturn(3);

        // when
        reaper.scan();

        // then
        verify(sessionStore).expireIdle(300000, NOW, 100);
        verify(sessionStore).purgeTerminal(3600000, NOW);
    }

    @Test
    void scan_변경된_배치_크기를_사용함() {
        // given
        reaper = new SessionReaper(sessionStore, config.withBatchSize(5).withInactivityTimeoutMs(1000), () -> NOW);
        when(sessionStore.expireIdle(1000, NOW, 5)).thenReturn(List.of());

        // when
        reaper.scan();

        // then
        verify(sessionStore).expireIdle(1000, NOW, 5);
    }

    @Test
    void scan_만료_단계_예외가_발생해도_정리_단계는_진행함() {
        // given
        when(sessionStore.expireIdle(anyLong(), anyLong(), anyInt()))
            .thenThrow(new IllegalStateException("store unavailable"));

        // when
        reaper.scan();

        // then
        verify(sessionStore).purgeTerminal(3600000, NOW);
    }

    @Test
    void scan_정리_단계_예외는_전파하지_않음() {
        // given
        when(sessionStore.expireIdle(anyLong(), anyLong(), anyInt())).thenReturn(List.of());
        when(sessionStore.purgeTerminal(anyLong(), anyLong())).thenThrow(new IllegalStateException("boom"));

        // when & then (no exception)
        reaper.scan();
        verify(sessionStore).purgeTerminal(3600000, NOW);
    }

    // ============================================================
    // 2. start / stop
    // ============================================================

    @Test
    void start_주기적으로_스캔함() {
        // given
        reaper = new SessionReaper(sessionStore, config.withScanIntervalMs(10), () -> NOW);
        when(sessionStore.expireIdle(anyLong(), anyLong(), anyInt())).thenReturn(List.of());

        // when
        reaper.start();

        // then
        try {
            verify(sessionStore, timeout(2000).atLeast(2)).expireIdle(300000, NOW, 100);
            assertThat(reaper.isRunning()).isTrue();
        } finally {
            reaper.stop();
        }
        assertThat(reaper.isRunning()).isFalse();
    }

    @Test
    void start_중복_호출은_예외() {
        // given
        reaper = new SessionReaper(sessionStore, config.withScanIntervalMs(60000), () -> NOW);
        reaper.start();

        // when & then
        try {
            assertThatThrownBy(reaper::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");
        } finally {
            reaper.stop();
        }
    }

    @Test
    void stop_시작하지_않았으면_아무것도_하지_않음() {
        // when
        reaper.stop();

        // then
        assertThat(reaper.isRunning()).isFalse();
    }

    // ============================================================
    // 3. 생성자 검증
    // ============================================================

    @Test
    void 생성자_null_의존성은_예외() {
        assertThatThrownBy(() -> new SessionReaper(null, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sessionStore cannot be null");
        assertThatThrownBy(() -> new SessionReaper(sessionStore, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }
}
