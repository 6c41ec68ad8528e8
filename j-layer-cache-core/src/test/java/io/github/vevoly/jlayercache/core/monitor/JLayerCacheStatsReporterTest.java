package io.github.vevoly.jlayercache.core.monitor;

import io.github.vevoly.jlayercache.api.JLayerCacheManager;
import io.github.vevoly.jlayercache.api.config.ResolvedJLayerCacheConfig;
import io.github.vevoly.jlayercache.api.redis.RedisClient;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("监控任务")
class JLayerCacheStatsReporterTest {

    private final JLayerCacheManager manager = mock(JLayerCacheManager.class);
    private final RedisClient redisClient = mock(RedisClient.class);

    private static JLayerCacheStats stats(long hits, long misses, long size) {
        return JLayerCacheStats.builder()
                .l1(JLayerCacheStats.TierStats.builder().size(size).maxSize(100).build())
                .l2(JLayerCacheStats.TierStats.builder().connected(true).build())
                .hits(hits)
                .misses(misses)
                .build();
    }

    @Test
    @DisplayName("指标正常时没有告警")
    void healthy() {
        when(redisClient.isConnected()).thenReturn(true);
        when(redisClient.ping()).thenReturn(true);
        when(manager.getStats()).thenReturn(stats(90, 10, 10));
        when(manager.analyze()).thenReturn(List.of());

        JLayerCacheStatsReporter reporter = new JLayerCacheStatsReporter(manager, redisClient,
                ResolvedJLayerCacheConfig.builder().monitorEnabled(false).build());

        assertThat(reporter.report()).isZero();
    }

    @Test
    @DisplayName("Redis 断开、命中率低、内存占用高时分别告警")
    void alerts() {
        when(redisClient.isConnected()).thenReturn(false);
        when(manager.getStats()).thenReturn(stats(1, 9, 95));
        when(manager.getAverageResponseTime()).thenReturn(250.0);
        when(manager.analyze()).thenReturn(List.of("raise max-size"));

        JLayerCacheStatsReporter reporter = new JLayerCacheStatsReporter(manager, redisClient,
                ResolvedJLayerCacheConfig.builder().monitorEnabled(false).build());

        assertThat(reporter.report()).isEqualTo(4);
    }

    @Test
    @DisplayName("单次检查失败不抛出异常")
    void failureIsContained() {
        when(redisClient.isConnected()).thenReturn(true);
        when(redisClient.ping()).thenReturn(true);
        when(manager.getStats()).thenThrow(new IllegalStateException("boom"));

        JLayerCacheStatsReporter reporter = new JLayerCacheStatsReporter(manager, redisClient,
                ResolvedJLayerCacheConfig.builder().monitorEnabled(false).build());

        assertThat(reporter.report()).isZero();
    }

    @Test
    @DisplayName("启用时按间隔调度，销毁时停止")
    void lifecycle() {
        when(redisClient.isConnected()).thenReturn(true);
        when(redisClient.ping()).thenReturn(true);
        when(manager.getStats()).thenReturn(stats(0, 0, 0));
        when(manager.analyze()).thenReturn(List.of());

        JLayerCacheStatsReporter reporter = new JLayerCacheStatsReporter(manager, redisClient,
                ResolvedJLayerCacheConfig.builder().build());
        reporter.afterPropertiesSet();
        assertThat(reporter.report()).isZero();
        reporter.destroy();
    }
}
