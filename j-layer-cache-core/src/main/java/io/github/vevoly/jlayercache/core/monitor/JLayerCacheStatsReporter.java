package io.github.vevoly.jlayercache.core.monitor;

import io.github.vevoly.jlayercache.api.JLayerCacheManager;
import io.github.vevoly.jlayercache.api.config.ResolvedJLayerCacheConfig;
import io.github.vevoly.jlayercache.api.redis.RedisClient;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheStats;
import io.github.vevoly.jlayercache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 周期性监控任务：输出缓存统计，检测 Redis 连接，并在指标越过阈值时告警。
 * <p>
 * Periodic monitor: logs the cache statistics, probes the Redis connection and warns when a metric crosses its threshold.
 *
 * @author vevoly
 */
@Slf4j
public class JLayerCacheStatsReporter implements InitializingBean, DisposableBean {

    private final JLayerCacheManager manager;
    private final RedisClient redisClient;
    private final ResolvedJLayerCacheConfig config;

    private ThreadPoolTaskScheduler scheduler;

    private final I18nLogger i18nLog = new I18nLogger(log);

    public JLayerCacheStatsReporter(JLayerCacheManager manager, RedisClient redisClient, ResolvedJLayerCacheConfig config) {
        this.manager = manager;
        this.redisClient = redisClient;
        this.config = config;
    }

    @Override
    public void afterPropertiesSet() {
        if (!config.isMonitorEnabled()) {
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("JLayerCache-Monitor-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        scheduler.scheduleAtFixedRate(this::report, config.getMonitorInterval());
        i18nLog.info("monitor.started", config.getMonitorInterval().toSeconds());
    }

    /**
     * 执行一次检查，返回触发的告警条数。
     * <p>
     * Runs one check and returns the number of alerts raised.
     */
    public int report() {
        int alerts = 0;
        try {
            if (!redisClient.isConnected() || !redisClient.ping()) {
                i18nLog.warn("monitor.redis_down");
                alerts++;
            }

            JLayerCacheStats stats = manager.getStats();
            JLayerCacheStats.TierStats l1 = stats.getL1();
            i18nLog.info("monitor.stats", String.format("%.1f", stats.getHitRate()), l1.getSize(), l1.getMaxSize(),
                    String.format("%.2f", stats.getAvgGetTime()), String.format("%.2f", stats.getAvgSetTime()),
                    stats.getTotalOperations());

            if (stats.getHits() + stats.getMisses() > 0 && stats.getHitRate() < config.getHitRateMin()) {
                i18nLog.warn("monitor.low_hit_rate", String.format("%.1f", stats.getHitRate()), config.getHitRateMin());
                alerts++;
            }
            double avgResponseTime = manager.getAverageResponseTime();
            if (avgResponseTime > config.getAvgResponseTimeMax()) {
                i18nLog.warn("monitor.slow_response", String.format("%.2f", avgResponseTime), config.getAvgResponseTimeMax());
                alerts++;
            }
            if (l1.getMaxSize() > 0) {
                double usage = (double) l1.getSize() / l1.getMaxSize() * 100.0;
                if (usage > config.getMemoryUsageMax()) {
                    i18nLog.warn("monitor.memory_usage", String.format("%.1f", usage), config.getMemoryUsageMax());
                    alerts++;
                }
            }
            for (String suggestion : manager.analyze()) {
                i18nLog.info("monitor.suggestion", suggestion);
            }
        } catch (RuntimeException e) {
            // 单次失败不能终止定时任务
            i18nLog.error("monitor.failed", e);
        }
        return alerts;
    }

    @Override
    public void destroy() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }
}
