package io.github.vevoly.jlayercache.starter.autoconfigure;

import io.github.vevoly.jlayercache.api.JLayerCacheManager;
import io.github.vevoly.jlayercache.core.config.JLayerCacheConfigResolver;
import io.github.vevoly.jlayercache.core.config.JLayerCacheMarkerConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;

/**
 * 缓存预热自动装配器
 * <p>
 * 应用启动完成后按配置执行一次 {@link JLayerCacheManager#warmupCache()}。
 * {@code @EnableJLayerCache(warmup = false)} 或 {@code j-layer-cache.warmup.enabled=false} 时跳过。
 */
@Slf4j
public class JLayerCacheWarmupAutoConfiguration implements CommandLineRunner {

    private static final String LOG_PREFIX = "[JLayerCache-Warmup] ";

    private final JLayerCacheManager manager;
    private final JLayerCacheMarkerConfiguration marker;
    private final JLayerCacheConfigResolver configResolver;

    public JLayerCacheWarmupAutoConfiguration(JLayerCacheManager manager,
                                              JLayerCacheMarkerConfiguration marker,
                                              JLayerCacheConfigResolver configResolver) {
        this.manager = manager;
        this.marker = marker;
        this.configResolver = configResolver;
    }

    @Override
    public void run(String... args) {
        if (!marker.isWarmup() || !configResolver.getResolvedConfig().isWarmupEnabled()) {
            log.info(LOG_PREFIX + "Warmup is disabled, skipping.");
            return;
        }
        manager.warmupCache();
    }
}
