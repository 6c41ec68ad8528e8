package io.github.vevoly.jlayercache.starter.autoconfigure;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.vevoly.jlayercache.api.config.ResolvedJLayerCacheConfig;
import io.github.vevoly.jlayercache.core.config.JLayerCacheConfigResolver;
import io.github.vevoly.jlayercache.core.internal.L1Entry;
import io.github.vevoly.jlayercache.core.internal.L1EntryExpiry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine 本地缓存 (L1) 的配置类。
 * <p>
 * 条目数量上限来自 {@code j-layer-cache.memory.max-size}，过期时间按条目单独计算 (见 {@link L1EntryExpiry})，
 * 因此每次写入都可以携带自己的 TTL。
 * <p>
 * Configuration class for the Caffeine local cache (L1). The entry bound comes from
 * {@code j-layer-cache.memory.max-size}; expiry is computed per entry (see {@link L1EntryExpiry}) so every write
 * may carry its own TTL.
 *
 * @author vevoly
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnClass(Caffeine.class)
public class JLayerCacheCaffeineConfiguration {

    private final JLayerCacheConfigResolver configResolver;

    /**
     * 配置 L1 Cache Bean。
     * <p>
     * Configures the L1 cache bean.
     *
     * @return 已配置好的 Caffeine Cache 实例 / The configured Caffeine cache instance.
     */
    @Bean("jLayerCacheL1")
    @ConditionalOnMissingBean(name = "jLayerCacheL1")
    public Cache<String, L1Entry> jLayerCacheL1() {
        ResolvedJLayerCacheConfig config = configResolver.getResolvedConfig();
        log.info("[JLayerCache-Caffeine] Building L1 cache: maxSize={}, default ttl={}s",
                config.getMemoryMaxSize(), config.getMemoryTtl().getSeconds());
        return Caffeine.newBuilder()
                .maximumSize(config.getMemoryMaxSize())
                .expireAfter(new L1EntryExpiry())
                .recordStats()
                .build();
    }
}
