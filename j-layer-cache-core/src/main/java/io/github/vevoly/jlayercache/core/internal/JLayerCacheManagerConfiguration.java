package io.github.vevoly.jlayercache.core.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import io.github.vevoly.jlayercache.api.EntityKeyPatternResolver;
import io.github.vevoly.jlayercache.api.JLayerCache;
import io.github.vevoly.jlayercache.api.JLayerCacheManager;
import io.github.vevoly.jlayercache.api.JLayerCacheWarmupStrategy;
import io.github.vevoly.jlayercache.api.redis.RedisClient;
import io.github.vevoly.jlayercache.core.codec.JsonValueCodec;
import io.github.vevoly.jlayercache.core.config.JLayerCacheConfigResolver;
import io.github.vevoly.jlayercache.core.monitor.JLayerCacheStatsReporter;
import io.github.vevoly.jlayercache.core.processor.JLayerCacheWarmupProcessor;
import io.github.vevoly.jlayercache.core.properties.JLayerCacheProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * JLayerCacheManager 配置类。
 * @author vevoly
 */
@Configuration
public class JLayerCacheManagerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JsonValueCodec jLayerCacheValueCodec(@Qualifier("jLayerCacheObjectMapper") ObjectMapper objectMapper,
                                                JLayerCacheProperties properties) {
        return new JsonValueCodec(objectMapper, properties.getSerialization().getTrustedPackages());
    }

    @Bean(destroyMethod = "close")
    public JLayerCache jLayerCache(
            RedisClient redisClient,
            @Qualifier("jLayerCacheL1") Cache<String, L1Entry> l1Cache,
            JLayerCacheConfigResolver configResolver,
            @Qualifier("jLayerCacheAsyncExecutor") Executor asyncExecutor
    ) {
        return new JLayerCacheImpl(redisClient, l1Cache, configResolver.getResolvedConfig(), asyncExecutor);
    }

    @Bean
    @ConditionalOnMissingBean(EntityKeyPatternResolver.class)
    public EntityKeyPatternResolver jLayerCacheEntityKeyPatterns() {
        return new DefaultEntityKeyPatterns();
    }

    @Bean
    public JLayerCacheWarmupProcessor jLayerCacheWarmupProcessor(JLayerCache jLayerCache) {
        return new JLayerCacheWarmupProcessor(jLayerCache);
    }

    @Bean
    public JLayerCacheManager jLayerCacheManager(
            JLayerCache jLayerCache,
            JLayerCacheConfigResolver configResolver,
            EntityKeyPatternResolver keyPatternResolver,
            JLayerCacheWarmupProcessor warmupProcessor,
            ObjectProvider<JLayerCacheWarmupStrategy> warmupStrategies,
            @Qualifier("jLayerCacheAsyncExecutor") Executor asyncExecutor
    ) {
        return new JLayerCacheManagerImpl(
                jLayerCache, configResolver.getResolvedConfig(), keyPatternResolver, warmupProcessor,
                warmupStrategies.orderedStream().collect(Collectors.toList()), asyncExecutor
        );
    }

    @Bean
    public JLayerCacheStatsReporter jLayerCacheStatsReporter(JLayerCacheManager jLayerCacheManager,
                                                             RedisClient redisClient,
                                                             JLayerCacheConfigResolver configResolver) {
        return new JLayerCacheStatsReporter(jLayerCacheManager, redisClient, configResolver.getResolvedConfig());
    }
}
