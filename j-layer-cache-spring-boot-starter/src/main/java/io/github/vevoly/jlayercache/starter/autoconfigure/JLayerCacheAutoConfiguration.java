package io.github.vevoly.jlayercache.starter.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.vevoly.jlayercache.api.JLayerCache;
import io.github.vevoly.jlayercache.api.JLayerCacheManager;
import io.github.vevoly.jlayercache.api.redis.RedisClient;
import io.github.vevoly.jlayercache.core.codec.JsonValueCodec;
import io.github.vevoly.jlayercache.core.config.JLayerCacheConfigResolver;
import io.github.vevoly.jlayercache.core.internal.JLayerCacheManagerConfiguration;
import io.github.vevoly.jlayercache.core.internal.NoOpJLayerCache;
import io.github.vevoly.jlayercache.core.properties.JLayerCacheProperties;
import io.github.vevoly.jlayercache.core.redis.RedissonRedisClient;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import static io.github.vevoly.jlayercache.api.constants.JLayerCacheConstants.MARKER_CONFIG_CLASS_NAME;

/**
 * j-layer-cache 的自动配置类。
 * <p>
 * 负责初始化和组装框架的所有核心组件，包括：
 * 1. 激活配置属性。
 * 2. 初始化配置解析器。
 * 3. 配置 Redis 客户端 (基于 Redisson)。
 * 4. 配置 Caffeine 本地缓存。
 * 5. 注册缓存、管理器、监控和预热执行器。
 * <p>
 * Auto-configuration class for j-layer-cache.
 * Responsible for initializing and assembling all core components of the framework, including:
 * 1. Activating configuration properties.
 * 2. Initializing the configuration resolver.
 * 3. Configuring the Redis client (based on Redisson).
 * 4. Configuring the Caffeine local cache.
 * 5. Registering the cache, manager, monitor and warmup runner.
 *
 * @author vevoly
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass({RedissonClient.class, Caffeine.class})
@EnableConfigurationProperties(JLayerCacheProperties.class)
@ConditionalOnProperty(prefix = "j-layer-cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JLayerCacheAutoConfiguration {

    /**
     * 【启用模式】
     * 用户使用了 @EnableJLayerCache 注解。
     * 此时加载真实的组件：线程池、Redis连接、两级缓存、预热器等。
     */
    @Configuration
    @ConditionalOnBean(type = MARKER_CONFIG_CLASS_NAME) // 只有 Marker 存在时才生效 / Only take effect when Marker exists
    @Import({
            JLayerCacheCaffeineConfiguration.class,     // L1 Caffeine 配置 / L1 Caffeine configuration
            JLayerCacheRedissonConfiguration.class,     // Redisson 配置 (StringCodec) / Redisson configuration (StringCodec)
            JLayerCacheManagerConfiguration.class,      // 真实 Cache 与 Manager / Real cache and manager
            JLayerCacheWarmupAutoConfiguration.class,   // 预热调度器 (Runner) / Warmup scheduler (Runner)
    })
    static class JLayerCacheActiveConfiguration {

        /**
         * 1. 配置异步线程池
         * 用于 write-behind 写入和预热任务。
         */
        @Bean("jLayerCacheAsyncExecutor")
        @ConditionalOnMissingBean(name = "jLayerCacheAsyncExecutor")
        public Executor jLayerCacheAsyncExecutor() {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(Runtime.getRuntime().availableProcessors());
            executor.setMaxPoolSize(Runtime.getRuntime().availableProcessors() * 4);
            executor.setQueueCapacity(500);
            executor.setKeepAliveSeconds(60);
            executor.setThreadNamePrefix("JLayerCache-Async-");
            executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
            executor.initialize();
            return executor;
        }

        /**
         * 2. 配置 Jackson ObjectMapper
         * 配置框架专用的 ObjectMapper，避免受用户全局配置污染
         */
        @Bean("jLayerCacheObjectMapper")
        @ConditionalOnMissingBean(name = "jLayerCacheObjectMapper")
        public ObjectMapper jLayerCacheObjectMapper() {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            return mapper;
        }

        /**
         * 3. 配置 Config Resolver (核心配置解析器)
         * 它必须先于 Caffeine 和 Redisson 初始化，因为它负责校验配置。
         */
        @Bean
        public JLayerCacheConfigResolver jLayerCacheConfigResolver(JLayerCacheProperties properties) {
            return new JLayerCacheConfigResolver(properties);
        }

        /**
         * 4. 配置 RedisClient (基于 Redisson)
         */
        @Bean
        @ConditionalOnMissingBean(RedisClient.class)
        public RedisClient jLayerCacheRedisClient(@Qualifier("jLayerCacheRedissonClient") RedissonClient redissonClient,
                                                  JsonValueCodec valueCodec,
                                                  JLayerCacheProperties properties) {
            JLayerCacheProperties.Redis redis = properties.getRedis();
            return new RedissonRedisClient(redissonClient, valueCodec, redis.getDefaultTtl(),
                    redis.getScanCount(), redis.getReconnectInterval());
        }
    }

    /**
     * 【降级模式】
     * 用户没有使用 @EnableJLayerCache 注解。
     * 此时不加载任何重资源（Redis/Thread），只注册一个空实现，防止报错。
     */
    @Configuration
    @ConditionalOnMissingBean(type = MARKER_CONFIG_CLASS_NAME) // Marker 不存在时生效 / Only take effect when Marker not exists
    static class JLayerCacheFallbackConfiguration {

        @Bean
        @ConditionalOnMissingBean({JLayerCache.class, JLayerCacheManager.class})
        public NoOpJLayerCache jLayerCacheFallback() {
            // 返回空实现，所有方法直接透传数据源，不走缓存
            return new NoOpJLayerCache();
        }
    }

}
