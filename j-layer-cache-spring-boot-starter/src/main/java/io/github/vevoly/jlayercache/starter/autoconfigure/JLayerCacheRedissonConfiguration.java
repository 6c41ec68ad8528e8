package io.github.vevoly.jlayercache.starter.autoconfigure;

import io.github.vevoly.jlayercache.core.config.JLayerCacheConfigResolver;
import io.github.vevoly.jlayercache.core.properties.JLayerCacheProperties;
import org.apache.commons.lang3.StringUtils;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 配置
 * @author vevoly
 */
@Configuration
public class JLayerCacheRedissonConfiguration {

    /**
     * 解析器参数保证在连接前完成配置校验。
     * <p>
     * Taking the resolver as a parameter makes the configuration validated before connecting.
     */
    @Bean(value = "jLayerCacheRedissonClient", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "jLayerCacheRedissonClient")
    public RedissonClient jLayerCacheRedissonClient(JLayerCacheProperties properties,
                                                    JLayerCacheConfigResolver configResolver) {
        return Redisson.create(buildConfig(properties.getRedis()));
    }

    static Config buildConfig(JLayerCacheProperties.Redis redis) {
        Config config = new Config();

        // 强制使用 StringCodec
        config.setCodec(new StringCodec());

        // 解析地址
        String prefix = redis.isSsl() ? "rediss://" : "redis://";
        String address = prefix + redis.getHost() + ":" + redis.getPort();

        // 配置单机模式
        SingleServerConfig server = config.useSingleServer()
                .setAddress(address)
                .setDatabase(redis.getDatabase())
                .setTimeout((int) redis.getTimeout().toMillis())
                .setConnectTimeout((int) redis.getConnectTimeout().toMillis())
                .setRetryAttempts(redis.getRetryAttempts())
                .setRetryInterval((int) redis.getRetryInterval().toMillis());
        if (StringUtils.isNotBlank(redis.getPassword())) {
            server.setPassword(redis.getPassword());
        }
        if (StringUtils.isNotBlank(redis.getUsername())) {
            server.setUsername(redis.getUsername());
        }
        return config;
    }
}
