package io.github.vevoly.jlayercache.core.properties;

import io.github.vevoly.jlayercache.api.constants.JLayerCacheConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 映射 application.yml 文件中 {@code j-layer-cache} 根配置块的属性。
 * <p>
 * Maps the properties of the {@code j-layer-cache} root configuration block from the application.yml file.
 *
 * @author vevoly
 */
@Data
@ConfigurationProperties(prefix = "j-layer-cache")
public class JLayerCacheProperties {

    /**
     * 是否启用框架的自动配置。
     * <p>
     * Whether the auto-configuration is enabled.
     */
    private boolean enabled = true;

    /**
     * 所有 key 的命名空间前缀。
     * <p>
     * Namespace prefix applied to every key.
     */
    private String namespace = JLayerCacheConstants.DEFAULT_NAMESPACE;

    private Memory memory = new Memory();

    private Redis redis = new Redis();

    private Serialization serialization = new Serialization();

    /**
     * 是否合并内置的依赖表 (user、post、product、order)。同名标签以用户配置为准。
     * <p>
     * Whether the built-in dependency table (user, post, product, order) is merged in. User entries win on the same tag.
     */
    private boolean useDefaultDependencies = true;

    /**
     * 标签依赖表，Map 的 Key 是标签名。
     * <p>
     * Tag dependency table keyed by tag name.
     */
    private Map<String, Dependency> dependencies = new LinkedHashMap<>();

    private Warmup warmup = new Warmup();

    private Monitor monitor = new Monitor();

    /**
     * L1 (Caffeine) 本地缓存配置。
     * <p>
     * L1 (Caffeine) memory tier settings.
     */
    @Data
    public static class Memory {

        /** 最大条目数 / maximum number of entries */
        private Long maxSize = JLayerCacheConstants.DEFAULT_MEMORY_MAX_SIZE;

        /** 默认过期时间 / default time to live */
        private Duration ttl = Duration.ofSeconds(JLayerCacheConstants.DEFAULT_MEMORY_TTL);
    }

    /**
     * L2 (Redis) 连接与行为配置。
     * <p>
     * L2 (Redis) connection and behaviour settings.
     */
    @Data
    public static class Redis {

        private String host = "localhost";

        private int port = 6379;

        private String username;

        private String password;

        private int database = 0;

        private boolean ssl = false;

        /** 单个命令的超时时间，超时视为连接失败 / per-command timeout, a timeout counts as a connectivity failure */
        private Duration timeout = Duration.ofSeconds(3);

        private Duration connectTimeout = Duration.ofSeconds(10);

        private int retryAttempts = 3;

        private Duration retryInterval = Duration.ofMillis(100);

        /** SCAN 每页数量，同时作为批量删除的分片大小 / SCAN page size, also the chunk size of batch deletes */
        private int scanCount = JLayerCacheConstants.DEFAULT_SCAN_COUNT;

        /** 未指定 TTL 时 Redis 中的过期时间 / Redis TTL when a call specifies none */
        private Duration defaultTtl = Duration.ofSeconds(JLayerCacheConstants.DEFAULT_REDIS_TTL);

        /** 断连后重新探测的间隔 / probe interval while disconnected */
        private Duration reconnectInterval = Duration.ofSeconds(5);
    }

    /**
     * 序列化配置。
     * <p>
     * Serialization settings.
     */
    @Data
    public static class Serialization {

        /**
         * 允许从缓存中还原为具体类型的包名，java.lang / java.util / java.time / java.math 总是受信任。
         * 其他类型在无类型读取时得到 Map，按类型读取 ({@code get(key, Class)}) 不受此限制。
         * <p>
         * Packages whose types may be restored from the cache; java.lang, java.util, java.time and java.math are always trusted.
         * Other types come back as a Map from an untyped read; typed reads ({@code get(key, Class)}) are not limited by this list.
         */
        private List<String> trustedPackages = new ArrayList<>();
    }

    /**
     * 单个标签的依赖规则。
     * <p>
     * Dependency rule of a single tag.
     */
    @Data
    public static class Dependency {

        /** 触发事件，格式 entity:operation / trigger events, entity:operation */
        private List<String> triggers = new ArrayList<>();

        /** 下游标签 / dependent tags */
        private List<String> dependencies = new ArrayList<>();

        private boolean cascading = false;
    }

    /**
     * 预热配置。
     * <p>
     * Warmup settings.
     */
    @Data
    public static class Warmup {

        private boolean enabled = true;

        /** 执行的策略名及顺序，为空表示全部 / strategy names in order, empty means all */
        private List<String> strategies = new ArrayList<>();

        private int batchSize = JLayerCacheConstants.DEFAULT_WARMUP_BATCH_SIZE;

        private Duration delayBetweenBatches = Duration.ofMillis(JLayerCacheConstants.DEFAULT_WARMUP_DELAY);

        private Duration maxWarmupTime = Duration.ofMillis(JLayerCacheConstants.DEFAULT_WARMUP_MAX_TIME);
    }

    /**
     * 监控配置。
     * <p>
     * Monitor settings.
     */
    @Data
    public static class Monitor {

        private boolean enabled = true;

        private Duration interval = Duration.ofMinutes(1);

        private double hitRateMin = JLayerCacheConstants.DEFAULT_HIT_RATE_MIN;

        private double avgResponseTimeMax = JLayerCacheConstants.DEFAULT_AVG_RESPONSE_TIME_MAX;

        private double memoryUsageMax = JLayerCacheConstants.DEFAULT_MEMORY_USAGE_MAX;
    }
}
