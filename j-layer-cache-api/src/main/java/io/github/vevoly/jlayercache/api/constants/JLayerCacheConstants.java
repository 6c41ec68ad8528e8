package io.github.vevoly.jlayercache.api.constants;

/**
 * 框架中使用的所有公共常量的集合。
 * <p>
 * A collection of all public constants used within the framework.
 *
 * @author vevoly
 */
public interface JLayerCacheConstants {

    // ===================================================================
    // ====================== Key 相关常量 / Key Constants ======================
    // ===================================================================

    /**
     * 命名空间与业务 key 之间的分隔符。
     * <p>
     * Separator between the namespace and the logical key.
     */
    String KEY_SEPARATOR = ":";

    /**
     * 当未指定时，使用的默认缓存命名空间。
     * <p>
     * The default cache namespace to use when none is specified.
     */
    String DEFAULT_NAMESPACE = "cache";

    /**
     * L1 健康检查使用的探测 key。
     * <p>
     * Probe key used by the L1 health check.
     */
    String HEALTH_PROBE_KEY = "__j_layer_cache_health__";

    // ===================================================================
    // ====================== 全局默认配置值 / Global Default Values ======================
    // ===================================================================

    /**
     * L1 (Caffeine) 本地缓存的默认最大容量。
     * <p>
     * The default maximum size for the L1 (Caffeine) local cache.
     */
    long DEFAULT_MEMORY_MAX_SIZE = 1000L;

    /**
     * 缓存项在 L1 本地缓存中的默认过期时间（秒）。(5 分钟)
     * <p>
     * The default expiration time (in seconds) for cache items in L1. (5 minutes)
     */
    long DEFAULT_MEMORY_TTL = 300L;

    /**
     * 缓存项在 Redis 中的默认过期时间（秒）。(1 小时)
     * <p>
     * The default expiration time (in seconds) for cache items in Redis. (1 hour)
     */
    long DEFAULT_REDIS_TTL = 3600L;

    /**
     * SCAN 命令每页返回的建议数量。
     * <p>
     * Page size hint for the SCAN command.
     */
    int DEFAULT_SCAN_COUNT = 100;

    /**
     * 预热时每个策略最多写入的条目数。
     * <p>
     * Maximum entries written per warmup strategy.
     */
    int DEFAULT_WARMUP_BATCH_SIZE = 50;

    /**
     * 两个预热策略之间的默认间隔（毫秒）。
     * <p>
     * Default delay between two warmup strategies (milliseconds).
     */
    long DEFAULT_WARMUP_DELAY = 100L;

    /**
     * 整个预热过程的默认最长耗时（毫秒）。
     * <p>
     * Default wall-clock budget of a whole warmup run (milliseconds).
     */
    long DEFAULT_WARMUP_MAX_TIME = 30_000L;

    // ===================================================================
    // ====================== 监控阈值 / Monitor Thresholds ======================
    // ===================================================================

    /** 命中率告警下限（百分比）/ hit rate alert floor (percent) */
    double DEFAULT_HIT_RATE_MIN = 70.0;

    /** 平均响应时间告警上限（毫秒）/ average response time alert ceiling (ms) */
    double DEFAULT_AVG_RESPONSE_TIME_MAX = 100.0;

    /** L1 使用率告警上限（百分比）/ L1 usage alert ceiling (percent) */
    double DEFAULT_MEMORY_USAGE_MAX = 90.0;

    // ===================================================================
    // ====================== 内部使用 / Internal Usage ======================
    // ===================================================================

    /**
     * Registrar 类的全限定名，供 ImportSelector 在运行期加载。
     * <p>
     * Fully qualified name of the registrar, loaded at runtime by the ImportSelector.
     */
    String REGISTRAR_CLASS_NAME = "io.github.vevoly.jlayercache.core.config.JLayerCacheEnableRegistrar";

    /**
     * Marker 类的全限定名，用于条件装配。
     * <p>
     * Fully qualified name of the marker class, used by conditional configuration.
     */
    String MARKER_CONFIG_CLASS_NAME = "io.github.vevoly.jlayercache.core.config.JLayerCacheMarkerConfiguration";

    /**
     * {@code @EnableJLayerCache} 中 warmup 属性的名称。
     * <p>
     * Name of the warmup attribute of {@code @EnableJLayerCache}.
     */
    String WARMUP_ATTRIBUTE_NAME = "warmup";
}
