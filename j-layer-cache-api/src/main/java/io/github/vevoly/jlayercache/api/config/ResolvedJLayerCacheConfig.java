package io.github.vevoly.jlayercache.api.config;

import io.github.vevoly.jlayercache.api.constants.JLayerCacheConstants;
import io.github.vevoly.jlayercache.api.structure.DependencyRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一个不可变的数据对象，代表经过校验、合并默认值后最终生效的缓存配置。
 * <p>
 * An immutable data object representing the final, effective configuration after validation
 * and merging with defaults.
 *
 * @author vevoly
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public final class ResolvedJLayerCacheConfig {

    @Builder.Default
    private final String namespace = JLayerCacheConstants.DEFAULT_NAMESPACE;

    @Builder.Default
    private final long memoryMaxSize = JLayerCacheConstants.DEFAULT_MEMORY_MAX_SIZE;

    @Builder.Default
    private final Duration memoryTtl = Duration.ofSeconds(JLayerCacheConstants.DEFAULT_MEMORY_TTL);

    @Builder.Default
    private final Duration redisTtl = Duration.ofSeconds(JLayerCacheConstants.DEFAULT_REDIS_TTL);

    @Builder.Default
    private final int scanCount = JLayerCacheConstants.DEFAULT_SCAN_COUNT;

    /**
     * 标签依赖表，key 为标签名。
     * <p>
     * Tag dependency table keyed by tag name.
     */
    @Builder.Default
    private final Map<String, DependencyRule> dependencyRules = Collections.emptyMap();

    // ---------------------- 预热 / Warmup ----------------------

    @Builder.Default
    private final boolean warmupEnabled = true;

    /**
     * 需要执行的策略名及顺序；为空表示执行所有已注册的策略。
     * <p>
     * Strategy names in execution order; empty means every registered strategy.
     */
    @Builder.Default
    private final List<String> warmupStrategies = Collections.emptyList();

    @Builder.Default
    private final int warmupBatchSize = JLayerCacheConstants.DEFAULT_WARMUP_BATCH_SIZE;

    @Builder.Default
    private final Duration warmupDelay = Duration.ofMillis(JLayerCacheConstants.DEFAULT_WARMUP_DELAY);

    @Builder.Default
    private final Duration warmupMaxTime = Duration.ofMillis(JLayerCacheConstants.DEFAULT_WARMUP_MAX_TIME);

    // ---------------------- 监控 / Monitor ----------------------

    @Builder.Default
    private final boolean monitorEnabled = true;

    @Builder.Default
    private final Duration monitorInterval = Duration.ofMinutes(1);

    @Builder.Default
    private final double hitRateMin = JLayerCacheConstants.DEFAULT_HIT_RATE_MIN;

    @Builder.Default
    private final double avgResponseTimeMax = JLayerCacheConstants.DEFAULT_AVG_RESPONSE_TIME_MAX;

    @Builder.Default
    private final double memoryUsageMax = JLayerCacheConstants.DEFAULT_MEMORY_USAGE_MAX;
}
