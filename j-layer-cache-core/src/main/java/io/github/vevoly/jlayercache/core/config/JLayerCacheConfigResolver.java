package io.github.vevoly.jlayercache.core.config;

import io.github.vevoly.jlayercache.api.config.ResolvedJLayerCacheConfig;
import io.github.vevoly.jlayercache.api.constants.DefaultDependencyRules;
import io.github.vevoly.jlayercache.api.exception.ConfigurationException;
import io.github.vevoly.jlayercache.api.structure.DependencyRule;
import io.github.vevoly.jlayercache.core.properties.JLayerCacheProperties;
import io.github.vevoly.jlayercache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.InitializingBean;

import java.time.Duration;
import java.util.*;

/**
 * 缓存配置解析器。
 * <p>
 * 此组件在 Spring 容器启动时运行 (通过 {@link InitializingBean})，负责校验 YML 配置，
 * 并与框架默认值合并，构建一个不可变的 {@link ResolvedJLayerCacheConfig}。配置非法时抛出
 * {@link ConfigurationException}，阻止容器启动。
 * <p>
 * The cache configuration resolver. This component runs on Spring container startup (via {@link InitializingBean}),
 * validates the YML configuration and merges it with the framework defaults into an immutable
 * {@link ResolvedJLayerCacheConfig}. Invalid configuration raises a {@link ConfigurationException} and stops the context.
 *
 * @author vevoly
 */
@Slf4j
public class JLayerCacheConfigResolver implements InitializingBean {

    public static final String LOG_PREFIX = "[JLayerCacheResolver] ";

    private final JLayerCacheProperties properties;
    private ResolvedJLayerCacheConfig resolvedConfig;

    private final I18nLogger i18nLog = new I18nLogger(log);

    public JLayerCacheConfigResolver(JLayerCacheProperties properties) {
        this.properties = properties;
    }

    @Override
    public void afterPropertiesSet() {
        i18nLog.info("resolver.start_parse");
        this.resolvedConfig = resolve(properties);
        i18nLog.info("resolver.done", resolvedConfig.getNamespace(), resolvedConfig.getDependencyRules().size());
    }

    /**
     * 返回最终生效的配置。
     * <p>
     * Returns the effective configuration.
     *
     * @throws IllegalStateException 尚未解析 / not resolved yet
     */
    public ResolvedJLayerCacheConfig getResolvedConfig() {
        if (resolvedConfig == null) {
            throw new IllegalStateException(LOG_PREFIX + "Configuration has not been resolved yet.");
        }
        return resolvedConfig;
    }

    /**
     * 校验并合并配置。
     * <p>
     * Validates and merges the configuration.
     *
     * @throws ConfigurationException 配置非法 / invalid configuration
     */
    public static ResolvedJLayerCacheConfig resolve(JLayerCacheProperties props) {
        // 1. 基础项 / basics
        require(StringUtils.isNotBlank(props.getNamespace()), "'j-layer-cache.namespace' must not be blank.");
        require(!StringUtils.contains(props.getNamespace(), '*') && !StringUtils.contains(props.getNamespace(), '?'),
                "'j-layer-cache.namespace' must not contain wildcards.");

        JLayerCacheProperties.Memory memory = props.getMemory();
        require(memory.getMaxSize() != null && memory.getMaxSize() > 0, "'j-layer-cache.memory.max-size' must be greater than 0.");
        requirePositive(memory.getTtl(), "j-layer-cache.memory.ttl");

        // 2. Redis 连接 / Redis connection
        validateRedis(props.getRedis());

        // 3. 依赖表 / dependency table
        Map<String, DependencyRule> rules = resolveDependencies(props);

        // 4. 预热与监控 / warmup and monitor
        JLayerCacheProperties.Warmup warmup = props.getWarmup();
        require(warmup.getBatchSize() > 0, "'j-layer-cache.warmup.batch-size' must be greater than 0.");
        requirePositive(warmup.getMaxWarmupTime(), "j-layer-cache.warmup.max-warmup-time");
        require(warmup.getDelayBetweenBatches() != null && !warmup.getDelayBetweenBatches().isNegative(),
                "'j-layer-cache.warmup.delay-between-batches' must not be negative.");

        JLayerCacheProperties.Monitor monitor = props.getMonitor();
        if (monitor.isEnabled()) {
            requirePositive(monitor.getInterval(), "j-layer-cache.monitor.interval");
        }

        return ResolvedJLayerCacheConfig.builder()
                .namespace(props.getNamespace())
                .memoryMaxSize(memory.getMaxSize())
                .memoryTtl(memory.getTtl())
                .redisTtl(props.getRedis().getDefaultTtl())
                .scanCount(props.getRedis().getScanCount())
                .dependencyRules(Collections.unmodifiableMap(rules))
                .warmupEnabled(warmup.isEnabled())
                .warmupStrategies(List.copyOf(warmup.getStrategies()))
                .warmupBatchSize(warmup.getBatchSize())
                .warmupDelay(warmup.getDelayBetweenBatches())
                .warmupMaxTime(warmup.getMaxWarmupTime())
                .monitorEnabled(monitor.isEnabled())
                .monitorInterval(monitor.getInterval())
                .hitRateMin(monitor.getHitRateMin())
                .avgResponseTimeMax(monitor.getAvgResponseTimeMax())
                .memoryUsageMax(monitor.getMemoryUsageMax())
                .build();
    }

    private static void validateRedis(JLayerCacheProperties.Redis redis) {
        require(StringUtils.isNotBlank(redis.getHost()), "'j-layer-cache.redis.host' is required.");
        require(redis.getPort() > 0 && redis.getPort() <= 65535, "'j-layer-cache.redis.port' must be between 1 and 65535.");
        require(redis.getDatabase() >= 0, "'j-layer-cache.redis.database' must not be negative.");
        require(StringUtils.isBlank(redis.getUsername()) || StringUtils.isNotBlank(redis.getPassword()),
                "'j-layer-cache.redis.password' is required when a username is set.");
        requirePositive(redis.getTimeout(), "j-layer-cache.redis.timeout");
        requirePositive(redis.getConnectTimeout(), "j-layer-cache.redis.connect-timeout");
        require(redis.getRetryAttempts() >= 0, "'j-layer-cache.redis.retry-attempts' must not be negative.");
        require(redis.getRetryInterval() != null && !redis.getRetryInterval().isNegative(),
                "'j-layer-cache.redis.retry-interval' must not be negative.");
        require(redis.getScanCount() > 0, "'j-layer-cache.redis.scan-count' must be greater than 0.");
        requirePositive(redis.getDefaultTtl(), "j-layer-cache.redis.default-ttl");
        require(redis.getReconnectInterval() != null && !redis.getReconnectInterval().isNegative(),
                "'j-layer-cache.redis.reconnect-interval' must not be negative.");
    }

    private static Map<String, DependencyRule> resolveDependencies(JLayerCacheProperties props) {
        Map<String, DependencyRule> rules = props.isUseDefaultDependencies()
                ? DefaultDependencyRules.defaults() : new LinkedHashMap<>();
        props.getDependencies().forEach((tag, dependency) -> {
            require(StringUtils.isNotBlank(tag), "Dependency tag names must not be blank.");
            for (String trigger : dependency.getTriggers()) {
                require(isValidTrigger(trigger),
                        "Trigger '" + trigger + "' of tag '" + tag + "' must have the form entity:operation.");
            }
            for (String dependent : dependency.getDependencies()) {
                require(StringUtils.isNotBlank(dependent), "Tag '" + tag + "' declares a blank dependency.");
            }
            rules.put(tag, DependencyRule.builder()
                    .tag(tag)
                    .triggers(dependency.getTriggers())
                    .dependencies(dependency.getDependencies())
                    .cascading(dependency.isCascading())
                    .build());
        });
        checkAcyclic(rules);
        return rules;
    }

    private static boolean isValidTrigger(String trigger) {
        String[] parts = StringUtils.split(trigger, ':');
        return parts != null && parts.length == 2 && StringUtils.countMatches(trigger, ':') == 1
                && StringUtils.isNoneBlank(parts[0], parts[1]);
    }

    /**
     * 级联关系必须无环，否则失效会无限递归。
     * <p>
     * The cascade graph must be acyclic.
     */
    private static void checkAcyclic(Map<String, DependencyRule> rules) {
        Map<String, Integer> state = new HashMap<>();
        for (String tag : rules.keySet()) {
            Deque<String> path = new ArrayDeque<>();
            visit(tag, rules, state, path);
        }
    }

    private static void visit(String tag, Map<String, DependencyRule> rules, Map<String, Integer> state, Deque<String> path) {
        Integer current = state.get(tag);
        if (current != null && current == 2) {
            return;
        }
        path.addLast(tag);
        if (current != null && current == 1) {
            throw new ConfigurationException(LOG_PREFIX + "Cyclic cascading dependency: " + String.join(" -> ", path));
        }
        state.put(tag, 1);
        DependencyRule rule = rules.get(tag);
        if (rule != null && rule.isCascading()) {
            for (String dependent : rule.getDependencies()) {
                visit(dependent, rules, state, path);
            }
        }
        state.put(tag, 2);
        path.removeLast();
    }

    private static void requirePositive(Duration duration, String name) {
        require(duration != null && !duration.isNegative() && !duration.isZero(), "'" + name + "' must be greater than 0.");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(LOG_PREFIX + message);
        }
    }
}
