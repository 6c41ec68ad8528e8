package io.github.vevoly.jlayercache.core.internal;

import io.github.vevoly.jlayercache.api.EntityKeyPatternResolver;
import io.github.vevoly.jlayercache.api.JLayerCache;
import io.github.vevoly.jlayercache.api.JLayerCacheManager;
import io.github.vevoly.jlayercache.api.JLayerCacheWarmupStrategy;
import io.github.vevoly.jlayercache.api.config.ResolvedJLayerCacheConfig;
import io.github.vevoly.jlayercache.api.structure.*;
import io.github.vevoly.jlayercache.core.internal.CacheTagRegistry.TaggedKey;
import io.github.vevoly.jlayercache.core.processor.JLayerCacheWarmupProcessor;
import io.github.vevoly.jlayercache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.util.StopWatch;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link JLayerCacheManager} 的默认实现。
 * <p>
 * Default {@link JLayerCacheManager} implementation.
 *
 * @author vevoly
 */
@Slf4j
public class JLayerCacheManagerImpl implements JLayerCacheManager {

    private static final String LOG_PREFIX = "[JLayerCache-Manager] ";

    private final JLayerCache cache;
    private final ResolvedJLayerCacheConfig config;
    private final EntityKeyPatternResolver keyPatternResolver;
    private final JLayerCacheWarmupProcessor warmupProcessor;
    private final List<JLayerCacheWarmupStrategy> warmupStrategies;
    private final Executor asyncExecutor;

    private final CacheTagRegistry tagRegistry = new CacheTagRegistry();
    private final I18nLogger i18nLog = new I18nLogger(log);

    public JLayerCacheManagerImpl(JLayerCache cache, ResolvedJLayerCacheConfig config,
                                  EntityKeyPatternResolver keyPatternResolver,
                                  JLayerCacheWarmupProcessor warmupProcessor,
                                  List<JLayerCacheWarmupStrategy> warmupStrategies,
                                  Executor asyncExecutor) {
        this.cache = cache;
        this.config = config;
        this.keyPatternResolver = keyPatternResolver;
        this.warmupProcessor = warmupProcessor;
        this.warmupStrategies = warmupStrategies == null ? Collections.emptyList() : List.copyOf(warmupStrategies);
        this.asyncExecutor = asyncExecutor;
    }

    // ==================================================================
    // ============ 标签 / Tags ==========================================
    // ==================================================================

    @Override
    public boolean setWithTags(String key, Object value, Collection<String> tags, JLayerCacheOptions options) {
        JLayerCacheOptions opts = JLayerCacheOptions.orDefault(options);
        boolean stored = cache.set(key, value, opts);
        if (CollectionUtils.isNotEmpty(tags)) {
            // 写入失败也记录标签，保证之后的失效一定覆盖到该 key / recorded even on failure so a later invalidation covers the key
            TaggedKey taggedKey = new TaggedKey(opts.getNamespace(), key);
            tags.stream().filter(StringUtils::isNotBlank).forEach(tag -> tagRegistry.associate(tag, taggedKey));
        }
        return stored;
    }

    @Override
    public long invalidateByTag(String tag) {
        if (StringUtils.isBlank(tag)) {
            return 0L;
        }
        return invalidateTag(tag, new HashSet<>(), 0);
    }

    private long invalidateTag(String tag, Set<String> visited, int depth) {
        if (!visited.add(tag)) {
            i18nLog.warn("tag.cycle", tag);
            return 0L;
        }
        Set<TaggedKey> keys = tagRegistry.snapshot(tag);
        long removed = 0L;
        for (TaggedKey taggedKey : keys) {
            if (cache.del(taggedKey.getKey(), JLayerCacheOptions.namespace(taggedKey.getNamespace()))) {
                removed++;
            }
        }
        tagRegistry.removeAll(tag, keys);
        log.debug(LOG_PREFIX + "{}Tag '{}' invalidated, {} keys removed.", StringUtils.repeat("  ", depth), tag, removed);

        DependencyRule rule = config.getDependencyRules().get(tag);
        if (rule != null && rule.isCascading()) {
            for (String dependent : rule.getDependencies()) {
                removed += invalidateTag(dependent, visited, depth + 1);
            }
        }
        return removed;
    }

    @Override
    public Set<String> getTaggedKeys(String tag) {
        return tagRegistry.keysOf(tag);
    }

    // ==================================================================
    // ============ 数据变更 / Data Change ================================
    // ==================================================================

    @Override
    public long handleDataChange(DataChangeEvent event) {
        if (event == null || StringUtils.isAnyBlank(event.getEntity(), event.getOperation())) {
            return 0L;
        }
        long removed = 0L;
        // 1. 按触发表失效标签 / tags whose triggers match
        List<String> affectedTags = new ArrayList<>();
        for (DependencyRule rule : config.getDependencyRules().values()) {
            if (rule.isTriggeredBy(event.getEntity(), event.getOperation())) {
                affectedTags.add(rule.getTag());
                removed += invalidateByTag(rule.getTag());
            }
        }
        // 2. 实体相关的 key 模式 / entity key patterns
        List<InvalidationPattern> patterns = keyPatternResolver.resolve(event);
        for (InvalidationPattern pattern : patterns) {
            removed += cache.invalidate(pattern);
        }
        i18nLog.info("data_change.handled", event.trigger(), affectedTags, patterns.size(), removed);
        return removed;
    }

    // ==================================================================
    // ============ 预热 / Warmup ========================================
    // ==================================================================

    @Override
    public WarmupResult warmupCache() {
        WarmupResult.WarmupResultBuilder result = WarmupResult.builder();
        if (!config.isWarmupEnabled()) {
            i18nLog.info("warmup.disabled");
            return result.build();
        }
        List<JLayerCacheWarmupStrategy> plan = resolveWarmupPlan();
        if (plan.isEmpty()) {
            i18nLog.info("warmup.nothing");
            return result.build();
        }

        long budgetMillis = config.getWarmupMaxTime().toMillis();
        long delayMillis = config.getWarmupDelay().toMillis();
        int batchSize = config.getWarmupBatchSize();
        i18nLog.info("warmup.start", plan.size(), batchSize, budgetMillis);

        StopWatch stopWatch = new StopWatch("JLayerCache Warmup");
        stopWatch.start();
        long startNanos = System.nanoTime();
        int warmed = 0;
        boolean budgetExceeded = false;

        for (int i = 0; i < plan.size(); i++) {
            JLayerCacheWarmupStrategy strategy = plan.get(i);
            if (i > 0 && delayMillis > 0 && !pause(delayMillis)) {
                skipRest(plan, i, result);
                break;
            }
            long remaining = budgetMillis - elapsedMillis(startNanos);
            if (remaining <= 0) {
                budgetExceeded = true;
                i18nLog.warn("warmup.budget_exceeded", budgetMillis, plan.size() - i);
                skipRest(plan, i, result);
                break;
            }

            CompletableFuture<List<WarmupEntry>> future =
                    CompletableFuture.supplyAsync(() -> warmupProcessor.fetch(strategy, batchSize), asyncExecutor);
            try {
                List<WarmupEntry> entries = future.get(remaining, TimeUnit.MILLISECONDS);
                int count = warmupProcessor.write(strategy, entries);
                warmed += count;
                result.completed(strategy.getName());
                i18nLog.info("warmup.strategy_done", i + 1, strategy.getName(), count);
            } catch (TimeoutException e) {
                future.cancel(true);
                budgetExceeded = true;
                i18nLog.warn("warmup.budget_exceeded", budgetMillis, plan.size() - i);
                skipRest(plan, i, result);
                break;
            } catch (ExecutionException e) {
                result.failed(strategy.getName());
                i18nLog.error("warmup.strategy_failed", e.getCause(), i + 1, strategy.getName());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                skipRest(plan, i, result);
                break;
            } catch (RuntimeException e) {
                result.failed(strategy.getName());
                i18nLog.error("warmup.strategy_failed", e, i + 1, strategy.getName());
            }
        }

        stopWatch.stop();
        WarmupResult outcome = result
                .warmedKeys(warmed)
                .budgetExceeded(budgetExceeded)
                .elapsedMillis(stopWatch.getTotalTimeMillis())
                .build();
        i18nLog.info("warmup.done", outcome.getWarmedKeys(), outcome.getCompleted().size(),
                outcome.getFailed().size(), outcome.getSkipped().size(), outcome.getElapsedMillis());
        return outcome;
    }

    /**
     * 按配置的策略名排序；未配置时使用全部已注册策略。
     * <p>
     * Orders the strategies by the configured names; with no names configured every registered strategy runs.
     */
    private List<JLayerCacheWarmupStrategy> resolveWarmupPlan() {
        List<String> names = config.getWarmupStrategies();
        if (CollectionUtils.isEmpty(names)) {
            return warmupStrategies;
        }
        Map<String, JLayerCacheWarmupStrategy> byName = new LinkedHashMap<>();
        warmupStrategies.forEach(s -> byName.putIfAbsent(s.getName(), s));
        List<JLayerCacheWarmupStrategy> plan = new ArrayList<>();
        for (String name : names) {
            JLayerCacheWarmupStrategy strategy = byName.get(name);
            if (strategy == null) {
                i18nLog.warn("warmup.unknown_strategy", name);
            } else {
                plan.add(strategy);
            }
        }
        return plan;
    }

    private void skipRest(List<JLayerCacheWarmupStrategy> plan, int from, WarmupResult.WarmupResultBuilder result) {
        for (int j = from; j < plan.size(); j++) {
            result.skipped(plan.get(j).getName());
        }
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    // ==================================================================
    // ============ 监控 / Monitoring ====================================
    // ==================================================================

    @Override
    public JLayerCacheStats getStats() {
        return cache.getStats();
    }

    @Override
    public HealthStatus healthCheck() {
        return cache.healthCheck();
    }

    @Override
    public double getHitRate() {
        return cache.getStats().getHitRate();
    }

    @Override
    public double getAverageResponseTime() {
        JLayerCacheStats stats = cache.getStats();
        return (stats.getAvgGetTime() + stats.getAvgSetTime()) / 2;
    }

    @Override
    public List<String> analyze() {
        JLayerCacheStats stats = cache.getStats();
        JLayerCacheStats.TierStats l1 = stats.getL1();
        JLayerCacheStats.TierStats l2 = stats.getL2();
        List<String> suggestions = new ArrayList<>();
        if (l1.getHits() + l1.getMisses() > 0 && l1.getHitRate() < 70) {
            suggestions.add(String.format("L1 hit rate is %.1f%%, consider a larger j-layer-cache.memory.max-size or a longer memory.ttl.", l1.getHitRate()));
        }
        if (l1.getMaxSize() > 0 && l1.getSize() >= l1.getMaxSize() * 0.9) {
            suggestions.add(String.format("L1 holds %d of %d entries, consider raising j-layer-cache.memory.max-size.", l1.getSize(), l1.getMaxSize()));
        }
        if (l2.getHits() + l2.getMisses() > 0 && l2.getHitRate() < 50) {
            suggestions.add(String.format("L2 hit rate is %.1f%%, review the Redis TTLs or add warmup strategies.", l2.getHitRate()));
        }
        if (stats.getAvgGetTime() > 50) {
            suggestions.add(String.format("Average get takes %.1f ms, check the Redis latency.", stats.getAvgGetTime()));
        }
        if (stats.getAvgSetTime() > 100) {
            suggestions.add(String.format("Average set takes %.1f ms, consider batching writes with mset.", stats.getAvgSetTime()));
        }
        return suggestions;
    }

    @Override
    public JLayerCache getCache() {
        return cache;
    }
}
