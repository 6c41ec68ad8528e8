package io.github.vevoly.jlayercache.core.internal;

import com.github.benmanes.caffeine.cache.Cache;
import io.github.vevoly.jlayercache.api.CacheWriter;
import io.github.vevoly.jlayercache.api.JLayerCache;
import io.github.vevoly.jlayercache.api.config.ResolvedJLayerCacheConfig;
import io.github.vevoly.jlayercache.api.constants.JLayerCacheConstants;
import io.github.vevoly.jlayercache.api.redis.RedisClient;
import io.github.vevoly.jlayercache.api.structure.HealthStatus;
import io.github.vevoly.jlayercache.api.structure.InvalidationPattern;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheOptions;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheStats;
import io.github.vevoly.jlayercache.api.utils.JLayerCacheHelper;
import io.github.vevoly.jlayercache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * 两级缓存的默认实现：Caffeine 作为 L1，{@link RedisClient} 作为 L2。
 * <p>
 * L1 中的数据总是来源于一次 L2 写入或 L2 读取；L2 写入失败（而非断连）时会同时移除 L1 中刚写入的条目。
 * L2 断连期间跳过 L2，只读写 L1。
 * <p>
 * Default two-tier implementation: Caffeine as L1 and a {@link RedisClient} as L2. L1 content is always derived
 * from an L2 write or read; when an L2 write fails while Redis is reachable the fresh L1 entry is removed again.
 * While L2 is disconnected it is skipped and only L1 is used.
 *
 * @author vevoly
 */
@Slf4j
public class JLayerCacheImpl implements JLayerCache {

    private static final String LOG_PREFIX = "[JLayerCache] ";

    private final RedisClient redisClient;
    private final Cache<String, L1Entry> l1Cache;
    private final Executor asyncExecutor;

    private final String defaultNamespace;
    private final long memoryMaxSize;
    private final Duration memoryTtl;
    private final Duration redisTtl;
    private final int scanCount;

    private final LongAdder l1Hits = new LongAdder();
    private final LongAdder l1Misses = new LongAdder();
    private final LongAdder l1Sets = new LongAdder();
    private final LongAdder l2Hits = new LongAdder();
    private final LongAdder l2Misses = new LongAdder();
    private final LongAdder l2Sets = new LongAdder();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder getCount = new LongAdder();
    private final LongAdder getNanos = new LongAdder();
    private final LongAdder setCount = new LongAdder();
    private final LongAdder setNanos = new LongAdder();
    private final LongAdder operations = new LongAdder();

    private final I18nLogger i18nLog = new I18nLogger(log);

    public JLayerCacheImpl(RedisClient redisClient, Cache<String, L1Entry> l1Cache,
                           ResolvedJLayerCacheConfig config, Executor asyncExecutor) {
        this.redisClient = redisClient;
        this.l1Cache = l1Cache;
        this.asyncExecutor = asyncExecutor;
        this.defaultNamespace = config.getNamespace();
        this.memoryMaxSize = config.getMemoryMaxSize();
        this.memoryTtl = config.getMemoryTtl();
        this.redisTtl = config.getRedisTtl();
        this.scanCount = config.getScanCount();
        i18nLog.info("cache.init", defaultNamespace, memoryMaxSize, memoryTtl.toSeconds(), redisTtl.toSeconds());
    }

    // ==================================================================
    // ============ 基本读写 / Basic Read & Write =========================
    // ==================================================================

    @Override
    public <T> T get(String key) {
        return get(key, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public <T> T get(String key, JLayerCacheOptions options) {
        return read(key, null, options);
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        return get(key, type, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public <T> T get(String key, Class<T> type, JLayerCacheOptions options) {
        return read(key, Objects.requireNonNull(type, "type"), options);
    }

    /**
     * 读路径。{@code type} 为 null 时不做类型转换。
     * <p>
     * The read path; a {@code null} type skips conversion.
     */
    @SuppressWarnings("unchecked")
    private <T> T read(String key, Class<T> type, JLayerCacheOptions options) {
        JLayerCacheOptions opts = JLayerCacheOptions.orDefault(options);
        String fullKey = fullKey(key, opts);
        long start = System.nanoTime();
        try {
            // 1. L1
            if (!opts.isSkipMemory()) {
                L1Entry entry = l1Cache.getIfPresent(fullKey);
                if (entry != null && (type == null || type.isInstance(entry.getValue()))) {
                    l1Hits.increment();
                    hits.increment();
                    log.debug(LOG_PREFIX + "[L1 HIT] Key: {}", fullKey);
                    return (T) entry.getValue();
                }
                if (entry != null) {
                    // 由无类型读取回填的 Map，按类型从 L2 重新读取 / an untyped back-fill, re-read from L2 with the type
                    l1Cache.invalidate(fullKey);
                }
                l1Misses.increment();
            }
            // 2. L2，命中后回填 L1 / L2, back-fill L1 on hit
            if (isL2Active(opts)) {
                Object value = type == null ? redisClient.get(fullKey) : redisClient.get(fullKey, type);
                if (value != null) {
                    l2Hits.increment();
                    hits.increment();
                    log.debug(LOG_PREFIX + "[L2 HIT] Key: {}", fullKey);
                    if (!opts.isSkipMemory()) {
                        putL1(fullKey, value, opts);
                    }
                    return (T) value;
                }
                l2Misses.increment();
            }
            misses.increment();
            log.debug(LOG_PREFIX + "[MISS] Key: {}", fullKey);
            return null;
        } catch (RuntimeException e) {
            misses.increment();
            log.error(LOG_PREFIX + "Get failed for key '{}', treated as a miss.", fullKey, e);
            return null;
        } finally {
            recordGet(start);
        }
    }

    @Override
    public boolean set(String key, Object value) {
        return set(key, value, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public boolean set(String key, Object value, JLayerCacheOptions options) {
        JLayerCacheOptions opts = JLayerCacheOptions.orDefault(options);
        String fullKey = fullKey(key, opts);
        if (value == null) {
            del(key, opts);
            return true;
        }
        long start = System.nanoTime();
        try {
            if (!opts.isSkipMemory()) {
                putL1(fullKey, value, opts);
            }
            if (opts.isSkipRedis()) {
                return true;
            }
            if (!redisClient.isConnected()) {
                log.debug(LOG_PREFIX + "[DEGRADED] L2 unavailable, key '{}' written to L1 only.", fullKey);
                return true;
            }
            if (redisClient.set(fullKey, value, redisTtl(opts))) {
                l2Sets.increment();
                return true;
            }
            return onL2WriteFailure(Collections.singletonList(fullKey));
        } catch (RuntimeException e) {
            l1Cache.invalidate(fullKey);
            log.error(LOG_PREFIX + "Set failed for key '{}'.", fullKey, e);
            return false;
        } finally {
            recordSet(start);
        }
    }

    @Override
    public boolean del(String key) {
        return del(key, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public boolean del(String key, JLayerCacheOptions options) {
        JLayerCacheOptions opts = JLayerCacheOptions.orDefault(options);
        String fullKey = fullKey(key, opts);
        operations.increment();
        try {
            boolean removed = false;
            if (!opts.isSkipMemory()) {
                removed = l1Cache.asMap().remove(fullKey) != null;
            }
            if (isL2Active(opts)) {
                removed |= redisClient.del(fullKey) > 0;
            }
            log.debug(LOG_PREFIX + "[DEL] Key: {}, removed: {}", fullKey, removed);
            return removed;
        } catch (RuntimeException e) {
            log.error(LOG_PREFIX + "Delete failed for key '{}'.", fullKey, e);
            return false;
        }
    }

    @Override
    public boolean exists(String key) {
        return exists(key, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public boolean exists(String key, JLayerCacheOptions options) {
        JLayerCacheOptions opts = JLayerCacheOptions.orDefault(options);
        String fullKey = fullKey(key, opts);
        operations.increment();
        try {
            if (!opts.isSkipMemory() && l1Cache.getIfPresent(fullKey) != null) {
                return true;
            }
            return isL2Active(opts) && redisClient.exists(fullKey);
        } catch (RuntimeException e) {
            log.error(LOG_PREFIX + "Exists failed for key '{}'.", fullKey, e);
            return false;
        }
    }

    @Override
    public <T> List<T> mget(List<String> keys) {
        return mget(keys, JLayerCacheOptions.DEFAULT);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<T> mget(List<String> keys, JLayerCacheOptions options) {
        if (CollectionUtils.isEmpty(keys)) {
            return new ArrayList<>();
        }
        JLayerCacheOptions opts = JLayerCacheOptions.orDefault(options);
        long start = System.nanoTime();
        List<T> result = new ArrayList<>(Collections.nCopies(keys.size(), null));
        try {
            // 1. 先从 L1 取，记录未命中的位置 / L1 first, remember the misses
            Map<String, List<Integer>> missing = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                String fullKey = fullKey(keys.get(i), opts);
                L1Entry entry = opts.isSkipMemory() ? null : l1Cache.getIfPresent(fullKey);
                if (entry != null) {
                    l1Hits.increment();
                    hits.increment();
                    result.set(i, (T) entry.getValue());
                } else {
                    if (!opts.isSkipMemory()) {
                        l1Misses.increment();
                    }
                    missing.computeIfAbsent(fullKey, k -> new ArrayList<>()).add(i);
                }
            }
            if (missing.isEmpty()) {
                return result;
            }
            // 2. 只对缺失的 key 发起一次 L2 批量读取 / one L2 batch for the missing subset only
            Map<String, Object> fromL2 = isL2Active(opts) ? redisClient.mget(missing.keySet()) : Collections.emptyMap();
            missing.forEach((fullKey, positions) -> {
                Object value = fromL2.get(fullKey);
                if (value != null) {
                    l2Hits.add(positions.size());
                    hits.add(positions.size());
                    positions.forEach(i -> result.set(i, (T) value));
                    if (!opts.isSkipMemory()) {
                        putL1(fullKey, value, opts);
                    }
                } else {
                    if (isL2Active(opts)) {
                        l2Misses.add(positions.size());
                    }
                    misses.add(positions.size());
                }
            });
            return result;
        } catch (RuntimeException e) {
            log.error(LOG_PREFIX + "Batch get failed for {} keys.", keys.size(), e);
            return result;
        } finally {
            recordGet(start);
        }
    }

    @Override
    public boolean mset(Map<String, ?> entries) {
        return mset(entries, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public boolean mset(Map<String, ?> entries, JLayerCacheOptions options) {
        if (MapUtils.isEmpty(entries)) {
            return true;
        }
        JLayerCacheOptions opts = JLayerCacheOptions.orDefault(options);
        long start = System.nanoTime();
        Map<String, Object> fullEntries = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            if (value != null) {
                fullEntries.put(fullKey(key, opts), value);
            }
        });
        try {
            if (!opts.isSkipMemory()) {
                fullEntries.forEach((fullKey, value) -> putL1(fullKey, value, opts));
            }
            if (opts.isSkipRedis()) {
                return true;
            }
            if (!redisClient.isConnected()) {
                log.debug(LOG_PREFIX + "[DEGRADED] L2 unavailable, {} keys written to L1 only.", fullEntries.size());
                return true;
            }
            if (redisClient.mset(fullEntries, redisTtl(opts))) {
                l2Sets.add(fullEntries.size());
                return true;
            }
            return onL2WriteFailure(fullEntries.keySet());
        } catch (RuntimeException e) {
            l1Cache.invalidateAll(fullEntries.keySet());
            log.error(LOG_PREFIX + "Batch set failed for {} keys.", fullEntries.size(), e);
            return false;
        } finally {
            recordSet(start);
        }
    }

    // ==================================================================
    // ============ 失效 / Invalidation ==================================
    // ==================================================================

    @Override
    public long invalidate(InvalidationPattern pattern) {
        return invalidate(pattern, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public long invalidate(InvalidationPattern pattern, JLayerCacheOptions options) {
        if (pattern == null) {
            return 0L;
        }
        JLayerCacheOptions opts = JLayerCacheOptions.orDefault(options);
        String namespace = namespace(opts);
        operations.increment();
        try {
            long removed;
            switch (pattern.getType()) {
                case GLOB:
                    removed = invalidateGlob(namespace, pattern.getGlob(), opts);
                    break;
                case REGEX:
                    removed = invalidateMatching(namespace, opts, (key, value) -> pattern.getRegex().matcher(key).find(), false);
                    break;
                case PREDICATE:
                    removed = invalidateMatching(namespace, opts, pattern.getPredicate(), true);
                    break;
                default:
                    throw new IllegalStateException("Unknown pattern type: " + pattern.getType());
            }
            i18nLog.debug("invalidate.done", pattern, namespace, removed);
            return removed;
        } catch (RuntimeException e) {
            log.error(LOG_PREFIX + "Invalidation failed for pattern {}.", pattern, e);
            return 0L;
        }
    }

    @Override
    public long clear() {
        return clear(defaultNamespace);
    }

    @Override
    public long clear(String namespace) {
        long removed = invalidate(InvalidationPattern.glob("*"), JLayerCacheOptions.namespace(namespace));
        i18nLog.info("cache.cleared", StringUtils.defaultIfBlank(namespace, defaultNamespace), removed);
        return removed;
    }

    /**
     * 通配符：L1 转为正则匹配，L2 交给 SCAN MATCH；不含通配符时直接按 key 删除。
     * <p>
     * Glob: matched as a regex on L1 and handed to SCAN MATCH on L2; a glob without wildcards is a plain delete.
     */
    private long invalidateGlob(String namespace, String glob, JLayerCacheOptions opts) {
        String fullPattern = JLayerCacheHelper.withNamespace(namespace, glob);
        if (!JLayerCacheHelper.isWildcard(glob)) {
            long removed = 0L;
            if (!opts.isSkipMemory() && l1Cache.asMap().remove(fullPattern) != null) {
                removed++;
            }
            if (isL2Active(opts)) {
                removed += redisClient.del(fullPattern);
            }
            return removed;
        }
        long removed = 0L;
        if (!opts.isSkipMemory()) {
            Pattern regex = JLayerCacheHelper.globToRegex(fullPattern);
            removed += removeFromL1(key -> regex.matcher(key).matches());
        }
        if (isL2Active(opts)) {
            removed += redisClient.flushPattern(fullPattern);
        }
        return removed;
    }

    /**
     * 正则与断言：作用于去掉命名空间后的业务 key。L2 侧先列出命名空间下的所有 key 再过滤，
     * 断言模式还需要分批读回每一个值。
     * <p>
     * Regex and predicate: applied to the logical key. On L2 every key of the namespace is listed and
     * filtered; the predicate form also reads back every value in chunks.
     */
    private long invalidateMatching(String namespace, JLayerCacheOptions opts,
                                    BiPredicate<String, Object> matcher, boolean needsValue) {
        long removed = 0L;
        if (!opts.isSkipMemory()) {
            List<String> matched = new ArrayList<>();
            l1Cache.asMap().forEach((fullKey, entry) -> {
                String key = JLayerCacheHelper.stripNamespace(namespace, fullKey);
                if (key != null && matcher.test(key, entry.getValue())) {
                    matched.add(fullKey);
                }
            });
            removed += matched.stream().filter(k -> l1Cache.asMap().remove(k) != null).count();
        }
        if (!isL2Active(opts)) {
            return removed;
        }
        List<String> candidates = redisClient.keys(JLayerCacheHelper.withNamespace(namespace, "*"));
        if (needsValue) {
            i18nLog.warn("invalidate.predicate_scan", namespace, candidates.size());
        }
        List<String> doomed = new ArrayList<>();
        for (List<String> chunk : ListUtils.partition(candidates, scanCount)) {
            Map<String, Object> values = needsValue ? redisClient.mget(chunk) : Collections.emptyMap();
            for (String fullKey : chunk) {
                String key = JLayerCacheHelper.stripNamespace(namespace, fullKey);
                if (key == null) {
                    continue;
                }
                if (needsValue && !values.containsKey(fullKey)) {
                    continue;
                }
                if (matcher.test(key, values.get(fullKey))) {
                    doomed.add(fullKey);
                }
            }
        }
        for (List<String> chunk : ListUtils.partition(doomed, scanCount)) {
            removed += redisClient.del(chunk);
        }
        return removed;
    }

    private long removeFromL1(Predicate<String> keyMatcher) {
        List<String> matched = new ArrayList<>();
        for (String fullKey : l1Cache.asMap().keySet()) {
            if (keyMatcher.test(fullKey)) {
                matched.add(fullKey);
            }
        }
        return matched.stream().filter(k -> l1Cache.asMap().remove(k) != null).count();
    }

    // ==================================================================
    // ============ 读写模式 / Caching Patterns ===========================
    // ==================================================================

    @Override
    public <T> T getOrSet(String key, Supplier<T> fetcher) {
        return getOrSet(key, fetcher, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public <T> T getOrSet(String key, Supplier<T> fetcher, JLayerCacheOptions options) {
        T cached = get(key, options);
        return cached != null ? cached : fetchAndStore(key, fetcher, options);
    }

    @Override
    public <T> T getOrSet(String key, Class<T> type, Supplier<T> fetcher) {
        return getOrSet(key, type, fetcher, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public <T> T getOrSet(String key, Class<T> type, Supplier<T> fetcher, JLayerCacheOptions options) {
        T cached = get(key, type, options);
        return cached != null ? cached : fetchAndStore(key, fetcher, options);
    }

    private <T> T fetchAndStore(String key, Supplier<T> fetcher, JLayerCacheOptions options) {
        T value = fetcher.get();
        if (value != null) {
            set(key, value, options);
        }
        return value;
    }

    @Override
    public <T> boolean setThrough(String key, T value, CacheWriter<T> writer, JLayerCacheOptions options) {
        try {
            writer.write(value);
        } catch (Exception e) {
            log.error(LOG_PREFIX + "[WRITE-THROUGH] Writer failed for key '{}', cache left untouched.", key, e);
            return false;
        }
        return set(key, value, options);
    }

    @Override
    public <T> CompletableFuture<Boolean> setBehind(String key, T value, CacheWriter<T> writer, JLayerCacheOptions options) {
        set(key, value, options);
        return CompletableFuture.runAsync(() -> {
            try {
                writer.write(value);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, asyncExecutor).handle((ignored, error) -> {
            if (error == null) {
                return true;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.error(LOG_PREFIX + "[WRITE-BEHIND] Background write failed for key '{}', evicting the entry.", key, cause);
            del(key, options);
            return false;
        });
    }

    // ==================================================================
    // ============ 监控 / Monitoring ====================================
    // ==================================================================

    @Override
    public JLayerCacheStats getStats() {
        long gets = getCount.sum();
        long sets = setCount.sum();
        return JLayerCacheStats.builder()
                .l1(JLayerCacheStats.TierStats.builder()
                        .hits(l1Hits.sum())
                        .misses(l1Misses.sum())
                        .sets(l1Sets.sum())
                        .size(l1Cache.estimatedSize())
                        .maxSize(memoryMaxSize)
                        .build())
                .l2(JLayerCacheStats.TierStats.builder()
                        .hits(l2Hits.sum())
                        .misses(l2Misses.sum())
                        .sets(l2Sets.sum())
                        .connected(redisClient.isConnected())
                        .build())
                .avgGetTime(gets == 0 ? 0.0 : getNanos.sum() / 1_000_000.0 / gets)
                .avgSetTime(sets == 0 ? 0.0 : setNanos.sum() / 1_000_000.0 / sets)
                .totalOperations(operations.sum())
                .hits(hits.sum())
                .misses(misses.sum())
                .build();
    }

    @Override
    public void resetStats() {
        List.of(l1Hits, l1Misses, l1Sets, l2Hits, l2Misses, l2Sets, hits, misses,
                getCount, getNanos, setCount, setNanos, operations).forEach(LongAdder::reset);
        redisClient.resetMetrics();
    }

    @Override
    public HealthStatus healthCheck() {
        boolean l1Healthy;
        try {
            String probeKey = JLayerCacheHelper.withNamespace(defaultNamespace, JLayerCacheConstants.HEALTH_PROBE_KEY);
            Object probe = Boolean.TRUE;
            l1Cache.put(probeKey, new L1Entry(probe, Duration.ofSeconds(1).toNanos()));
            L1Entry read = l1Cache.getIfPresent(probeKey);
            l1Cache.invalidate(probeKey);
            l1Healthy = read != null && probe.equals(read.getValue());
        } catch (RuntimeException e) {
            log.error(LOG_PREFIX + "L1 health probe failed.", e);
            l1Healthy = false;
        }
        boolean l2Connected = redisClient.ping();
        return HealthStatus.builder()
                .healthy(l1Healthy && l2Connected)
                .l1Healthy(l1Healthy)
                .l1Size(l1Cache.estimatedSize())
                .l2Healthy(l2Connected)
                .l2Connected(l2Connected)
                .build();
    }

    @Override
    public void close() {
        long size = l1Cache.estimatedSize();
        l1Cache.invalidateAll();
        l1Cache.cleanUp();
        i18nLog.info("cache.closed", size);
    }

    // ==================================================================
    // ============ 内部方法 / Internal ===================================
    // ==================================================================

    private boolean onL2WriteFailure(Collection<String> fullKeys) {
        if (!redisClient.isConnected()) {
            // 写入过程中断连，保留 L1，视为降级成功 / lost the connection mid-write, keep L1 as a degraded success
            log.debug(LOG_PREFIX + "[DEGRADED] L2 went away during write of {} keys.", fullKeys.size());
            return true;
        }
        l1Cache.invalidateAll(fullKeys);
        log.warn(LOG_PREFIX + "L2 write failed for {} keys, L1 entries dropped.", fullKeys.size());
        return false;
    }

    /**
     * L2 命中回填时同样使用 {@code memory.ttl}（或本次调用的 TTL），不读取 L2 剩余 TTL，
     * 因此回填的条目最多比 L2 多存活一个 {@code memory.ttl}。
     * <p>
     * A back-fill from an L2 hit also uses {@code memory.ttl} (or the per-call TTL) without reading the remaining
     * L2 TTL, so a back-filled entry may outlive its L2 copy by up to {@code memory.ttl}.
     */
    private void putL1(String fullKey, Object value, JLayerCacheOptions opts) {
        Duration ttl = opts.getTtl() != null && !opts.getTtl().isNegative() && !opts.getTtl().isZero()
                ? opts.getTtl() : memoryTtl;
        l1Cache.put(fullKey, new L1Entry(value, ttl.toNanos()));
        l1Sets.increment();
    }

    private Duration redisTtl(JLayerCacheOptions opts) {
        return opts.getTtl() != null ? opts.getTtl() : redisTtl;
    }

    private boolean isL2Active(JLayerCacheOptions opts) {
        return !opts.isSkipRedis() && redisClient.isConnected();
    }

    private String namespace(JLayerCacheOptions opts) {
        return StringUtils.defaultIfBlank(opts.getNamespace(), defaultNamespace);
    }

    private String fullKey(String key, JLayerCacheOptions opts) {
        return JLayerCacheHelper.withNamespace(namespace(opts), key);
    }

    private void recordGet(long startNanos) {
        getCount.increment();
        getNanos.add(System.nanoTime() - startNanos);
        operations.increment();
    }

    private void recordSet(long startNanos) {
        setCount.increment();
        setNanos.add(System.nanoTime() - startNanos);
        operations.increment();
    }
}
