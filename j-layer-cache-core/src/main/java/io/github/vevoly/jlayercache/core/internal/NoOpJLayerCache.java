package io.github.vevoly.jlayercache.core.internal;

import io.github.vevoly.jlayercache.api.CacheWriter;
import io.github.vevoly.jlayercache.api.JLayerCache;
import io.github.vevoly.jlayercache.api.JLayerCacheManager;
import io.github.vevoly.jlayercache.api.structure.*;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 降级实现类（当未启用框架时使用）。
 * 所有读取直接回源，写入只调用业务 writer，不经过 Redis 或 Caffeine。
 * <p>
 * Fallback used when the framework is not enabled. Reads go straight to the system of record and writes only
 * call the writer; neither Redis nor Caffeine is touched.
 *
 * @author vevoly
 */
@Slf4j
public class NoOpJLayerCache implements JLayerCache, JLayerCacheManager {

    private static final String LOG_PREFIX = "[JLayerCache-NoOp] ";

    private static final JLayerCacheStats EMPTY_STATS = JLayerCacheStats.builder()
            .l1(JLayerCacheStats.TierStats.builder().build())
            .l2(JLayerCacheStats.TierStats.builder().build())
            .build();

    public NoOpJLayerCache() {
        log.warn(LOG_PREFIX + "框架未启用 (@EnableJLayerCache 缺失)，缓存功能已降级为直连数据源模式。");
    }

    @Override
    public <T> T get(String key) {
        return null;
    }

    @Override
    public <T> T get(String key, JLayerCacheOptions options) {
        return null;
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        return null;
    }

    @Override
    public <T> T get(String key, Class<T> type, JLayerCacheOptions options) {
        return null;
    }

    @Override
    public boolean set(String key, Object value) {
        return false;
    }

    @Override
    public boolean set(String key, Object value, JLayerCacheOptions options) {
        return false;
    }

    @Override
    public boolean del(String key) {
        return false;
    }

    @Override
    public boolean del(String key, JLayerCacheOptions options) {
        return false;
    }

    @Override
    public boolean exists(String key) {
        return false;
    }

    @Override
    public boolean exists(String key, JLayerCacheOptions options) {
        return false;
    }

    @Override
    public <T> List<T> mget(List<String> keys) {
        return mget(keys, JLayerCacheOptions.DEFAULT);
    }

    @Override
    public <T> List<T> mget(List<String> keys, JLayerCacheOptions options) {
        return keys == null ? new ArrayList<>() : new ArrayList<>(Collections.nCopies(keys.size(), null));
    }

    @Override
    public boolean mset(Map<String, ?> entries) {
        return false;
    }

    @Override
    public boolean mset(Map<String, ?> entries, JLayerCacheOptions options) {
        return false;
    }

    @Override
    public long invalidate(InvalidationPattern pattern) {
        return 0L;
    }

    @Override
    public long invalidate(InvalidationPattern pattern, JLayerCacheOptions options) {
        return 0L;
    }

    @Override
    public long clear() {
        return 0L;
    }

    @Override
    public long clear(String namespace) {
        return 0L;
    }

    @Override
    public <T> T getOrSet(String key, Supplier<T> fetcher) {
        return fetcher != null ? fetcher.get() : null;
    }

    @Override
    public <T> T getOrSet(String key, Supplier<T> fetcher, JLayerCacheOptions options) {
        return getOrSet(key, fetcher);
    }

    @Override
    public <T> T getOrSet(String key, Class<T> type, Supplier<T> fetcher) {
        return getOrSet(key, fetcher);
    }

    @Override
    public <T> T getOrSet(String key, Class<T> type, Supplier<T> fetcher, JLayerCacheOptions options) {
        return getOrSet(key, fetcher);
    }

    @Override
    public <T> boolean setThrough(String key, T value, CacheWriter<T> writer, JLayerCacheOptions options) {
        try {
            writer.write(value);
            return true;
        } catch (Exception e) {
            log.error(LOG_PREFIX + "Writer failed for key '{}'.", key, e);
            return false;
        }
    }

    @Override
    public <T> CompletableFuture<Boolean> setBehind(String key, T value, CacheWriter<T> writer, JLayerCacheOptions options) {
        // 没有缓存可以先行更新，直接同步写入 / no cache to update first, write synchronously
        return CompletableFuture.completedFuture(setThrough(key, value, writer, options));
    }

    @Override
    public boolean setWithTags(String key, Object value, Collection<String> tags, JLayerCacheOptions options) {
        return false;
    }

    @Override
    public long invalidateByTag(String tag) {
        return 0L;
    }

    @Override
    public long handleDataChange(DataChangeEvent event) {
        return 0L;
    }

    @Override
    public WarmupResult warmupCache() {
        return WarmupResult.builder().build();
    }

    @Override
    public Set<String> getTaggedKeys(String tag) {
        return Collections.emptySet();
    }

    @Override
    public JLayerCacheStats getStats() {
        return EMPTY_STATS;
    }

    @Override
    public void resetStats() {
    }

    @Override
    public HealthStatus healthCheck() {
        return HealthStatus.builder().build();
    }

    @Override
    public double getHitRate() {
        return 0.0;
    }

    @Override
    public double getAverageResponseTime() {
        return 0.0;
    }

    @Override
    public List<String> analyze() {
        return Collections.emptyList();
    }

    @Override
    public JLayerCache getCache() {
        return this;
    }

    @Override
    public void close() {
    }
}
