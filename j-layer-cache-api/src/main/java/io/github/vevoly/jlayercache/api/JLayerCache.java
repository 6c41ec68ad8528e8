package io.github.vevoly.jlayercache.api;

import io.github.vevoly.jlayercache.api.structure.HealthStatus;
import io.github.vevoly.jlayercache.api.structure.InvalidationPattern;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheOptions;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheStats;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 两级缓存的核心接口：L1 本地缓存 (Caffeine) 在前，L2 远程缓存 (Redis) 在后。
 * <p>
 * 读路径的所有内部故障都被吞掉并视为未命中，写路径返回布尔值，调用方总能回退到业务数据源。
 * 所有 key 都是业务 key，框架会在前面加上命名空间。
 * <p>
 * Core two-tier cache contract: an L1 memory tier (Caffeine) in front of an L2 remote tier (Redis).
 * Internal faults on the read path are swallowed and reported as a miss; the write path reports a boolean,
 * so a caller can always fall back to the system of record. Every key is a logical key; the framework
 * prefixes it with the namespace.
 *
 * @author vevoly
 */
public interface JLayerCache extends AutoCloseable {

    // ==================================================================
    // ============ 基本读写 / Basic Read & Write =========================
    // ==================================================================

    /**
     * 先查 L1，未命中再查 L2，L2 命中后回填 L1。
     * <p>
     * Probes L1, then L2; an L2 hit back-fills L1.
     * <p>
     * 不指定类型时，L2 中的值按 JSON 记录的类型还原，类型不在受信任包中时得到 Map / List；需要业务类型时使用
     * {@link #get(String, Class)}。
     * <p>
     * Without a type, an L2 value is restored from its recorded class only when that class is trusted, otherwise
     * it comes back as Map / List; use {@link #get(String, Class)} for application types.
     *
     * @return 缓存值，未命中返回 null / the cached value, or {@code null} on a miss
     */
    <T> T get(String key);

    <T> T get(String key, JLayerCacheOptions options);

    /**
     * 按指定类型读取。L2 中的 JSON 会先转换为 {@code type} 再回填 L1，因此即使值的类型不在
     * {@code serialization.trusted-packages} 中，也能拿回原来的类型；无法转换时视为未命中。
     * <p>
     * Typed read. JSON from L2 is converted into {@code type} before it is back-filled into L1, so the stored
     * type comes back even when it is outside {@code serialization.trusted-packages}. A value that cannot be
     * converted is a miss.
     */
    <T> T get(String key, Class<T> type);

    <T> T get(String key, Class<T> type, JLayerCacheOptions options);

    /**
     * 同时写入 L1 和 L2。L2 可用时以 L2 写入结果为准；L2 不可用时只写 L1，视为降级成功。
     * <p>
     * Writes both tiers. When L2 is active its result decides success; during an L2 outage
     * an L1-only write is a degraded success.
     */
    boolean set(String key, Object value);

    boolean set(String key, Object value, JLayerCacheOptions options);

    /**
     * 从两级缓存中删除。
     * <p>
     * Removes the key from both tiers.
     *
     * @return 任意一级确实删除了数据 / {@code true} if either tier removed an entry
     */
    boolean del(String key);

    boolean del(String key, JLayerCacheOptions options);

    boolean exists(String key);

    boolean exists(String key, JLayerCacheOptions options);

    /**
     * 批量读取。只有 L1 未命中的 key 会在一次 L2 往返中读取，并回填到 L1。
     * <p>
     * Batch read. Only the keys missing from L1 are fetched from L2, in one round trip, and back-filled.
     *
     * @return 与入参顺序一致的值列表，未命中位置为 null / values aligned with {@code keys}, {@code null} for misses
     */
    <T> List<T> mget(List<String> keys);

    <T> List<T> mget(List<String> keys, JLayerCacheOptions options);

    /**
     * 批量写入。L1 逐条写入，L2 一次批量写入；结果为整体成功与否。
     * <p>
     * Batch write. L1 entries are written one by one, L2 in one batch; the result is an aggregate.
     */
    boolean mset(Map<String, ?> entries);

    boolean mset(Map<String, ?> entries, JLayerCacheOptions options);

    // ==================================================================
    // ============ 失效 / Invalidation ==================================
    // ==================================================================

    /**
     * 按模式失效两级缓存。
     * <p>
     * Invalidates both tiers by pattern.
     *
     * @return 两级缓存合计删除的条目数 / total entries removed across both tiers
     */
    long invalidate(InvalidationPattern pattern);

    long invalidate(InvalidationPattern pattern, JLayerCacheOptions options);

    /**
     * 清空默认命名空间。
     * <p>
     * Clears the default namespace.
     */
    long clear();

    long clear(String namespace);

    // ==================================================================
    // ============ 读写模式 / Caching Patterns ===========================
    // ==================================================================

    /**
     * Cache-aside：命中直接返回，否则调用 fetcher 并写入缓存。不做并发合并，同一 key 的并发未命中可能各自回源。
     * fetcher 抛出的异常会原样传给调用方。
     * <p>
     * Cache-aside: returns the cached value, or calls {@code fetcher} and stores the result.
     * No single-flight: concurrent misses for one key may each call the fetcher.
     * Exceptions thrown by the fetcher reach the caller unchanged.
     */
    <T> T getOrSet(String key, Supplier<T> fetcher);

    <T> T getOrSet(String key, Supplier<T> fetcher, JLayerCacheOptions options);

    /**
     * 带类型的 cache-aside，读取规则同 {@link #get(String, Class)}。
     * <p>
     * Typed cache-aside; reads follow {@link #get(String, Class)}.
     */
    <T> T getOrSet(String key, Class<T> type, Supplier<T> fetcher);

    <T> T getOrSet(String key, Class<T> type, Supplier<T> fetcher, JLayerCacheOptions options);

    /**
     * Write-through：先写业务数据源，成功后才更新缓存；writer 失败时缓存保持不变。
     * <p>
     * Write-through: writes the system of record first and updates the cache only on success;
     * a failing writer leaves the cache untouched.
     *
     * @return 数据源与缓存都写入成功 / {@code true} if both the writer and the cache write succeeded
     */
    <T> boolean setThrough(String key, T value, CacheWriter<T> writer, JLayerCacheOptions options);

    /**
     * Write-behind：立即更新缓存，异步写入业务数据源；异步写入失败时驱逐该缓存项。
     * <p>
     * Write-behind: updates the cache now and writes the system of record asynchronously;
     * the entry is evicted if that background write fails.
     *
     * @return 后台写入的结果，失败时为 false / completes with the background write outcome
     */
    <T> CompletableFuture<Boolean> setBehind(String key, T value, CacheWriter<T> writer, JLayerCacheOptions options);

    // ==================================================================
    // ============ 监控 / Monitoring ====================================
    // ==================================================================

    JLayerCacheStats getStats();

    void resetStats();

    HealthStatus healthCheck();

    /**
     * 释放 L1 中的数据。Redis 连接由容器管理。
     * <p>
     * Releases the L1 entries. The Redis connection is owned by the container.
     */
    @Override
    void close();
}
