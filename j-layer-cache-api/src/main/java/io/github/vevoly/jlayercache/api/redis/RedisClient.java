package io.github.vevoly.jlayercache.api.redis;

import io.github.vevoly.jlayercache.api.exception.ConnectivityException;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 多级缓存框架对 Redis 操作的统一客户端接口。
 * <p>
 * 所有值在写入时序列化为 JSON，读取时反序列化；反序列化失败视为未命中。
 * Redis 不可达时，读取、删除、存在性判断降级为空 / false / 0，只有计数器操作和 {@link #connect()} 会抛出异常。
 * <p>
 * Uniform client over the Redis operations the framework needs. Values are serialized to JSON on write
 * and deserialized on read; a value that cannot be decoded is a miss. While Redis is unreachable reads,
 * deletes and existence checks degrade to empty / false / 0; only counters and {@link #connect()} throw.
 *
 * @author vevoly
 */
public interface RedisClient {

    // ===================================================================
    // ============ 连接 / Connection =====================================
    // ===================================================================

    /**
     * 当前是否认为 Redis 可用。断开期间会按间隔自动重新探测。
     * <p>
     * Whether Redis is currently considered reachable. While disconnected, a probe is retried periodically.
     */
    boolean isConnected();

    /**
     * 显式建立 / 校验连接。
     * <p>
     * Explicitly verifies the connection.
     *
     * @throws ConnectivityException Redis 不可达 / Redis is unreachable
     */
    void connect();

    /**
     * 探测一次 Redis，并据此更新连接状态。
     * <p>
     * Probes Redis once and updates the connection state accordingly.
     *
     * @return {@code true} 可达 / reachable
     */
    boolean ping();

    // ===================================================================
    // ============ 通用 Key 操作 / Common Key Operations =================
    // ===================================================================

    /**
     * 检查给定的 key 是否存在。
     * <p>
     * Checks if a given key exists.
     */
    boolean exists(String key);

    /**
     * 删除一个或多个 key，返回实际删除的数量。
     * <p>
     * Deletes one or more keys and returns how many were removed.
     */
    long del(String... keys);

    /**
     * 删除一个 key 集合，返回实际删除的数量。
     * <p>
     * Deletes a collection of keys and returns how many were removed.
     */
    long del(Collection<String> keys);

    /**
     * 设置 key 的过期时间。
     * <p>
     * Sets a timeout on a key.
     */
    boolean expire(String key, Duration ttl);

    /**
     * 剩余存活时间（秒）。-1 表示永不过期，-2 表示 key 不存在或查询失败。
     * <p>
     * Remaining time to live in seconds. -1 means no expiry, -2 means missing key or failure.
     */
    long ttl(String key);

    /**
     * 通过 SCAN 游标分页遍历匹配的 key，不会发出一次性的 KEYS 命令。
     * <p>
     * Lists matching keys by paging through the keyspace with a SCAN cursor, never a single KEYS call.
     *
     * @param pattern Redis glob 模式 / Redis glob pattern
     */
    List<String> keys(String pattern);

    /**
     * 扫描匹配的 key 并批量删除。
     * <p>
     * Scans the matching keys and deletes them in batches.
     *
     * @return 删除的数量 / number of keys removed
     */
    long flushPattern(String pattern);

    // ===================================================================
    // ======== String / Object 操作 / String or Object Operations ========
    // ===================================================================

    /**
     * 读取并反序列化一个值；不存在、解码失败或 Redis 不可达时返回 null。
     * <p>
     * Reads and decodes a value; {@code null} when missing, undecodable or Redis is unreachable.
     */
    Object get(String key);

    /**
     * 读取并转换为指定类型。
     * <p>
     * Reads a value and converts it to the given type.
     */
    <T> T get(String key, Class<T> type);

    /**
     * 写入一个值。ttl 为 null 时使用客户端默认 TTL。
     * <p>
     * Writes a value. A {@code null} ttl falls back to the client default TTL.
     */
    boolean set(String key, Object value, Duration ttl);

    /**
     * 原子的条件写入 (SET NX)。
     * <p>
     * Atomic conditional insert (SET NX).
     *
     * @return {@code true} 写入成功 / the value was inserted
     */
    boolean setIfAbsent(String key, Object value, Duration ttl);

    /**
     * 一次往返批量读取，结果中只包含存在且可解码的 key。
     * <p>
     * Reads many keys in one round trip; only present and decodable keys appear in the result.
     */
    Map<String, Object> mget(Collection<String> keys);

    /**
     * 批量写入。非原子操作，部分失败时返回 false。
     * <p>
     * Writes many keys in one batch. Not atomic; a partial failure yields {@code false}.
     */
    boolean mset(Map<String, ?> entries, Duration ttl);

    // ===================================================================
    // ======== 计数器 / Counters =========================================
    // ===================================================================

    /**
     * 原子自增。Redis 不可达时抛出异常，避免静默返回 0 破坏计数。
     * <p>
     * Atomic increment. Throws while Redis is unreachable instead of silently returning 0.
     *
     * @throws ConnectivityException Redis 不可达 / Redis is unreachable
     */
    long increment(String key, long delta);

    /**
     * 原子自减。
     * <p>
     * Atomic decrement.
     *
     * @throws ConnectivityException Redis 不可达 / Redis is unreachable
     */
    long decrement(String key, long delta);

    // ===================================================================
    // ======== Hash 操作 / Hash Operations ================================
    // ===================================================================

    Object hget(String key, String field);

    boolean hset(String key, String field, Object value);

    Map<String, Object> hgetAll(String key);

    long hdel(String key, String... fields);

    // ===================================================================
    // ======== List 操作 / List Operations ================================
    // ===================================================================

    long lpush(String key, Object... values);

    long rpush(String key, Object... values);

    Object lpop(String key);

    Object rpop(String key);

    List<Object> lrange(String key, int start, int stop);

    // ===================================================================
    // ======== Set 操作 / Set Operations ==================================
    // ===================================================================

    long sadd(String key, Object... members);

    Set<Object> smembers(String key);

    boolean sismember(String key, Object member);

    long srem(String key, Object... members);

    // ===================================================================
    // ======== 发布订阅 / Pub-Sub =========================================
    // ===================================================================

    /**
     * 发布消息，返回收到消息的订阅者数量。
     * <p>
     * Publishes a message and returns the number of receivers.
     */
    long publish(String channel, Object message);

    /**
     * 订阅频道，返回监听器 id，用于取消订阅。
     * <p>
     * Subscribes to a channel and returns the listener id used to unsubscribe. Returns -1 on failure.
     */
    int subscribe(String channel, Consumer<Object> listener);

    void unsubscribe(String channel, int listenerId);

    // ===================================================================
    // ======== 统计 / Metrics =============================================
    // ===================================================================

    RedisClientMetrics getMetrics();

    void resetMetrics();
}
