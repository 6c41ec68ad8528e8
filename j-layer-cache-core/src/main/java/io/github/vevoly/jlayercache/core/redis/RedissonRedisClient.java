package io.github.vevoly.jlayercache.core.redis;

import io.github.vevoly.jlayercache.api.exception.ConnectivityException;
import io.github.vevoly.jlayercache.api.exception.JLayerCacheException;
import io.github.vevoly.jlayercache.api.exception.SerializationException;
import io.github.vevoly.jlayercache.api.redis.RedisClient;
import io.github.vevoly.jlayercache.api.redis.RedisClientMetrics;
import io.github.vevoly.jlayercache.core.codec.JsonValueCodec;
import io.github.vevoly.jlayercache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.redisson.api.*;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisTimeoutException;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link RedisClient} 接口基于 Redisson 的实现。
 * <p>
 * 所有数据以 {@link StringCodec} 存储为 JSON 字符串。每个命令都受 Redisson 的命令超时约束，
 * 超时或连接失败会把客户端标记为断开，之后按 {@code reconnectInterval} 间隔重新探测。
 * <p>
 * An implementation of the {@link RedisClient} interface based on Redisson. Values are stored as JSON
 * strings through {@link StringCodec}. Every command is bounded by the Redisson command timeout; a timeout
 * or connection failure marks the client as disconnected and a probe is retried every {@code reconnectInterval}.
 *
 * @author vevoly
 */
@Slf4j
public class RedissonRedisClient implements RedisClient {

    private static final String LOG_PREFIX = "[JLayerCache-Redis] ";

    private final RedissonClient redisson;
    private final JsonValueCodec codec;
    private final Duration defaultTtl;
    private final int scanCount;
    private final long reconnectIntervalNanos;

    private final RedisOperationMetrics metrics = new RedisOperationMetrics();
    private final AtomicBoolean connected = new AtomicBoolean(true);
    private final AtomicLong lastProbeNanos = new AtomicLong(System.nanoTime());

    private final I18nLogger i18nLog = new I18nLogger(log);

    public RedissonRedisClient(RedissonClient redisson, JsonValueCodec codec, Duration defaultTtl,
                               int scanCount, Duration reconnectInterval) {
        this.redisson = redisson;
        this.codec = codec;
        this.defaultTtl = defaultTtl;
        this.scanCount = scanCount;
        this.reconnectIntervalNanos = reconnectInterval.toNanos();
    }

    // ==================================================================
    // ============ 连接 / Connection =====================================
    // ==================================================================

    @Override
    public boolean isConnected() {
        if (connected.get()) {
            return true;
        }
        long now = System.nanoTime();
        long last = lastProbeNanos.get();
        // 同一时刻只允许一个线程发起探测 / only one thread probes at a time
        if (now - last >= reconnectIntervalNanos && lastProbeNanos.compareAndSet(last, now)) {
            return ping();
        }
        return false;
    }

    @Override
    public void connect() {
        long start = System.nanoTime();
        try {
            redisson.getKeys().count();
            markConnected();
        } catch (RuntimeException e) {
            handleFailure("CONNECT", null, e);
            throw new ConnectivityException(LOG_PREFIX + "Redis is unreachable.", e);
        } finally {
            metrics.record(start);
        }
    }

    @Override
    public boolean ping() {
        return execute("PING", null, () -> {
            redisson.getKeys().count();
            return true;
        }, false);
    }

    // ==================================================================
    // ============ 通用 Key 操作 / Common Key Operations =================
    // ==================================================================

    @Override
    public boolean exists(String key) {
        return execute("EXISTS", key, () -> redisson.getKeys().countExists(key) > 0, false);
    }

    @Override
    public long del(String... keys) {
        if (ArrayUtils.isEmpty(keys)) {
            return 0L;
        }
        return execute("DEL", keys[0], () -> {
            long removed = redisson.getKeys().delete(keys);
            metrics.delete(removed);
            return removed;
        }, 0L);
    }

    @Override
    public long del(Collection<String> keys) {
        if (CollectionUtils.isEmpty(keys)) {
            return 0L;
        }
        return del(keys.toArray(new String[0]));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return false;
        }
        return execute("EXPIRE", key,
                () -> redisson.getKeys().expire(key, ttl.toMillis(), TimeUnit.MILLISECONDS), false);
    }

    @Override
    public long ttl(String key) {
        return execute("TTL", key, () -> {
            long millis = bucket(key).remainTimeToLive();
            return millis < 0 ? millis : TimeUnit.MILLISECONDS.toSeconds(millis);
        }, -2L);
    }

    @Override
    public List<String> keys(String pattern) {
        return execute("SCAN", pattern, () -> {
            List<String> result = new ArrayList<>();
            // getKeysByPattern 内部使用 SCAN 游标分页 / backed by a paged SCAN cursor
            for (String key : redisson.getKeys().getKeysByPattern(pattern, scanCount)) {
                result.add(key);
            }
            return result;
        }, Collections.emptyList());
    }

    @Override
    public long flushPattern(String pattern) {
        List<String> keys = keys(pattern);
        if (keys.isEmpty()) {
            return 0L;
        }
        long removed = 0L;
        for (List<String> chunk : ListUtils.partition(keys, scanCount)) {
            removed += del(chunk);
        }
        log.debug(LOG_PREFIX + "Flushed {} keys matching '{}'.", removed, pattern);
        return removed;
    }

    // ==================================================================
    // ======== String / Object 操作 / String or Object Operations ========
    // ==================================================================

    @Override
    public Object get(String key) {
        String raw = execute("GET", key, () -> bucket(key).get(), null);
        return decodeRead(key, raw);
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        Object value = get(key);
        try {
            return codec.convert(value, type);
        } catch (SerializationException e) {
            log.warn(LOG_PREFIX + "Value under key '{}' is not a {}, treated as a miss.", key, type.getSimpleName());
            return null;
        }
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        if (value == null) {
            // null 值视作删除 / a null value is a delete
            del(key);
            return true;
        }
        String json = encodeWrite(key, value);
        if (json == null) {
            return false;
        }
        Duration effective = effectiveTtl(ttl);
        return execute("SET", key, () -> {
            RBucket<String> bucket = bucket(key);
            if (effective != null) {
                bucket.set(json, effective);
            } else {
                bucket.set(json);
            }
            metrics.set(1);
            return true;
        }, false);
    }

    @Override
    public boolean setIfAbsent(String key, Object value, Duration ttl) {
        String json = value == null ? null : encodeWrite(key, value);
        if (json == null) {
            return false;
        }
        Duration effective = effectiveTtl(ttl);
        return execute("SETNX", key, () -> {
            RBucket<String> bucket = bucket(key);
            boolean inserted = effective != null ? bucket.setIfAbsent(json, effective) : bucket.setIfAbsent(json);
            if (inserted) {
                metrics.set(1);
            }
            return inserted;
        }, false);
    }

    @Override
    public Map<String, Object> mget(Collection<String> keys) {
        if (CollectionUtils.isEmpty(keys)) {
            return Collections.emptyMap();
        }
        String[] keyArray = keys.toArray(new String[0]);
        Map<String, String> raw = execute("MGET", keyArray[0],
                () -> redisson.getBuckets(StringCodec.INSTANCE).<String>get(keyArray), Collections.emptyMap());
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keyArray) {
            Object value = decodeRead(key, raw.get(key));
            if (value != null) {
                result.put(key, value);
            }
        }
        return result;
    }

    @Override
    public boolean mset(Map<String, ?> entries, Duration ttl) {
        if (MapUtils.isEmpty(entries)) {
            return true;
        }
        boolean allEncoded = true;
        Map<String, String> encoded = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : entries.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            String json = encodeWrite(entry.getKey(), entry.getValue());
            if (json == null) {
                allEncoded = false;
            } else {
                encoded.put(entry.getKey(), json);
            }
        }
        if (encoded.isEmpty()) {
            return allEncoded;
        }
        Duration effective = effectiveTtl(ttl);
        boolean written = execute("MSET", encoded.keySet().iterator().next(), () -> {
            RBatch batch = redisson.createBatch(BatchOptions.defaults());
            encoded.forEach((key, json) -> {
                RBucketAsync<String> bucket = batch.getBucket(key, StringCodec.INSTANCE);
                if (effective != null) {
                    bucket.setAsync(json, effective);
                } else {
                    bucket.setAsync(json);
                }
            });
            batch.execute();
            metrics.set(encoded.size());
            return true;
        }, false);
        return written && allEncoded;
    }

    // ==================================================================
    // ======== 计数器 / Counters =========================================
    // ==================================================================

    @Override
    public long increment(String key, long delta) {
        return counter("INCRBY", key, delta);
    }

    @Override
    public long decrement(String key, long delta) {
        return counter("DECRBY", key, -delta);
    }

    private long counter(String operation, String key, long delta) {
        long start = System.nanoTime();
        try {
            long value = redisson.getAtomicLong(key).addAndGet(delta);
            markConnected();
            return value;
        } catch (RuntimeException e) {
            handleFailure(operation, key, e);
            if (isConnectivityFailure(e)) {
                throw new ConnectivityException(LOG_PREFIX + operation + " failed for key '" + key + "', Redis is unreachable.", e);
            }
            throw new JLayerCacheException(LOG_PREFIX + operation + " failed for key '" + key + "'.", e);
        } finally {
            metrics.record(start);
        }
    }

    // ==================================================================
    // ======== Hash 操作 / Hash Operations ================================
    // ==================================================================

    @Override
    public Object hget(String key, String field) {
        String raw = execute("HGET", key, () -> hash(key).get(field), null);
        return decodeRead(key, raw);
    }

    @Override
    public boolean hset(String key, String field, Object value) {
        String json = value == null ? null : encodeWrite(key, value);
        if (json == null) {
            return false;
        }
        return execute("HSET", key, () -> {
            hash(key).fastPut(field, json);
            metrics.set(1);
            return true;
        }, false);
    }

    @Override
    public Map<String, Object> hgetAll(String key) {
        Map<String, String> raw = execute("HGETALL", key, () -> hash(key).readAllMap(), Collections.emptyMap());
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((field, value) -> result.put(field, decodeLenient(value)));
        return result;
    }

    @Override
    public long hdel(String key, String... fields) {
        if (ArrayUtils.isEmpty(fields)) {
            return 0L;
        }
        return execute("HDEL", key, () -> {
            long removed = hash(key).fastRemove(fields);
            metrics.delete(removed);
            return removed;
        }, 0L);
    }

    // ==================================================================
    // ======== List 操作 / List Operations ================================
    // ==================================================================

    @Override
    public long lpush(String key, Object... values) {
        List<String> encoded = encodeAll(key, values);
        if (encoded.isEmpty()) {
            return 0L;
        }
        return execute("LPUSH", key, () -> (long) deque(key).addFirst(encoded.toArray(new String[0])), 0L);
    }

    @Override
    public long rpush(String key, Object... values) {
        List<String> encoded = encodeAll(key, values);
        if (encoded.isEmpty()) {
            return 0L;
        }
        return execute("RPUSH", key, () -> (long) deque(key).addLast(encoded.toArray(new String[0])), 0L);
    }

    @Override
    public Object lpop(String key) {
        return decodeLenient(execute("LPOP", key, () -> deque(key).pollFirst(), null));
    }

    @Override
    public Object rpop(String key) {
        return decodeLenient(execute("RPOP", key, () -> deque(key).pollLast(), null));
    }

    @Override
    public List<Object> lrange(String key, int start, int stop) {
        List<String> raw = execute("LRANGE", key,
                () -> redisson.<String>getList(key, StringCodec.INSTANCE).range(start, stop), Collections.emptyList());
        List<Object> result = new ArrayList<>(raw.size());
        raw.forEach(item -> result.add(decodeLenient(item)));
        return result;
    }

    // ==================================================================
    // ======== Set 操作 / Set Operations ==================================
    // ==================================================================

    @Override
    public long sadd(String key, Object... members) {
        List<String> encoded = encodeAll(key, members);
        if (encoded.isEmpty()) {
            return 0L;
        }
        return execute("SADD", key, () -> {
            long added = set(key).addAllCounted(encoded);
            metrics.set(added);
            return added;
        }, 0L);
    }

    @Override
    public Set<Object> smembers(String key) {
        Set<String> raw = execute("SMEMBERS", key, () -> set(key).readAll(), Collections.emptySet());
        Set<Object> result = new LinkedHashSet<>();
        raw.forEach(member -> result.add(decodeLenient(member)));
        return result;
    }

    @Override
    public boolean sismember(String key, Object member) {
        String json = member == null ? null : encodeWrite(key, member);
        if (json == null) {
            return false;
        }
        return execute("SISMEMBER", key, () -> set(key).contains(json), false);
    }

    @Override
    public long srem(String key, Object... members) {
        List<String> encoded = encodeAll(key, members);
        if (encoded.isEmpty()) {
            return 0L;
        }
        return execute("SREM", key, () -> {
            long removed = set(key).removeAllCounted(encoded);
            metrics.delete(removed);
            return removed;
        }, 0L);
    }

    // ==================================================================
    // ======== 发布订阅 / Pub-Sub =========================================
    // ==================================================================

    @Override
    public long publish(String channel, Object message) {
        String json = message == null ? null : encodeWrite(channel, message);
        if (json == null) {
            return 0L;
        }
        return execute("PUBLISH", channel, () -> redisson.getTopic(channel, StringCodec.INSTANCE).publish(json), 0L);
    }

    @Override
    public int subscribe(String channel, Consumer<Object> listener) {
        return execute("SUBSCRIBE", channel, () -> redisson.getTopic(channel, StringCodec.INSTANCE)
                .addListener(String.class, (ch, message) -> listener.accept(decodeLenient(message))), -1);
    }

    @Override
    public void unsubscribe(String channel, int listenerId) {
        execute("UNSUBSCRIBE", channel, () -> {
            redisson.getTopic(channel, StringCodec.INSTANCE).removeListener(listenerId);
            return true;
        }, false);
    }

    // ==================================================================
    // ======== 统计 / Metrics =============================================
    // ==================================================================

    @Override
    public RedisClientMetrics getMetrics() {
        return metrics.snapshot(connected.get());
    }

    @Override
    public void resetMetrics() {
        metrics.reset();
    }

    // ==================================================================
    // ======== 内部方法 / Internal =========================================
    // ==================================================================

    /**
     * 执行一次 Redis 调用：记录耗时，失败时记录错误并返回降级值。
     * <p>
     * Runs one Redis call: records latency, and on failure records an error and returns the fallback.
     */
    private <T> T execute(String operation, String key, Supplier<T> action, T fallback) {
        long start = System.nanoTime();
        try {
            T result = action.get();
            markConnected();
            return result;
        } catch (RuntimeException e) {
            handleFailure(operation, key, e);
            return fallback;
        } finally {
            metrics.record(start);
        }
    }

    private void handleFailure(String operation, String key, RuntimeException e) {
        metrics.error();
        if (isConnectivityFailure(e)) {
            lastProbeNanos.set(System.nanoTime());
            if (connected.compareAndSet(true, false)) {
                i18nLog.warn("redis.disconnected", operation, ExceptionUtils.getRootCauseMessage(e));
            }
            log.debug(LOG_PREFIX + "{} failed for key '{}' while disconnected.", operation, key);
        } else {
            log.warn(LOG_PREFIX + "{} failed for key '{}'.", operation, key, e);
        }
    }

    private void markConnected() {
        if (!connected.get() && connected.compareAndSet(false, true)) {
            i18nLog.info("redis.reconnected");
        }
    }

    private boolean isConnectivityFailure(Throwable e) {
        return ExceptionUtils.indexOfType(e, RedisConnectionException.class) >= 0
                || ExceptionUtils.indexOfType(e, RedisTimeoutException.class) >= 0;
    }

    private Object decodeRead(String key, String raw) {
        if (raw == null) {
            metrics.miss();
            return null;
        }
        try {
            Object value = codec.decode(raw);
            metrics.hit();
            return value;
        } catch (SerializationException e) {
            metrics.miss();
            log.warn(LOG_PREFIX + "Undecodable value under key '{}', treated as a miss: {}", key, e.getMessage());
            return null;
        }
    }

    private Object decodeLenient(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return codec.decode(raw);
        } catch (SerializationException e) {
            return raw;
        }
    }

    private String encodeWrite(String key, Object value) {
        try {
            return codec.encode(value);
        } catch (SerializationException e) {
            metrics.error();
            log.warn(LOG_PREFIX + "Cannot serialize value for key '{}': {}", key, e.getMessage());
            return null;
        }
    }

    private List<String> encodeAll(String key, Object... values) {
        if (ArrayUtils.isEmpty(values)) {
            return Collections.emptyList();
        }
        List<String> encoded = new ArrayList<>(values.length);
        for (Object value : values) {
            String json = value == null ? null : encodeWrite(key, value);
            if (json != null) {
                encoded.add(json);
            }
        }
        return encoded;
    }

    private Duration effectiveTtl(Duration ttl) {
        Duration effective = ttl != null ? ttl : defaultTtl;
        if (effective == null || effective.isZero() || effective.isNegative()) {
            return null;
        }
        return effective;
    }

    private RBucket<String> bucket(String key) {
        return redisson.getBucket(key, StringCodec.INSTANCE);
    }

    private RMap<String, String> hash(String key) {
        return redisson.getMap(key, StringCodec.INSTANCE);
    }

    private RDeque<String> deque(String key) {
        return redisson.getDeque(key, StringCodec.INSTANCE);
    }

    private RSet<String> set(String key) {
        return redisson.getSet(key, StringCodec.INSTANCE);
    }
}
