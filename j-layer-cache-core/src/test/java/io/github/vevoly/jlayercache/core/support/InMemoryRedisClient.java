package io.github.vevoly.jlayercache.core.support;

import io.github.vevoly.jlayercache.api.exception.ConnectivityException;
import io.github.vevoly.jlayercache.api.redis.RedisClient;
import io.github.vevoly.jlayercache.api.redis.RedisClientMetrics;
import io.github.vevoly.jlayercache.api.utils.JLayerCacheHelper;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * 内存版 {@link RedisClient}，只用于测试。支持 TTL、断连开关和写失败开关。
 */
public class InMemoryRedisClient implements RedisClient {

    private final ManualClock clock;
    private final Map<String, Object> values = new ConcurrentHashMap<>();
    private final Map<String, Long> expiresAt = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<Object>>> listeners = new ConcurrentHashMap<>();

    private volatile boolean available = true;
    private volatile boolean failWrites = false;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicInteger mgetCalls = new AtomicInteger();
    private final AtomicInteger listenerIds = new AtomicInteger();

    public InMemoryRedisClient(ManualClock clock) {
        this.clock = clock;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public boolean contains(String fullKey) {
        return live(fullKey) != null;
    }

    public int mgetCalls() {
        return mgetCalls.get();
    }

    /** 直接写入，不经过开关 / raw write bypassing the toggles */
    public void put(String fullKey, Object value) {
        values.put(fullKey, value);
        expiresAt.remove(fullKey);
    }

    private Object live(String key) {
        Long deadline = expiresAt.get(key);
        if (deadline != null && clock.millis() >= deadline) {
            values.remove(key);
            expiresAt.remove(key);
            return null;
        }
        return values.get(key);
    }

    private void store(String key, Object value, Duration ttl) {
        values.put(key, value);
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            expiresAt.put(key, clock.millis() + ttl.toMillis());
        } else {
            expiresAt.remove(key);
        }
    }

    private void requireAvailable() {
        if (!available) {
            throw new ConnectivityException("redis unavailable");
        }
    }

    @Override
    public boolean isConnected() {
        return available;
    }

    @Override
    public void connect() {
        requireAvailable();
    }

    @Override
    public boolean ping() {
        return available;
    }

    @Override
    public boolean exists(String key) {
        return available && live(key) != null;
    }

    @Override
    public long del(String... keys) {
        return del(Arrays.asList(keys));
    }

    @Override
    public long del(Collection<String> keys) {
        if (!available) {
            return 0L;
        }
        long removed = 0L;
        for (String key : keys) {
            if (live(key) != null) {
                values.remove(key);
                expiresAt.remove(key);
                removed++;
            }
        }
        deletes.addAndGet(removed);
        return removed;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        if (!available || live(key) == null) {
            return false;
        }
        expiresAt.put(key, clock.millis() + ttl.toMillis());
        return true;
    }

    @Override
    public long ttl(String key) {
        if (!available || live(key) == null) {
            return -2L;
        }
        Long deadline = expiresAt.get(key);
        return deadline == null ? -1L : (deadline - clock.millis()) / 1000L;
    }

    @Override
    public List<String> keys(String pattern) {
        if (!available) {
            return new ArrayList<>();
        }
        Pattern regex = JLayerCacheHelper.globToRegex(pattern);
        List<String> matched = new ArrayList<>();
        for (String key : new ArrayList<>(values.keySet())) {
            if (live(key) != null && regex.matcher(key).matches()) {
                matched.add(key);
            }
        }
        return matched;
    }

    @Override
    public long flushPattern(String pattern) {
        return del(keys(pattern));
    }

    @Override
    public Object get(String key) {
        if (!available) {
            return null;
        }
        Object value = live(key);
        (value == null ? misses : hits).incrementAndGet();
        return value;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object value = get(key);
        return type.isInstance(value) ? (T) value : null;
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        if (!available || failWrites) {
            return false;
        }
        store(key, value, ttl);
        sets.incrementAndGet();
        return true;
    }

    @Override
    public boolean setIfAbsent(String key, Object value, Duration ttl) {
        if (!available || failWrites || live(key) != null) {
            return false;
        }
        store(key, value, ttl);
        return true;
    }

    @Override
    public Map<String, Object> mget(Collection<String> keys) {
        mgetCalls.incrementAndGet();
        Map<String, Object> found = new LinkedHashMap<>();
        if (!available) {
            return found;
        }
        for (String key : keys) {
            Object value = live(key);
            if (value != null) {
                found.put(key, value);
            }
        }
        return found;
    }

    @Override
    public boolean mset(Map<String, ?> entries, Duration ttl) {
        if (!available || failWrites) {
            return false;
        }
        entries.forEach((key, value) -> store(key, value, ttl));
        sets.addAndGet(entries.size());
        return true;
    }

    @Override
    public long increment(String key, long delta) {
        requireAvailable();
        long next = (live(key) instanceof Number ? ((Number) live(key)).longValue() : 0L) + delta;
        values.put(key, next);
        return next;
    }

    @Override
    public long decrement(String key, long delta) {
        return increment(key, -delta);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object hget(String key, String field) {
        Object hash = available ? live(key) : null;
        return hash instanceof Map ? ((Map<String, Object>) hash).get(field) : null;
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean hset(String key, String field, Object value) {
        if (!available) {
            return false;
        }
        ((Map<String, Object>) values.computeIfAbsent(key, k -> new ConcurrentHashMap<String, Object>())).put(field, value);
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> hgetAll(String key) {
        Object hash = available ? live(key) : null;
        return hash instanceof Map ? new LinkedHashMap<>((Map<String, Object>) hash) : new LinkedHashMap<>();
    }

    @Override
    @SuppressWarnings("unchecked")
    public long hdel(String key, String... fields) {
        Object hash = available ? live(key) : null;
        if (!(hash instanceof Map)) {
            return 0L;
        }
        return Arrays.stream(fields).filter(f -> ((Map<String, Object>) hash).remove(f) != null).count();
    }

    @SuppressWarnings("unchecked")
    private Deque<Object> deque(String key) {
        return (Deque<Object>) values.computeIfAbsent(key, k -> new ArrayDeque<>());
    }

    @Override
    public long lpush(String key, Object... items) {
        if (!available) {
            return 0L;
        }
        Deque<Object> deque = deque(key);
        for (Object item : items) {
            deque.addFirst(item);
        }
        return deque.size();
    }

    @Override
    public long rpush(String key, Object... items) {
        if (!available) {
            return 0L;
        }
        Deque<Object> deque = deque(key);
        for (Object item : items) {
            deque.addLast(item);
        }
        return deque.size();
    }

    @Override
    public Object lpop(String key) {
        return available ? deque(key).pollFirst() : null;
    }

    @Override
    public Object rpop(String key) {
        return available ? deque(key).pollLast() : null;
    }

    @Override
    public List<Object> lrange(String key, int start, int stop) {
        if (!available) {
            return new ArrayList<>();
        }
        List<Object> all = new ArrayList<>(deque(key));
        int to = stop < 0 ? all.size() + stop + 1 : Math.min(stop + 1, all.size());
        return start >= to ? new ArrayList<>() : new ArrayList<>(all.subList(start, to));
    }

    @SuppressWarnings("unchecked")
    private Set<Object> set(String key) {
        return (Set<Object>) values.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet());
    }

    @Override
    public long sadd(String key, Object... members) {
        return available ? Arrays.stream(members).filter(set(key)::add).count() : 0L;
    }

    @Override
    public Set<Object> smembers(String key) {
        return available ? new HashSet<>(set(key)) : new HashSet<>();
    }

    @Override
    public boolean sismember(String key, Object member) {
        return available && set(key).contains(member);
    }

    @Override
    public long srem(String key, Object... members) {
        return available ? Arrays.stream(members).filter(set(key)::remove).count() : 0L;
    }

    @Override
    public long publish(String channel, Object message) {
        if (!available) {
            return 0L;
        }
        List<Consumer<Object>> subscribers = listeners.getOrDefault(channel, Collections.emptyList());
        subscribers.forEach(listener -> listener.accept(message));
        return subscribers.size();
    }

    @Override
    public int subscribe(String channel, Consumer<Object> listener) {
        listeners.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(listener);
        return listenerIds.incrementAndGet();
    }

    @Override
    public void unsubscribe(String channel, int listenerId) {
        listeners.remove(channel);
    }

    @Override
    public RedisClientMetrics getMetrics() {
        return RedisClientMetrics.builder()
                .hits(hits.get())
                .misses(misses.get())
                .sets(sets.get())
                .deletes(deletes.get())
                .connected(available)
                .build();
    }

    @Override
    public void resetMetrics() {
        hits.set(0);
        misses.set(0);
        sets.set(0);
        deletes.set(0);
    }
}
