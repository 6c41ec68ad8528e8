package io.github.vevoly.jlayercache.core.redis;

import io.github.vevoly.jlayercache.api.redis.RedisClientMetrics;

import java.util.concurrent.atomic.LongAdder;

/**
 * Redis 客户端的线程安全计数器。
 * <p>
 * Thread-safe counters of the Redis client.
 *
 * @author vevoly
 */
class RedisOperationMetrics {

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder sets = new LongAdder();
    private final LongAdder deletes = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder operations = new LongAdder();
    private final LongAdder totalNanos = new LongAdder();

    void hit() {
        hits.increment();
    }

    void miss() {
        misses.increment();
    }

    void set(long count) {
        sets.add(count);
    }

    void delete(long count) {
        deletes.add(count);
    }

    void error() {
        errors.increment();
    }

    void record(long startNanos) {
        operations.increment();
        totalNanos.add(System.nanoTime() - startNanos);
    }

    RedisClientMetrics snapshot(boolean connected) {
        return RedisClientMetrics.builder()
                .hits(hits.sum())
                .misses(misses.sum())
                .sets(sets.sum())
                .deletes(deletes.sum())
                .errors(errors.sum())
                .operations(operations.sum())
                .totalTime(totalNanos.sum() / 1_000_000.0)
                .connected(connected)
                .build();
    }

    void reset() {
        hits.reset();
        misses.reset();
        sets.reset();
        deletes.reset();
        errors.reset();
        operations.reset();
        totalNanos.reset();
    }
}
