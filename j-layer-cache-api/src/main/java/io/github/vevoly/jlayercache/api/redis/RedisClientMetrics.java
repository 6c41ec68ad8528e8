package io.github.vevoly.jlayercache.api.redis;

import lombok.Builder;
import lombok.Value;

/**
 * Redis 客户端的操作统计快照。
 * <p>
 * Operation metrics snapshot of the Redis client.
 *
 * @author vevoly
 */
@Value
@Builder
public class RedisClientMetrics {

    long hits;
    long misses;
    long sets;
    long deletes;
    long errors;
    long operations;
    /** 累计耗时（毫秒）/ cumulative latency (ms) */
    double totalTime;
    boolean connected;

    public double getHitRate() {
        long reads = hits + misses;
        return reads == 0 ? 0.0 : (double) hits / reads * 100.0;
    }

    public double getAvgResponseTime() {
        return operations == 0 ? 0.0 : totalTime / operations;
    }
}
