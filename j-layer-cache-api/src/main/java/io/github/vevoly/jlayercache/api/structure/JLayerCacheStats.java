package io.github.vevoly.jlayercache.api.structure;

import lombok.Builder;
import lombok.Value;

/**
 * 缓存统计快照。
 * <p>
 * A snapshot of the cache statistics.
 *
 * @author vevoly
 */
@Value
@Builder
public class JLayerCacheStats {

    TierStats l1;
    TierStats l2;

    /** 平均 get 耗时（毫秒）/ average get latency (ms) */
    double avgGetTime;

    /** 平均 set 耗时（毫秒）/ average set latency (ms) */
    double avgSetTime;

    long totalOperations;

    /** 任意一级命中的 get 次数 / get calls answered by either tier */
    long hits;

    /** 两级都未命中的 get 次数 / get calls missed by both tiers */
    long misses;

    /**
     * 两级缓存合并后的命中率（百分比）。
     * <p>
     * Combined hit rate across both tiers (percent).
     */
    public double getHitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests * 100.0;
    }

    @Value
    @Builder
    public static class TierStats {
        long hits;
        long misses;
        long sets;
        /** 仅 L1 / L1 only */
        long size;
        /** 仅 L1 / L1 only */
        long maxSize;
        /** 仅 L2 / L2 only */
        boolean connected;

        public double getHitRate() {
            long requests = hits + misses;
            return requests == 0 ? 0.0 : (double) hits / requests * 100.0;
        }
    }
}
