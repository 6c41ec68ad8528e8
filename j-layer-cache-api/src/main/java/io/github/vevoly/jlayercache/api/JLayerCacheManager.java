package io.github.vevoly.jlayercache.api;

import io.github.vevoly.jlayercache.api.structure.DataChangeEvent;
import io.github.vevoly.jlayercache.api.structure.DataChangePayload;
import io.github.vevoly.jlayercache.api.structure.HealthStatus;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheOptions;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheStats;
import io.github.vevoly.jlayercache.api.structure.WarmupResult;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 缓存管理器：标签索引、级联失效、数据变更失效与缓存预热。
 * <p>
 * Cache manager: tag index, cascading invalidation, data-change invalidation and warmup.
 *
 * @author vevoly
 */
public interface JLayerCacheManager {

    /**
     * 写入缓存，并把 key 记录到每个标签下。
     * <p>
     * Stores the value and records the key under every tag.
     */
    boolean setWithTags(String key, Object value, Collection<String> tags, JLayerCacheOptions options);

    /**
     * 删除标签下的所有 key，清空标签，并按依赖表级联到下游标签。
     * <p>
     * Deletes every key of the tag from both tiers, empties the tag and cascades to the dependent
     * tags declared in the dependency table. Cycles are detected and broken.
     *
     * @return 删除的 key 数量 / number of keys removed
     */
    long invalidateByTag(String tag);

    /**
     * 处理业务数据变更：按触发表失效标签，再按实体的 key 模式失效。
     * <p>
     * Handles a data change: invalidates the tags whose triggers match, then the entity key patterns.
     *
     * @return 删除的条目数 / entries removed
     */
    long handleDataChange(DataChangeEvent event);

    default long handleDataChange(String entity, String operation, DataChangePayload payload) {
        return handleDataChange(DataChangeEvent.of(entity, operation, payload));
    }

    /**
     * 按配置顺序串行执行预热策略，受总时间预算约束。
     * <p>
     * Runs the configured warmup strategies sequentially within the total time budget.
     */
    WarmupResult warmupCache();

    /**
     * 标签当前关联的 key 快照。
     * <p>
     * Snapshot of the keys currently associated with a tag.
     */
    Set<String> getTaggedKeys(String tag);

    JLayerCacheStats getStats();

    HealthStatus healthCheck();

    /** 合并命中率（百分比）/ combined hit rate (percent) */
    double getHitRate();

    /** 平均响应时间（毫秒）/ average response time (ms) */
    double getAverageResponseTime();

    /**
     * 根据当前统计给出调优建议。
     * <p>
     * Tuning suggestions derived from the current statistics.
     */
    List<String> analyze();

    JLayerCache getCache();
}
