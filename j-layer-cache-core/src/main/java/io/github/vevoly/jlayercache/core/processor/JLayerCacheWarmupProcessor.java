package io.github.vevoly.jlayercache.core.processor;

import io.github.vevoly.jlayercache.api.JLayerCache;
import io.github.vevoly.jlayercache.api.JLayerCacheWarmupStrategy;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheOptions;
import io.github.vevoly.jlayercache.api.structure.WarmupEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * 缓存预热执行器，负责执行单个预热策略。
 * <p>
 * 策略的编排（顺序、间隔、时间预算）由 manager 负责，这里只处理“取数据”和“写缓存”两步。
 * <p>
 * Cache warmup executor for a single strategy. Ordering, delays and the time budget are handled by the
 * manager; this class only fetches a batch and writes it to the cache.
 *
 * @author vevoly
 */
@Slf4j
@RequiredArgsConstructor
public class JLayerCacheWarmupProcessor {

    private final JLayerCache cache;

    private static final String LOG_PREFIX = "[JLayerCache-Warmup] ";

    /**
     * 从业务数据源读取一批数据，超出 batchSize 的部分被截断，key 为空或值为 null 的条目被丢弃。
     * <p>
     * Reads one batch from the system of record. Entries beyond {@code batchSize} are dropped, as are entries
     * with a blank key or a {@code null} value.
     *
     * @throws CompletionException 包装策略抛出的异常 / wraps whatever the strategy threw
     */
    public List<WarmupEntry> fetch(JLayerCacheWarmupStrategy strategy, int batchSize) {
        List<WarmupEntry> entries;
        try {
            entries = strategy.fetch(batchSize);
        } catch (Exception e) {
            throw new CompletionException(e);
        }
        if (CollectionUtils.isEmpty(entries)) {
            log.warn(LOG_PREFIX + "Strategy '{}' produced no data.", strategy.getName());
            return Collections.emptyList();
        }
        if (entries.size() > batchSize) {
            log.warn(LOG_PREFIX + "Strategy '{}' produced {} entries, truncated to batch size {}.",
                    strategy.getName(), entries.size(), batchSize);
            entries = entries.subList(0, batchSize);
        }
        return entries.stream()
                .filter(Objects::nonNull)
                .filter(entry -> StringUtils.isNotBlank(entry.getKey()) && entry.getValue() != null)
                .toList();
    }

    /**
     * 把数据按 TTL 分组后批量写入缓存。
     * <p>
     * Groups the entries by TTL and writes each group with one batch call.
     *
     * @return 成功写入的条目数 / entries written successfully
     */
    public int write(JLayerCacheWarmupStrategy strategy, List<WarmupEntry> entries) {
        if (entries.isEmpty()) {
            return 0;
        }
        // 步骤 1: 按 TTL 分组 / Step 1: group by TTL
        Map<Duration, Map<String, Object>> byTtl = new LinkedHashMap<>();
        for (WarmupEntry entry : entries) {
            Duration ttl = entry.getTtl() != null ? entry.getTtl() : strategy.getTtl();
            byTtl.computeIfAbsent(ttl, t -> new LinkedHashMap<>()).put(entry.getKey(), entry.getValue());
        }
        // 步骤 2: 每组一次批量写入 / Step 2: one batch write per group
        int written = 0;
        for (Map.Entry<Duration, Map<String, Object>> group : byTtl.entrySet()) {
            JLayerCacheOptions options = JLayerCacheOptions.builder().ttl(group.getKey()).build();
            if (cache.mset(group.getValue(), options)) {
                written += group.getValue().size();
            } else {
                log.warn(LOG_PREFIX + "Strategy '{}': batch of {} entries (ttl={}) was not fully written.",
                        strategy.getName(), group.getValue().size(), group.getKey());
            }
        }
        return written;
    }
}
