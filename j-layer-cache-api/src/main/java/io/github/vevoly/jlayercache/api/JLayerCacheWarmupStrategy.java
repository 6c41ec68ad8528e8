package io.github.vevoly.jlayercache.api;

import io.github.vevoly.jlayercache.api.structure.WarmupEntry;

import java.time.Duration;
import java.util.List;

/**
 * 预热策略接口。实现类注册为 Spring Bean 即可被框架发现。
 * <p>
 * Warmup strategy. Implementations registered as Spring beans are picked up by the framework.
 *
 * @author vevoly
 */
public interface JLayerCacheWarmupStrategy {

    /**
     * 策略名，对应配置 {@code j-layer-cache.warmup.strategies} 中的条目。
     * <p>
     * Strategy name, as listed in {@code j-layer-cache.warmup.strategies}.
     */
    String getName();

    /**
     * 该策略写入条目的默认 TTL。
     * <p>
     * Default TTL for the entries written by this strategy.
     */
    Duration getTtl();

    /**
     * 从业务数据源读取一批数据，超出 batchSize 的部分会被截断。
     * <p>
     * Reads one batch from the system of record; anything beyond {@code batchSize} is dropped.
     */
    List<WarmupEntry> fetch(int batchSize) throws Exception;
}
