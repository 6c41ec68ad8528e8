package io.github.vevoly.jlayercache.api.structure;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 单次缓存调用的选项。
 * <p>
 * Per-call cache options.
 *
 * @author vevoly
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class JLayerCacheOptions {

    /**
     * 不带任何覆盖项的默认选项。
     * <p>
     * Default options without any override.
     */
    public static final JLayerCacheOptions DEFAULT = JLayerCacheOptions.builder().build();

    /**
     * 本次调用的 TTL，为 null 时使用各级缓存的默认 TTL。
     * <p>
     * TTL for this call; {@code null} falls back to each tier's default TTL.
     */
    private final Duration ttl;

    /**
     * 是否跳过 L1 本地缓存。
     * <p>
     * Whether to bypass the L1 memory tier.
     */
    private final boolean skipMemory;

    /**
     * 是否跳过 L2 Redis 缓存。
     * <p>
     * Whether to bypass the L2 Redis tier.
     */
    private final boolean skipRedis;

    /**
     * 覆盖默认命名空间。
     * <p>
     * Overrides the configured namespace.
     */
    private final String namespace;

    public static JLayerCacheOptions ttl(Duration ttl) {
        return JLayerCacheOptions.builder().ttl(ttl).build();
    }

    public static JLayerCacheOptions namespace(String namespace) {
        return JLayerCacheOptions.builder().namespace(namespace).build();
    }

    public static JLayerCacheOptions orDefault(JLayerCacheOptions options) {
        return options == null ? DEFAULT : options;
    }
}
