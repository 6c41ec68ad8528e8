package io.github.vevoly.jlayercache.api.structure;

import lombok.Value;

import java.time.Duration;

/**
 * 预热策略产出的一条数据。ttl 为 null 时使用策略自身的 TTL。
 * <p>
 * One entry produced by a warmup strategy. A {@code null} ttl falls back to the strategy TTL.
 *
 * @author vevoly
 */
@Value
public class WarmupEntry {

    String key;
    Object value;
    Duration ttl;

    public static WarmupEntry of(String key, Object value) {
        return new WarmupEntry(key, value, null);
    }

    public static WarmupEntry of(String key, Object value, Duration ttl) {
        return new WarmupEntry(key, value, ttl);
    }
}
