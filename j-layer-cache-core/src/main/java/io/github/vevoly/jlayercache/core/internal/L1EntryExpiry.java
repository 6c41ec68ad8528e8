package io.github.vevoly.jlayercache.core.internal;

import com.github.benmanes.caffeine.cache.Expiry;

/**
 * 按条目自身 TTL 过期的 Caffeine {@link Expiry}。读取不会延长存活时间。
 * <p>
 * Caffeine {@link Expiry} that expires each entry after its own TTL. Reads do not extend the lifetime.
 *
 * @author vevoly
 */
public class L1EntryExpiry implements Expiry<String, L1Entry> {

    @Override
    public long expireAfterCreate(String key, L1Entry entry, long currentTime) {
        return entry.getTtlNanos();
    }

    @Override
    public long expireAfterUpdate(String key, L1Entry entry, long currentTime, long currentDuration) {
        return entry.getTtlNanos();
    }

    @Override
    public long expireAfterRead(String key, L1Entry entry, long currentTime, long currentDuration) {
        return currentDuration;
    }
}
