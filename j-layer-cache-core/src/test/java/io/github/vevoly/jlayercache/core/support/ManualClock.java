package io.github.vevoly.jlayercache.core.support;

import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 测试用的手动时钟，同时驱动 Caffeine 和内存版 Redis 的过期。
 */
public class ManualClock implements Ticker {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);

    @Override
    public long read() {
        return nanos.get();
    }

    public long millis() {
        return nanos.get() / 1_000_000L;
    }

    public void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}
