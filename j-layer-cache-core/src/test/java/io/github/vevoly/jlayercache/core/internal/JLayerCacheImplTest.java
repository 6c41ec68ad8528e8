package io.github.vevoly.jlayercache.core.internal;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vevoly.jlayercache.api.config.ResolvedJLayerCacheConfig;
import io.github.vevoly.jlayercache.api.structure.HealthStatus;
import io.github.vevoly.jlayercache.api.structure.InvalidationPattern;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheOptions;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheStats;
import io.github.vevoly.jlayercache.api.utils.JLayerCacheFunctions;
import io.github.vevoly.jlayercache.core.codec.JsonValueCodec;
import io.github.vevoly.jlayercache.core.redis.RedissonRedisClient;
import io.github.vevoly.jlayercache.core.support.InMemoryRedisClient;
import io.github.vevoly.jlayercache.core.support.ManualClock;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Slf4j
@DisplayName("两级缓存 JLayerCacheImpl")
class JLayerCacheImplTest {

    private ManualClock clock;
    private InMemoryRedisClient redis;
    private Cache<String, L1Entry> l1;
    private JLayerCacheImpl cache;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        redis = new InMemoryRedisClient(clock);
        l1 = Caffeine.newBuilder()
                .maximumSize(100)
                .expireAfter(new L1EntryExpiry())
                .ticker(clock)
                .executor(Runnable::run)
                .build();
        ResolvedJLayerCacheConfig config = ResolvedJLayerCacheConfig.builder()
                .namespace("app")
                .memoryMaxSize(100)
                .memoryTtl(Duration.ofMinutes(5))
                .redisTtl(Duration.ofHours(1))
                .scanCount(2)
                .build();
        cache = new JLayerCacheImpl(redis, l1, config, Runnable::run);
    }

    @Nested
    @DisplayName("基本读写")
    class BasicReadWrite {

        @Test
        @DisplayName("set 之后立即 get 返回同一个值，并写入两级")
        void setThenGet() {
            assertThat(cache.set("user:1", Map.of("uid", 1))).isTrue();

            Map<String, Integer> value = cache.get("user:1");
            assertThat(value).containsEntry("uid", 1);
            assertThat(l1.getIfPresent("app:user:1")).isNotNull();
            assertThat(redis.contains("app:user:1")).isTrue();
            assertThat(cache.getStats().getL1().getHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("未写入或已删除的 key 返回 null")
        void missingKeyIsNull() {
            assertThat((Object) cache.get("nothing")).isNull();

            cache.set("user:1", "alice");
            assertThat(cache.del("user:1")).isTrue();
            assertThat((Object) cache.get("user:1")).isNull();
            assertThat(redis.contains("app:user:1")).isFalse();
        }

        @Test
        @DisplayName("set null 等同于删除")
        void setNullDeletes() {
            cache.set("k", "v");
            assertThat(cache.set("k", null)).isTrue();
            assertThat(cache.exists("k")).isFalse();
        }

        @Test
        @DisplayName("L1 未命中、L2 命中时回填 L1")
        void l2HitBackFillsL1() {
            redis.put("app:profile:7", "bob");

            assertThat((String) cache.get("profile:7")).isEqualTo("bob");
            assertThat(l1.getIfPresent("app:profile:7")).isNotNull();

            JLayerCacheStats stats = cache.getStats();
            assertThat(stats.getL1().getMisses()).isEqualTo(1);
            assertThat(stats.getL2().getHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("命名空间互相隔离")
        void namespacesAreIsolated() {
            cache.set("k", "default");
            cache.set("k", "other", JLayerCacheOptions.namespace("tenant"));

            assertThat((String) cache.get("k")).isEqualTo("default");
            assertThat((String) cache.get("k", JLayerCacheOptions.namespace("tenant"))).isEqualTo("other");
            assertThat(redis.contains("tenant:k")).isTrue();
        }

        @Test
        @DisplayName("skipRedis 只写 L1，skipMemory 只写 L2")
        void skipFlags() {
            cache.set("a", 1, JLayerCacheOptions.builder().skipRedis(true).build());
            cache.set("b", 2, JLayerCacheOptions.builder().skipMemory(true).build());

            assertThat(redis.contains("app:a")).isFalse();
            assertThat(l1.getIfPresent("app:a")).isNotNull();
            assertThat(redis.contains("app:b")).isTrue();
            assertThat(l1.getIfPresent("app:b")).isNull();
        }
    }

    @Nested
    @DisplayName("TTL")
    class Ttl {

        @Test
        @DisplayName("单次 TTL 覆盖同时作用于两级，过期后 get 返回 null")
        void perCallTtlExpiresBothTiers() {
            cache.set("session:abc", Map.of("uid", 1), JLayerCacheOptions.ttl(Duration.ofSeconds(1)));
            assertThat((Object) cache.get("session:abc")).isNotNull();

            clock.advance(Duration.ofMillis(1200));

            assertThat((Object) cache.get("session:abc")).isNull();
        }

        @Test
        @DisplayName("L1 默认 TTL 过期后仍可从 L2 读回")
        void l1ExpiresBeforeL2() {
            cache.set("k", "v");
            clock.advance(Duration.ofMinutes(6));

            assertThat(l1.getIfPresent("app:k")).isNull();
            assertThat((String) cache.get("k")).isEqualTo("v");
        }

        @Test
        @DisplayName("L2 命中回填 L1 时使用本次读取的 TTL")
        void backFillUsesReadTtl() {
            cache.set("otp:1", "123456", JLayerCacheOptions.builder().ttl(Duration.ofSeconds(1)).skipMemory(true).build());

            assertThat((String) cache.get("otp:1", JLayerCacheOptions.ttl(Duration.ofSeconds(1)))).isEqualTo("123456");
            assertThat(l1.getIfPresent("app:otp:1")).isNotNull();

            clock.advance(Duration.ofMillis(1200));

            assertThat(l1.getIfPresent("app:otp:1")).isNull();
            assertThat((Object) cache.get("otp:1")).isNull();
        }
    }

    @Nested
    @DisplayName("批量操作")
    class Batch {

        @Test
        @DisplayName("mget 保持顺序，只对缺失的 key 发起一次 L2 批量读取并回填")
        void mgetMixesTiers() {
            cache.set("k1", "v1");
            redis.put("app:k2", "v2");

            List<String> values = cache.mget(List.of("k1", "k2", "k3"));

            assertThat(values).containsExactly("v1", "v2", null);
            assertThat(redis.mgetCalls()).isEqualTo(1);
            assertThat(l1.getIfPresent("app:k2")).isNotNull();
        }

        @Test
        @DisplayName("mset 写入两级，跳过 null 值")
        void msetWritesBothTiers() {
            Map<String, Object> entries = new LinkedHashMap<>();
            entries.put("a", 1);
            entries.put("b", 2);
            entries.put("c", null);

            assertThat(cache.mset(entries)).isTrue();
            assertThat(redis.contains("app:a")).isTrue();
            assertThat(redis.contains("app:b")).isTrue();
            assertThat(redis.contains("app:c")).isFalse();
            List<Integer> values = cache.mget(List.of("a", "b", "c"));
            assertThat(values).containsExactly(1, 2, null);
        }
    }

    @Nested
    @DisplayName("失效")
    class Invalidation {

        @Test
        @DisplayName("通配符只删除匹配的 key")
        void globRemovesOnlyMatches() {
            cache.set("user:42:profile", "p");
            cache.set("user:42:prefs", "q");
            cache.set("user:7:profile", "r");

            long removed = cache.invalidate(InvalidationPattern.glob("user:42:*"));

            assertThat(removed).isEqualTo(4);
            assertThat(cache.exists("user:42:profile")).isFalse();
            assertThat(cache.exists("user:42:prefs")).isFalse();
            assertThat((String) cache.get("user:7:profile")).isEqualTo("r");
        }

        @Test
        @DisplayName("不含通配符的 glob 按精确 key 删除")
        void exactGlob() {
            cache.set("user:1", "a");
            cache.set("user:10", "b");

            cache.invalidate(InvalidationPattern.glob("user:1"));

            assertThat(cache.exists("user:1")).isFalse();
            assertThat(cache.exists("user:10")).isTrue();
        }

        @Test
        @DisplayName("正则作用于业务 key，跨 SCAN 分片删除")
        void regexOnLogicalKeys() {
            for (int i = 0; i < 5; i++) {
                cache.set("order:" + i, i);
            }
            cache.set("product:1", "x");

            cache.invalidate(InvalidationPattern.regex("order:\\d+"));

            for (int i = 0; i < 5; i++) {
                assertThat(cache.exists("order:" + i)).isFalse();
                assertThat(redis.contains("app:order:" + i)).isFalse();
            }
            assertThat(cache.exists("product:1")).isTrue();
        }

        @Test
        @DisplayName("正则按查找语义匹配，只写前缀也能命中")
        void regexMatchesPrefix() {
            cache.set("user:42:profile", "p");
            cache.set("user:42:prefs", "q");
            cache.set("user:420:profile", "x");
            cache.set("team:user:42", "t");

            long removed = cache.invalidate(InvalidationPattern.regex("^user:42:"));

            assertThat(removed).isEqualTo(4);
            assertThat(cache.exists("user:42:profile")).isFalse();
            assertThat(cache.exists("user:42:prefs")).isFalse();
            assertThat(cache.exists("user:420:profile")).isTrue();
            assertThat(cache.exists("team:user:42")).isTrue();
        }

        @Test
        @DisplayName("断言失效读取每个值后判断")
        void predicateSeesValues() {
            cache.set("item:1", 10);
            cache.set("item:2", 99);
            l1.invalidateAll();

            cache.invalidate(InvalidationPattern.predicate((key, value) -> value instanceof Integer && (Integer) value > 50));

            assertThat(redis.contains("app:item:1")).isTrue();
            assertThat(redis.contains("app:item:2")).isFalse();
        }

        @Test
        @DisplayName("clear 只清空目标命名空间")
        void clearNamespace() {
            cache.set("a", 1);
            cache.set("a", 1, JLayerCacheOptions.namespace("other"));

            cache.clear();

            assertThat(cache.exists("a")).isFalse();
            assertThat(cache.exists("a", JLayerCacheOptions.namespace("other"))).isTrue();
        }
    }

    @Nested
    @DisplayName("读写模式")
    class CachingPatterns {

        @Test
        @DisplayName("getOrSet 未命中时只调用一次数据源")
        void getOrSetFetchesOnce() {
            AtomicInteger calls = new AtomicInteger();

            String first = cache.getOrSet("cfg", () -> "loaded-" + calls.incrementAndGet());
            String second = cache.getOrSet("cfg", () -> "loaded-" + calls.incrementAndGet());

            assertThat(first).isEqualTo("loaded-1");
            assertThat(second).isEqualTo("loaded-1");
            assertThat((String) cache.get("cfg")).isEqualTo("loaded-1");
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("getOrSet 数据源返回 null 时不缓存")
        void getOrSetNullNotCached() {
            AtomicInteger calls = new AtomicInteger();
            cache.getOrSet("none", () -> {
                calls.incrementAndGet();
                return null;
            });
            cache.getOrSet("none", () -> {
                calls.incrementAndGet();
                return null;
            });
            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("getOrSet 将数据源异常抛给调用方")
        void getOrSetPropagatesFetcherFailure() {
            assertThrows(IllegalStateException.class, () -> cache.getOrSet("x", () -> {
                throw new IllegalStateException("db down");
            }));
            assertThat(cache.exists("x")).isFalse();
        }

        @Test
        @DisplayName("setThrough 写入失败时缓存保持不变")
        void setThroughWriterFailure() {
            cache.set("acc", "old");

            boolean ok = cache.setThrough("acc", "new", v -> {
                throw new IllegalStateException("db down");
            }, null);

            assertThat(ok).isFalse();
            assertThat((String) cache.get("acc")).isEqualTo("old");
        }

        @Test
        @DisplayName("setThrough 先写数据源再写缓存")
        void setThroughSuccess() {
            List<String> db = new ArrayList<>();

            assertThat(cache.setThrough("acc", "v", db::add, null)).isTrue();
            assertThat(db).containsExactly("v");
            assertThat((String) cache.get("acc")).isEqualTo("v");
        }

        @Test
        @DisplayName("setBehind 立即可读，异步写入失败后条目被移除")
        void setBehindFailureEvicts() throws Exception {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                JLayerCacheImpl asyncCache = new JLayerCacheImpl(redis, l1, ResolvedJLayerCacheConfig.builder().namespace("app").build(), executor);
                CountDownLatch release = new CountDownLatch(1);

                CompletableFuture<Boolean> future = asyncCache.setBehind("draft", "v", v -> {
                    release.await();
                    throw new IllegalStateException("db down");
                }, null);

                assertThat((String) asyncCache.get("draft")).isEqualTo("v");
                release.countDown();

                assertThat(future.get(5, TimeUnit.SECONDS)).isFalse();
                assertThat((Object) asyncCache.get("draft")).isNull();
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("setBehind 异步写入成功时保留条目")
        void setBehindSuccess() throws Exception {
            List<String> db = new ArrayList<>();

            assertThat(cache.setBehind("draft", "v", db::add, null).get()).isTrue();
            assertThat(db).containsExactly("v");
            assertThat((String) cache.get("draft")).isEqualTo("v");
        }
    }

    @Nested
    @DisplayName("降级")
    class Degradation {

        @Test
        @DisplayName("Redis 断连时读写只走 L1，写入视为降级成功")
        void l1OnlyWhileDisconnected() {
            redis.setAvailable(false);

            assertThat(cache.set("k", "v")).isTrue();
            assertThat((String) cache.get("k")).isEqualTo("v");
            assertThat((Object) cache.get("other")).isNull();
            assertThat(cache.del("missing")).isFalse();
        }

        @Test
        @DisplayName("Redis 在线但写入失败时返回 false 并移除 L1")
        void l2WriteFailure() {
            redis.setFailWrites(true);

            assertThat(cache.set("k", "v")).isFalse();
            assertThat(l1.getIfPresent("app:k")).isNull();
            assertThat(cache.mset(Map.of("a", 1))).isFalse();
            assertThat(l1.getIfPresent("app:a")).isNull();
        }
    }

    @Nested
    @DisplayName("统计与健康检查")
    class Monitoring {

        @Test
        @DisplayName("统计命中率并可重置")
        void statsAndReset() {
            cache.set("k", "v");
            cache.get("k");
            cache.get("missing");

            JLayerCacheStats stats = cache.getStats();
            log.info("stats: {}", stats);
            assertThat(stats.getHits()).isEqualTo(1);
            assertThat(stats.getMisses()).isEqualTo(1);
            assertThat(stats.getHitRate()).isEqualTo(50.0);
            assertThat(stats.getL1().getSize()).isEqualTo(1);
            assertThat(stats.getL2().isConnected()).isTrue();

            cache.resetStats();
            assertThat(cache.getStats().getHits()).isZero();
            assertThat(cache.getStats().getTotalOperations()).isZero();
        }

        @Test
        @DisplayName("健康检查反映 Redis 状态")
        void healthCheck() {
            HealthStatus healthy = cache.healthCheck();
            assertThat(healthy.isHealthy()).isTrue();
            assertThat(healthy.isL1Healthy()).isTrue();

            redis.setAvailable(false);
            HealthStatus degraded = cache.healthCheck();
            assertThat(degraded.isHealthy()).isFalse();
            assertThat(degraded.isL1Healthy()).isTrue();
            assertThat(degraded.isL2Connected()).isFalse();
        }

        @Test
        @DisplayName("close 释放 L1")
        void closeReleasesL1() {
            cache.set("k", "v");
            cache.close();
            assertThat(l1.estimatedSize()).isZero();
        }
    }

    @Nested
    @DisplayName("经由 Redisson 与 JSON 编解码的类型还原")
    class TypedValues {

        private final Map<String, String> remote = new ConcurrentHashMap<>();
        private JLayerCacheImpl typedCache;

        @BeforeEach
        void setUp() {
            RedissonClient redisson = mock(RedissonClient.class);
            doAnswer(invocation -> remoteBucket(invocation.getArgument(0)))
                    .when(redisson).getBucket(anyString(), any(Codec.class));
            JsonValueCodec codec = new JsonValueCodec(new ObjectMapper(), List.of());
            RedissonRedisClient redisClient = new RedissonRedisClient(redisson, codec,
                    Duration.ofHours(1), 2, Duration.ofSeconds(5));
            ResolvedJLayerCacheConfig config = ResolvedJLayerCacheConfig.builder()
                    .namespace("app")
                    .memoryMaxSize(100)
                    .memoryTtl(Duration.ofMinutes(5))
                    .redisTtl(Duration.ofHours(1))
                    .scanCount(2)
                    .build();
            typedCache = new JLayerCacheImpl(redisClient, l1, config, Runnable::run);
        }

        @SuppressWarnings("unchecked")
        private RBucket<String> remoteBucket(String key) {
            RBucket<String> bucket = mock(RBucket.class);
            when(bucket.get()).thenAnswer(invocation -> remote.get(key));
            doAnswer(invocation -> {
                remote.put(key, invocation.getArgument(0));
                return null;
            }).when(bucket).set(anyString(), any(Duration.class));
            return bucket;
        }

        @Test
        @DisplayName("L1 被清空后，按类型读取仍得到原类型并回填 L1")
        void typedGetAfterL1Eviction() {
            assertThat(typedCache.set("user:1", new User(1L, "ann"))).isTrue();
            assertThat(remote).containsKey("app:user:1");
            l1.invalidateAll();

            User user = typedCache.get("user:1", User.class);

            assertThat(user).isEqualTo(new User(1L, "ann"));
            assertThat(l1.getIfPresent("app:user:1").getValue()).isInstanceOf(User.class);
        }

        @Test
        @DisplayName("不受信任的类型按无类型读取得到 Map，之后按类型读取会替换 L1 中的 Map")
        void typedGetReplacesUntypedBackFill() {
            typedCache.set("user:2", new User(2L, "bob"));
            l1.invalidateAll();

            Object raw = typedCache.get("user:2");
            assertThat(raw).isInstanceOf(Map.class);

            assertThat(typedCache.get("user:2", User.class)).isEqualTo(new User(2L, "bob"));
            assertThat(l1.getIfPresent("app:user:2").getValue()).isInstanceOf(User.class);
        }

        @Test
        @DisplayName("带类型的包装函数在 L1 失效后不回源，也不抛 ClassCastException")
        void typedCachedFunction() {
            AtomicInteger calls = new AtomicInteger();
            Function<Long, User> findUser = JLayerCacheFunctions.cached(typedCache,
                    id -> "user:" + id,
                    id -> {
                        calls.incrementAndGet();
                        return new User(id, "ann");
                    },
                    User.class,
                    null);

            assertThat(findUser.apply(1L).getName()).isEqualTo("ann");
            l1.invalidateAll();
            assertThat(findUser.apply(1L)).isEqualTo(new User(1L, "ann"));
            assertThat(calls).hasValue(1);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class User {
        private Long id;
        private String name;
    }
}
