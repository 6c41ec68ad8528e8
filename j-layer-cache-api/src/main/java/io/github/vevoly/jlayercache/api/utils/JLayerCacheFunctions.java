package io.github.vevoly.jlayercache.api.utils;

import io.github.vevoly.jlayercache.api.JLayerCache;
import io.github.vevoly.jlayercache.api.structure.JLayerCacheOptions;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 把普通函数包装为带缓存的函数（cache-aside）。
 * <p>
 * Wraps a plain function into a cached one (cache-aside).
 * <pre>
 * Function&lt;Long, User&gt; findUser = JLayerCacheFunctions.cached(cache,
 *         id -&gt; JLayerCacheHelper.buildKey("user", id), userRepository::findById, User.class, options);
 * </pre>
 * 不带 {@code resultType} 的版本返回 {@link JLayerCache#get(String)} 的原始结果，适合 JDK 类型或受信任包中的类型。
 * <p>
 * The variants without {@code resultType} return what {@link JLayerCache#get(String)} returns, which suits JDK
 * types and types under trusted packages.
 *
 * @author vevoly
 */
public final class JLayerCacheFunctions {

    private JLayerCacheFunctions() {
    }

    public static <A, R> Function<A, R> cached(JLayerCache cache,
                                               Function<? super A, String> keyGenerator,
                                               Function<? super A, ? extends R> operation,
                                               JLayerCacheOptions options) {
        return arg -> cache.getOrSet(keyGenerator.apply(arg), () -> operation.apply(arg), options);
    }

    public static <A, B, R> BiFunction<A, B, R> cached(JLayerCache cache,
                                                       BiFunction<? super A, ? super B, String> keyGenerator,
                                                       BiFunction<? super A, ? super B, ? extends R> operation,
                                                       JLayerCacheOptions options) {
        return (a, b) -> cache.getOrSet(keyGenerator.apply(a, b), () -> operation.apply(a, b), options);
    }

    public static <A, R> Function<A, R> cached(JLayerCache cache,
                                               Function<? super A, String> keyGenerator,
                                               Function<? super A, ? extends R> operation,
                                               Class<R> resultType,
                                               JLayerCacheOptions options) {
        return arg -> cache.getOrSet(keyGenerator.apply(arg), resultType, () -> operation.apply(arg), options);
    }

    public static <A, B, R> BiFunction<A, B, R> cached(JLayerCache cache,
                                                       BiFunction<? super A, ? super B, String> keyGenerator,
                                                       BiFunction<? super A, ? super B, ? extends R> operation,
                                                       Class<R> resultType,
                                                       JLayerCacheOptions options) {
        return (a, b) -> cache.getOrSet(keyGenerator.apply(a, b), resultType, () -> operation.apply(a, b), options);
    }
}
