package io.github.vevoly.jlayercache.api.structure;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;

/**
 * 失效模式，三选一：通配符字符串、正则表达式、(key, value) 断言。
 * <p>
 * 通配符写的是业务 key，框架在前面加上命名空间后整体匹配，在 Redis 侧直接交给 SCAN MATCH；
 * 正则和断言作用于去掉命名空间后的业务 key。正则按查找语义匹配（{@link java.util.regex.Matcher#find()}），
 * 只要 key 中有一段匹配即可，需要整体匹配时请自行加上 {@code ^...$}。
 * <p>
 * An invalidation pattern, one of: a glob string, a regular expression or a (key, value) predicate.
 * A glob is written against the logical key; the namespace is prefixed and the whole key must match, on Redis
 * through SCAN MATCH. Regular expressions and predicates see the logical key with the namespace stripped.
 * A regular expression uses search semantics ({@link java.util.regex.Matcher#find()}): it matches when any part
 * of the key matches, so anchor it with {@code ^...$} for a whole-key match.
 * <p>
 * 断言拿到的值：L1 中是写入时的对象，L2 中是 JSON 解码结果（类型不受信任时为 Map / List）。
 * <p>
 * Values seen by a predicate are the stored objects for L1 entries and the decoded JSON for L2 entries
 * (Map / List when the type is not trusted).
 * <p>
 * 断言模式需要从 Redis 读回命名空间下的每一个值，代价为 O(keyspace)，不要在热路径上使用。
 * <p>
 * The predicate form must read back every value of the namespace from Redis, which costs
 * O(keyspace); keep it off hot paths.
 *
 * @author vevoly
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class InvalidationPattern {

    public enum Type {
        /** 精确 key 或通配符 (*, ?) / exact key or wildcard (*, ?) */
        GLOB,
        /** 正则表达式 / regular expression */
        REGEX,
        /** 断言 / predicate */
        PREDICATE
    }

    private final Type type;
    private final String glob;
    private final Pattern regex;
    @ToString.Exclude
    private final BiPredicate<String, Object> predicate;

    public static InvalidationPattern glob(String glob) {
        Objects.requireNonNull(glob, "glob");
        return new InvalidationPattern(Type.GLOB, glob, null, null);
    }

    public static InvalidationPattern regex(Pattern regex) {
        Objects.requireNonNull(regex, "regex");
        return new InvalidationPattern(Type.REGEX, null, regex, null);
    }

    public static InvalidationPattern regex(String regex) {
        return regex(Pattern.compile(regex));
    }

    public static InvalidationPattern predicate(BiPredicate<String, Object> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new InvalidationPattern(Type.PREDICATE, null, null, predicate);
    }
}
