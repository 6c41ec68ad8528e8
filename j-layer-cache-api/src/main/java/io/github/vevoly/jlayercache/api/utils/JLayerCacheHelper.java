package io.github.vevoly.jlayercache.api.utils;

import io.github.vevoly.jlayercache.api.constants.JLayerCacheConstants;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 框架对外提供的工具方法。
 * <p>
 * Public helper methods of the framework.
 *
 * @author vevoly
 */
public final class JLayerCacheHelper {

    private JLayerCacheHelper() {
    }

    /**
     * 构建缓存 key，空白部分会被忽略。
     * <p>
     * Builds a cache key; blank parts are skipped.
     * <pre>
     * buildKey("user", 42, "profile") = "user:42:profile"
     * </pre>
     */
    public static String buildKey(Object... parts) {
        if (parts == null || parts.length == 0) {
            return "";
        }
        return Arrays.stream(parts)
                .filter(Objects::nonNull)
                .map(String::valueOf)
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.joining(JLayerCacheConstants.KEY_SEPARATOR));
    }

    /**
     * 在业务 key 前加上命名空间。
     * <p>
     * Prefixes a logical key with the namespace.
     */
    public static String withNamespace(String namespace, String key) {
        if (StringUtils.isBlank(namespace)) {
            return key;
        }
        return namespace + JLayerCacheConstants.KEY_SEPARATOR + key;
    }

    /**
     * 去掉完整 key 上的命名空间前缀；前缀不匹配时返回 null。
     * <p>
     * Strips the namespace prefix of a full key; {@code null} when the prefix does not match.
     */
    public static String stripNamespace(String namespace, String fullKey) {
        if (StringUtils.isBlank(namespace)) {
            return fullKey;
        }
        String prefix = namespace + JLayerCacheConstants.KEY_SEPARATOR;
        return fullKey.startsWith(prefix) ? fullKey.substring(prefix.length()) : null;
    }

    /**
     * 是否包含通配符 (* 或 ?)。
     * <p>
     * Whether the pattern contains a wildcard (* or ?).
     */
    public static boolean isWildcard(String pattern) {
        return StringUtils.containsAny(pattern, '*', '?');
    }

    /**
     * 把 Redis 风格的通配符 (* 与 ?) 转换为整串匹配的正则，其余字符按字面量处理。
     * <p>
     * Translates a Redis style glob (* and ?) into a fully anchored regex; every other character is literal.
     */
    public static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.append('$').toString());
    }
}
