package io.github.vevoly.jlayercache.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.vevoly.jlayercache.api.exception.SerializationException;
import org.apache.commons.lang3.ClassUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 缓存值的 JSON 编解码器。
 * <p>
 * 值会被包装为 {@code {"@class": "...", "v": ...}}，解码时只有受信任包下的类型会被还原，
 * 其他类型（以及不带类型信息的普通 JSON）解码为 Map / List / 基本类型。
 * <p>
 * JSON codec for cached values. A value is wrapped as {@code {"@class": "...", "v": ...}}. On decode only
 * types under trusted packages are restored; anything else, including plain JSON without type information,
 * decodes to Map / List / scalar values.
 *
 * @author vevoly
 */
public class JsonValueCodec {

    static final String CLASS_FIELD = "@class";
    static final String VALUE_FIELD = "v";

    private static final List<String> BUILT_IN_TRUSTED = List.of("java.lang.", "java.util.", "java.time.", "java.math.");

    private final ObjectMapper objectMapper;
    private final List<String> trustedPackages;

    public JsonValueCodec(ObjectMapper objectMapper, Collection<String> trustedPackages) {
        this.objectMapper = objectMapper;
        List<String> packages = new ArrayList<>(BUILT_IN_TRUSTED);
        if (trustedPackages != null) {
            trustedPackages.stream()
                    .map(p -> p.endsWith(".") ? p : p + ".")
                    .forEach(packages::add);
        }
        this.trustedPackages = List.copyOf(packages);
    }

    /**
     * 编码为 JSON 字符串。
     * <p>
     * Encodes a value into a JSON string.
     *
     * @throws SerializationException 无法序列化 / the value cannot be serialized
     */
    public String encode(Object value) {
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put(CLASS_FIELD, typeName(value));
            envelope.set(VALUE_FIELD, objectMapper.valueToTree(value));
            return objectMapper.writeValueAsString(envelope);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new SerializationException("Cannot encode value of type " + value.getClass().getName(), e);
        }
    }

    /**
     * 从 JSON 字符串解码。
     * <p>
     * Decodes a JSON string.
     *
     * @throws SerializationException 不是合法的 JSON，或与记录的类型不匹配 / malformed JSON or a type mismatch
     */
    public Object decode(String json) {
        if (json == null) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node.isObject() && node.size() == 2 && node.hasNonNull(CLASS_FIELD) && node.has(VALUE_FIELD)) {
                return restore(node.get(CLASS_FIELD).asText(), node.get(VALUE_FIELD));
            }
            return objectMapper.treeToValue(node, Object.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializationException("Cannot decode cached value", e);
        }
    }

    /**
     * 把已解码的值转换为指定类型。
     * <p>
     * Converts a decoded value into the requested type.
     */
    public <T> T convert(Object value, Class<T> type) {
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Cannot convert cached value to " + type.getName(), e);
        }
    }

    private Object restore(String className, JsonNode value) throws JsonProcessingException {
        if (isTrusted(className)) {
            try {
                Class<?> type = ClassUtils.getClass(Thread.currentThread().getContextClassLoader(), className);
                return objectMapper.treeToValue(value, type);
            } catch (ClassNotFoundException e) {
                // 类型已不存在时按普通 JSON 解码 / the type is gone, decode as plain JSON
                return objectMapper.treeToValue(value, Object.class);
            }
        }
        return objectMapper.treeToValue(value, Object.class);
    }

    private boolean isTrusted(String className) {
        return trustedPackages.stream().anyMatch(className::startsWith);
    }

    private String typeName(Object value) {
        // 集合类型记录为接口，避免还原 List.of() 之类没有默认构造器的实现
        if (value instanceof List) {
            return List.class.getName();
        }
        if (value instanceof Set) {
            return Set.class.getName();
        }
        if (value instanceof Map) {
            return Map.class.getName();
        }
        return value.getClass().getName();
    }
}
