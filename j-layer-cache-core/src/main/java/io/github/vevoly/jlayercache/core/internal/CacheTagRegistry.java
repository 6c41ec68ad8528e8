package io.github.vevoly.jlayercache.core.internal;

import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * 进程内的标签 → key 索引。只记录成员关系，不持有缓存条目的生命周期；标签被清空后保留为空集合，可再次使用。
 * <p>
 * In-process tag to key index. It tracks membership only and never owns entry lifetime; an emptied tag stays
 * registered as an empty set and can be repopulated.
 *
 * @author vevoly
 */
class CacheTagRegistry {

    private final ConcurrentMap<String, Set<TaggedKey>> index = new ConcurrentHashMap<>();

    void associate(String tag, TaggedKey key) {
        index.computeIfAbsent(tag, t -> ConcurrentHashMap.newKeySet()).add(key);
    }

    Set<TaggedKey> snapshot(String tag) {
        Set<TaggedKey> keys = index.get(tag);
        return keys == null ? Collections.emptySet() : new HashSet<>(keys);
    }

    /**
     * 只移除给定的快照，失效过程中新关联的 key 会保留下来。
     * <p>
     * Removes only the given snapshot; keys associated while the invalidation ran are kept.
     */
    void removeAll(String tag, Collection<TaggedKey> keys) {
        Set<TaggedKey> current = index.get(tag);
        if (current != null) {
            current.removeAll(keys);
        }
    }

    Set<String> keysOf(String tag) {
        return snapshot(tag).stream().map(TaggedKey::getKey).collect(Collectors.toSet());
    }

    /**
     * 标签下关联的一个缓存 key，连同写入时使用的命名空间。
     * <p>
     * A cache key associated with a tag, with the namespace it was written under.
     */
    @Value
    static class TaggedKey {
        String namespace;
        String key;
    }
}
