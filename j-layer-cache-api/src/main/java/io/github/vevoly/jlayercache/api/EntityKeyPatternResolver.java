package io.github.vevoly.jlayercache.api;

import io.github.vevoly.jlayercache.api.structure.DataChangeEvent;
import io.github.vevoly.jlayercache.api.structure.InvalidationPattern;

import java.util.List;

/**
 * 根据数据变更事件推导需要失效的 key 模式（详情 key、列表 key、外键维度的 key）。
 * <p>
 * Derives the key patterns to invalidate for a data change: detail keys, list keys and
 * foreign-key scoped keys.
 *
 * @author vevoly
 */
@FunctionalInterface
public interface EntityKeyPatternResolver {

    List<InvalidationPattern> resolve(DataChangeEvent event);
}
