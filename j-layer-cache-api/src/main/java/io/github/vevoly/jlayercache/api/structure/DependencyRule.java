package io.github.vevoly.jlayercache.api.structure;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 标签依赖规则：哪些数据变更事件会使该标签失效，以及失效时需要级联的下游标签。
 * <p>
 * A tag dependency rule: which data-change events invalidate the tag and which dependent
 * tags are invalidated along with it.
 *
 * @author vevoly
 */
@Value
@Builder
public class DependencyRule {

    /** 标签名 / tag name */
    String tag;

    /** 触发事件，格式为 entity:operation / trigger events in entity:operation form */
    @Singular
    List<String> triggers;

    /** 依赖的下游标签 / dependent tags */
    @Singular
    List<String> dependencies;

    /** 失效时是否级联下游标签 / whether invalidation cascades to the dependent tags */
    boolean cascading;

    public boolean isTriggeredBy(String entity, String operation) {
        return triggers.contains(entity + ":" + operation);
    }
}
