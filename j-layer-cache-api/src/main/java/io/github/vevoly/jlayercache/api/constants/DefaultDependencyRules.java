package io.github.vevoly.jlayercache.api.constants;

import io.github.vevoly.jlayercache.api.structure.DependencyRule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 框架内置的标签依赖表。
 * <p>
 * Built-in tag dependency table.
 *
 * @author vevoly
 */
public final class DefaultDependencyRules {

    public static final String USER = "user";
    public static final String POST = "post";
    public static final String PRODUCT = "product";
    public static final String ORDER = "order";

    private DefaultDependencyRules() {
    }

    /**
     * 返回一份新的可修改副本，按 user、post、product、order 的顺序排列。
     * <p>
     * Returns a fresh, mutable copy ordered user, post, product, order.
     */
    public static Map<String, DependencyRule> defaults() {
        Map<String, DependencyRule> rules = new LinkedHashMap<>();
        rules.put(USER, DependencyRule.builder()
                .tag(USER)
                .trigger("user:update").trigger("user:delete")
                .dependency("user:profile").dependency("user:preferences").dependency("user:permissions")
                .cascading(true)
                .build());
        rules.put(POST, DependencyRule.builder()
                .tag(POST)
                .trigger("post:create").trigger("post:update").trigger("post:delete")
                .dependency("post:list").dependency("post:category").dependency("post:author")
                .cascading(true)
                .build());
        rules.put(PRODUCT, DependencyRule.builder()
                .tag(PRODUCT)
                .trigger("product:update").trigger("product:delete").trigger("inventory:update")
                .dependency("product:list").dependency("product:category").dependency("product:search")
                .cascading(true)
                .build());
        rules.put(ORDER, DependencyRule.builder()
                .tag(ORDER)
                .trigger("order:create").trigger("order:update").trigger("order:status")
                .dependency("order:user").dependency("order:summary").dependency("analytics:sales")
                .cascading(false)
                .build());
        return rules;
    }
}
