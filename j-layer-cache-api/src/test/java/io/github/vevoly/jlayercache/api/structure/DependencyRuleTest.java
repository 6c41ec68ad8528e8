package io.github.vevoly.jlayercache.api.structure;

import io.github.vevoly.jlayercache.api.constants.DefaultDependencyRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("依赖规则")
class DependencyRuleTest {

    @Test
    @DisplayName("按 entity:operation 匹配触发器")
    void triggeredBy() {
        DependencyRule product = DefaultDependencyRules.defaults().get(DefaultDependencyRules.PRODUCT);

        assertThat(product.isTriggeredBy("inventory", "update")).isTrue();
        assertThat(product.isTriggeredBy("product", "create")).isFalse();
        assertThat(DataChangeEvent.of("inventory", "update", null).trigger()).isEqualTo("inventory:update");
        assertThat(DataChangeEvent.of("inventory", "update", null).getPayload()).isSameAs(DataChangePayload.EMPTY);
    }

    @Test
    @DisplayName("内置规则中只有 order 不级联")
    void defaultsCascade() {
        assertThat(DefaultDependencyRules.defaults().values())
                .filteredOn(rule -> !rule.isCascading())
                .extracting(DependencyRule::getTag)
                .containsExactly(DefaultDependencyRules.ORDER);
    }
}
