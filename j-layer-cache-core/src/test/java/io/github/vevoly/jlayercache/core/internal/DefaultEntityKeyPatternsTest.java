package io.github.vevoly.jlayercache.core.internal;

import io.github.vevoly.jlayercache.api.structure.DataChangeEvent;
import io.github.vevoly.jlayercache.api.structure.DataChangePayload;
import io.github.vevoly.jlayercache.api.structure.InvalidationPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("内置实体 key 模式")
class DefaultEntityKeyPatternsTest {

    private final DefaultEntityKeyPatterns resolver = new DefaultEntityKeyPatterns();

    private List<String> globs(String entity, String operation, DataChangePayload payload) {
        return resolver.resolve(DataChangeEvent.of(entity, operation, payload)).stream()
                .map(InvalidationPattern::getGlob)
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("用户删除时额外清除用户列表")
    void userDelete() {
        assertThat(globs("user", "update", DataChangePayload.ofId("42")))
                .containsExactly("user:42:*", "user:profile:42", "user:preferences:42", "user:permissions:42");
        assertThat(globs("user", "delete", DataChangePayload.ofId("42"))).contains("user:list:*");
    }

    @Test
    @DisplayName("缺少的字段对应的模式被跳过")
    void missingFieldsSkipped() {
        assertThat(globs("post", "create", DataChangePayload.EMPTY)).containsExactly("post:list:*");
        assertThat(globs("post", "update", DataChangePayload.builder().id("5").authorId("9").build()))
                .containsExactly("post:5:*", "post:list:*", "post:author:9:*");
    }

    @Test
    @DisplayName("订单事件清除用户订单与销售统计")
    void order() {
        assertThat(globs("order", "status", DataChangePayload.builder().id("1").userId("7").build()))
                .containsExactly("order:1:*", "order:user:7:*", "analytics:sales:*");
    }

    @Test
    @DisplayName("未知实体没有模式")
    void unknownEntity() {
        assertThat(globs("invoice", "create", DataChangePayload.ofId("1"))).isEmpty();
    }
}
