package io.github.vevoly.jlayercache.core.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.vevoly.jlayercache.api.exception.SerializationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("JSON 值编解码")
class JsonValueCodecTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final JsonValueCodec trusting = new JsonValueCodec(mapper, List.of("io.github.vevoly.jlayercache.core.codec"));
    private final JsonValueCodec strict = new JsonValueCodec(mapper, List.of());

    @Test
    @DisplayName("JDK 类型还原为原始类型")
    void jdkTypesKeepTheirType() {
        assertEquals(7L, trusting.decode(trusting.encode(7L)));
        assertThat((BigDecimal) trusting.decode(trusting.encode(new BigDecimal("19.90")))).isEqualByComparingTo("19.9");
        assertEquals(LocalDate.of(2024, 2, 29), trusting.decode(trusting.encode(LocalDate.of(2024, 2, 29))));
        assertEquals("text", trusting.decode(trusting.encode("text")));
    }

    @Test
    @DisplayName("不可变集合按接口类型还原")
    void collectionsDecodeAsInterfaces() {
        Object list = trusting.decode(trusting.encode(List.of("a", "b")));
        Object set = trusting.decode(trusting.encode(Set.of(1)));
        Object map = trusting.decode(trusting.encode(Map.of("uid", 1)));

        assertThat(list).isInstanceOf(List.class).isEqualTo(List.of("a", "b"));
        assertThat(set).isInstanceOf(Set.class);
        assertThat(map).isInstanceOf(Map.class).isEqualTo(Map.of("uid", 1));
    }

    @Test
    @DisplayName("受信任包下的类型还原为对象，否则还原为 Map")
    void trustedPackagesOnly() {
        String json = trusting.encode(new Profile("alice", 30));

        assertThat(trusting.decode(json)).isEqualTo(new Profile("alice", 30));
        assertThat(strict.decode(json)).isInstanceOf(Map.class);
    }

    @Test
    @DisplayName("不带类型信息的 JSON 按普通结构解码")
    void plainJson() {
        assertThat(strict.decode("{\"a\":1}")).isEqualTo(Map.of("a", 1));
        assertThat(strict.decode("[1,2]")).isEqualTo(List.of(1, 2));
    }

    @Test
    @DisplayName("非法 JSON 抛出 SerializationException")
    void malformedJson() {
        assertThrows(SerializationException.class, () -> strict.decode("{oops"));
    }

    @Test
    @DisplayName("convert 把 Map 转为目标类型")
    void convert() {
        Object decoded = strict.decode(trusting.encode(new Profile("bob", 40)));

        Profile profile = strict.convert(decoded, Profile.class);

        assertThat(profile.getName()).isEqualTo("bob");
        assertThat(strict.convert(null, Profile.class)).isNull();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Profile {
        private String name;
        private int age;
    }
}
