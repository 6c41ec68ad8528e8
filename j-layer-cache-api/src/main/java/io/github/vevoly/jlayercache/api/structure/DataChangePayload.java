package io.github.vevoly.jlayercache.api.structure;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 数据变更事件携带的标识字段。常用的外键字段是显式属性，其余放入 extras。
 * <p>
 * Identifying fields carried by a data-change event. Well known foreign keys are explicit
 * properties; anything else goes into {@code extras}.
 *
 * @author vevoly
 */
@Value
@Builder
public class DataChangePayload {

    public static final DataChangePayload EMPTY = DataChangePayload.builder().build();

    String id;
    String category;
    String authorId;
    String userId;

    @Singular
    Map<String, String> extras;

    public static DataChangePayload ofId(String id) {
        return DataChangePayload.builder().id(id).build();
    }
}
