package io.github.vevoly.jlayercache.api.structure;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 系统数据发生变更的通知，例如 {@code post:update}。
 * <p>
 * Notification that a record of the system of record changed, e.g. {@code post:update}.
 * Built through {@link #of}, so the payload is never {@code null}.
 *
 * @author vevoly
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DataChangeEvent {

    String entity;
    String operation;
    DataChangePayload payload;

    public static DataChangeEvent of(String entity, String operation, DataChangePayload payload) {
        return new DataChangeEvent(entity, operation, payload == null ? DataChangePayload.EMPTY : payload);
    }

    public String trigger() {
        return entity + ":" + operation;
    }
}
