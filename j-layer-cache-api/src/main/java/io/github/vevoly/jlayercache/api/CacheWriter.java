package io.github.vevoly.jlayercache.api;

/**
 * 向业务数据源（数据库等）写入数据的回调，用于 write-through / write-behind。
 * <p>
 * Callback that writes a value to the system of record, used by write-through and write-behind.
 *
 * @param <T> 值类型 / value type
 * @author vevoly
 */
@FunctionalInterface
public interface CacheWriter<T> {

    void write(T value) throws Exception;
}
