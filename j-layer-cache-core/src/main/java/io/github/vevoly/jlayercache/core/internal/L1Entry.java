package io.github.vevoly.jlayercache.core.internal;

import lombok.Value;

/**
 * L1 中保存的条目：值本身以及它自己的 TTL。
 * <p>
 * An L1 entry: the value and its own TTL.
 *
 * @author vevoly
 */
@Value
public class L1Entry {

    Object value;

    /** 存活时间（纳秒）/ time to live (nanos) */
    long ttlNanos;
}
