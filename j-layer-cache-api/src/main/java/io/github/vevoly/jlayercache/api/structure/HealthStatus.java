package io.github.vevoly.jlayercache.api.structure;

import lombok.Builder;
import lombok.Value;

/**
 * 两级缓存的健康状态。
 * <p>
 * Health of both tiers.
 *
 * @author vevoly
 */
@Value
@Builder
public class HealthStatus {
    boolean healthy;
    boolean l1Healthy;
    long l1Size;
    boolean l2Healthy;
    boolean l2Connected;
}
