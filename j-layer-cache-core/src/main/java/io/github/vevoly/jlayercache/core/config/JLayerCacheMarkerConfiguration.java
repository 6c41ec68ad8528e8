package io.github.vevoly.jlayercache.core.config;

/**
 * 这是一个标记 Bean，用于保存 @EnableJLayerCache 注解中的配置信息。
 * 它的存在同时也标志着用户启用了该框架。
 * <p>
 * Marker bean holding the attributes of {@code @EnableJLayerCache}; its presence means the framework is enabled.
 *
 * @author vevoly
 */
public class JLayerCacheMarkerConfiguration {

    private boolean warmup = true;

    public boolean isWarmup() {
        return warmup;
    }

    public void setWarmup(boolean warmup) {
        this.warmup = warmup;
    }
}
