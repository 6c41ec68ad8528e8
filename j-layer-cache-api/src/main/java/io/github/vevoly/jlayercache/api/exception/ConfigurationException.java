package io.github.vevoly.jlayercache.api.exception;

/**
 * 配置非法，在启动阶段抛出，阻止容器启动。
 * <p>
 * Invalid configuration, raised at startup so the context fails fast.
 *
 * @author vevoly
 */
public class ConfigurationException extends JLayerCacheException {

    public ConfigurationException(String message) {
        super(message);
    }
}
