package io.github.vevoly.jlayercache.api.exception;

/**
 * 框架所有异常的基类。
 * <p>
 * Base class of every exception raised by the framework.
 *
 * @author vevoly
 */
public class JLayerCacheException extends RuntimeException {

    public JLayerCacheException(String message) {
        super(message);
    }

    public JLayerCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
