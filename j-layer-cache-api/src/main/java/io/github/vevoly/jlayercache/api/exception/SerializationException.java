package io.github.vevoly.jlayercache.api.exception;

/**
 * 缓存值编解码失败。由客户端内部捕获并视作未命中。
 * <p>
 * A cached value could not be encoded or decoded. Caught inside the client and treated as a miss.
 *
 * @author vevoly
 */
public class SerializationException extends JLayerCacheException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
