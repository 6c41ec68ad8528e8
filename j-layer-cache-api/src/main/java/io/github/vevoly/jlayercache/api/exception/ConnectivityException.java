package io.github.vevoly.jlayercache.api.exception;

/**
 * 远程存储不可达。只会从计数器操作和显式的 connect() 中抛出，其他操作会静默降级。
 * <p>
 * The remote store is unreachable. Only thrown by counter operations and an explicit connect();
 * every other operation degrades silently.
 *
 * @author vevoly
 */
public class ConnectivityException extends JLayerCacheException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
