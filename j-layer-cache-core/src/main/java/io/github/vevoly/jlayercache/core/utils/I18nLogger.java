package io.github.vevoly.jlayercache.core.utils;

import org.slf4j.Logger;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * 一个用于支持国际化 (i18n) 日志输出的辅助类。
 * <p>
 * 日志代码中使用语言无关的键，消息模板根据当前 Locale 从 {@code i18n/jlayercache_messages*.properties} 中加载，
 * 参数按 {@link MessageFormat} 格式化。
 * <p>
 * A helper class for internationalized log output. Logging code uses language-neutral keys; the message
 * templates are loaded from {@code i18n/jlayercache_messages*.properties} for the current locale and the
 * arguments are formatted with {@link MessageFormat}.
 *
 * @author vevoly
 */
public class I18nLogger {

    private static final String BUNDLE_BASE_NAME = "i18n.jlayercache_messages";

    private final Logger slf4jLogger;
    private final ResourceBundle resourceBundle;

    public I18nLogger(Logger slf4jLogger) {
        this.slf4jLogger = slf4jLogger;
        ResourceBundle bundle = null;
        try {
            bundle = ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.getDefault(), I18nLogger.class.getClassLoader());
        } catch (MissingResourceException e) {
            // 找不到资源文件时输出原始 key / without the bundle the raw key is logged
            slf4jLogger.warn("Could not find i18n resource bundle with base name '{}'. Internationalized logging will be disabled.", BUNDLE_BASE_NAME);
        }
        this.resourceBundle = bundle;
    }

    public void debug(String key, Object... args) {
        if (slf4jLogger.isDebugEnabled()) {
            slf4jLogger.debug(format(key, args));
        }
    }

    /**
     * 以 INFO 级别记录一条国际化日志。
     * <p>
     * Logs an internationalized message at the INFO level.
     *
     * @param key  资源文件中的消息键。/ The message key in the resource file.
     * @param args 用于格式化消息的可选参数。/ Optional arguments for formatting the message.
     */
    public void info(String key, Object... args) {
        if (slf4jLogger.isInfoEnabled()) {
            slf4jLogger.info(format(key, args));
        }
    }

    /**
     * 以 WARN 级别记录一条国际化日志。
     * <p>
     * Logs an internationalized message at the WARN level.
     */
    public void warn(String key, Object... args) {
        if (slf4jLogger.isWarnEnabled()) {
            slf4jLogger.warn(format(key, args));
        }
    }

    /**
     * 以 ERROR 级别记录一条带异常信息的国际化日志。
     * <p>
     * Logs an internationalized message with an exception at the ERROR level.
     */
    public void error(String key, Throwable t, Object... args) {
        if (slf4jLogger.isErrorEnabled()) {
            slf4jLogger.error(format(key, args), t);
        }
    }

    String format(String key, Object... args) {
        if (resourceBundle == null) {
            return "[i18n disabled] " + key;
        }
        try {
            return MessageFormat.format(resourceBundle.getString(key), args);
        } catch (MissingResourceException e) {
            return "!!! LOG KEY NOT FOUND: " + key + " !!!";
        } catch (IllegalArgumentException e) {
            return "!!! LOG FORMATTING ERROR for key: " + key + " !!!";
        }
    }
}
