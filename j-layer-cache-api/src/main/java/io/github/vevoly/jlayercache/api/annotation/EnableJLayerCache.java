package io.github.vevoly.jlayercache.api.annotation;

import io.github.vevoly.jlayercache.api.config.JLayerCacheImportsSelector;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * 启用 j-layer-cache 框架的核心功能。
 * 将此注解添加到您的主应用类 (带有 @SpringBootApplication 的类) 上。
 * <p>
 * Enables the core functionalities of the j-layer-cache framework.
 * Add this annotation to your main application class (the one with @SpringBootApplication).
 *
 * @author vevoly
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import(JLayerCacheImportsSelector.class)
public @interface EnableJLayerCache {

    /**
     * 是否在启动时执行缓存预热。
     * 如果设置为 false，即使配置了预热策略，框架也不会在启动时执行。
     * <p>
     * Whether to run the cache warmup on startup.
     * If set to false, no warmup runs on startup even if strategies are configured.
     */
    boolean warmup() default true;
}
