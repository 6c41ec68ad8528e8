package io.github.vevoly.jlayercache.core.config;

import io.github.vevoly.jlayercache.api.annotation.EnableJLayerCache;
import org.springframework.beans.factory.support.BeanDefinitionBuilder;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.context.annotation.ImportBeanDefinitionRegistrar;
import org.springframework.core.annotation.AnnotationAttributes;
import org.springframework.core.type.AnnotationMetadata;

import static io.github.vevoly.jlayercache.api.constants.JLayerCacheConstants.WARMUP_ATTRIBUTE_NAME;

/**
 * 这个类负责解析 @EnableJLayerCache 注解，并将 JLayerCacheMarkerConfiguration 注册到 Spring 容器中
 * @author vevoly
 */
public class JLayerCacheEnableRegistrar implements ImportBeanDefinitionRegistrar {

    @Override
    public void registerBeanDefinitions(AnnotationMetadata importingClassMetadata, BeanDefinitionRegistry registry) {
        // 1. 获取注解属性
        AnnotationAttributes attributes = AnnotationAttributes.fromMap(
                importingClassMetadata.getAnnotationAttributes(EnableJLayerCache.class.getName())
        );

        if (attributes != null) {
            boolean warmup = attributes.getBoolean(WARMUP_ATTRIBUTE_NAME);

            // 2. 构建 Marker Bean 定义
            BeanDefinitionBuilder builder = BeanDefinitionBuilder.rootBeanDefinition(JLayerCacheMarkerConfiguration.class);
            builder.addPropertyValue(WARMUP_ATTRIBUTE_NAME, warmup);

            // 3. 注册到 Spring 容器
            registry.registerBeanDefinition(JLayerCacheMarkerConfiguration.class.getName(), builder.getBeanDefinition());
        }
    }
}
