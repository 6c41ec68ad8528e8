package io.github.vevoly.jlayercache.api.config;

import org.springframework.context.annotation.ImportSelector;
import org.springframework.core.type.AnnotationMetadata;

import static io.github.vevoly.jlayercache.api.constants.JLayerCacheConstants.REGISTRAR_CLASS_NAME;

/**
 * 用于导入 core 模块中的 JLayerCacheEnableRegistrar 类，避免 api 模块对 core 模块的编译期依赖。
 * 编译期只引用全限定类名，运行期只要 core 包在 classpath 下，就能正常加载。
 * <p>
 * Imports the JLayerCacheEnableRegistrar of the core module by name, so that the api module needs
 * no compile-time dependency on core.
 *
 * @author vevoly
 */
public class JLayerCacheImportsSelector implements ImportSelector {

    @Override
    public String[] selectImports(AnnotationMetadata importingClassMetadata) {
        return new String[]{REGISTRAR_CLASS_NAME};
    }
}
