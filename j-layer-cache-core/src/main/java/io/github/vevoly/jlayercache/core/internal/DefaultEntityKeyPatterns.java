package io.github.vevoly.jlayercache.core.internal;

import io.github.vevoly.jlayercache.api.EntityKeyPatternResolver;
import io.github.vevoly.jlayercache.api.structure.DataChangeEvent;
import io.github.vevoly.jlayercache.api.structure.DataChangePayload;
import io.github.vevoly.jlayercache.api.structure.InvalidationPattern;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.vevoly.jlayercache.api.constants.DefaultDependencyRules.*;

/**
 * 内置实体（user、post、product、order）的 key 模式。缺失的标识字段对应的模式会被跳过。
 * <p>
 * Key patterns of the built-in entities (user, post, product, order). Patterns whose identifying field is
 * missing from the payload are skipped.
 *
 * @author vevoly
 */
public class DefaultEntityKeyPatterns implements EntityKeyPatternResolver {

    @Override
    public List<InvalidationPattern> resolve(DataChangeEvent event) {
        DataChangePayload payload = ObjectUtils.defaultIfNull(event.getPayload(), DataChangePayload.EMPTY);
        List<String> globs = new ArrayList<>();
        switch (StringUtils.defaultString(event.getEntity())) {
            case USER:
                if (StringUtils.isNotBlank(payload.getId())) {
                    globs.add("user:" + payload.getId() + ":*");
                    globs.add("user:profile:" + payload.getId());
                    globs.add("user:preferences:" + payload.getId());
                    globs.add("user:permissions:" + payload.getId());
                }
                if ("delete".equals(event.getOperation())) {
                    globs.add("user:list:*");
                }
                break;
            case POST:
                if (StringUtils.isNotBlank(payload.getId())) {
                    globs.add("post:" + payload.getId() + ":*");
                }
                globs.add("post:list:*");
                if (StringUtils.isNotBlank(payload.getCategory())) {
                    globs.add("post:category:" + payload.getCategory() + ":*");
                }
                if (StringUtils.isNotBlank(payload.getAuthorId())) {
                    globs.add("post:author:" + payload.getAuthorId() + ":*");
                }
                break;
            case PRODUCT:
                if (StringUtils.isNotBlank(payload.getId())) {
                    globs.add("product:" + payload.getId() + ":*");
                }
                globs.add("product:list:*");
                globs.add("product:search:*");
                if (StringUtils.isNotBlank(payload.getCategory())) {
                    globs.add("product:category:" + payload.getCategory() + ":*");
                }
                break;
            case ORDER:
                if (StringUtils.isNotBlank(payload.getId())) {
                    globs.add("order:" + payload.getId() + ":*");
                }
                if (StringUtils.isNotBlank(payload.getUserId())) {
                    globs.add("order:user:" + payload.getUserId() + ":*");
                }
                globs.add("analytics:sales:*");
                break;
            default:
                return Collections.emptyList();
        }
        List<InvalidationPattern> patterns = new ArrayList<>(globs.size());
        globs.forEach(glob -> patterns.add(InvalidationPattern.glob(glob)));
        return patterns;
    }
}
