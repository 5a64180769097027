package xyz.firestige.shipyard.domain.target;

import xyz.firestige.shipyard.domain.target.exception.UrlAlreadyTakenException;

import java.util.Objects;

/**
 * URL 唯一性约束：候选 URL 与预先计算好的"是否唯一"事实
 */
public record TargetUrlRequirement(TargetUrl url, boolean unique) {

    public TargetUrlRequirement {
        Objects.requireNonNull(url, "url cannot be null");
    }

    /**
     * 约束满足时返回 URL，否则抛出 {@link UrlAlreadyTakenException}
     */
    public TargetUrl met() {
        if (!unique) {
            throw new UrlAlreadyTakenException(url.getValue());
        }
        return url;
    }
}
