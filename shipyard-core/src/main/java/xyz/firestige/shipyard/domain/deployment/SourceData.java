package xyz.firestige.shipyard.domain.deployment;

import java.util.Objects;

/**
 * 部署源数据（git 引用、归档包、compose 文件等）
 * <p>
 * 对核心不透明，晋升与重新部署时原样复制
 */
public record SourceData(String kind, String data) {

    public SourceData {
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("source kind 不能为空");
        }
        Objects.requireNonNull(data, "data cannot be null");
    }
}
