package xyz.firestige.shipyard.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * 目标（Target） ID 值对象
 * <p>
 * 聚合间只通过 ID 引用，不直接持有对方对象
 * <p>
 * 格式：target-{uuid}
 */
public final class TargetId {

    private static final String PREFIX = "target-";

    private final String value;

    private TargetId(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("targetId 不能为空");
        }
        this.value = value;
    }

    /**
     * 由已有值创建（带验证）
     */
    public static TargetId of(String value) {
        return new TargetId(value);
    }

    /**
     * 生成新的 ID
     */
    public static TargetId generate() {
        return new TargetId(PREFIX + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetId that = (TargetId) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
