package xyz.firestige.shipyard.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * 应用（App） ID 值对象
 * <p>
 * 聚合间只通过 ID 引用，不直接持有对方对象
 * <p>
 * 格式：app-{uuid}
 */
public final class AppId {

    private static final String PREFIX = "app-";

    private final String value;

    private AppId(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("appId 不能为空");
        }
        this.value = value;
    }

    /**
     * 由已有值创建（带验证）
     */
    public static AppId of(String value) {
        return new AppId(value);
    }

    /**
     * 生成新的 ID
     */
    public static AppId generate() {
        return new AppId(PREFIX + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AppId that = (AppId) o;
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
