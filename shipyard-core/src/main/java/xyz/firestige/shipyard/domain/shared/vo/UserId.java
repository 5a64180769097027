package xyz.firestige.shipyard.domain.shared.vo;

import java.util.Objects;

/**
 * 用户 ID 值对象
 * <p>
 * 命令发起人的身份，由请求上下文提供，核心不做认证
 */
public final class UserId {

    private final String value;

    private UserId(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("userId 不能为空");
        }
        this.value = value;
    }

    public static UserId of(String value) {
        return new UserId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserId userId = (UserId) o;
        return Objects.equals(value, userId.value);
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
