package xyz.firestige.shipyard.domain.deployment;

import java.util.Objects;
import java.util.Optional;

/**
 * 部署编号值对象
 * <p>
 * 每个应用从 1 开始严格递增，不跨应用共享
 */
public final class DeploymentNumber implements Comparable<DeploymentNumber> {

    private final int value;

    private DeploymentNumber(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("部署编号必须大于 0: " + value);
        }
        this.value = value;
    }

    public static DeploymentNumber of(int value) {
        return new DeploymentNumber(value);
    }

    /**
     * 外部输入的编号，小于 1 时为空
     */
    public static Optional<DeploymentNumber> tryOf(int value) {
        return value < 1 ? Optional.empty() : Optional.of(new DeploymentNumber(value));
    }

    public static DeploymentNumber first() {
        return new DeploymentNumber(1);
    }

    public DeploymentNumber next() {
        return new DeploymentNumber(value + 1);
    }

    public int getValue() {
        return value;
    }

    @Override
    public int compareTo(DeploymentNumber o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentNumber that = (DeploymentNumber) o;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
