package xyz.firestige.shipyard.domain.deployment;

import xyz.firestige.shipyard.domain.deployment.exception.DeploymentNotFoundException;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

import java.util.Objects;

/**
 * 部署标识：应用 ID + 部署编号
 */
public final class DeploymentId {

    private final AppId appId;
    private final DeploymentNumber number;

    private DeploymentId(AppId appId, DeploymentNumber number) {
        this.appId = Objects.requireNonNull(appId, "appId cannot be null");
        this.number = Objects.requireNonNull(number, "number cannot be null");
    }

    public static DeploymentId of(AppId appId, DeploymentNumber number) {
        return new DeploymentId(appId, number);
    }

    public static DeploymentId of(AppId appId, int number) {
        return new DeploymentId(appId, DeploymentNumber.of(number));
    }

    /**
     * 解析命令中的编号，非法编号视为部署不存在
     */
    public static DeploymentId resolve(AppId appId, int number) {
        return DeploymentNumber.tryOf(number)
                .map(n -> new DeploymentId(appId, n))
                .orElseThrow(() -> new DeploymentNotFoundException(appId, number));
    }

    public AppId getAppId() {
        return appId;
    }

    public DeploymentNumber getNumber() {
        return number;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentId that = (DeploymentId) o;
        return appId.equals(that.appId) && number.equals(that.number);
    }

    @Override
    public int hashCode() {
        return Objects.hash(appId, number);
    }

    @Override
    public String toString() {
        return appId + "#" + number;
    }
}
