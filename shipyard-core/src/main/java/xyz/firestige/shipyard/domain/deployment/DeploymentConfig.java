package xyz.firestige.shipyard.domain.deployment;

import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

import java.util.Map;
import java.util.Objects;

/**
 * 部署配置快照
 * <p>
 * 创建部署时从应用当前的环境配置复制，之后应用配置的任何变更都不会影响已有部署
 */
public final class DeploymentConfig {

    private final AppId appId;
    private final AppName appName;
    private final Environment environment;
    private final EnvironmentConfig environmentConfig;

    private DeploymentConfig(AppId appId, AppName appName, Environment environment, EnvironmentConfig environmentConfig) {
        this.appId = Objects.requireNonNull(appId, "appId cannot be null");
        this.appName = Objects.requireNonNull(appName, "appName cannot be null");
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.environmentConfig = Objects.requireNonNull(environmentConfig, "environmentConfig cannot be null");
    }

    public static DeploymentConfig snapshot(AppId appId, AppName appName, Environment environment, EnvironmentConfig environmentConfig) {
        return new DeploymentConfig(appId, appName, environment, environmentConfig);
    }

    public AppId getAppId() {
        return appId;
    }

    public AppName getAppName() {
        return appName;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public TargetId getTarget() {
        return environmentConfig.getTarget();
    }

    public Map<String, Map<String, String>> getVars() {
        return environmentConfig.getVars();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentConfig that = (DeploymentConfig) o;
        return appId.equals(that.appId)
                && appName.equals(that.appName)
                && environment == that.environment
                && environmentConfig.equals(that.environmentConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(appId, appName, environment, environmentConfig);
    }

    @Override
    public String toString() {
        return "DeploymentConfig{" +
                "appName=" + appName +
                ", environment=" + environment +
                ", target=" + getTarget() +
                '}';
    }
}
