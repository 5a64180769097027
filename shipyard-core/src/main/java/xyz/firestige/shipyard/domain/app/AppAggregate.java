package xyz.firestige.shipyard.domain.app;

import xyz.firestige.shipyard.domain.app.event.AppCleanupRequestedEvent;
import xyz.firestige.shipyard.domain.app.event.AppCreatedEvent;
import xyz.firestige.shipyard.domain.app.event.AppDeletedEvent;
import xyz.firestige.shipyard.domain.app.event.AppEnvironmentConfigChangedEvent;
import xyz.firestige.shipyard.domain.app.exception.AppCleanupNeededException;
import xyz.firestige.shipyard.domain.app.exception.AppCleanupRequestedException;
import xyz.firestige.shipyard.domain.app.exception.CouldNotPromoteProductionDeploymentException;
import xyz.firestige.shipyard.domain.deployment.DeploymentAggregate;
import xyz.firestige.shipyard.domain.deployment.DeploymentConfig;
import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.deployment.DeploymentNumber;
import xyz.firestige.shipyard.domain.deployment.SourceData;
import xyz.firestige.shipyard.domain.deployment.exception.DeploymentNotFoundException;
import xyz.firestige.shipyard.domain.shared.event.AggregateRoot;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.AuditStamp;
import xyz.firestige.shipyard.domain.shared.vo.UserId;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 应用聚合（App）
 * <p>
 * 职责：
 * 1. 维护每个环境到目标的绑定（经约束校验）
 * 2. 持有部署编号序列，是部署的唯一工厂
 * 3. 管理清理请求与删除
 * <p>
 * 不变式：同一应用的部署编号从 1 开始严格递增，无空洞无重复；
 * 编号只在应用被作为一个整体加载并保存时才安全。
 * 与目标、部署之间只通过 ID 引用。
 */
public class AppAggregate extends AggregateRoot {

    private final AppId appId;
    private final AppName name;
    private final Map<Environment, EnvironmentConfig> environments = new EnumMap<>(Environment.class);
    private DeploymentNumber latestDeployment;
    private AuditStamp cleanupRequested;
    private final AuditStamp created;
    private boolean deleted;

    private AppAggregate(AppId appId, AppName name, EnvironmentConfig production, EnvironmentConfig staging, AuditStamp created) {
        this.appId = appId;
        this.name = name;
        this.environments.put(Environment.PRODUCTION, production);
        this.environments.put(Environment.STAGING, staging);
        this.created = created;
    }

    /**
     * 创建应用，先校验生产环境再校验预发环境
     */
    public static AppAggregate create(AppName name,
                                      EnvironmentConfigRequirement production,
                                      EnvironmentConfigRequirement staging,
                                      UserId requestedBy) {
        EnvironmentConfig productionConfig = production.met();
        EnvironmentConfig stagingConfig = staging.met();

        AppAggregate app = new AppAggregate(AppId.generate(), name, productionConfig, stagingConfig, AuditStamp.now(requestedBy));
        app.addDomainEvent(new AppCreatedEvent(app.appId, name, productionConfig, stagingConfig, app.created));
        return app;
    }

    /**
     * 变更某个环境的配置，相同配置不产生事件
     */
    public void hasEnvironmentConfig(Environment environment, EnvironmentConfigRequirement requirement) {
        ensureNotCleanupRequested();

        EnvironmentConfig config = requirement.met();
        if (config.equals(environments.get(environment))) {
            return;
        }

        environments.put(environment, config);
        addDomainEvent(new AppEnvironmentConfigChangedEvent(appId, environment, config));
    }

    // ============================================
    // 部署工厂
    // ============================================

    /**
     * 分配下一个部署编号，并以该环境当前配置的快照创建部署
     */
    public DeploymentAggregate newDeployment(SourceData source, Environment environment, UserId requestedBy) {
        ensureNotCleanupRequested();

        DeploymentNumber number = latestDeployment == null ? DeploymentNumber.first() : latestDeployment.next();
        DeploymentConfig config = DeploymentConfig.snapshot(appId, name, environment, environments.get(environment));

        DeploymentAggregate deployment = DeploymentAggregate.queue(
                DeploymentId.of(appId, number), config, source, AuditStamp.now(requestedBy));
        this.latestDeployment = number;
        return deployment;
    }

    /**
     * 将预发部署晋升到生产环境，源数据原样复制
     */
    public DeploymentAggregate promote(DeploymentAggregate source, UserId requestedBy) {
        ensureOwned(source);
        if (source.getEnvironment() == Environment.PRODUCTION) {
            throw new CouldNotPromoteProductionDeploymentException(source.getDeploymentId());
        }
        return newDeployment(source.getSource(), Environment.PRODUCTION, requestedBy);
    }

    /**
     * 在原环境上重新部署
     */
    public DeploymentAggregate redeploy(DeploymentAggregate source, UserId requestedBy) {
        ensureOwned(source);
        return newDeployment(source.getSource(), source.getEnvironment(), requestedBy);
    }

    // ============================================
    // 清理
    // ============================================

    public void requestCleanup(UserId requestedBy) {
        if (cleanupRequested != null) {
            return;
        }
        this.cleanupRequested = AuditStamp.now(requestedBy);
        addDomainEvent(new AppCleanupRequestedEvent(appId, cleanupRequested));
    }

    /**
     * @param resourcesCleanedUp 所有环境上的应用资源是否都已回收
     */
    public void delete(boolean resourcesCleanedUp) {
        if (cleanupRequested == null || !resourcesCleanedUp) {
            throw new AppCleanupNeededException(appId);
        }
        if (deleted) {
            return;
        }
        this.deleted = true;
        addDomainEvent(new AppDeletedEvent(appId));
    }

    private void ensureNotCleanupRequested() {
        if (cleanupRequested != null) {
            throw new AppCleanupRequestedException(appId);
        }
    }

    private void ensureOwned(DeploymentAggregate deployment) {
        if (!appId.equals(deployment.getDeploymentId().getAppId())) {
            throw new DeploymentNotFoundException(deployment.getDeploymentId());
        }
    }

    // ============================================
    // Getters
    // ============================================

    public AppId getAppId() {
        return appId;
    }

    public AppName getName() {
        return name;
    }

    public EnvironmentConfig getEnvironmentConfig(Environment environment) {
        return environments.get(environment);
    }

    public EnvironmentConfig getProduction() {
        return environments.get(Environment.PRODUCTION);
    }

    public EnvironmentConfig getStaging() {
        return environments.get(Environment.STAGING);
    }

    public Optional<DeploymentNumber> getLatestDeployment() {
        return Optional.ofNullable(latestDeployment);
    }

    public Optional<AuditStamp> getCleanupRequested() {
        return Optional.ofNullable(cleanupRequested);
    }

    public boolean isCleanupRequested() {
        return cleanupRequested != null;
    }

    public AuditStamp getCreated() {
        return created;
    }

    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public String toString() {
        return "AppAggregate{" +
                "appId=" + appId +
                ", name=" + name +
                ", latestDeployment=" + latestDeployment +
                ", cleanupRequested=" + (cleanupRequested != null) +
                '}';
    }
}
