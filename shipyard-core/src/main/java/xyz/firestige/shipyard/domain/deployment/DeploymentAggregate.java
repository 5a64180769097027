package xyz.firestige.shipyard.domain.deployment;

import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.deployment.event.DeploymentCreatedEvent;
import xyz.firestige.shipyard.domain.deployment.event.DeploymentStateChangedEvent;
import xyz.firestige.shipyard.domain.deployment.exception.DeploymentNotPendingException;
import xyz.firestige.shipyard.domain.deployment.exception.DeploymentNotRunningException;
import xyz.firestige.shipyard.domain.shared.event.AggregateRoot;
import xyz.firestige.shipyard.domain.shared.vo.AuditStamp;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 部署聚合（Deployment）
 * <p>
 * 一次部署尝试的记录：配置快照与源数据在创建后不可变，晋升总是产生新的部署。
 * 只能由 {@link xyz.firestige.shipyard.domain.app.AppAggregate} 创建，以保证编号连续递增。
 * <p>
 * 状态流转（由外部执行层驱动）：PENDING → RUNNING → SUCCEEDED / FAILED
 */
public class DeploymentAggregate extends AggregateRoot {

    private final DeploymentId deploymentId;
    private final DeploymentConfig config;
    private final SourceData source;
    private final AuditStamp requested;
    private DeploymentState state;

    private DeploymentAggregate(DeploymentId deploymentId, DeploymentConfig config, SourceData source, AuditStamp requested) {
        this.deploymentId = deploymentId;
        this.config = config;
        this.source = source;
        this.requested = requested;
        this.state = DeploymentState.pending();
    }

    /**
     * 排队一个新部署，编号由应用分配
     */
    public static DeploymentAggregate queue(DeploymentId deploymentId, DeploymentConfig config,
                                            SourceData source, AuditStamp requested) {
        DeploymentAggregate deployment = new DeploymentAggregate(deploymentId, config, source, requested);
        deployment.addDomainEvent(new DeploymentCreatedEvent(
                deploymentId, config, source, deployment.state, requested));
        return deployment;
    }

    public void markAsRunning() {
        if (state.getStatus() != DeploymentStatus.PENDING) {
            throw new DeploymentNotPendingException(deploymentId);
        }
        this.state = state.started();
        addDomainEvent(new DeploymentStateChangedEvent(deploymentId, state));
    }

    /**
     * 结束部署
     *
     * @param errorMessage 失败原因，成功时为 null
     */
    public void markAsEnded(String errorMessage) {
        if (state.getStatus() != DeploymentStatus.RUNNING) {
            throw new DeploymentNotRunningException(deploymentId);
        }
        this.state = state.ended(errorMessage);
        addDomainEvent(new DeploymentStateChangedEvent(deploymentId, state));
    }

    // ============================================
    // Getters
    // ============================================

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public DeploymentConfig getConfig() {
        return config;
    }

    public Environment getEnvironment() {
        return config.getEnvironment();
    }

    public TargetId getTarget() {
        return config.getTarget();
    }

    public SourceData getSource() {
        return source;
    }

    public AuditStamp getRequested() {
        return requested;
    }

    public DeploymentState getState() {
        return state;
    }

    public DeploymentStatus getStatus() {
        return state.getStatus();
    }

    @Override
    public String toString() {
        return "DeploymentAggregate{" +
                "deploymentId=" + deploymentId +
                ", config=" + config +
                ", state=" + state +
                '}';
    }
}
