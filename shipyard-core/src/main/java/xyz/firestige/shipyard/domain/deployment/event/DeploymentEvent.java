package xyz.firestige.shipyard.domain.deployment.event;

import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.shared.event.DomainEvent;

/**
 * 部署事件基类
 */
public abstract class DeploymentEvent extends DomainEvent {

    private final DeploymentId deploymentId;

    protected DeploymentEvent(DeploymentId deploymentId) {
        super();
        this.deploymentId = deploymentId;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    @Override
    public String getAggregateId() {
        return deploymentId.toString();
    }
}
