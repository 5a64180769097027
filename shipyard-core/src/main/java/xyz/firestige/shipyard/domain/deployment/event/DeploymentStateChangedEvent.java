package xyz.firestige.shipyard.domain.deployment.event;

import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.deployment.DeploymentState;

public class DeploymentStateChangedEvent extends DeploymentEvent {

    private final DeploymentState state;

    public DeploymentStateChangedEvent(DeploymentId deploymentId, DeploymentState state) {
        super(deploymentId);
        this.state = state;
        setMessage("部署状态变更为 " + state.getStatus());
    }

    public DeploymentState getState() {
        return state;
    }
}
