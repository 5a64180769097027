package xyz.firestige.shipyard.domain.deployment.event;

import xyz.firestige.shipyard.domain.deployment.DeploymentConfig;
import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.deployment.DeploymentState;
import xyz.firestige.shipyard.domain.deployment.SourceData;
import xyz.firestige.shipyard.domain.shared.vo.AuditStamp;

public class DeploymentCreatedEvent extends DeploymentEvent {

    private final DeploymentConfig config;
    private final SourceData source;
    private final DeploymentState state;
    private final AuditStamp requested;

    public DeploymentCreatedEvent(DeploymentId deploymentId, DeploymentConfig config, SourceData source,
                                  DeploymentState state, AuditStamp requested) {
        super(deploymentId);
        this.config = config;
        this.source = source;
        this.state = state;
        this.requested = requested;
        setMessage("部署已排队, 环境: " + config.getEnvironment() + ", 目标: " + config.getTarget());
    }

    public DeploymentConfig getConfig() {
        return config;
    }

    public SourceData getSource() {
        return source;
    }

    public DeploymentState getState() {
        return state;
    }

    public AuditStamp getRequested() {
        return requested;
    }
}
