package xyz.firestige.shipyard.domain.deployment.exception;

import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.shared.exception.InvalidTransitionException;

public class DeploymentNotRunningException extends InvalidTransitionException {

    public static final String ERROR_CODE = "deployment.not_running";

    public DeploymentNotRunningException(DeploymentId deploymentId) {
        super(ERROR_CODE, String.format("部署未在运行，无法结束: %s", deploymentId));
        addContext("deploymentId", String.valueOf(deploymentId));
    }
}
