package xyz.firestige.shipyard.domain.deployment.exception;

import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.shared.exception.InvalidTransitionException;

public class DeploymentNotPendingException extends InvalidTransitionException {

    public static final String ERROR_CODE = "deployment.not_pending";

    public DeploymentNotPendingException(DeploymentId deploymentId) {
        super(ERROR_CODE, String.format("部署不处于排队状态，无法开始: %s", deploymentId));
        addContext("deploymentId", String.valueOf(deploymentId));
    }
}
