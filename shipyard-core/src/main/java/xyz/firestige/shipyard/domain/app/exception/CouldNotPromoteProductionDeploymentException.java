package xyz.firestige.shipyard.domain.app.exception;

import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.shared.exception.InvalidTransitionException;

/**
 * 生产环境的部署不能再被晋升
 */
public class CouldNotPromoteProductionDeploymentException extends InvalidTransitionException {

    public static final String ERROR_CODE = "app.could_not_promote_production_deployment";

    public CouldNotPromoteProductionDeploymentException(DeploymentId deploymentId) {
        super(ERROR_CODE, String.format("生产环境部署不能晋升: %s", deploymentId));
        addContext("deploymentId", String.valueOf(deploymentId));
    }
}
