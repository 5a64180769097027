package xyz.firestige.shipyard.domain.deployment.exception;

import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.shared.exception.NotFoundException;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

public class DeploymentNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "deployment.not_found";

    public DeploymentNotFoundException(DeploymentId deploymentId) {
        super(ERROR_CODE, String.format("部署不存在: %s", deploymentId));
        addContext("deploymentId", String.valueOf(deploymentId));
    }

    public DeploymentNotFoundException(AppId appId, int deploymentNumber) {
        super(ERROR_CODE, String.format("部署不存在: %s#%d", appId, deploymentNumber));
        addContext("deploymentId", appId + "#" + deploymentNumber);
    }
}
