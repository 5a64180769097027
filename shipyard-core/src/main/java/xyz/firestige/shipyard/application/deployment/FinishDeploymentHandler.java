package xyz.firestige.shipyard.application.deployment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.deployment.DeploymentAggregate;
import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.deployment.DeploymentRepository;
import xyz.firestige.shipyard.domain.deployment.exception.DeploymentNotFoundException;

public class FinishDeploymentHandler implements CommandHandler<FinishDeploymentCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(FinishDeploymentHandler.class);

    private final DeploymentRepository deploymentRepository;

    public FinishDeploymentHandler(DeploymentRepository deploymentRepository) {
        this.deploymentRepository = deploymentRepository;
    }

    @Override
    @Transactional
    public Void handle(FinishDeploymentCommand command, RequestContext context) {
        DeploymentId deploymentId = DeploymentId.resolve(command.appId(), command.deploymentNumber());
        DeploymentAggregate deployment = deploymentRepository.findById(deploymentId)
                .orElseThrow(() -> new DeploymentNotFoundException(deploymentId));

        deployment.markAsEnded(command.errorMessage());
        deploymentRepository.save(deployment);

        if (command.errorMessage() == null) {
            logger.info("[FinishDeploymentHandler] 部署成功: {}", deploymentId);
        } else {
            logger.warn("[FinishDeploymentHandler] 部署失败: {}, 原因: {}", deploymentId, command.errorMessage());
        }
        return null;
    }

    @Override
    public Class<FinishDeploymentCommand> commandType() {
        return FinishDeploymentCommand.class;
    }
}
