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
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;

/**
 * 执行层开始处理部署前调用：目标必须可用
 */
public class StartDeploymentHandler implements CommandHandler<StartDeploymentCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(StartDeploymentHandler.class);

    private final DeploymentRepository deploymentRepository;
    private final TargetRepository targetRepository;

    public StartDeploymentHandler(DeploymentRepository deploymentRepository, TargetRepository targetRepository) {
        this.deploymentRepository = deploymentRepository;
        this.targetRepository = targetRepository;
    }

    @Override
    @Transactional
    public Void handle(StartDeploymentCommand command, RequestContext context) {
        DeploymentId deploymentId = DeploymentId.resolve(command.appId(), command.deploymentNumber());
        DeploymentAggregate deployment = deploymentRepository.findById(deploymentId)
                .orElseThrow(() -> new DeploymentNotFoundException(deploymentId));

        TargetAggregate target = targetRepository.findById(deployment.getTarget())
                .orElseThrow(() -> new TargetNotFoundException(deployment.getTarget()));
        target.checkAvailability();

        deployment.markAsRunning();
        deploymentRepository.save(deployment);
        logger.info("[StartDeploymentHandler] 部署开始: {}, target: {}", deploymentId, target.getTargetId());
        return null;
    }

    @Override
    public Class<StartDeploymentCommand> commandType() {
        return StartDeploymentCommand.class;
    }
}
