package xyz.firestige.shipyard.application.deployment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.AppRepository;
import xyz.firestige.shipyard.domain.app.exception.AppNotFoundException;
import xyz.firestige.shipyard.domain.deployment.DeploymentAggregate;
import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.deployment.DeploymentRepository;
import xyz.firestige.shipyard.domain.deployment.exception.DeploymentNotFoundException;

public class RedeployHandler implements CommandHandler<RedeployCommand, Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RedeployHandler.class);

    private final AppRepository appRepository;
    private final DeploymentRepository deploymentRepository;

    public RedeployHandler(AppRepository appRepository, DeploymentRepository deploymentRepository) {
        this.appRepository = appRepository;
        this.deploymentRepository = deploymentRepository;
    }

    @Override
    @Transactional
    public Integer handle(RedeployCommand command, RequestContext context) {
        AppAggregate app = appRepository.findById(command.appId())
                .orElseThrow(() -> new AppNotFoundException(command.appId()));

        DeploymentId sourceId = DeploymentId.resolve(command.appId(), command.deploymentNumber());
        DeploymentAggregate source = deploymentRepository.findById(sourceId)
                .orElseThrow(() -> new DeploymentNotFoundException(sourceId));

        DeploymentAggregate redeployed = app.redeploy(source, context.getRequester());

        appRepository.save(app);
        deploymentRepository.save(redeployed);
        logger.info("[RedeployHandler] 重新部署: {} → {}, environment: {}",
                sourceId, redeployed.getDeploymentId(), redeployed.getEnvironment());
        return redeployed.getDeploymentId().getNumber().getValue();
    }

    @Override
    public Class<RedeployCommand> commandType() {
        return RedeployCommand.class;
    }
}
