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
import xyz.firestige.shipyard.domain.deployment.DeploymentRepository;

public class QueueDeploymentHandler implements CommandHandler<QueueDeploymentCommand, Integer> {

    private static final Logger logger = LoggerFactory.getLogger(QueueDeploymentHandler.class);

    private final AppRepository appRepository;
    private final DeploymentRepository deploymentRepository;

    public QueueDeploymentHandler(AppRepository appRepository, DeploymentRepository deploymentRepository) {
        this.appRepository = appRepository;
        this.deploymentRepository = deploymentRepository;
    }

    @Override
    @Transactional
    public Integer handle(QueueDeploymentCommand command, RequestContext context) {
        AppAggregate app = appRepository.findById(command.appId())
                .orElseThrow(() -> new AppNotFoundException(command.appId()));

        DeploymentAggregate deployment = app.newDeployment(command.source(), command.environment(), context.getRequester());

        appRepository.save(app);
        deploymentRepository.save(deployment);
        logger.info("[QueueDeploymentHandler] 部署已排队: {}, environment: {}",
                deployment.getDeploymentId(), command.environment());
        return deployment.getDeploymentId().getNumber().getValue();
    }

    @Override
    public Class<QueueDeploymentCommand> commandType() {
        return QueueDeploymentCommand.class;
    }
}
