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

/**
 * 晋升用例
 * <p>
 * 流程：
 * 1. 加载应用，不存在 → NOT_FOUND
 * 2. 加载源部署（应用 ID + 编号），不存在 → NOT_FOUND
 * 3. 由应用以源部署的数据创建生产环境的新部署（编号 = 最新编号 + 1）
 * 4. 在同一事务内保存应用与新部署
 */
public class PromoteHandler implements CommandHandler<PromoteCommand, Integer> {

    private static final Logger logger = LoggerFactory.getLogger(PromoteHandler.class);

    private final AppRepository appRepository;
    private final DeploymentRepository deploymentRepository;

    public PromoteHandler(AppRepository appRepository, DeploymentRepository deploymentRepository) {
        this.appRepository = appRepository;
        this.deploymentRepository = deploymentRepository;
    }

    @Override
    @Transactional
    public Integer handle(PromoteCommand command, RequestContext context) {
        AppAggregate app = appRepository.findById(command.appId())
                .orElseThrow(() -> new AppNotFoundException(command.appId()));

        DeploymentId sourceId = DeploymentId.resolve(command.appId(), command.deploymentNumber());
        DeploymentAggregate source = deploymentRepository.findById(sourceId)
                .orElseThrow(() -> new DeploymentNotFoundException(sourceId));

        DeploymentAggregate promoted = app.promote(source, context.getRequester());

        appRepository.save(app);
        deploymentRepository.save(promoted);
        logger.info("[PromoteHandler] 部署已晋升: {} → {}", sourceId, promoted.getDeploymentId());
        return promoted.getDeploymentId().getNumber().getValue();
    }

    @Override
    public Class<PromoteCommand> commandType() {
        return PromoteCommand.class;
    }
}
