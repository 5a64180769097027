package xyz.firestige.shipyard.application.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.deployment.DeploymentsReader;
import xyz.firestige.shipyard.domain.target.CleanupStrategy;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetProvider;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.exception.TargetCleanupNeededException;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;

/**
 * 回收目标资源并删除目标
 * <p>
 * 前置条件：目标已请求清理；Provider 回收失败时命令失败，目标保持原状以便重试
 */
public class CleanupTargetHandler implements CommandHandler<CleanupTargetCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(CleanupTargetHandler.class);

    private final TargetRepository targetRepository;
    private final DeploymentsReader deploymentsReader;
    private final TargetProvider targetProvider;

    public CleanupTargetHandler(TargetRepository targetRepository,
                                DeploymentsReader deploymentsReader,
                                TargetProvider targetProvider) {
        this.targetRepository = targetRepository;
        this.deploymentsReader = deploymentsReader;
        this.targetProvider = targetProvider;
    }

    @Override
    @Transactional
    public Void handle(CleanupTargetCommand command, RequestContext context) {
        TargetAggregate target = targetRepository.findById(command.targetId())
                .orElseThrow(() -> new TargetNotFoundException(command.targetId()));

        if (!target.isCleanupRequested()) {
            throw new TargetCleanupNeededException(target.getTargetId());
        }

        CleanupStrategy strategy = target.cleanupStrategy(
                deploymentsReader.hasRunningOrPendingDeployments(target.getTargetId()));
        logger.info("[CleanupTargetHandler] 开始清理目标: {}, strategy: {}", target.getTargetId(), strategy);

        targetProvider.cleanupTarget(target, strategy);

        target.delete(true);
        targetRepository.save(target);
        logger.info("[CleanupTargetHandler] 目标已删除: {}", target.getTargetId());
        return null;
    }

    @Override
    public Class<CleanupTargetCommand> commandType() {
        return CleanupTargetCommand.class;
    }
}
