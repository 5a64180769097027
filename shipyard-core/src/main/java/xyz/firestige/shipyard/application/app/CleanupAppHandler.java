package xyz.firestige.shipyard.application.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.AppRepository;
import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.app.exception.AppCleanupNeededException;
import xyz.firestige.shipyard.domain.app.exception.AppNotFoundException;
import xyz.firestige.shipyard.domain.deployment.DeploymentsReader;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.CleanupStrategy;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetProvider;
import xyz.firestige.shipyard.domain.target.TargetRepository;

import java.util.Optional;

/**
 * 回收应用在各环境目标上的资源并删除应用
 * <p>
 * 职责：
 * 1. 校验应用已请求清理
 * 2. 逐个环境向目标询问清理策略，交给 Provider 回收
 * 3. 全部成功后删除应用
 * <p>
 * 已删除的目标上不会再有应用资源，直接跳过
 */
public class CleanupAppHandler implements CommandHandler<CleanupAppCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(CleanupAppHandler.class);

    private final AppRepository appRepository;
    private final TargetRepository targetRepository;
    private final DeploymentsReader deploymentsReader;
    private final TargetProvider targetProvider;

    public CleanupAppHandler(AppRepository appRepository,
                             TargetRepository targetRepository,
                             DeploymentsReader deploymentsReader,
                             TargetProvider targetProvider) {
        this.appRepository = appRepository;
        this.targetRepository = targetRepository;
        this.deploymentsReader = deploymentsReader;
        this.targetProvider = targetProvider;
    }

    @Override
    @Transactional
    public Void handle(CleanupAppCommand command, RequestContext context) {
        AppAggregate app = appRepository.findById(command.appId())
                .orElseThrow(() -> new AppNotFoundException(command.appId()));

        if (!app.isCleanupRequested()) {
            throw new AppCleanupNeededException(app.getAppId());
        }

        for (Environment environment : Environment.values()) {
            cleanupEnvironment(app, environment);
        }

        app.delete(true);
        appRepository.save(app);
        logger.info("[CleanupAppHandler] 应用已删除: {}", app.getAppId());
        return null;
    }

    private void cleanupEnvironment(AppAggregate app, Environment environment) {
        TargetId targetId = app.getEnvironmentConfig(environment).getTarget();
        Optional<TargetAggregate> target = targetRepository.findById(targetId)
                .filter(t -> !t.isDeleted());
        if (target.isEmpty()) {
            logger.debug("[CleanupAppHandler] 目标已不存在，跳过: {}, environment: {}", targetId, environment);
            return;
        }

        CleanupStrategy strategy = target.get().appCleanupStrategy(
                deploymentsReader.hasRunningOrPendingDeployments(app.getAppId(), targetId),
                deploymentsReader.hasSucceededDeployment(app.getAppId(), targetId));

        logger.info("[CleanupAppHandler] 清理应用资源: {}, environment: {}, target: {}, strategy: {}",
                app.getAppId(), environment, targetId, strategy);
        targetProvider.cleanupApp(target.get(), app.getAppId(), app.getName(), environment, strategy);
    }

    @Override
    public Class<CleanupAppCommand> commandType() {
        return CleanupAppCommand.class;
    }
}
