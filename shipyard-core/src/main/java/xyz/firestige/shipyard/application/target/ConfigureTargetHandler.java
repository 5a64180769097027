package xyz.firestige.shipyard.application.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetProvider;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.exception.ProviderException;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;

/**
 * 调用 Provider 下发目标配置，并把结果回报给目标
 * <p>
 * Provider 失败不会让命令失败，而是把目标标记为 FAILED
 */
public class ConfigureTargetHandler implements CommandHandler<ConfigureTargetCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(ConfigureTargetHandler.class);

    private final TargetRepository targetRepository;
    private final TargetProvider targetProvider;

    public ConfigureTargetHandler(TargetRepository targetRepository, TargetProvider targetProvider) {
        this.targetRepository = targetRepository;
        this.targetProvider = targetProvider;
    }

    @Override
    @Transactional
    public Void handle(ConfigureTargetCommand command, RequestContext context) {
        TargetAggregate target = targetRepository.findById(command.targetId())
                .orElseThrow(() -> new TargetNotFoundException(command.targetId()));

        if (target.getState().isOutdated(command.version())) {
            logger.debug("[ConfigureTargetHandler] 配置版本已过期，跳过: {}, version: {}, current: {}",
                    target.getTargetId(), command.version(), target.getCurrentVersion());
            return null;
        }

        String error = null;
        try {
            targetProvider.setup(target);
        } catch (ProviderException e) {
            logger.warn("[ConfigureTargetHandler] 目标配置失败: {}, 原因: {}", target.getTargetId(), e.getMessage());
            error = e.getMessage();
        }

        target.configured(command.version(), error);
        targetRepository.save(target);

        logger.info("[ConfigureTargetHandler] 目标配置完成: {}, status: {}",
                target.getTargetId(), target.getState().getStatus());
        return null;
    }

    @Override
    public Class<ConfigureTargetCommand> commandType() {
        return ConfigureTargetCommand.class;
    }
}
