package xyz.firestige.shipyard.application.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.app.AppRepository;
import xyz.firestige.shipyard.domain.app.AppsReader;
import xyz.firestige.shipyard.domain.app.exception.AppNameAlreadyTakenException;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.target.TargetsReader;

/**
 * 创建应用
 * <p>
 * 应用名全局唯一；两个环境的绑定分别校验目标存在性与名称可用性
 */
public class CreateAppHandler implements CommandHandler<CreateAppCommand, AppId> {

    private static final Logger logger = LoggerFactory.getLogger(CreateAppHandler.class);

    private final AppRepository appRepository;
    private final EnvironmentRequirementResolver requirementResolver;

    public CreateAppHandler(AppRepository appRepository, AppsReader appsReader, TargetsReader targetsReader) {
        this.appRepository = appRepository;
        this.requirementResolver = new EnvironmentRequirementResolver(appsReader, targetsReader);
    }

    @Override
    @Transactional
    public AppId handle(CreateAppCommand command, RequestContext context) {
        AppName name = AppName.parse(command.name());
        if (appRepository.findByName(name).isPresent()) {
            throw new AppNameAlreadyTakenException(name);
        }

        AppAggregate app = AppAggregate.create(
                name,
                requirementResolver.resolve(name, command.production(), null),
                requirementResolver.resolve(name, command.staging(), null),
                context.getRequester());

        appRepository.save(app);
        logger.info("[CreateAppHandler] 应用已创建: {}, name: {}", app.getAppId(), name);
        return app.getAppId();
    }

    @Override
    public Class<CreateAppCommand> commandType() {
        return CreateAppCommand.class;
    }
}
