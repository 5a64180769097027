package xyz.firestige.shipyard.application.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.AppRepository;
import xyz.firestige.shipyard.domain.app.AppsReader;
import xyz.firestige.shipyard.domain.app.exception.AppNotFoundException;
import xyz.firestige.shipyard.domain.target.TargetsReader;

public class UpdateAppEnvironmentHandler implements CommandHandler<UpdateAppEnvironmentCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(UpdateAppEnvironmentHandler.class);

    private final AppRepository appRepository;
    private final EnvironmentRequirementResolver requirementResolver;

    public UpdateAppEnvironmentHandler(AppRepository appRepository, AppsReader appsReader, TargetsReader targetsReader) {
        this.appRepository = appRepository;
        this.requirementResolver = new EnvironmentRequirementResolver(appsReader, targetsReader);
    }

    @Override
    @Transactional
    public Void handle(UpdateAppEnvironmentCommand command, RequestContext context) {
        AppAggregate app = appRepository.findById(command.appId())
                .orElseThrow(() -> new AppNotFoundException(command.appId()));

        app.hasEnvironmentConfig(command.environment(),
                requirementResolver.resolve(app.getName(), command.config(), app.getAppId()));

        appRepository.save(app);
        logger.info("[UpdateAppEnvironmentHandler] 应用环境配置已更新: {}, environment: {}, target: {}",
                app.getAppId(), command.environment(), command.config().getTarget());
        return null;
    }

    @Override
    public Class<UpdateAppEnvironmentCommand> commandType() {
        return UpdateAppEnvironmentCommand.class;
    }
}
