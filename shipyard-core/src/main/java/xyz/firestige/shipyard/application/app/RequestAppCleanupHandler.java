package xyz.firestige.shipyard.application.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.AppRepository;
import xyz.firestige.shipyard.domain.app.exception.AppNotFoundException;

public class RequestAppCleanupHandler implements CommandHandler<RequestAppCleanupCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(RequestAppCleanupHandler.class);

    private final AppRepository appRepository;

    public RequestAppCleanupHandler(AppRepository appRepository) {
        this.appRepository = appRepository;
    }

    @Override
    @Transactional
    public Void handle(RequestAppCleanupCommand command, RequestContext context) {
        AppAggregate app = appRepository.findById(command.appId())
                .orElseThrow(() -> new AppNotFoundException(command.appId()));

        app.requestCleanup(context.getRequester());

        appRepository.save(app);
        logger.info("[RequestAppCleanupHandler] 应用已请求清理: {}, by: {}", app.getAppId(), context.getRequester());
        return null;
    }

    @Override
    public Class<RequestAppCleanupCommand> commandType() {
        return RequestAppCleanupCommand.class;
    }
}
