package xyz.firestige.shipyard.application.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.app.AppsReader;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;

public class RequestTargetCleanupHandler implements CommandHandler<RequestTargetCleanupCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(RequestTargetCleanupHandler.class);

    private final TargetRepository targetRepository;
    private final AppsReader appsReader;

    public RequestTargetCleanupHandler(TargetRepository targetRepository, AppsReader appsReader) {
        this.targetRepository = targetRepository;
        this.appsReader = appsReader;
    }

    @Override
    @Transactional
    public Void handle(RequestTargetCleanupCommand command, RequestContext context) {
        TargetAggregate target = targetRepository.findById(command.targetId())
                .orElseThrow(() -> new TargetNotFoundException(command.targetId()));

        target.requestCleanup(appsReader.isTargetUsed(target.getTargetId()), context.getRequester());

        targetRepository.save(target);
        logger.info("[RequestTargetCleanupHandler] 目标已请求清理: {}, by: {}",
                target.getTargetId(), context.getRequester());
        return null;
    }

    @Override
    public Class<RequestTargetCleanupCommand> commandType() {
        return RequestTargetCleanupCommand.class;
    }
}
