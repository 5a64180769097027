package xyz.firestige.shipyard.application.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;

public class ReconfigureTargetHandler implements CommandHandler<ReconfigureTargetCommand, Void> {

    private static final Logger logger = LoggerFactory.getLogger(ReconfigureTargetHandler.class);

    private final TargetRepository targetRepository;

    public ReconfigureTargetHandler(TargetRepository targetRepository) {
        this.targetRepository = targetRepository;
    }

    @Override
    @Transactional
    public Void handle(ReconfigureTargetCommand command, RequestContext context) {
        TargetAggregate target = targetRepository.findById(command.targetId())
                .orElseThrow(() -> new TargetNotFoundException(command.targetId()));

        target.reconfigure();

        targetRepository.save(target);
        logger.info("[ReconfigureTargetHandler] 目标重新配置: {}, version: {}",
                target.getTargetId(), target.getCurrentVersion());
        return null;
    }

    @Override
    public Class<ReconfigureTargetCommand> commandType() {
        return ReconfigureTargetCommand.class;
    }
}
