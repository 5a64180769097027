package xyz.firestige.shipyard.application.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.TargetUrl;
import xyz.firestige.shipyard.domain.target.TargetsReader;

public class CreateTargetHandler implements CommandHandler<CreateTargetCommand, TargetId> {

    private static final Logger logger = LoggerFactory.getLogger(CreateTargetHandler.class);

    private final TargetRepository targetRepository;
    private final TargetsReader targetsReader;

    public CreateTargetHandler(TargetRepository targetRepository, TargetsReader targetsReader) {
        this.targetRepository = targetRepository;
        this.targetsReader = targetsReader;
    }

    @Override
    @Transactional
    public TargetId handle(CreateTargetCommand command, RequestContext context) {
        TargetUrl url = TargetUrl.parse(command.url());

        TargetAggregate target = TargetAggregate.create(
                command.name(),
                targetsReader.checkUrlAvailability(url, null),
                targetsReader.checkConfigAvailability(command.provider(), null),
                context.getRequester());

        targetRepository.save(target);
        logger.info("[CreateTargetHandler] 目标已创建: {}, url: {}, provider: {}",
                target.getTargetId(), url, command.provider().kind());
        return target.getTargetId();
    }

    @Override
    public Class<CreateTargetCommand> commandType() {
        return CreateTargetCommand.class;
    }
}
