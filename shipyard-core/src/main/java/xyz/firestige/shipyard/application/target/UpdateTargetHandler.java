package xyz.firestige.shipyard.application.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.ProviderConfigRequirement;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.TargetUrl;
import xyz.firestige.shipyard.domain.target.TargetUrlRequirement;
import xyz.firestige.shipyard.domain.target.TargetsReader;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;

/**
 * 更新目标名称、URL、Provider 配置
 * <p>
 * URL 或 Provider 变更会触发重新配置，同一次更新只产生一个状态变更事件。
 * 约束全部满足后才修改目标，被拒绝的更新不留下任何变更
 */
public class UpdateTargetHandler implements CommandHandler<UpdateTargetCommand, TargetId> {

    private static final Logger logger = LoggerFactory.getLogger(UpdateTargetHandler.class);

    private final TargetRepository targetRepository;
    private final TargetsReader targetsReader;

    public UpdateTargetHandler(TargetRepository targetRepository, TargetsReader targetsReader) {
        this.targetRepository = targetRepository;
        this.targetsReader = targetsReader;
    }

    @Override
    @Transactional
    public TargetId handle(UpdateTargetCommand command, RequestContext context) {
        TargetAggregate target = targetRepository.findById(command.targetId())
                .orElseThrow(() -> new TargetNotFoundException(command.targetId()));

        TargetUrlRequirement urlRequirement = null;
        if (command.url() != null) {
            TargetUrl url = TargetUrl.parse(command.url());
            urlRequirement = targetsReader.checkUrlAvailability(url, target.getTargetId());
        }
        ProviderConfigRequirement configRequirement = null;
        if (command.provider() != null) {
            configRequirement = targetsReader.checkConfigAvailability(command.provider(), target.getTargetId());
        }

        target.update(command.name(), urlRequirement, configRequirement);

        int changes = target.getDomainEvents().size();
        targetRepository.save(target);
        logger.info("[UpdateTargetHandler] 目标已更新: {}, 事件数: {}", target.getTargetId(), changes);
        return target.getTargetId();
    }

    @Override
    public Class<UpdateTargetCommand> commandType() {
        return UpdateTargetCommand.class;
    }
}
