package xyz.firestige.shipyard.infrastructure.persistence.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.ProviderConfig;
import xyz.firestige.shipyard.domain.target.ProviderConfigRequirement;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.TargetUrl;
import xyz.firestige.shipyard.domain.target.TargetUrlRequirement;
import xyz.firestige.shipyard.domain.target.TargetsReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Target Repository 内存实现
 * <p>
 * 使用 ConcurrentHashMap 存储 Target 聚合根，同时提供唯一性查询。
 * 注意：
 * - 保存的是聚合实例本身，不做回滚；聚合方法先校验全部约束再修改，被拒绝的命令不留下变更
 * - 不做乐观并发控制，生产环境应替换为持久化实现
 */
public class InMemoryTargetRepository implements TargetRepository, TargetsReader {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTargetRepository.class);

    private final Map<TargetId, TargetAggregate> targets = new ConcurrentHashMap<>();
    private final DomainEventPublisher eventPublisher;

    public InMemoryTargetRepository(DomainEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void save(TargetAggregate target) {
        if (target == null || target.getTargetId() == null) {
            throw new IllegalArgumentException("Target or TargetId cannot be null");
        }
        targets.put(target.getTargetId(), target);

        List<DomainEvent> events = new ArrayList<>(target.getDomainEvents());
        eventPublisher.publishAll(events);
        target.clearDomainEvents();
        logger.debug("[InMemoryTargetRepository] 已保存: {}, 发布事件数: {}", target.getTargetId(), events.size());
    }

    @Override
    public Optional<TargetAggregate> findById(TargetId targetId) {
        return Optional.ofNullable(targets.get(targetId));
    }

    @Override
    public List<TargetAggregate> findAll() {
        return new ArrayList<>(targets.values());
    }

    @Override
    public TargetUrlRequirement checkUrlAvailability(TargetUrl url, TargetId excluding) {
        boolean unique = targets.values().stream()
                .filter(t -> !t.isDeleted())
                .filter(t -> !t.getTargetId().equals(excluding))
                .noneMatch(t -> t.getUrl().equals(url));
        return new TargetUrlRequirement(url, unique);
    }

    @Override
    public ProviderConfigRequirement checkConfigAvailability(ProviderConfig config, TargetId excluding) {
        boolean unique = targets.values().stream()
                .filter(t -> !t.isDeleted())
                .filter(t -> !t.getTargetId().equals(excluding))
                .noneMatch(t -> Objects.equals(t.getProvider().fingerprint(), config.fingerprint()));
        return new ProviderConfigRequirement(config, unique);
    }

    @Override
    public boolean exists(TargetId targetId) {
        TargetAggregate target = targets.get(targetId);
        return target != null && !target.isDeleted();
    }
}
