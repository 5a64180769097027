package xyz.firestige.shipyard.infrastructure.persistence.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.app.AppRepository;
import xyz.firestige.shipyard.domain.app.AppsReader;
import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * App Repository 内存实现
 */
public class InMemoryAppRepository implements AppRepository, AppsReader {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryAppRepository.class);

    private final Map<AppId, AppAggregate> apps = new ConcurrentHashMap<>();
    private final DomainEventPublisher eventPublisher;

    public InMemoryAppRepository(DomainEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void save(AppAggregate app) {
        if (app == null || app.getAppId() == null) {
            throw new IllegalArgumentException("App or AppId cannot be null");
        }
        apps.put(app.getAppId(), app);

        List<DomainEvent> events = new ArrayList<>(app.getDomainEvents());
        eventPublisher.publishAll(events);
        app.clearDomainEvents();
        logger.debug("[InMemoryAppRepository] 已保存: {}, 发布事件数: {}", app.getAppId(), events.size());
    }

    @Override
    public Optional<AppAggregate> findById(AppId appId) {
        return Optional.ofNullable(apps.get(appId));
    }

    @Override
    public Optional<AppAggregate> findByName(AppName name) {
        return apps.values().stream()
                .filter(a -> !a.isDeleted())
                .filter(a -> a.getName().equals(name))
                .findFirst();
    }

    @Override
    public List<AppAggregate> findAll() {
        return new ArrayList<>(apps.values());
    }

    @Override
    public boolean isNameAvailableOnTarget(AppName name, TargetId target, AppId excluding) {
        return apps.values().stream()
                .filter(a -> !a.isDeleted())
                .filter(a -> !a.getAppId().equals(excluding))
                .filter(a -> a.getName().equals(name))
                .noneMatch(a -> isBoundTo(a, target));
    }

    @Override
    public boolean isTargetUsed(TargetId target) {
        return apps.values().stream()
                .filter(a -> !a.isDeleted())
                .anyMatch(a -> isBoundTo(a, target));
    }

    private static boolean isBoundTo(AppAggregate app, TargetId target) {
        return Arrays.stream(Environment.values())
                .anyMatch(env -> app.getEnvironmentConfig(env).getTarget().equals(target));
    }
}
