package xyz.firestige.shipyard.infrastructure.persistence.deployment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.shipyard.domain.deployment.DeploymentAggregate;
import xyz.firestige.shipyard.domain.deployment.DeploymentId;
import xyz.firestige.shipyard.domain.deployment.DeploymentRepository;
import xyz.firestige.shipyard.domain.deployment.DeploymentStatus;
import xyz.firestige.shipyard.domain.deployment.DeploymentsReader;
import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Deployment Repository 内存实现
 */
public class InMemoryDeploymentRepository implements DeploymentRepository, DeploymentsReader {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDeploymentRepository.class);

    private final Map<DeploymentId, DeploymentAggregate> deployments = new ConcurrentHashMap<>();
    private final DomainEventPublisher eventPublisher;

    public InMemoryDeploymentRepository(DomainEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void save(DeploymentAggregate deployment) {
        if (deployment == null || deployment.getDeploymentId() == null) {
            throw new IllegalArgumentException("Deployment or DeploymentId cannot be null");
        }
        deployments.put(deployment.getDeploymentId(), deployment);

        List<DomainEvent> events = new ArrayList<>(deployment.getDomainEvents());
        eventPublisher.publishAll(events);
        deployment.clearDomainEvents();
        logger.debug("[InMemoryDeploymentRepository] 已保存: {}, 发布事件数: {}",
                deployment.getDeploymentId(), events.size());
    }

    @Override
    public Optional<DeploymentAggregate> findById(DeploymentId deploymentId) {
        return Optional.ofNullable(deployments.get(deploymentId));
    }

    @Override
    public List<DeploymentAggregate> findByApp(AppId appId) {
        return deployments.values().stream()
                .filter(d -> d.getDeploymentId().getAppId().equals(appId))
                .sorted(Comparator.comparing(d -> d.getDeploymentId().getNumber()))
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasRunningOrPendingDeployments(TargetId target) {
        return deployments.values().stream()
                .filter(d -> d.getTarget().equals(target))
                .anyMatch(d -> d.getStatus().isRunningOrPending());
    }

    @Override
    public boolean hasRunningOrPendingDeployments(AppId appId, TargetId target) {
        return deployments.values().stream()
                .filter(d -> d.getDeploymentId().getAppId().equals(appId))
                .filter(d -> d.getTarget().equals(target))
                .anyMatch(d -> d.getStatus().isRunningOrPending());
    }

    @Override
    public boolean hasSucceededDeployment(AppId appId, TargetId target) {
        return deployments.values().stream()
                .filter(d -> d.getDeploymentId().getAppId().equals(appId))
                .filter(d -> d.getTarget().equals(target))
                .anyMatch(d -> d.getStatus() == DeploymentStatus.SUCCEEDED);
    }
}
