package xyz.firestige.shipyard.domain.deployment;

import xyz.firestige.shipyard.domain.shared.vo.AppId;

import java.util.List;
import java.util.Optional;

/**
 * Deployment Repository 接口
 */
public interface DeploymentRepository {

    void save(DeploymentAggregate deployment);

    Optional<DeploymentAggregate> findById(DeploymentId deploymentId);

    /**
     * 按编号升序返回应用的全部部署
     */
    List<DeploymentAggregate> findByApp(AppId appId);
}
