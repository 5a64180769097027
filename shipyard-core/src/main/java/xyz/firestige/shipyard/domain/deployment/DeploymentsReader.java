package xyz.firestige.shipyard.domain.deployment;

import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 部署查询端：为清理策略提供事实
 */
public interface DeploymentsReader {

    boolean hasRunningOrPendingDeployments(TargetId target);

    boolean hasRunningOrPendingDeployments(AppId appId, TargetId target);

    boolean hasSucceededDeployment(AppId appId, TargetId target);
}
