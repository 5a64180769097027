package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.PreconditionException;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 目标上仍有运行中或排队中的部署，无法清理
 */
public class RunningOrPendingDeploymentsException extends PreconditionException {

    public static final String ERROR_CODE = "target.running_or_pending_deployments";

    public RunningOrPendingDeploymentsException(TargetId targetId) {
        super(ERROR_CODE, String.format("目标上仍有运行中或排队中的部署: %s", targetId));
        addContext("targetId", String.valueOf(targetId));
    }
}
