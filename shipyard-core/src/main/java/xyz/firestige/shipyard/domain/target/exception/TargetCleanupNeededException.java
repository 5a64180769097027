package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.PreconditionException;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 删除目标前必须先请求清理并确认资源已清理
 */
public class TargetCleanupNeededException extends PreconditionException {

    public static final String ERROR_CODE = "target.cleanup_needed";

    public TargetCleanupNeededException(TargetId targetId) {
        super(ERROR_CODE, String.format("目标资源尚未清理，无法删除: %s", targetId));
        addContext("targetId", String.valueOf(targetId));
    }
}
