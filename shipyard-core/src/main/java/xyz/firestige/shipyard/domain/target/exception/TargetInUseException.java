package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.PreconditionException;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 目标仍被至少一个应用的环境绑定引用
 */
public class TargetInUseException extends PreconditionException {

    public static final String ERROR_CODE = "target.in_use";

    public TargetInUseException(TargetId targetId) {
        super(ERROR_CODE, String.format("目标仍被应用使用，无法清理: %s", targetId));
        addContext("targetId", String.valueOf(targetId));
    }
}
