package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * Provider 配置指纹一经设定不可变更
 */
public class ProviderUpdateNotPermittedException extends InvalidTransitionException {

    public static final String ERROR_CODE = "target.provider_update_not_permitted";

    public ProviderUpdateNotPermittedException(TargetId targetId) {
        super(ERROR_CODE, String.format("不允许修改目标的 Provider 指纹: %s", targetId));
        addContext("targetId", String.valueOf(targetId));
    }
}
