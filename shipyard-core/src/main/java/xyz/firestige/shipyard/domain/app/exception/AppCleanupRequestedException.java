package xyz.firestige.shipyard.domain.app.exception;

import xyz.firestige.shipyard.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

/**
 * 应用已请求清理，拒绝新的部署与配置变更
 */
public class AppCleanupRequestedException extends InvalidTransitionException {

    public static final String ERROR_CODE = "app.cleanup_requested";

    public AppCleanupRequestedException(AppId appId) {
        super(ERROR_CODE, String.format("应用已请求清理，不再接受变更: %s", appId));
        addContext("appId", String.valueOf(appId));
    }
}
