package xyz.firestige.shipyard.domain.app.exception;

import xyz.firestige.shipyard.domain.shared.exception.PreconditionException;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

public class AppCleanupNeededException extends PreconditionException {

    public static final String ERROR_CODE = "app.cleanup_needed";

    public AppCleanupNeededException(AppId appId) {
        super(ERROR_CODE, String.format("应用资源尚未清理，无法删除: %s", appId));
        addContext("appId", String.valueOf(appId));
    }
}
