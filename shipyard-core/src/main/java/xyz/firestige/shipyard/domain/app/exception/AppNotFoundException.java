package xyz.firestige.shipyard.domain.app.exception;

import xyz.firestige.shipyard.domain.shared.exception.NotFoundException;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

public class AppNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "app.not_found";

    public AppNotFoundException(AppId appId) {
        super(ERROR_CODE, String.format("应用不存在: %s", appId));
        addContext("appId", String.valueOf(appId));
    }
}
