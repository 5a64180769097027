package xyz.firestige.shipyard.domain.app.exception;

import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.shared.exception.ConflictException;

/**
 * 应用名已被其他应用占用
 */
public class AppNameAlreadyTakenException extends ConflictException {

    public static final String ERROR_CODE = "app.name_already_taken";

    public AppNameAlreadyTakenException(AppName name) {
        super(ERROR_CODE, String.format("应用名已被占用: %s", name));
        addContext("name", name.getValue());
    }
}
