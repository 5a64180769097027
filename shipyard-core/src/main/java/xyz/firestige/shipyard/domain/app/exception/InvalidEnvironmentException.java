package xyz.firestige.shipyard.domain.app.exception;

import xyz.firestige.shipyard.domain.shared.exception.ValidationException;

public class InvalidEnvironmentException extends ValidationException {

    public static final String ERROR_CODE = "app.invalid_environment";

    public InvalidEnvironmentException(String environment) {
        super(ERROR_CODE, String.format("未知的环境: %s", environment));
        addContext("environment", String.valueOf(environment));
    }
}
