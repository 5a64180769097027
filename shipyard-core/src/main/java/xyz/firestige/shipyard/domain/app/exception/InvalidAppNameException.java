package xyz.firestige.shipyard.domain.app.exception;

import xyz.firestige.shipyard.domain.shared.exception.ValidationException;

/**
 * 应用名称不合法（须为小写字母开头，仅含小写字母、数字、中划线，且不以中划线结尾）
 */
public class InvalidAppNameException extends ValidationException {

    public static final String ERROR_CODE = "app.invalid_name";

    public InvalidAppNameException(String name) {
        super(ERROR_CODE, String.format("非法的应用名称: %s", name));
        addContext("name", String.valueOf(name));
    }
}
