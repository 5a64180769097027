package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.ValidationException;

/**
 * 目标 URL 格式非法（必须是带主机名的 http/https 绝对地址）
 */
public class InvalidUrlException extends ValidationException {

    public static final String ERROR_CODE = "target.invalid_url";

    public InvalidUrlException(String url) {
        super(ERROR_CODE, String.format("非法的目标 URL: %s", url));
        addContext("url", String.valueOf(url));
    }
}
