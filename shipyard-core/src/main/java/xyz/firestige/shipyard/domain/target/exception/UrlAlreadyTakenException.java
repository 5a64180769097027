package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.ConflictException;

/**
 * 目标 URL 已被其他未删除的目标使用
 */
public class UrlAlreadyTakenException extends ConflictException {

    public static final String ERROR_CODE = "target.url_already_taken";

    public UrlAlreadyTakenException(String url) {
        super(ERROR_CODE, String.format("URL 已被其他目标占用: %s", url));
        addContext("url", String.valueOf(url));
    }
}
