package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.ConflictException;

/**
 * Provider 配置已被其他未删除的目标使用
 */
public class ConfigAlreadyTakenException extends ConflictException {

    public static final String ERROR_CODE = "target.config_already_taken";

    public ConfigAlreadyTakenException(String fingerprint) {
        super(ERROR_CODE, String.format("Provider 配置已被其他目标占用, fingerprint: %s", fingerprint));
        addContext("fingerprint", String.valueOf(fingerprint));
    }
}
