package xyz.firestige.shipyard.domain.shared.vo;

import java.time.Instant;
import java.util.Objects;

/**
 * 操作审计戳：谁在何时执行了某个动作（创建、请求清理、请求部署）
 */
public record AuditStamp(Instant at, UserId by) {

    public AuditStamp {
        Objects.requireNonNull(at, "at cannot be null");
        Objects.requireNonNull(by, "by cannot be null");
    }

    public static AuditStamp now(UserId by) {
        return new AuditStamp(Instant.now(), by);
    }
}
