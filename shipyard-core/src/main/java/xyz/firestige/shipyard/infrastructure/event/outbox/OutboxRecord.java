package xyz.firestige.shipyard.infrastructure.event.outbox;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Outbox 记录：已序列化的领域事件，等待外部中继投递
 *
 * @param eventId 事件 ID，投递端可用于去重
 * @param aggregateId 产生事件的聚合
 * @param eventType 事件类型（类简单名）
 * @param payload JSON 负载
 * @param occurredAt 事件发生时间
 */
public record OutboxRecord(String eventId, String aggregateId, String eventType, String payload,
                           LocalDateTime occurredAt) {

    public OutboxRecord {
        Objects.requireNonNull(eventId, "eventId cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
    }
}
