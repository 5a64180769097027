package xyz.firestige.shipyard.domain.shared.event;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * 领域事件基类
 * <p>
 * 所有聚合产生的事件都继承此类，携带事件 ID、发生时间以及所属聚合的标识。
 * 事件在聚合内部收集，由仓储在保存成功后统一发布。
 */
public abstract class DomainEvent {

    private final String eventId;
    private final LocalDateTime timestamp;
    private String message;

    protected DomainEvent() {
        this(UUID.randomUUID().toString(), LocalDateTime.now());
    }

    protected DomainEvent(String eventId, LocalDateTime timestamp) {
        this(eventId, timestamp, "");
    }

    protected DomainEvent(String eventId, LocalDateTime timestamp, String message) {
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.message = message;
    }

    /**
     * 产生该事件的聚合标识（用于 outbox 记录与日志关联）
     */
    public abstract String getAggregateId();

    public String getEventName() {
        return this.getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public String getFormattedTimestamp() {
        return getFormattedTimestamp(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
    }

    public String getFormattedTimestamp(DateTimeFormatter formatter) {
        Objects.requireNonNull(formatter, "formatter must not be null");
        return timestamp.format(formatter);
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getEventName() + "{" +
                "eventId='" + eventId + '\'' +
                ", aggregateId='" + getAggregateId() + '\'' +
                ", timestamp=" + getFormattedTimestamp() +
                ", message='" + message + '\'' +
                '}';
    }
}
