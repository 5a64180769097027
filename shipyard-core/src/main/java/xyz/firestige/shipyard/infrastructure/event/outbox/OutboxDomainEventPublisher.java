package xyz.firestige.shipyard.infrastructure.event.outbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;

/**
 * Outbox 发布器：把事件序列化为 {@link OutboxRecord} 写入 {@link OutboxStore}，
 * 由外部中继负责投递到消息中间件
 */
public class OutboxDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDomainEventPublisher.class);

    private final OutboxStore store;
    private final EventJsonSerializer serializer;

    public OutboxDomainEventPublisher(OutboxStore store, EventJsonSerializer serializer) {
        this.store = store;
        this.serializer = serializer;
    }

    @Override
    public void publish(DomainEvent event) {
        if (event == null) {
            return;
        }
        OutboxRecord record = new OutboxRecord(
                event.getEventId(),
                event.getAggregateId(),
                event.getEventName(),
                serializer.serialize(event),
                event.getTimestamp());
        store.append(record);
        log.debug("[OutboxDomainEventPublisher] 事件已写入 outbox: {}, aggregate: {}",
                record.eventType(), record.aggregateId());
    }
}
