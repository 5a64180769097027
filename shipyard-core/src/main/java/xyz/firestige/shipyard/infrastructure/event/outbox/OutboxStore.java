package xyz.firestige.shipyard.infrastructure.event.outbox;

import java.util.List;

/**
 * Outbox 存储
 * <p>
 * 持久化实现应与聚合写入共用同一事务
 */
public interface OutboxStore {

    void append(OutboxRecord record);

    /**
     * 按写入顺序返回尚未投递的记录
     */
    List<OutboxRecord> pending(int limit);

    void markDispatched(String eventId);
}
