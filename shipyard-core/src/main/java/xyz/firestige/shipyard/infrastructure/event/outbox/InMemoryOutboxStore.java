package xyz.firestige.shipyard.infrastructure.event.outbox;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outbox 内存实现（测试与单实例部署）
 */
public class InMemoryOutboxStore implements OutboxStore {

    private final Map<String, OutboxRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void append(OutboxRecord record) {
        records.put(record.eventId(), record);
    }

    @Override
    public synchronized List<OutboxRecord> pending(int limit) {
        List<OutboxRecord> result = new ArrayList<>();
        for (OutboxRecord record : records.values()) {
            if (result.size() >= limit) {
                break;
            }
            result.add(record);
        }
        return result;
    }

    @Override
    public synchronized void markDispatched(String eventId) {
        records.remove(eventId);
    }

    public synchronized int size() {
        return records.size();
    }
}
