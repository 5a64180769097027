package xyz.firestige.shipyard.testutil;

import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 记录型事件发布器
 * 用于测试时断言仓储发布了哪些事件
 */
public class RecordingEventPublisher implements DomainEventPublisher {

    private final List<DomainEvent> publishedEvents = new ArrayList<>();

    @Override
    public synchronized void publish(DomainEvent event) {
        publishedEvents.add(event);
    }

    public synchronized List<DomainEvent> getPublishedEvents() {
        return new ArrayList<>(publishedEvents);
    }

    /**
     * 获取指定类型的事件
     */
    public synchronized <T extends DomainEvent> List<T> getEventsOfType(Class<T> eventType) {
        return publishedEvents.stream()
                .filter(eventType::isInstance)
                .map(eventType::cast)
                .collect(Collectors.toList());
    }

    public synchronized int getEventCount() {
        return publishedEvents.size();
    }

    public synchronized <T extends DomainEvent> T getLastEvent(Class<T> eventType) {
        List<T> events = getEventsOfType(eventType);
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public synchronized void clear() {
        publishedEvents.clear();
    }
}
