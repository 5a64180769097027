package xyz.firestige.shipyard.infrastructure.event;

import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;

import java.util.List;

/**
 * Spring 本地事件总线实现（单实例部署，默认）
 * <p>
 * 事件作为 Spring ApplicationEvent 发布，消费方用 @EventListener 订阅
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(DomainEvent event) {
        if (event != null) {
            applicationEventPublisher.publishEvent(event);
        }
    }

    @Override
    public void publishAll(List<? extends DomainEvent> events) {
        if (events != null && !events.isEmpty()) {
            events.forEach(this::publish);
        }
    }
}
