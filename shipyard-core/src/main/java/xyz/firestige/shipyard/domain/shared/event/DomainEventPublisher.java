package xyz.firestige.shipyard.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布器接口
 * <p>
 * 职责：
 * - 定义领域事件发布的标准契约
 * - 解耦领域层与具体的事件传输机制（本地事件总线、outbox 等）
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     *
     * @param event 领域事件
     */
    void publish(DomainEvent event);

    /**
     * 按顺序批量发布领域事件
     *
     * @param events 领域事件列表
     */
    default void publishAll(List<? extends DomainEvent> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}
