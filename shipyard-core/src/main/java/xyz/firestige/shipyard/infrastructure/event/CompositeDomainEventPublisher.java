package xyz.firestige.shipyard.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;

import java.util.ArrayList;
import java.util.List;

/**
 * 复合领域事件发布器
 * <p>
 * 按顺序把事件交给每个发布器（如本地事件总线 + outbox）。
 * 非快速失败模式下单个发布器失败只记录日志，其余发布器照常执行；
 * 快速失败模式下第一个失败即抛出 {@link CompositePublishException}。
 */
public class CompositeDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(CompositeDomainEventPublisher.class);

    private final List<DomainEventPublisher> publishers;
    private final boolean failFast;

    public CompositeDomainEventPublisher(DomainEventPublisher... publishers) {
        this(false, publishers);
    }

    public CompositeDomainEventPublisher(boolean failFast, DomainEventPublisher... publishers) {
        this.failFast = failFast;
        this.publishers = new ArrayList<>();
        if (publishers != null) {
            for (DomainEventPublisher publisher : publishers) {
                if (publisher != null) {
                    this.publishers.add(publisher);
                }
            }
        }
    }

    @Override
    public void publish(DomainEvent event) {
        if (publishers.isEmpty()) {
            log.warn("[CompositeDomainEventPublisher] 没有配置发布器，事件未发布: {}", event.getEventName());
            return;
        }

        int failures = 0;
        for (int i = 0; i < publishers.size(); i++) {
            DomainEventPublisher publisher = publishers.get(i);
            try {
                publisher.publish(event);
                log.trace("[CompositeDomainEventPublisher] 发布器 #{} ({}) 已发布: {}",
                        i, publisher.getClass().getSimpleName(), event.getEventName());
            } catch (RuntimeException e) {
                log.error("[CompositeDomainEventPublisher] 发布器 #{} ({}) 发布失败: {}",
                        i, publisher.getClass().getSimpleName(), event.getEventName(), e);
                if (failFast) {
                    throw new CompositePublishException(
                            String.format("Publisher #%d failed (fail-fast mode)", i), e);
                }
                failures++;
            }
        }

        if (failures > 0) {
            log.warn("[CompositeDomainEventPublisher] 事件发布完成，{}/{} 个发布器失败: {}",
                    failures, publishers.size(), event.getEventName());
        }
    }

    public int getPublisherCount() {
        return publishers.size();
    }

    public boolean isFailFast() {
        return failFast;
    }

    /**
     * 复合发布异常
     */
    public static class CompositePublishException extends RuntimeException {
        public CompositePublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
