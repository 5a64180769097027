package xyz.firestige.shipyard.domain.shared.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 聚合根基类：维护自上次持久化以来产生的领域事件（未提交事件缓冲区）
 * <p>
 * 约定：
 * - 聚合只通过 {@link #addDomainEvent} / {@link #replaceDomainEvent} 记录事件
 * - 仓储保存成功后读取 {@link #getDomainEvents()} 发布，再调用 {@link #clearDomainEvents()}
 */
public abstract class AggregateRoot {

    private final List<DomainEvent> domainEvents = new ArrayList<>();

    /**
     * 获取聚合产生的领域事件（不可修改，按产生顺序）
     */
    public List<DomainEvent> getDomainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    /**
     * 清空领域事件（发布后调用）
     */
    public void clearDomainEvents() {
        domainEvents.clear();
    }

    protected void addDomainEvent(DomainEvent event) {
        this.domainEvents.add(event);
    }

    /**
     * 移除缓冲区中同类型的待发布事件后追加新事件，保证该类型事件在缓冲区内至多一个且位于末尾
     */
    protected void replaceDomainEvent(DomainEvent event) {
        domainEvents.removeIf(existing -> existing.getClass() == event.getClass());
        domainEvents.add(event);
    }
}
