package xyz.firestige.shipyard.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import xyz.firestige.shipyard.config.properties.DomainEventPublisherProperties;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;
import xyz.firestige.shipyard.infrastructure.event.CompositeDomainEventPublisher;
import xyz.firestige.shipyard.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.shipyard.infrastructure.event.outbox.EventJsonSerializer;
import xyz.firestige.shipyard.infrastructure.event.outbox.InMemoryOutboxStore;
import xyz.firestige.shipyard.infrastructure.event.outbox.OutboxDomainEventPublisher;
import xyz.firestige.shipyard.infrastructure.event.outbox.OutboxStore;

/**
 * 领域事件发布器自动配置
 *
 * 配置属性：
 * - shipyard.event.publisher.type: 发布器类型（spring/outbox/composite）
 * - shipyard.event.publisher.composite.enable-local: 复合模式下是否启用本地事件
 * - shipyard.event.publisher.composite.enable-outbox: 复合模式下是否写 outbox
 * - shipyard.event.publisher.composite.fail-fast: 复合模式下是否快速失败
 *
 * 使用示例：
 * <pre>
 * # 单实例 - 使用 Spring 本地事件
 * shipyard.event.publisher.type=spring
 *
 * # 本地事件 + outbox 双写
 * shipyard.event.publisher.type=composite
 * shipyard.event.publisher.composite.enable-local=true
 * shipyard.event.publisher.composite.enable-outbox=true
 * </pre>
 */
@AutoConfiguration
@EnableConfigurationProperties(DomainEventPublisherProperties.class)
public class DomainEventPublisherAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DomainEventPublisherAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public OutboxStore outboxStore() {
        return new InMemoryOutboxStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventJsonSerializer eventJsonSerializer(ObjectProvider<ObjectMapper> objectMapper) {
        return new EventJsonSerializer(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    /**
     * Spring 本地事件发布器（默认配置）
     */
    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    @ConditionalOnProperty(name = "shipyard.event.publisher.type", havingValue = "spring", matchIfMissing = true)
    public DomainEventPublisher springDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        log.info("[DomainEventPublisher] Configuring SpringDomainEventPublisher (local event bus)");
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    @ConditionalOnProperty(name = "shipyard.event.publisher.type", havingValue = "outbox")
    public DomainEventPublisher outboxDomainEventPublisher(OutboxStore outboxStore, EventJsonSerializer serializer) {
        log.info("[DomainEventPublisher] Configuring OutboxDomainEventPublisher (store: {})",
                outboxStore.getClass().getSimpleName());
        return new OutboxDomainEventPublisher(outboxStore, serializer);
    }

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    @ConditionalOnProperty(name = "shipyard.event.publisher.type", havingValue = "composite")
    public DomainEventPublisher compositeDomainEventPublisher(DomainEventPublisherProperties properties,
                                                              ApplicationEventPublisher applicationEventPublisher,
                                                              OutboxStore outboxStore,
                                                              EventJsonSerializer serializer) {
        DomainEventPublisherProperties.CompositeProperties composite = properties.getComposite();

        DomainEventPublisher local = composite.isEnableLocal()
                ? new SpringDomainEventPublisher(applicationEventPublisher) : null;
        DomainEventPublisher outbox = composite.isEnableOutbox()
                ? new OutboxDomainEventPublisher(outboxStore, serializer) : null;

        log.info("[DomainEventPublisher] Configuring CompositeDomainEventPublisher (local={}, outbox={}, failFast={})",
                composite.isEnableLocal(), composite.isEnableOutbox(), composite.isFailFast());
        return new CompositeDomainEventPublisher(composite.isFailFast(), local, outbox);
    }
}
