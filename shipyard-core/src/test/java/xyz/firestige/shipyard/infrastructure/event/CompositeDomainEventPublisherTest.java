package xyz.firestige.shipyard.infrastructure.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.event.TargetDeletedEvent;
import xyz.firestige.shipyard.testutil.RecordingEventPublisher;
import xyz.firestige.shipyard.testutil.TimingExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("领域事件发布器测试")
class CompositeDomainEventPublisherTest {

    private final DomainEvent event = new TargetDeletedEvent(TargetId.generate());

    @Test
    @DisplayName("场景: 事件按顺序交给每个发布器")
    void shouldPublishToAllPublishers() {
        RecordingEventPublisher first = new RecordingEventPublisher();
        RecordingEventPublisher second = new RecordingEventPublisher();
        CompositeDomainEventPublisher composite = new CompositeDomainEventPublisher(first, null, second);

        composite.publish(event);

        assertEquals(2, composite.getPublisherCount());
        assertEquals(1, first.getEventCount());
        assertEquals(1, second.getEventCount());
    }

    @Test
    @DisplayName("场景: 非快速失败模式下单个发布器失败不影响其它发布器")
    void shouldContinueWhenPublisherFails() {
        // Given
        DomainEventPublisher broken = mock(DomainEventPublisher.class);
        doThrow(new IllegalStateException("down")).when(broken).publish(any());
        RecordingEventPublisher healthy = new RecordingEventPublisher();
        CompositeDomainEventPublisher composite = new CompositeDomainEventPublisher(broken, healthy);

        // When
        composite.publish(event);

        // Then
        assertFalse(composite.isFailFast());
        assertEquals(1, healthy.getEventCount());
    }

    @Test
    @DisplayName("场景: 快速失败模式下第一个失败即抛出")
    void shouldFailFast() {
        DomainEventPublisher broken = mock(DomainEventPublisher.class);
        doThrow(new IllegalStateException("down")).when(broken).publish(any());
        RecordingEventPublisher healthy = new RecordingEventPublisher();
        CompositeDomainEventPublisher composite = new CompositeDomainEventPublisher(true, broken, healthy);

        assertThatThrownBy(() -> composite.publish(event))
                .isInstanceOf(CompositeDomainEventPublisher.CompositePublishException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertTrue(composite.isFailFast());
        assertEquals(0, healthy.getEventCount());
    }

    @Test
    @DisplayName("场景: Spring 发布器逐个转发到 ApplicationEventPublisher")
    void shouldForwardToSpringEvents() {
        ApplicationEventPublisher applicationEventPublisher = mock(ApplicationEventPublisher.class);
        SpringDomainEventPublisher publisher = new SpringDomainEventPublisher(applicationEventPublisher);

        publisher.publishAll(List.of(event, new TargetDeletedEvent(TargetId.generate())));
        publisher.publish(null);

        verify(applicationEventPublisher, times(2)).publishEvent(any(Object.class));
    }
}
