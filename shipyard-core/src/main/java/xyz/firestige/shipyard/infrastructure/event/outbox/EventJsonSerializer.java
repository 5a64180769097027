package xyz.firestige.shipyard.infrastructure.event.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import xyz.firestige.shipyard.domain.shared.event.DomainEvent;

/**
 * 领域事件 JSON 序列化
 * <p>
 * 时间字段按 ISO-8601 字符串输出，Optional 展开为值或 null
 */
public class EventJsonSerializer {

    private final ObjectMapper mapper;

    public EventJsonSerializer() {
        this(new ObjectMapper());
    }

    public EventJsonSerializer(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * @throws EventSerializationException 序列化失败
     */
    public String serialize(DomainEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.getEventId(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
