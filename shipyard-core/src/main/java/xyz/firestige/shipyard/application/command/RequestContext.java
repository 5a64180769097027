package xyz.firestige.shipyard.application.command;

import xyz.firestige.shipyard.domain.shared.vo.UserId;

import java.util.Objects;
import java.util.UUID;

/**
 * 请求上下文：已认证的命令发起人 + 关联 ID
 */
public final class RequestContext {

    private final UserId requester;
    private final String correlationId;

    private RequestContext(UserId requester, String correlationId) {
        this.requester = Objects.requireNonNull(requester, "requester cannot be null");
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId cannot be null");
    }

    public static RequestContext of(UserId requester) {
        return new RequestContext(requester, UUID.randomUUID().toString());
    }

    public static RequestContext of(UserId requester, String correlationId) {
        return new RequestContext(requester, correlationId);
    }

    public UserId getRequester() {
        return requester;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    public String toString() {
        return "RequestContext{requester=" + requester + ", correlationId='" + correlationId + "'}";
    }
}
