package io.switchboard.core.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.model.WireFormat;
import java.util.Objects;
import java.util.UUID;

/**
 * Inbound request as received from a client.
 *
 * @param explicitProvider provider chosen outside the model string, may be {@code null}
 * @param clientApiKey key sent by the client, used by passthrough providers
 * @param conversationId groups the turns of one conversation, may be {@code null}
 */
public record ClientRequest(
    WireFormat clientFormat,
    ObjectNode body,
    String explicitProvider,
    String clientApiKey,
    String requestId,
    String conversationId
) {

    public ClientRequest {
        Objects.requireNonNull(clientFormat, "clientFormat must not be null");
        Objects.requireNonNull(body, "body must not be null");
        body = body.deepCopy();
        requestId = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
    }

    public static ClientRequest of(WireFormat clientFormat, ObjectNode body) {
        return new ClientRequest(clientFormat, body, null, null, null, null);
    }

    @Override
    public ObjectNode body() {
        return body.deepCopy();
    }

    public String model() {
        return body.path("model").asText("");
    }

    public boolean streaming() {
        return body.path("stream").asBoolean(false);
    }

    public ClientRequest withClientApiKey(String key) {
        return new ClientRequest(clientFormat, body, explicitProvider, key, requestId, conversationId);
    }

    public ClientRequest withConversationId(String id) {
        return new ClientRequest(clientFormat, body, explicitProvider, clientApiKey, requestId, id);
    }
}
