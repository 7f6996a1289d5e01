package io.switchboard.core.middleware;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestContextTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void shouldNotSeeChangesToCallerMessages() {
        ArrayNode messages = MAPPER.createArrayNode();
        messages.addObject().put("role", "user").put("content", "hi");
        RequestContext context = new RequestContext(messages, "openai", "gpt-4o", "req-1", null, Map.of(), null);

        ((ObjectNode) messages.get(0)).put("content", "changed");
        ((ObjectNode) context.messages().get(0)).put("content", "changed too");

        assertThat(context.messages().get(0).path("content").asText()).isEqualTo("hi");
    }

    @Test
    void shouldReturnNewContextFromWithers() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("client_model", "fast");
        RequestContext original = new RequestContext(null, "openai", "gpt-4o", "req-1", null, metadata, null);
        metadata.put("client_model", "mutated");

        RequestContext changed = original
            .withModel("gpt-4o-mini")
            .withProvider("poe")
            .withConversationId("conv-1")
            .withMetadata("alias_resolved", true);

        assertThat(original.model()).isEqualTo("gpt-4o");
        assertThat(original.metadata()).containsOnly(Map.entry("client_model", "fast"));
        assertThat(changed.model()).isEqualTo("gpt-4o-mini");
        assertThat(changed.provider()).isEqualTo("poe");
        assertThat(changed.conversationId()).isEqualTo("conv-1");
        assertThat(changed.metadata()).containsEntry("alias_resolved", true).containsEntry("client_model", "fast");
        assertThat(changed.messages().isArray()).isTrue();
    }

    @Test
    void shouldAcceptNullMetadataValues() {
        RequestContext context = new RequestContext(null, "openai", "gpt-4o", "req-1", null, Map.of(), null)
            .withMetadata("conversation", null);
        ResponseContext response = ResponseContext.of(MAPPER.createObjectNode(), context)
            .withMetadata("usage", null);
        StreamChunkContext chunk = new StreamChunkContext(MAPPER.createObjectNode(), context, Map.of(), false)
            .withMetadata("stop_reason", null);

        assertThat(context.metadata()).containsEntry("conversation", null);
        assertThat(response.metadata()).containsEntry("usage", null);
        assertThat(chunk.accumulatedMetadata()).containsEntry("stop_reason", null);
    }
}
