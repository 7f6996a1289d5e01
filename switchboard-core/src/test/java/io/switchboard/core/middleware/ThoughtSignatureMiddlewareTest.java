package io.switchboard.core.middleware;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.testing.MutableClock;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ThoughtSignatureMiddlewareTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final ThoughtSignatureStore store = new ThoughtSignatureStore(Duration.ofMinutes(30), 100, clock);
    private final ThoughtSignatureMiddleware middleware = new ThoughtSignatureMiddleware(store, Duration.ofMinutes(5));

    @Test
    void shouldOnlyHandleGeminiModels() {
        assertThat(middleware.shouldHandle("poe", "Gemini-2.5-Pro")).isTrue();
        assertThat(middleware.shouldHandle("openai", "gpt-4o")).isFalse();
    }

    @Test
    void shouldRememberSignaturesFromResponseAndRestoreThem() throws Exception {
        JsonNode response = MAPPER.readTree("""
            {"choices":[{"message":{"role":"assistant","tool_calls":[
              {"id":"call_1","type":"function","function":{"name":"lookup","arguments":"{}"},
               "extra_content":{"google":{"thought_signature":"sig-abc"}}}
            ]}}]}
            """);
        middleware.afterResponse(ResponseContext.of(response, request("conv-1", MAPPER.createArrayNode())));

        JsonNode followUp = MAPPER.readTree("""
            [{"role":"assistant","tool_calls":[
               {"id":"call_1","type":"function","function":{"name":"lookup","arguments":"{}"}}]},
             {"role":"tool","tool_call_id":"call_1","content":"42"}]
            """);
        RequestContext restored = middleware.beforeRequest(request("conv-1", followUp));

        assertThat(restored.messages().at("/0/tool_calls/0/extra_content/google/thought_signature").asText())
            .isEqualTo("sig-abc");
        assertThat(restored.messages().at("/1/extra_content").isMissingNode()).isTrue();
    }

    @Test
    void shouldLeaveOtherConversationsUntouched() throws Exception {
        store.put("conv-1", Map.of("call_1", "sig-abc"));
        JsonNode messages = MAPPER.readTree("""
            [{"role":"assistant","tool_calls":[{"id":"call_1","type":"function","function":{"name":"x"}}]}]
            """);
        RequestContext context = request("conv-2", messages);

        assertThat(middleware.beforeRequest(context)).isSameAs(context);
    }

    @Test
    void shouldStoreSignaturesCollectedFromStream() throws Exception {
        RequestContext request = request("conv-1", MAPPER.createArrayNode());
        MiddlewareChain chain = new MiddlewareChain().add(middleware);

        try (StreamSession session = chain.openStream(request)) {
            session.process(MAPPER.readTree("""
                {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_9",
                  "extra_content":{"google":{"thought_signature":"sig-stream"}}}]}}]}
                """), false);
            session.process(MAPPER.readTree("{\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}"), true);
        }

        assertThat(store.get("conv-1")).containsEntry("call_9", "sig-stream");
    }

    @Test
    void shouldExpireConversations() {
        store.put("conv-1", Map.of("call_1", "sig"));

        clock.advance(Duration.ofMinutes(31));

        assertThat(store.cleanupExpired()).isEqualTo(1);
        assertThat(store.get("conv-1")).isEmpty();
    }

    @Test
    void shouldEvictOldestConversationWhenFull() {
        ThoughtSignatureStore small = new ThoughtSignatureStore(Duration.ofMinutes(30), 2, clock);
        small.put("a", Map.of("1", "s1"));
        clock.advance(Duration.ofSeconds(1));
        small.put("b", Map.of("2", "s2"));
        clock.advance(Duration.ofSeconds(1));
        small.put("c", Map.of("3", "s3"));

        assertThat(small.size()).isEqualTo(2);
        assertThat(small.get("a")).isEmpty();
        assertThat(small.get("c")).containsEntry("3", "s3");
    }

    @Test
    void shouldScheduleCleanupUntilShutdown() {
        store.put("conv-1", Map.of("call_1", "sig"));

        middleware.initialize();
        assertThat(middleware.isCleanupScheduled()).isTrue();
        middleware.cleanup();

        assertThat(middleware.isCleanupScheduled()).isFalse();
        assertThat(store.size()).isZero();
    }

    private static RequestContext request(String conversationId, JsonNode messages) {
        return new RequestContext(messages, "poe", "gemini-2.5-pro", "req-1", conversationId, Map.of(), null);
    }
}
