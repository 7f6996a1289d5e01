package io.switchboard.core.conversion;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.WireFormat;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StreamTranslatorTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ProtocolConverter converter = new ProtocolConverter(
        MAPPER,
        Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC)
    );

    @Test
    void shouldRebuildAnthropicEventsFromOpenAiChunks() throws Exception {
        StreamTranslator translator = converter.streamTranslator(WireFormat.ANTHROPIC, WireFormat.OPENAI, "gpt-4o", "req-1");
        List<SseEvent> out = new ArrayList<>();

        out.addAll(translator.translate(SseEvent.data("{\"choices\":[{\"delta\":{\"role\":\"assistant\",\"content\":\"Hel\"}}]}")));
        out.addAll(translator.translate(SseEvent.data("{\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}")));
        out.addAll(translator.translate(SseEvent.data(
            "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"function\":{\"name\":\"f\",\"arguments\":\"{\\\"a\\\"\"}}]}}]}"
        )));
        out.addAll(translator.translate(SseEvent.data(
            "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\":1}\"}}]}}]}"
        )));
        out.addAll(translator.translate(SseEvent.data("{\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}")));
        out.addAll(translator.translate(SseEvent.data("{\"choices\":[],\"usage\":{\"prompt_tokens\":3,\"completion_tokens\":7}}")));
        out.addAll(translator.translate(SseEvent.done()));
        out.addAll(translator.finish());

        assertThat(out).extracting(SseEvent::event).containsExactly(
            "message_start",
            "content_block_start",
            "content_block_delta",
            "content_block_delta",
            "content_block_stop",
            "content_block_start",
            "content_block_delta",
            "content_block_delta",
            "content_block_stop",
            "message_delta",
            "message_stop"
        );
        assertThat(payload(out.get(0)).at("/message/id").asText()).isEqualTo("msg_req-1");
        assertThat(payload(out.get(5)).at("/content_block/type").asText()).isEqualTo("tool_use");
        assertThat(payload(out.get(5)).path("index").asInt()).isEqualTo(1);
        assertThat(payload(out.get(7)).at("/delta/partial_json").asText()).isEqualTo(":1}");
        JsonNode messageDelta = payload(out.get(9));
        assertThat(messageDelta.at("/delta/stop_reason").asText()).isEqualTo("tool_use");
        assertThat(messageDelta.at("/usage/output_tokens").asLong()).isEqualTo(7);
    }

    @Test
    void shouldProduceOpenAiChunksFromAnthropicEvents() throws Exception {
        StreamTranslator translator = converter.streamTranslator(WireFormat.OPENAI, WireFormat.ANTHROPIC, "claude", "req-2");
        List<SseEvent> out = new ArrayList<>();

        out.addAll(translator.translate(SseEvent.named("message_start",
            "{\"type\":\"message_start\",\"message\":{\"id\":\"msg_1\",\"model\":\"claude-sonnet-4\"}}")));
        out.addAll(translator.translate(SseEvent.named("content_block_start",
            "{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"\"}}")));
        out.addAll(translator.translate(SseEvent.named("content_block_delta",
            "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hi\"}}")));
        out.addAll(translator.translate(SseEvent.named("content_block_start",
            "{\"type\":\"content_block_start\",\"index\":1,\"content_block\":{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"f\"}}")));
        out.addAll(translator.translate(SseEvent.named("content_block_delta",
            "{\"type\":\"content_block_delta\",\"index\":1,\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"{}\"}}")));
        out.addAll(translator.translate(SseEvent.named("message_delta",
            "{\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"tool_use\"}}")));
        out.addAll(translator.translate(SseEvent.named("message_stop", "{\"type\":\"message_stop\"}")));
        out.addAll(translator.finish());

        assertThat(out).hasSize(6);
        assertThat(payload(out.get(0)).at("/choices/0/delta/role").asText()).isEqualTo("assistant");
        assertThat(payload(out.get(0)).path("id").asText()).isEqualTo("chatcmpl-req-2");
        assertThat(payload(out.get(0)).path("model").asText()).isEqualTo("claude-sonnet-4");
        assertThat(payload(out.get(1)).at("/choices/0/delta/content").asText()).isEqualTo("Hi");
        assertThat(payload(out.get(2)).at("/choices/0/delta/tool_calls/0/id").asText()).isEqualTo("toolu_1");
        assertThat(payload(out.get(3)).at("/choices/0/delta/tool_calls/0/function/arguments").asText()).isEqualTo("{}");
        assertThat(payload(out.get(4)).at("/choices/0/finish_reason").asText()).isEqualTo("tool_calls");
        assertThat(out.get(5).isDone()).isTrue();
    }

    @Test
    void shouldPassEventsThroughForSameDialect() {
        StreamTranslator translator = converter.streamTranslator(WireFormat.OPENAI, WireFormat.OPENAI, "gpt-4o", "req-3");
        SseEvent event = SseEvent.data("{\"x\":1}");

        assertThat(translator.translate(event)).containsExactly(event);
        assertThat(translator.finish()).isEmpty();
    }

    @Test
    void shouldFinishAnthropicStreamEvenWithoutUpstreamEvents() {
        StreamTranslator translator = converter.streamTranslator(WireFormat.ANTHROPIC, WireFormat.OPENAI, "gpt-4o", "req-4");

        List<SseEvent> events = translator.finish();

        assertThat(events).extracting(SseEvent::event).containsExactly("message_start", "message_delta", "message_stop");
        assertThat(translator.finish()).isEmpty();
    }

    private static JsonNode payload(SseEvent event) throws Exception {
        return MAPPER.readTree(event.data());
    }
}
