package io.switchboard.core.conversion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns Anthropic stream events into OpenAI {@code chat.completion.chunk} events, ending
 * with {@code [DONE]}.
 */
final class AnthropicToOpenAiStream implements StreamTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(AnthropicToOpenAiStream.class);

    private final ObjectMapper mapper;
    private final long created;
    private final Map<Integer, Integer> toolIndexByBlock = new HashMap<>();
    private final String completionId;
    private String model;
    private boolean done;

    AnthropicToOpenAiStream(ObjectMapper mapper, String completionId, String model, long created) {
        this.mapper = mapper;
        this.completionId = completionId;
        this.model = model;
        this.created = created;
    }

    @Override
    public List<SseEvent> translate(SseEvent upstream) {
        if (done) {
            return List.of();
        }
        if (upstream.isDone()) {
            return finish();
        }
        JsonNode payload;
        try {
            payload = mapper.readTree(upstream.data());
        } catch (JsonProcessingException e) {
            LOG.debug("Skipping unparseable stream event: {}", upstream.data());
            return List.of();
        }
        String type = upstream.event() != null ? upstream.event() : payload.path("type").asText("");
        List<SseEvent> events = new ArrayList<>();
        switch (type) {
            case "message_start" -> {
                JsonNode message = payload.path("message");
                model = message.path("model").asText(model);
                ObjectNode delta = mapper.createObjectNode().put("role", "assistant").put("content", "");
                events.add(chunk(delta, null));
            }
            case "content_block_start" -> {
                JsonNode block = payload.path("content_block");
                if ("tool_use".equals(block.path("type").asText())) {
                    int toolIndex = toolIndexByBlock.size();
                    toolIndexByBlock.put(payload.path("index").asInt(), toolIndex);
                    ObjectNode delta = mapper.createObjectNode();
                    ObjectNode call = delta.putArray("tool_calls").addObject();
                    call.put("index", toolIndex);
                    call.put("id", block.path("id").asText(""));
                    call.put("type", "function");
                    call.putObject("function").put("name", block.path("name").asText("")).put("arguments", "");
                    if (block.has("extra_content")) {
                        call.set("extra_content", block.get("extra_content"));
                    }
                    events.add(chunk(delta, null));
                }
            }
            case "content_block_delta" -> {
                JsonNode delta = payload.path("delta");
                String deltaType = delta.path("type").asText("");
                if ("text_delta".equals(deltaType) && !delta.path("text").asText("").isEmpty()) {
                    events.add(chunk(mapper.createObjectNode().put("content", delta.path("text").asText()), null));
                } else if ("input_json_delta".equals(deltaType)) {
                    Integer toolIndex = toolIndexByBlock.get(payload.path("index").asInt());
                    if (toolIndex != null) {
                        ObjectNode out = mapper.createObjectNode();
                        ObjectNode call = out.putArray("tool_calls").addObject();
                        call.put("index", toolIndex);
                        call.putObject("function").put("arguments", delta.path("partial_json").asText(""));
                        events.add(chunk(out, null));
                    }
                }
            }
            case "message_delta" -> {
                String finishReason = StopReasons.toFinishReason(payload.path("delta").path("stop_reason").asText(null));
                events.add(chunk(mapper.createObjectNode(), finishReason));
            }
            case "message_stop" -> events.addAll(finish());
            case "error" -> events.add(SseEvent.data(upstream.data()));
            default -> {
            }
        }
        return events;
    }

    @Override
    public List<SseEvent> finish() {
        if (done) {
            return List.of();
        }
        done = true;
        return List.of(SseEvent.done());
    }

    private SseEvent chunk(ObjectNode delta, String finishReason) {
        ObjectNode chunk = mapper.createObjectNode();
        chunk.put("id", completionId);
        chunk.put("object", "chat.completion.chunk");
        chunk.put("created", created);
        chunk.put("model", model);
        ObjectNode choice = chunk.putArray("choices").addObject();
        choice.put("index", 0);
        choice.set("delta", delta);
        if (finishReason == null) {
            choice.putNull("finish_reason");
        } else {
            choice.put("finish_reason", finishReason);
        }
        try {
            return SseEvent.data(mapper.writeValueAsString(chunk));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream chunk", e);
        }
    }
}
