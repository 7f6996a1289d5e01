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
 * Rebuilds the Anthropic event sequence from OpenAI chat-completion chunks:
 * {@code message_start}, content blocks for text and tool use, {@code message_delta},
 * {@code message_stop}.
 */
final class OpenAiToAnthropicStream implements StreamTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiToAnthropicStream.class);

    private final ObjectMapper mapper;
    private final String messageId;
    private final String model;
    private final Map<Integer, Integer> toolBlocks = new HashMap<>();
    private boolean started;
    private boolean finished;
    private int nextBlockIndex;
    private int openBlockIndex = -1;
    private boolean openBlockIsText;
    private String stopReason = "end_turn";
    private long inputTokens;
    private long outputTokens;

    OpenAiToAnthropicStream(ObjectMapper mapper, String messageId, String model) {
        this.mapper = mapper;
        this.messageId = messageId;
        this.model = model;
    }

    @Override
    public List<SseEvent> translate(SseEvent upstream) {
        if (finished) {
            return List.of();
        }
        if (upstream.isDone()) {
            return finish();
        }
        JsonNode chunk;
        try {
            chunk = mapper.readTree(upstream.data());
        } catch (JsonProcessingException e) {
            LOG.debug("Skipping unparseable stream chunk: {}", upstream.data());
            return List.of();
        }

        List<SseEvent> events = new ArrayList<>();
        ensureStarted(events);
        JsonNode usage = chunk.path("usage");
        if (usage.isObject()) {
            inputTokens = usage.path("prompt_tokens").asLong(inputTokens);
            outputTokens = usage.path("completion_tokens").asLong(outputTokens);
        }
        JsonNode choice = chunk.path("choices").path(0);
        JsonNode delta = choice.path("delta");

        String text = delta.path("content").asText("");
        if (delta.path("content").isTextual() && !text.isEmpty()) {
            if (openBlockIndex < 0 || !openBlockIsText) {
                closeOpenBlock(events);
                openBlockIndex = nextBlockIndex++;
                openBlockIsText = true;
                ObjectNode start = event("content_block_start");
                start.put("index", openBlockIndex);
                start.putObject("content_block").put("type", "text").put("text", "");
                events.add(emit(start));
            }
            ObjectNode blockDelta = event("content_block_delta");
            blockDelta.put("index", openBlockIndex);
            blockDelta.putObject("delta").put("type", "text_delta").put("text", text);
            events.add(emit(blockDelta));
        }

        for (JsonNode call : delta.path("tool_calls")) {
            int toolIndex = call.path("index").asInt(0);
            Integer blockIndex = toolBlocks.get(toolIndex);
            if (blockIndex == null) {
                closeOpenBlock(events);
                blockIndex = nextBlockIndex++;
                toolBlocks.put(toolIndex, blockIndex);
                openBlockIndex = blockIndex;
                openBlockIsText = false;
                ObjectNode start = event("content_block_start");
                start.put("index", blockIndex);
                ObjectNode block = start.putObject("content_block");
                block.put("type", "tool_use");
                block.put("id", call.path("id").asText("toolu_" + toolIndex));
                block.put("name", call.path("function").path("name").asText(""));
                block.putObject("input");
                if (call.has("extra_content")) {
                    block.set("extra_content", call.get("extra_content"));
                }
                events.add(emit(start));
            }
            String arguments = call.path("function").path("arguments").asText("");
            if (!arguments.isEmpty()) {
                ObjectNode blockDelta = event("content_block_delta");
                blockDelta.put("index", blockIndex);
                blockDelta.putObject("delta").put("type", "input_json_delta").put("partial_json", arguments);
                events.add(emit(blockDelta));
            }
        }

        if (choice.hasNonNull("finish_reason")) {
            stopReason = StopReasons.toStopReason(choice.get("finish_reason").asText());
        }
        return events;
    }

    @Override
    public List<SseEvent> finish() {
        if (finished) {
            return List.of();
        }
        finished = true;
        List<SseEvent> events = new ArrayList<>();
        ensureStarted(events);
        closeOpenBlock(events);
        ObjectNode messageDelta = event("message_delta");
        messageDelta.putObject("delta").put("stop_reason", stopReason).putNull("stop_sequence");
        messageDelta.putObject("usage").put("output_tokens", outputTokens);
        events.add(emit(messageDelta));
        events.add(emit(event("message_stop")));
        return events;
    }

    private void ensureStarted(List<SseEvent> events) {
        if (started) {
            return;
        }
        started = true;
        ObjectNode start = event("message_start");
        ObjectNode message = start.putObject("message");
        message.put("id", messageId);
        message.put("type", "message");
        message.put("role", "assistant");
        message.put("model", model);
        message.putArray("content");
        message.putNull("stop_reason");
        message.putNull("stop_sequence");
        message.putObject("usage").put("input_tokens", inputTokens).put("output_tokens", 0);
        events.add(emit(start));
    }

    private void closeOpenBlock(List<SseEvent> events) {
        if (openBlockIndex < 0) {
            return;
        }
        ObjectNode stop = event("content_block_stop");
        stop.put("index", openBlockIndex);
        events.add(emit(stop));
        openBlockIndex = -1;
    }

    private ObjectNode event(String type) {
        return mapper.createObjectNode().put("type", type);
    }

    private SseEvent emit(ObjectNode payload) {
        try {
            return SseEvent.named(payload.get("type").asText(), mapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream event", e);
        }
    }
}
