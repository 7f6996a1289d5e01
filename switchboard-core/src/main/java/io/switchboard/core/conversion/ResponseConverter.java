package io.switchboard.core.conversion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;

/**
 * Translates non-streaming response bodies between the two dialects.
 */
public final class ResponseConverter {
    private final ObjectMapper mapper;
    private final Clock clock;

    public ResponseConverter(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public ObjectNode anthropicToOpenAi(JsonNode response) {
        StringBuilder text = new StringBuilder();
        ArrayNode toolCalls = mapper.createArrayNode();
        for (JsonNode block : response.path("content")) {
            String type = block.path("type").asText("");
            if ("text".equals(type)) {
                text.append(block.path("text").asText(""));
            } else if ("tool_use".equals(type)) {
                ObjectNode call = toolCalls.addObject();
                call.put("id", block.path("id").asText(""));
                call.put("type", "function");
                ObjectNode function = call.putObject("function");
                function.put("name", block.path("name").asText(""));
                function.put("arguments", writeJson(block.has("input") ? block.get("input") : mapper.createObjectNode()));
                if (block.has("extra_content")) {
                    call.set("extra_content", block.get("extra_content"));
                }
            }
        }

        ObjectNode out = mapper.createObjectNode();
        out.put("id", response.path("id").asText("chatcmpl-anthropic"));
        out.put("object", "chat.completion");
        out.put("created", clock.instant().getEpochSecond());
        out.put("model", response.path("model").asText("unknown"));
        ObjectNode choice = out.putArray("choices").addObject();
        choice.put("index", 0);
        ObjectNode message = choice.putObject("message");
        message.put("role", "assistant");
        if (text.length() == 0) {
            message.putNull("content");
        } else {
            message.put("content", text.toString());
        }
        if (!toolCalls.isEmpty()) {
            message.set("tool_calls", toolCalls);
        }
        choice.put("finish_reason", StopReasons.toFinishReason(response.path("stop_reason").asText(null)));

        JsonNode usage = response.path("usage");
        if (usage.has("input_tokens") && usage.has("output_tokens")) {
            long prompt = usage.get("input_tokens").asLong();
            long completion = usage.get("output_tokens").asLong();
            out.putObject("usage")
                .put("prompt_tokens", prompt)
                .put("completion_tokens", completion)
                .put("total_tokens", prompt + completion);
        }
        return out;
    }

    public ObjectNode openAiToAnthropic(JsonNode response) {
        JsonNode choice = response.path("choices").path(0);
        JsonNode message = choice.path("message");

        ObjectNode out = mapper.createObjectNode();
        out.put("id", response.path("id").asText("msg_openai"));
        out.put("type", "message");
        out.put("role", "assistant");
        out.put("model", response.path("model").asText("unknown"));
        ArrayNode content = out.putArray("content");
        String text = RequestConverter.contentText(message.path("content"));
        if (!text.isEmpty()) {
            content.addObject().put("type", "text").put("text", text);
        }
        for (JsonNode call : message.path("tool_calls")) {
            ObjectNode toolUse = content.addObject();
            toolUse.put("type", "tool_use");
            toolUse.put("id", call.path("id").asText(""));
            toolUse.put("name", call.path("function").path("name").asText(""));
            toolUse.set("input", parseArguments(call.path("function").path("arguments").asText("")));
            if (call.has("extra_content")) {
                toolUse.set("extra_content", call.get("extra_content"));
            }
        }
        out.put("stop_reason", StopReasons.toStopReason(choice.path("finish_reason").asText(null)));
        out.putNull("stop_sequence");
        JsonNode usage = response.path("usage");
        out.putObject("usage")
            .put("input_tokens", usage.path("prompt_tokens").asLong(0))
            .put("output_tokens", usage.path("completion_tokens").asLong(0));
        return out;
    }

    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            return mapper.createObjectNode().put("_raw", arguments);
        }
    }

    private String writeJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool input", e);
        }
    }
}
