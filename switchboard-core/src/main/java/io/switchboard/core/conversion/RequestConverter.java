package io.switchboard.core.conversion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.error.ConversionException;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates request bodies between the Anthropic messages and OpenAI chat-completion dialects.
 *
 * <p>Unknown top-level fields are not carried over; each dialect only receives what it accepts.
 */
public final class RequestConverter {
    private final ObjectMapper mapper;

    public RequestConverter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode anthropicToOpenAi(JsonNode request, String model) {
        ObjectNode out = mapper.createObjectNode();
        out.put("model", model);
        if (request.hasNonNull("max_tokens")) {
            out.set("max_tokens", request.get("max_tokens"));
        }
        ArrayNode messages = out.putArray("messages");
        String system = contentText(request.path("system"));
        if (!system.isEmpty()) {
            messages.addObject().put("role", "system").put("content", system);
        }
        for (JsonNode message : request.path("messages")) {
            appendOpenAiMessages(messages, message);
        }
        copyIfPresent(request, out, "temperature", "temperature");
        copyIfPresent(request, out, "top_p", "top_p");
        if (request.has("stop_sequences")) {
            out.set("stop", request.get("stop_sequences"));
        }
        if (request.path("stream").asBoolean(false)) {
            out.put("stream", true);
            out.putObject("stream_options").put("include_usage", true);
        }
        ArrayNode tools = mapper.createArrayNode();
        for (JsonNode tool : request.path("tools")) {
            String name = tool.path("name").asText("");
            if (name.isEmpty()) {
                continue;
            }
            ObjectNode function = tools.addObject().put("type", "function").putObject("function");
            function.put("name", name);
            function.put("description", tool.path("description").asText(""));
            function.set("parameters", tool.has("input_schema") ? tool.get("input_schema") : emptySchema());
        }
        if (!tools.isEmpty()) {
            out.set("tools", tools);
        }
        if (request.has("tool_choice")) {
            out.set("tool_choice", toOpenAiToolChoice(request.get("tool_choice")));
        }
        return out;
    }

    public ObjectNode openAiToAnthropic(JsonNode request, String model) {
        JsonNode maxTokens = request.hasNonNull("max_tokens") ? request.get("max_tokens") : request.get("max_completion_tokens");
        if (maxTokens == null || maxTokens.isNull()) {
            throw new ConversionException("OpenAI request missing max_tokens, required by Anthropic-format providers");
        }
        ObjectNode out = mapper.createObjectNode();
        out.put("model", model);
        out.set("max_tokens", maxTokens);
        out.put("stream", request.path("stream").asBoolean(false));

        List<String> systemParts = new ArrayList<>();
        ArrayNode messages = mapper.createArrayNode();
        for (JsonNode message : request.path("messages")) {
            String role = message.path("role").asText("");
            switch (role) {
                case "system", "developer" -> {
                    String text = contentText(message.path("content"));
                    if (!text.isEmpty()) {
                        systemParts.add(text);
                    }
                }
                case "tool" -> appendToolResult(messages, message);
                case "user", "assistant" -> messages.add(toAnthropicMessage(role, message));
                default -> {
                }
            }
        }
        if (!systemParts.isEmpty()) {
            out.put("system", String.join("\n\n", systemParts));
        }
        out.set("messages", messages);

        copyIfPresent(request, out, "temperature", "temperature");
        copyIfPresent(request, out, "top_p", "top_p");
        JsonNode stop = request.get("stop");
        if (stop != null && !stop.isNull()) {
            ArrayNode sequences = out.putArray("stop_sequences");
            if (stop.isArray()) {
                stop.forEach(sequences::add);
            } else {
                sequences.add(stop.asText());
            }
        }
        ArrayNode tools = mapper.createArrayNode();
        for (JsonNode tool : request.path("tools")) {
            if (!"function".equals(tool.path("type").asText())) {
                continue;
            }
            JsonNode function = tool.path("function");
            String name = function.path("name").asText("");
            if (name.isEmpty()) {
                continue;
            }
            ObjectNode converted = tools.addObject();
            converted.put("name", name);
            converted.put("description", function.path("description").asText(""));
            converted.set("input_schema", function.has("parameters") ? function.get("parameters") : emptySchema());
        }
        if (!tools.isEmpty()) {
            out.set("tools", tools);
        }
        if (request.has("tool_choice")) {
            JsonNode choice = toAnthropicToolChoice(request.get("tool_choice"));
            if (choice != null) {
                out.set("tool_choice", choice);
            }
        }
        return out;
    }

    private void appendOpenAiMessages(ArrayNode out, JsonNode message) {
        String role = message.path("role").asText("user");
        JsonNode content = message.path("content");
        if (content.isTextual()) {
            out.addObject().put("role", role).put("content", content.asText());
            return;
        }
        List<JsonNode> textParts = new ArrayList<>();
        ArrayNode toolCalls = mapper.createArrayNode();
        for (JsonNode block : content) {
            String type = block.path("type").asText("");
            switch (type) {
                case "text" -> textParts.add(mapper.createObjectNode().put("type", "text").put("text", block.path("text").asText("")));
                case "image" -> textParts.add(toImageUrlPart(block));
                case "tool_use" -> toolCalls.add(toToolCall(block));
                case "tool_result" -> {
                    ObjectNode tool = out.addObject();
                    tool.put("role", "tool");
                    tool.put("tool_call_id", block.path("tool_use_id").asText(""));
                    tool.put("content", contentText(block.path("content")));
                }
                default -> {
                }
            }
        }
        if (textParts.isEmpty() && toolCalls.isEmpty()) {
            return;
        }
        ObjectNode converted = out.addObject();
        converted.put("role", role);
        if ("assistant".equals(role)) {
            String text = joinText(textParts);
            if (text.isEmpty()) {
                converted.putNull("content");
            } else {
                converted.put("content", text);
            }
            if (!toolCalls.isEmpty()) {
                converted.set("tool_calls", toolCalls);
            }
        } else if (textParts.stream().allMatch(part -> "text".equals(part.path("type").asText()))) {
            converted.put("content", joinText(textParts));
        } else {
            converted.putArray("content").addAll(textParts);
        }
    }

    private ObjectNode toToolCall(JsonNode block) {
        ObjectNode call = mapper.createObjectNode();
        call.put("id", block.path("id").asText(""));
        call.put("type", "function");
        ObjectNode function = call.putObject("function");
        function.put("name", block.path("name").asText(""));
        function.put("arguments", writeJson(block.has("input") ? block.get("input") : mapper.createObjectNode()));
        if (block.has("extra_content")) {
            call.set("extra_content", block.get("extra_content"));
        }
        return call;
    }

    private ObjectNode toImageUrlPart(JsonNode block) {
        JsonNode source = block.path("source");
        String url = "base64".equals(source.path("type").asText())
            ? "data:" + source.path("media_type").asText("image/png") + ";base64," + source.path("data").asText("")
            : source.path("url").asText("");
        ObjectNode part = mapper.createObjectNode().put("type", "image_url");
        part.putObject("image_url").put("url", url);
        return part;
    }

    private ObjectNode toAnthropicMessage(String role, JsonNode message) {
        ObjectNode out = mapper.createObjectNode().put("role", role);
        ArrayNode blocks = out.putArray("content");
        JsonNode content = message.path("content");
        if (content.isTextual()) {
            if (!content.asText().isEmpty()) {
                blocks.addObject().put("type", "text").put("text", content.asText());
            }
        } else {
            for (JsonNode part : content) {
                String type = part.path("type").asText("");
                if ("text".equals(type)) {
                    blocks.addObject().put("type", "text").put("text", part.path("text").asText(""));
                } else if ("image_url".equals(type)) {
                    blocks.add(toImageBlock(part.path("image_url").path("url").asText("")));
                }
            }
        }
        for (JsonNode call : message.path("tool_calls")) {
            ObjectNode toolUse = blocks.addObject();
            toolUse.put("type", "tool_use");
            toolUse.put("id", call.path("id").asText(""));
            toolUse.put("name", call.path("function").path("name").asText(""));
            toolUse.set("input", parseArguments(call.path("function").path("arguments").asText("")));
            if (call.has("extra_content")) {
                toolUse.set("extra_content", call.get("extra_content"));
            }
        }
        return out;
    }

    private ObjectNode toImageBlock(String url) {
        ObjectNode block = mapper.createObjectNode().put("type", "image");
        ObjectNode source = block.putObject("source");
        if (url.startsWith("data:") && url.contains(";base64,")) {
            int separator = url.indexOf(";base64,");
            source.put("type", "base64");
            source.put("media_type", url.substring(5, separator));
            source.put("data", url.substring(separator + 8));
        } else {
            source.put("type", "url");
            source.put("url", url);
        }
        return block;
    }

    private void appendToolResult(ArrayNode messages, JsonNode message) {
        ObjectNode result = mapper.createObjectNode();
        result.put("type", "tool_result");
        result.put("tool_use_id", message.path("tool_call_id").asText(""));
        JsonNode content = message.path("content");
        result.put("content", content.isTextual() ? content.asText() : writeJson(content));

        // consecutive tool results belong to a single user turn
        JsonNode last = messages.isEmpty() ? null : messages.get(messages.size() - 1);
        if (last != null && "user".equals(last.path("role").asText()) && isToolResultTurn(last)) {
            ((ArrayNode) last.get("content")).add(result);
            return;
        }
        ObjectNode turn = messages.addObject().put("role", "user");
        turn.putArray("content").add(result);
    }

    private static boolean isToolResultTurn(JsonNode message) {
        JsonNode content = message.path("content");
        if (!content.isArray() || content.isEmpty()) {
            return false;
        }
        for (JsonNode block : content) {
            if (!"tool_result".equals(block.path("type").asText())) {
                return false;
            }
        }
        return true;
    }

    private JsonNode toOpenAiToolChoice(JsonNode choice) {
        String type = choice.path("type").asText(choice.asText(""));
        return switch (type) {
            case "any" -> mapper.getNodeFactory().textNode("required");
            case "none" -> mapper.getNodeFactory().textNode("none");
            case "tool" -> {
                ObjectNode named = mapper.createObjectNode().put("type", "function");
                named.putObject("function").put("name", choice.path("name").asText(""));
                yield named;
            }
            default -> mapper.getNodeFactory().textNode("auto");
        };
    }

    private JsonNode toAnthropicToolChoice(JsonNode choice) {
        if (choice.isTextual()) {
            return switch (choice.asText()) {
                case "required" -> mapper.createObjectNode().put("type", "any");
                case "none" -> mapper.createObjectNode().put("type", "none");
                case "auto" -> mapper.createObjectNode().put("type", "auto");
                default -> null;
            };
        }
        String name = choice.path("function").path("name").asText("");
        if (name.isEmpty()) {
            return null;
        }
        return mapper.createObjectNode().put("type", "tool").put("name", name);
    }

    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            throw new ConversionException("Tool call arguments are not valid JSON: " + e.getOriginalMessage());
        }
    }

    private String writeJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool payload", e);
        }
    }

    private ObjectNode emptySchema() {
        ObjectNode schema = mapper.createObjectNode().put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    private static void copyIfPresent(JsonNode from, ObjectNode to, String sourceField, String targetField) {
        if (from.hasNonNull(sourceField)) {
            to.set(targetField, from.get(sourceField));
        }
    }

    static String contentText(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode part : content) {
            if ("text".equals(part.path("type").asText()) && part.has("text")) {
                parts.add(part.get("text").asText());
            }
        }
        return String.join("\n\n", parts);
    }

    private static String joinText(List<JsonNode> parts) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            if ("text".equals(part.path("type").asText())) {
                text.append(part.path("text").asText(""));
            }
        }
        return text.toString();
    }
}
