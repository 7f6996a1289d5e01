package io.switchboard.core.conversion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.model.WireFormat;
import java.time.Clock;

/**
 * Converts bodies between the client's dialect and the provider's. When both speak the same
 * dialect, bodies and stream framing pass through untouched apart from the model name.
 */
public final class ProtocolConverter {
    private final ObjectMapper mapper;
    private final RequestConverter requests;
    private final ResponseConverter responses;
    private final Clock clock;

    public ProtocolConverter(ObjectMapper mapper) {
        this(mapper, Clock.systemUTC());
    }

    public ProtocolConverter(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
        this.requests = new RequestConverter(mapper);
        this.responses = new ResponseConverter(mapper, clock);
    }

    public static boolean needsConversion(WireFormat client, WireFormat provider) {
        return client != provider;
    }

    /**
     * Request body for the provider, with the resolved model filled in.
     */
    public ObjectNode convertRequest(ObjectNode body, WireFormat client, WireFormat provider, String model) {
        if (!needsConversion(client, provider)) {
            ObjectNode copy = body.deepCopy();
            copy.put("model", model);
            return copy;
        }
        return client == WireFormat.ANTHROPIC
            ? requests.anthropicToOpenAi(body, model)
            : requests.openAiToAnthropic(body, model);
    }

    public JsonNode convertResponse(JsonNode body, WireFormat client, WireFormat provider) {
        if (!needsConversion(client, provider)) {
            return body;
        }
        return client == WireFormat.ANTHROPIC
            ? responses.openAiToAnthropic(body)
            : responses.anthropicToOpenAi(body);
    }

    public StreamTranslator streamTranslator(WireFormat client, WireFormat provider, String model, String requestId) {
        if (!needsConversion(client, provider)) {
            return StreamTranslator.passThrough();
        }
        if (client == WireFormat.ANTHROPIC) {
            return new OpenAiToAnthropicStream(mapper, "msg_" + requestId, model);
        }
        return new AnthropicToOpenAiStream(mapper, "chatcmpl-" + requestId, model, clock.instant().getEpochSecond());
    }
}
