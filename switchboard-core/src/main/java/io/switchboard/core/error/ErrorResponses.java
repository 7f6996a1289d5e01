package io.switchboard.core.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.model.WireFormat;

/**
 * Renders gateway failures in the error envelope the client already understands.
 *
 * <pre>{@code
 * anthropic: {"type":"error","error":{"type":"rate_limit_error","message":"..."}}
 * openai:    {"error":{"message":"...","type":"rate_limit_error","code":429}}
 * }</pre>
 */
public final class ErrorResponses {
    private final ObjectMapper mapper;

    public ErrorResponses(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode render(GatewayException error, WireFormat clientFormat) {
        return render(error.category(), error.getMessage(), clientFormat);
    }

    public ObjectNode render(ErrorCategory category, String message, WireFormat clientFormat) {
        String text = message == null ? "" : message;
        if (clientFormat == WireFormat.ANTHROPIC) {
            ObjectNode root = mapper.createObjectNode();
            root.put("type", "error");
            ObjectNode error = root.putObject("error");
            error.put("type", category.errorType());
            error.put("message", text);
            return root;
        }
        ObjectNode root = mapper.createObjectNode();
        ObjectNode error = root.putObject("error");
        error.put("message", text);
        error.put("type", category.errorType());
        error.put("code", category.httpStatus());
        return root;
    }
}
