package io.switchboard.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.dispatch.ClientRequest;
import io.switchboard.core.error.GatewayException;
import io.switchboard.core.model.WireFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "send", description = "Dispatch a request body through the gateway and print the response")
public final class SendCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-f", "--file"}, required = true, description = "JSON request body")
    Path file;

    @Option(names = "--format", defaultValue = "openai", description = "Dialect of the body: openai or anthropic")
    String format;

    @Option(names = {"-p", "--provider"}, description = "Explicit provider scope")
    String provider;

    @Option(names = "--api-key", description = "Client API key, used by passthrough providers")
    String apiKey;

    @Option(names = "--conversation", description = "Conversation id")
    String conversationId;

    public SendCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        WireFormat clientFormat;
        ObjectNode body;
        try {
            clientFormat = WireFormat.parse(format);
            JsonNode parsed = context.mapper().readTree(Files.readString(file));
            if (!parsed.isObject()) {
                System.err.println("Send failed: request body must be a JSON object");
                return 1;
            }
            body = (ObjectNode) parsed;
        } catch (Exception e) {
            System.err.println("Send failed: " + e.getMessage());
            return 1;
        }

        ClientRequest request = new ClientRequest(clientFormat, body, provider, apiKey, null, conversationId);
        try {
            if (request.streaming()) {
                context.runtime().dispatcher().dispatchStream(request, event -> System.out.print(event.toWire()));
            } else {
                JsonNode response = context.runtime().dispatcher().dispatch(request);
                System.out.println(context.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(response));
            }
            return 0;
        } catch (GatewayException e) {
            System.err.println(context.runtime().errors().render(e, clientFormat).toString());
            return 1;
        } catch (Exception e) {
            System.err.println("Send failed: " + e.getMessage());
            return 1;
        }
    }
}
