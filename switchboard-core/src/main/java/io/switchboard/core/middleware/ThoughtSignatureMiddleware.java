package io.switchboard.core.middleware;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps Gemini thought signatures alive across the turns of a conversation.
 *
 * <p>Gemini attaches {@code extra_content.google.thought_signature} to the tool calls it emits
 * and rejects follow-up requests whose tool calls lost it. Clients rarely echo the field, so
 * this middleware remembers it per conversation and puts it back on matching tool calls.
 */
public final class ThoughtSignatureMiddleware implements Middleware {
    public static final String NAME = "gemini-thought-signatures";
    static final String METADATA_KEY = "thought_signatures";

    private static final Logger LOG = LoggerFactory.getLogger(ThoughtSignatureMiddleware.class);

    private final ThoughtSignatureStore store;
    private final Duration cleanupInterval;
    private ScheduledExecutorService scheduler;

    public ThoughtSignatureMiddleware(ThoughtSignatureStore store, Duration cleanupInterval) {
        this.store = store;
        this.cleanupInterval = cleanupInterval;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean shouldHandle(String provider, String model) {
        return model != null && model.toLowerCase(Locale.ROOT).contains("gemini");
    }

    @Override
    public RequestContext beforeRequest(RequestContext context) {
        Map<String, String> signatures = store.get(context.conversationId());
        if (signatures.isEmpty()) {
            return context;
        }
        JsonNode messages = context.messages();
        int injected = inject(messages, signatures);
        if (injected == 0) {
            return context;
        }
        LOG.debug("Restored {} thought signatures for conversation {}", injected, context.conversationId());
        return context.withMessages(messages);
    }

    @Override
    public ResponseContext afterResponse(ResponseContext context) {
        Map<String, String> found = new LinkedHashMap<>();
        collect(context.body(), found);
        if (!found.isEmpty()) {
            store.put(context.request().conversationId(), found);
        }
        return context;
    }

    @Override
    public StreamChunkContext onStreamChunk(StreamChunkContext context) {
        Map<String, String> found = new LinkedHashMap<>();
        collect(context.delta(), found);
        if (found.isEmpty()) {
            return context;
        }
        Map<String, String> merged = new LinkedHashMap<>(signaturesFrom(context.accumulatedMetadata()));
        merged.putAll(found);
        return context.withMetadata(METADATA_KEY, Map.copyOf(merged));
    }

    @Override
    public void onStreamComplete(RequestContext request, Map<String, Object> accumulatedMetadata) {
        Map<String, String> signatures = signaturesFrom(accumulatedMetadata);
        if (!signatures.isEmpty()) {
            store.put(request.conversationId(), signatures);
        }
    }

    @Override
    public void initialize() {
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "thought-signature-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = cleanupInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::cleanupExpired, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void cleanup() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        store.clear();
    }

    boolean isCleanupScheduled() {
        return scheduler != null && !scheduler.isShutdown();
    }

    private void cleanupExpired() {
        int removed = store.cleanupExpired();
        if (removed > 0) {
            LOG.debug("Dropped {} expired thought signature conversations", removed);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> signaturesFrom(Map<String, Object> metadata) {
        Object value = metadata.get(METADATA_KEY);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, String>) map;
        }
        return Map.of();
    }

    private static void collect(JsonNode node, Map<String, String> found) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            JsonNode signature = node.path("extra_content").path("google").path("thought_signature");
            String id = node.path("id").asText("");
            if (signature.isTextual() && !id.isEmpty()) {
                found.put(id, signature.asText());
            }
            node.elements().forEachRemaining(child -> collect(child, found));
        } else if (node.isArray()) {
            node.forEach(child -> collect(child, found));
        }
    }

    private static int inject(JsonNode node, Map<String, String> signatures) {
        int count = 0;
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            String id = object.path("id").asText("");
            boolean toolCall = object.has("function") || "tool_use".equals(object.path("type").asText());
            if (toolCall && signatures.containsKey(id) && !object.has("extra_content")) {
                object.putObject("extra_content")
                    .putObject("google")
                    .put("thought_signature", signatures.get(id));
                count++;
            }
            var fields = object.elements();
            while (fields.hasNext()) {
                count += inject(fields.next(), signatures);
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                count += inject(child, signatures);
            }
        }
        return count;
    }
}
