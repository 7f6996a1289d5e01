package io.switchboard.core.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.conversion.SseEvent;
import io.switchboard.core.conversion.SseParser;
import io.switchboard.core.error.UpstreamHttpException;
import io.switchboard.core.error.UpstreamResponseException;
import io.switchboard.core.error.UpstreamUnavailableException;
import io.switchboard.core.model.WireFormat;
import io.switchboard.core.provider.ProviderConfig;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UpstreamClient} on OkHttp. Connection failures and 5xx answers are retried with
 * backoff up to the provider's {@code maxRetries}; 4xx answers and unreadable 2xx bodies are
 * returned to the caller straight away.
 */
public final class OkHttpUpstreamClient implements UpstreamClient {
    public static final String ANTHROPIC_VERSION = "2023-06-01";

    private static final Logger LOG = LoggerFactory.getLogger(OkHttpUpstreamClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final long initialBackoffMs;

    public OkHttpUpstreamClient(ObjectMapper mapper) {
        this(new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .writeTimeout(Duration.ofSeconds(20))
            .build(), mapper, 250);
    }

    public OkHttpUpstreamClient(OkHttpClient client, ObjectMapper mapper, long initialBackoffMs) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
    }

    @Override
    public JsonNode send(UpstreamRequest request) {
        Request http = buildRequest(request, false);
        OkHttpClient scoped = scopedClient(request.provider());
        int maxAttempts = request.provider().maxRetries() + 1;
        long delayMs = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try (Response response = scoped.newCall(http).execute()) {
                ResponseBody body = response.body();
                String text = body == null ? "" : body.string();
                if (response.isSuccessful()) {
                    return parse(request.provider(), text);
                }
                if (response.code() >= 500 && attempt < maxAttempts) {
                    LOG.debug("Provider {} returned HTTP {}, retrying", request.provider().name(), response.code());
                    delayMs = backoff(delayMs);
                    continue;
                }
                throw new UpstreamHttpException(response.code(), text);
            } catch (IOException e) {
                if (attempt < maxAttempts) {
                    LOG.debug("Call to provider {} failed: {}, retrying", request.provider().name(), e.getMessage());
                    delayMs = backoff(delayMs);
                    continue;
                }
                throw new UpstreamUnavailableException(request.provider().name(), e);
            }
        }
    }

    @Override
    public void stream(UpstreamRequest request, Consumer<SseEvent> onEvent) {
        Request http = buildRequest(request, true);
        try (Response response = scopedClient(request.provider()).newCall(http).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new UpstreamHttpException(response.code(), body == null ? "" : body.string());
            }
            if (body == null) {
                return;
            }
            SseParser parser = new SseParser();
            BufferedSource source = body.source();
            while (!source.exhausted()) {
                String line = source.readUtf8Line();
                if (line == null) {
                    break;
                }
                parser.accept(line).ifPresent(onEvent);
            }
            parser.flush().ifPresent(onEvent);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(request.provider().name(), e);
        }
    }

    private Request buildRequest(UpstreamRequest request, boolean streaming) {
        ProviderConfig provider = request.provider();
        HttpUrl base = HttpUrl.get(provider.baseUrl());
        Request.Builder builder = new Request.Builder()
            .header("Content-Type", "application/json")
            .header("Accept", streaming ? "text/event-stream" : "application/json");
        String body;
        try {
            body = mapper.writeValueAsString(request.body());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize upstream request", e);
        }
        if (provider.apiFormat() == WireFormat.ANTHROPIC) {
            builder.url(base.newBuilder().addPathSegment("messages").build())
                .header("x-api-key", request.apiKey())
                .header("anthropic-version", ANTHROPIC_VERSION);
        } else {
            builder.url(base.newBuilder().addPathSegments("chat/completions").build())
                .header("Authorization", "Bearer " + request.apiKey());
        }
        for (Map.Entry<String, String> header : provider.customHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (request.requestId() != null) {
            builder.header("X-Request-Id", request.requestId());
        }
        return builder.post(RequestBody.create(body, JSON)).build();
    }

    private OkHttpClient scopedClient(ProviderConfig provider) {
        return client.newBuilder()
            .readTimeout(provider.timeout())
            .callTimeout(provider.timeout())
            .build();
    }

    private JsonNode parse(ProviderConfig provider, String text) {
        if (text.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UpstreamResponseException(provider.name(), e);
        }
    }

    private long backoff(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        return Math.min(Math.max(delayMs * 2, 1), 2000);
    }
}
