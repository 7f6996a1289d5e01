package io.switchboard.core.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.config.ConfigService;
import io.switchboard.core.config.ConfigurationLoader;
import io.switchboard.core.config.ConfigurationReloader;
import io.switchboard.core.conversion.SseEvent;
import io.switchboard.core.dispatch.ClientRequest;
import io.switchboard.core.middleware.ThoughtSignatureMiddleware;
import io.switchboard.core.model.WireFormat;
import io.switchboard.core.upstream.UpstreamClient;
import io.switchboard.core.upstream.UpstreamRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GatewayRuntimeTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void shouldWireThoughtSignatureMiddlewareWhenEnabled() throws Exception {
        Path configPath = write("""
            {"providers": {"openai": {"api_key": "sk"}}}
            """);

        try (GatewayRuntime runtime = runtime(configPath)) {
            runtime.start();

            assertThat(runtime.middleware().names()).containsExactly(ThoughtSignatureMiddleware.NAME);
            assertThat(runtime.middleware().isInitialized()).isTrue();
            assertThat(runtime.registry().defaultProvider()).contains("openai");
        }
    }

    @Test
    void shouldSkipDisabledMiddleware() throws Exception {
        Path configPath = write("""
            {"providers": {"openai": {"api_key": "sk"}},
             "middleware": {"thought_signatures": {"enabled": false}}}
            """);

        try (GatewayRuntime runtime = runtime(configPath)) {
            assertThat(runtime.middleware().names()).isEmpty();
        }
    }

    @Test
    void shouldApplyReloadedAliasesAndProviders() throws Exception {
        Path configPath = write("""
            {"providers": {"openai": {"api_key": "sk", "aliases": {"fast": "gpt-4o-mini"}}}}
            """);

        try (GatewayRuntime runtime = runtime(configPath)) {
            assertThat(runtime.aliases().resolve("fast").resolvedModel()).isEqualTo("gpt-4o-mini");

            write("""
                {"providers": {
                  "openai": {"api_key": "sk", "aliases": {"fast": "gpt-4.1-mini"}},
                  "poe": {"api_key": "pk", "base_url": "https://api.poe.com/v1"}
                }}
                """);
            assertThat(runtime.reloader().reload()).isTrue();

            assertThat(runtime.aliases().resolve("fast").resolvedModel()).isEqualTo("gpt-4.1-mini");
            assertThat(runtime.registry().names()).containsExactly("openai", "poe");
        }
    }

    @Test
    void shouldRouteEveryRequestAgainstOneConfigurationWhileReloading() throws Exception {
        String alpha = """
            {"default_provider": "alpha",
             "providers": {"alpha": {"api_key": "ka", "base_url": "https://alpha.example/v1", "aliases": {"fast": "model-a"}}},
             "middleware": {"thought_signatures": {"enabled": false}}}
            """;
        String beta = """
            {"default_provider": "beta",
             "providers": {"beta": {"api_key": "kb", "base_url": "https://beta.example/v1", "aliases": {"fast": "model-b"}}},
             "middleware": {"thought_signatures": {"enabled": false}}}
            """;
        Path configPath = write(alpha);
        RecordingUpstream upstream = new RecordingUpstream();
        ConfigurationReloader reloader = new ConfigurationReloader(
            new ConfigurationLoader(new ConfigService(MAPPER), configPath, Map.of())
        );

        try (GatewayRuntime runtime = GatewayRuntime.create(reloader, upstream, MAPPER, Clock.systemUTC())) {
            int clients = 4;
            ExecutorService executor = Executors.newFixedThreadPool(clients + 1);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < clients; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int n = 0; n < 300; n++) {
                            runtime.dispatcher().dispatch(ClientRequest.of(WireFormat.OPENAI, chatRequest("fast")));
                        }
                        return null;
                    }));
                }
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int n = 0; n < 200; n++) {
                        write(n % 2 == 0 ? beta : alpha);
                        assertThat(reloader.reload()).isTrue();
                    }
                    return null;
                }));

                start.countDown();
                for (Future<?> future : futures) {
                    future.get(60, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }
        }

        assertThat(upstream.calls).hasSize(1_200);
        assertThat(upstream.calls).allSatisfy(call -> assertThat(call).isIn("alpha:model-a", "beta:model-b"));
    }

    private static ObjectNode chatRequest(String model) {
        ObjectNode body = MAPPER.createObjectNode().put("model", model);
        body.putArray("messages").addObject().put("role", "user").put("content", "hi");
        return body;
    }

    private GatewayRuntime runtime(Path configPath) {
        ConfigurationReloader reloader = new ConfigurationReloader(
            new ConfigurationLoader(new ConfigService(MAPPER), configPath, Map.of())
        );
        return GatewayRuntime.create(reloader, new UnusedUpstream(), MAPPER, Clock.systemUTC());
    }

    private Path write(String json) throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, json);
        return configPath;
    }

    private static final class UnusedUpstream implements UpstreamClient {
        @Override
        public JsonNode send(UpstreamRequest request) {
            throw new UnsupportedOperationException("no upstream in this test");
        }

        @Override
        public void stream(UpstreamRequest request, Consumer<SseEvent> onEvent) {
            throw new UnsupportedOperationException("no upstream in this test");
        }
    }

    private static final class RecordingUpstream implements UpstreamClient {
        private final Queue<String> calls = new ConcurrentLinkedQueue<>();

        @Override
        public JsonNode send(UpstreamRequest request) {
            calls.add(request.provider().name() + ":" + request.body().path("model").asText());
            return MAPPER.createObjectNode().put("id", "chatcmpl-1").put("object", "chat.completion");
        }

        @Override
        public void stream(UpstreamRequest request, Consumer<SseEvent> onEvent) {
            throw new UnsupportedOperationException("streaming is not used in this test");
        }
    }
}
