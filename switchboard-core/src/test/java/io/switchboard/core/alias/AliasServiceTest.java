package io.switchboard.core.alias;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchboard.core.testing.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AliasServiceTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

    @Test
    void shouldCacheRepeatedResolutions() {
        AliasService service = new AliasService(
            table(Map.of("fast", "gemini-flash")),
            new AliasResolverChain(),
            new ResolutionCache(Duration.ofMinutes(5), 100, clock)
        );

        ResolutionResult first = service.resolve("fast");
        ResolutionResult second = service.resolve("fast");

        assertThat(second).isEqualTo(first);
        assertThat(service.cacheStats().hits()).isEqualTo(1);
        assertThat(service.cacheStats().misses()).isEqualTo(1);
    }

    @Test
    void shouldKeyCacheByExplicitProvider() {
        AliasTable table = AliasTable.of(
            List.of("openai", "poe"),
            "openai",
            Map.of("poe", Map.of("fast", "gemini-flash")),
            Map.of()
        );
        AliasService service = new AliasService(table);

        assertThat(service.resolve("fast").provider()).isEqualTo("openai");
        assertThat(service.resolve("fast", "poe").resolvedModel()).isEqualTo("gemini-flash");
    }

    @Test
    void shouldNeverServeOldAliasesAfterReload() {
        AliasService service = new AliasService(table(Map.of("fast", "gemini-flash")));
        assertThat(service.resolve("fast").resolvedModel()).isEqualTo("gemini-flash");

        service.reload(table(Map.of("fast", "claude-haiku")));

        assertThat(service.resolve("fast").resolvedModel()).isEqualTo("claude-haiku");
        assertThat(service.cacheStats().generation()).isEqualTo(1);
    }

    @Test
    void shouldListAliasesOfActiveProvidersOnly() {
        AliasTable table = AliasTable.of(
            List.of("openai", "poe"),
            "openai",
            Map.of("openai", Map.of("smart", "gpt-4o"), "poe", Map.of("fast", "gemini-flash")),
            Map.of()
        );
        AliasService service = new AliasService(table);

        assertThat(service.activeAliases(Set.of("poe"))).containsOnlyKeys("poe");
    }

    @Test
    void shouldResolveAgainstOneTableWhileReloadsRace() throws Exception {
        AliasTable first = table(Map.of("fast", "tier", "tier", "model-a"));
        AliasTable second = table(Map.of("fast", "mid", "mid", "model-b"));
        ResolutionResult fromFirst = new AliasService(first).resolve("fast");
        ResolutionResult fromSecond = new AliasService(second).resolve("fast");
        AliasService service = new AliasService(first);

        int readers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(readers + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<ResolutionResult>>> results = new ArrayList<>();
            for (int i = 0; i < readers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    List<ResolutionResult> seen = new ArrayList<>();
                    for (int n = 0; n < 2_000; n++) {
                        seen.add(service.resolve("fast"));
                    }
                    return seen;
                }));
            }
            Future<?> writer = executor.submit((Callable<Void>) () -> {
                start.await();
                for (int n = 0; n < 500; n++) {
                    service.reload(n % 2 == 0 ? second : first);
                }
                service.reload(second);
                return null;
            });

            start.countDown();
            writer.get(30, TimeUnit.SECONDS);
            for (Future<List<ResolutionResult>> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).allSatisfy(
                    seen -> assertThat(seen).isIn(fromFirst, fromSecond)
                );
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(fromFirst.resolvedModel()).isEqualTo("model-a");
        assertThat(fromSecond.resolvedModel()).isEqualTo("model-b");
        assertThat(service.resolve("fast")).isEqualTo(fromSecond);
    }

    private static AliasTable table(Map<String, String> aliases) {
        return AliasTable.of(List.of("poe"), "poe", Map.of("poe", aliases), Map.of());
    }
}
