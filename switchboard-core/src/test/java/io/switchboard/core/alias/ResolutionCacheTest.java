package io.switchboard.core.alias;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.switchboard.core.testing.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResolutionCacheTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

    @Test
    void shouldServeEntryUntilTtlElapses() {
        ResolutionCache cache = new ResolutionCache(Duration.ofMinutes(10), 10, clock);
        cache.put("|fast", ResolutionResult.resolved("poe", "gemini-flash", List.of("fast")));

        clock.advance(Duration.ofMinutes(9));
        assertThat(cache.get("|fast")).isPresent();

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get("|fast")).isEmpty();
    }

    @Test
    void shouldDropResultsComputedForOlderGeneration() {
        ResolutionCache cache = new ResolutionCache(Duration.ofMinutes(10), 10, clock);
        long before = cache.generation();

        long after = cache.invalidateAll();
        cache.put("|fast", ResolutionResult.unresolved("poe", "fast"), before);

        assertThat(after).isEqualTo(before + 1);
        assertThat(cache.get("|fast")).isEmpty();
        assertThat(cache.stats().size()).isZero();
    }

    @Test
    void shouldMissWhenReaderExpectsDifferentGeneration() {
        ResolutionCache cache = new ResolutionCache(Duration.ofMinutes(10), 10, clock);
        cache.put("|fast", ResolutionResult.unresolved("poe", "fast"));

        assertThat(cache.get("|fast", cache.generation() + 1)).isEmpty();
        assertThat(cache.get("|fast", cache.generation())).isPresent();
    }

    @Test
    void shouldEvictOldestEntryWhenFull() {
        ResolutionCache cache = new ResolutionCache(Duration.ofMinutes(10), 2, clock);
        cache.put("a", ResolutionResult.unresolved("p", "a"));
        cache.put("b", ResolutionResult.unresolved("p", "b"));
        cache.put("c", ResolutionResult.unresolved("p", "c"));

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).isPresent();
        assertThat(cache.get("c")).isPresent();
        assertThat(cache.stats().size()).isEqualTo(2);
    }

    @Test
    void shouldStayBoundedWhenHotKeyIsStoredAgainAfterExpiry() {
        ResolutionCache cache = new ResolutionCache(Duration.ofSeconds(1), 10, clock);

        for (int i = 0; i < 100_000; i++) {
            cache.put("fast", ResolutionResult.resolved("poe", "gemini-flash", List.of("fast")));
            clock.advance(Duration.ofSeconds(2));
            assertThat(cache.get("fast")).isEmpty();
        }
        cache.put("fast", ResolutionResult.resolved("poe", "gemini-flash", List.of("fast")));

        assertThat(cache.stats().size()).isEqualTo(1);
        assertThat(cache.get("fast")).isPresent();
    }

    @Test
    void shouldEvictLeastRecentlyUsedEntry() {
        ResolutionCache cache = new ResolutionCache(Duration.ofMinutes(10), 2, clock);
        cache.put("a", ResolutionResult.unresolved("p", "a"));
        for (int i = 0; i < 1_000; i++) {
            cache.put("fast", ResolutionResult.unresolved("p", "fast"));
        }
        cache.get("a");
        cache.put("b", ResolutionResult.unresolved("p", "b"));

        assertThat(cache.get("fast")).isEmpty();
        assertThat(cache.get("a")).isPresent();
        assertThat(cache.get("b")).isPresent();
        assertThat(cache.stats().size()).isEqualTo(2);
    }

    @Test
    void shouldReportHitsAndMisses() {
        ResolutionCache cache = new ResolutionCache(Duration.ofMinutes(10), 10, clock);
        cache.put("a", ResolutionResult.unresolved("p", "a"));

        cache.get("a");
        cache.get("a");
        cache.get("a");
        cache.get("missing");

        ResolutionCache.CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(3);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.75);
        assertThat(stats.maxSize()).isEqualTo(10);
        assertThat(stats.ttl()).isEqualTo(Duration.ofMinutes(10));

        cache.clear();
        assertThat(cache.stats().hits()).isZero();
        assertThat(cache.stats().size()).isZero();
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new ResolutionCache(Duration.ZERO, 10, clock))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolutionCache(Duration.ofMinutes(1), 0, clock))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
