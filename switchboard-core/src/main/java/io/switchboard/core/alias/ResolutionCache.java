package io.switchboard.core.alias;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, TTL'd cache of resolution results stamped with the generation of the alias
 * snapshot they were computed from.
 *
 * <p>{@link #invalidateAll()} bumps the generation before clearing, so an entry computed
 * against an older snapshot is never served and never stored once the bump happened.
 * Past {@code maxSize} the least recently used entry is evicted.
 */
public final class ResolutionCache {
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final int DEFAULT_MAX_SIZE = 1_000;

    private static final Logger LOG = LoggerFactory.getLogger(ResolutionCache.class);

    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;
    private final Map<String, Slot> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResolutionCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE, Clock.systemUTC());
    }

    public ResolutionCache(Duration ttl, int maxSize, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Slot> eldest) {
                return size() > ResolutionCache.this.maxSize;
            }
        };
    }

    public long generation() {
        return generation.get();
    }

    public Optional<ResolutionResult> get(String key) {
        return get(key, generation.get());
    }

    public Optional<ResolutionResult> get(String key, long expectedGeneration) {
        long now = clock.millis();
        lock.lock();
        try {
            Slot entry = entries.get(key);
            if (entry != null && entry.expiresAtMs() <= now) {
                entries.remove(key);
                entry = null;
            }
            if (entry == null || entry.generation() != expectedGeneration || entry.generation() != generation.get()) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(entry.result());
        } finally {
            lock.unlock();
        }
    }

    public void put(String key, ResolutionResult result) {
        put(key, result, generation.get());
    }

    /**
     * Stores a result computed under {@code computedGeneration}; dropped when the cache has
     * moved on to a newer generation in the meantime.
     */
    public void put(String key, ResolutionResult result, long computedGeneration) {
        lock.lock();
        try {
            if (computedGeneration != generation.get()) {
                return;
            }
            entries.put(key, new Slot(result, computedGeneration, clock.millis() + ttl.toMillis()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry and returns the new generation.
     */
    public long invalidateAll() {
        long next;
        lock.lock();
        try {
            next = generation.incrementAndGet();
            entries.clear();
        } finally {
            lock.unlock();
        }
        LOG.info("Alias resolution cache invalidated, generation={}", next);
        return next;
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        hits.set(0);
        misses.set(0);
    }

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        double rate = h + m == 0 ? 0.0 : (double) h / (h + m);
        int size;
        lock.lock();
        try {
            size = entries.size();
        } finally {
            lock.unlock();
        }
        return new CacheStats(size, maxSize, h, m, rate, generation.get(), ttl);
    }

    private record Slot(ResolutionResult result, long generation, long expiresAtMs) {
    }

    public record CacheStats(
        int size,
        int maxSize,
        long hits,
        long misses,
        double hitRate,
        long generation,
        Duration ttl
    ) {
    }
}
