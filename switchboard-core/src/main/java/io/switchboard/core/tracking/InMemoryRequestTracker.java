package io.switchboard.core.tracking;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts requests per {@code provider:model}.
 */
public final class InMemoryRequestTracker implements RequestTracker {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRequestTracker.class);

    private final Map<String, LongAdder> counts = new ConcurrentHashMap<>();

    @Override
    public void recordResolution(String requestId, String provider, String resolvedModel, String clientModel) {
        counts.computeIfAbsent(provider + ":" + resolvedModel, ignored -> new LongAdder()).increment();
        LOG.debug("Request {} routed {} -> {}:{}", requestId, clientModel, provider, resolvedModel);
    }

    public long count(String provider, String resolvedModel) {
        LongAdder adder = counts.get(provider + ":" + resolvedModel);
        return adder == null ? 0 : adder.sum();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new TreeMap<>();
        counts.forEach((key, adder) -> snapshot.put(key, adder.sum()));
        return snapshot;
    }
}
