package io.switchboard.core.tracking;

/**
 * Receives the routing decision of every request.
 */
public interface RequestTracker {

    void recordResolution(String requestId, String provider, String resolvedModel, String clientModel);

    static RequestTracker noop() {
        return (requestId, provider, resolvedModel, clientModel) -> {
        };
    }
}
