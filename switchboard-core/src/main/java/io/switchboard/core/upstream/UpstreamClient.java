package io.switchboard.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import io.switchboard.core.conversion.SseEvent;
import io.switchboard.core.error.UpstreamHttpException;
import java.util.function.Consumer;

/**
 * Performs the network call to a provider.
 *
 * <p>Implementations throw {@link UpstreamHttpException} for non-2xx answers so callers can
 * decide whether to rotate keys.
 */
public interface UpstreamClient {

    JsonNode send(UpstreamRequest request);

    /**
     * Streams the response, handing every event to {@code onEvent} as it arrives. Returns when
     * upstream closes the stream.
     */
    void stream(UpstreamRequest request, Consumer<SseEvent> onEvent);
}
