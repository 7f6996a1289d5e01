package io.switchboard.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.switchboard.core.alias.AliasService;
import io.switchboard.core.alias.ResolutionResult;
import io.switchboard.core.conversion.ProtocolConverter;
import io.switchboard.core.conversion.SseEvent;
import io.switchboard.core.conversion.StreamTranslator;
import io.switchboard.core.error.InvalidRequestException;
import io.switchboard.core.error.ProviderNotConfiguredException;
import io.switchboard.core.middleware.MiddlewareChain;
import io.switchboard.core.middleware.RequestContext;
import io.switchboard.core.middleware.ResponseContext;
import io.switchboard.core.middleware.StreamSession;
import io.switchboard.core.provider.AuthParams;
import io.switchboard.core.provider.KeyFailover;
import io.switchboard.core.provider.ProviderConfig;
import io.switchboard.core.provider.ProviderRegistry;
import io.switchboard.core.tracking.RequestTracker;
import io.switchboard.core.upstream.UpstreamClient;
import io.switchboard.core.upstream.UpstreamRequest;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one client request through resolution, credentials, middleware, conversion and the
 * upstream call.
 *
 * <p>Thread-safe; one dispatcher serves all requests.
 */
public final class RequestDispatcher {
    public static final String MDC_REQUEST_ID = "request_id";

    private static final Logger LOG = LoggerFactory.getLogger(RequestDispatcher.class);

    private final AliasService aliases;
    private final ProviderRegistry registry;
    private final MiddlewareChain middleware;
    private final ProtocolConverter converter;
    private final UpstreamClient upstream;
    private final RequestTracker tracker;
    private final KeyFailover failover;
    private final ObjectMapper mapper;
    private final ReadWriteLock routing = new ReentrantReadWriteLock();

    public RequestDispatcher(
        AliasService aliases,
        ProviderRegistry registry,
        MiddlewareChain middleware,
        ProtocolConverter converter,
        UpstreamClient upstream,
        RequestTracker tracker,
        ObjectMapper mapper
    ) {
        this.aliases = aliases;
        this.registry = registry;
        this.middleware = middleware;
        this.converter = converter;
        this.upstream = upstream;
        this.tracker = tracker;
        this.failover = new KeyFailover();
        this.mapper = mapper;
    }

    /**
     * Non-streaming dispatch. Returns the response body in the client's dialect.
     */
    public JsonNode dispatch(ClientRequest request) {
        MDC.put(MDC_REQUEST_ID, request.requestId());
        try {
            Route route = route(request);
            UpstreamRequest call = upstreamRequest(request, route, false);
            JsonNode raw = failover.execute(route.auth(), key -> upstream.send(call.withApiKey(key)));
            JsonNode clientBody = converter.convertResponse(raw, request.clientFormat(), route.provider().apiFormat());
            return middleware.processResponse(ResponseContext.of(clientBody, route.context())).body();
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    /**
     * Streaming dispatch. Events reach {@code downstream} in the client's dialect, after the
     * chunk middleware ran on them. Stream completion hooks run even when {@code downstream}
     * fails half way.
     */
    public void dispatchStream(ClientRequest request, Consumer<SseEvent> downstream) {
        MDC.put(MDC_REQUEST_ID, request.requestId());
        try {
            Route route = route(request);
            UpstreamRequest call = upstreamRequest(request, route, true);
            StreamTranslator translator = converter.streamTranslator(
                request.clientFormat(),
                route.provider().apiFormat(),
                route.context().model(),
                request.requestId()
            );
            try (StreamSession session = middleware.openStream(route.context())) {
                ChunkForwarder forwarder = new ChunkForwarder(session, downstream, mapper);
                failover.execute(route.auth(), key -> {
                    upstream.stream(call.withApiKey(key), event -> translator.translate(event).forEach(forwarder::accept));
                    return null;
                });
                translator.finish().forEach(forwarder::accept);
                forwarder.finish();
                LOG.debug("Stream finished after {} chunks", session.chunkCount());
            }
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    /**
     * Runs {@code swap}, typically a provider and alias reload, while no request is between
     * alias resolution and credential selection.
     */
    public void swapRouting(Runnable swap) {
        routing.writeLock().lock();
        try {
            swap.run();
        } finally {
            routing.writeLock().unlock();
        }
    }

    private Route route(ClientRequest request) {
        String rawModel = request.model();
        if (rawModel.isBlank()) {
            throw new InvalidRequestException("Request is missing a model");
        }
        ResolutionResult resolution;
        ProviderConfig provider;
        AuthParams auth;
        routing.readLock().lock();
        try {
            resolution = aliases.resolve(rawModel, request.explicitProvider());
            String providerName = resolution.provider() != null
                ? resolution.provider()
                : registry.defaultProvider().orElseThrow(() -> new ProviderNotConfiguredException("(default)", registry.names()));
            provider = registry.require(providerName);
            auth = registry.getClientAuth(provider.name(), request.clientApiKey());
        } finally {
            routing.readLock().unlock();
        }
        tracker.recordResolution(request.requestId(), provider.name(), resolution.resolvedModel(), rawModel);
        LOG.info("Routing {} to {}:{}", rawModel, provider.name(), resolution.resolvedModel());

        RequestContext context = new RequestContext(
            request.body().path("messages"),
            provider.name(),
            resolution.resolvedModel(),
            request.requestId(),
            request.conversationId(),
            Map.of("client_model", rawModel, "alias_resolved", resolution.wasResolved()),
            request.clientApiKey()
        );
        return new Route(provider, auth, middleware.processRequest(context));
    }

    private UpstreamRequest upstreamRequest(ClientRequest request, Route route, boolean streaming) {
        ObjectNode body = request.body();
        body.set("messages", route.context().messages());
        body.put("stream", streaming);
        ObjectNode converted = converter.convertRequest(
            body,
            request.clientFormat(),
            route.provider().apiFormat(),
            route.context().model()
        );
        return new UpstreamRequest(route.provider(), route.auth().apiKey(), converted, request.requestId());
    }

    private record Route(ProviderConfig provider, AuthParams auth, RequestContext context) {
    }
}
