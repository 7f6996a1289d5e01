package io.switchboard.core.middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered pipeline of {@link Middleware} stages.
 *
 * <p>Stages are added before {@link #initialize()}. For every phase only the stages whose
 * {@link Middleware#shouldHandle(String, String)} accepts the request run, in registration
 * order, each receiving the previous stage's output. A failing hook is logged and rethrown;
 * the rest of that phase does not run.
 */
public final class MiddlewareChain {
    private static final Logger LOG = LoggerFactory.getLogger(MiddlewareChain.class);

    private final List<Middleware> middlewares = new CopyOnWriteArrayList<>();
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicBoolean cleanedUp = new AtomicBoolean();

    public MiddlewareChain add(Middleware middleware) {
        if (initialized.get()) {
            throw new IllegalStateException("Cannot add middleware '" + middleware.name() + "' after initialize()");
        }
        middlewares.add(middleware);
        return this;
    }

    public List<String> names() {
        return middlewares.stream().map(Middleware::name).toList();
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * Initializes every stage in registration order. Any failure aborts startup.
     */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            throw new IllegalStateException("Middleware chain already initialized");
        }
        for (Middleware middleware : middlewares) {
            try {
                middleware.initialize();
                LOG.info("Initialized middleware {}", middleware.name());
            } catch (Exception e) {
                LOG.error("Failed to initialize middleware {}", middleware.name(), e);
                throw new IllegalStateException("Failed to initialize middleware '" + middleware.name() + "'", e);
            }
        }
    }

    /**
     * Cleans stages up in reverse order. Failures are logged and do not stop the others.
     */
    public void cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        List<Middleware> reversed = new ArrayList<>(middlewares);
        Collections.reverse(reversed);
        for (Middleware middleware : reversed) {
            try {
                middleware.cleanup();
            } catch (Exception e) {
                LOG.warn("Cleanup of middleware {} failed", middleware.name(), e);
            }
        }
    }

    public RequestContext processRequest(RequestContext context) {
        RequestContext current = context;
        for (Middleware middleware : applicable(context)) {
            try {
                current = middleware.beforeRequest(current);
            } catch (RuntimeException e) {
                logFailure("beforeRequest", middleware, context, e);
                throw e;
            }
        }
        return current;
    }

    public ResponseContext processResponse(ResponseContext context) {
        ResponseContext current = context;
        for (Middleware middleware : applicable(context.request())) {
            try {
                current = middleware.afterResponse(current);
            } catch (RuntimeException e) {
                logFailure("afterResponse", middleware, context.request(), e);
                throw e;
            }
        }
        return current;
    }

    public StreamChunkContext processStreamChunk(StreamChunkContext context) {
        StreamChunkContext current = context;
        for (Middleware middleware : applicable(context.request())) {
            try {
                current = middleware.onStreamChunk(current);
            } catch (RuntimeException e) {
                logFailure("onStreamChunk", middleware, context.request(), e);
                throw e;
            }
        }
        return current;
    }

    /**
     * Starts a stream for {@code request}. Close the session when the stream ends, however
     * it ends.
     */
    public StreamSession openStream(RequestContext request) {
        return new StreamSession(this, request);
    }

    void completeStream(RequestContext request, Map<String, Object> accumulated) {
        for (Middleware middleware : applicable(request)) {
            try {
                middleware.onStreamComplete(request, accumulated);
            } catch (RuntimeException e) {
                logFailure("onStreamComplete", middleware, request, e);
                throw e;
            }
        }
    }

    private List<Middleware> applicable(RequestContext request) {
        List<Middleware> matching = new ArrayList<>();
        for (Middleware middleware : middlewares) {
            if (middleware.shouldHandle(request.provider(), request.model())) {
                matching.add(middleware);
            }
        }
        return matching;
    }

    private void logFailure(String hook, Middleware middleware, RequestContext request, RuntimeException e) {
        LOG.error(
            "Middleware {} failed in {} (provider={}, model={}, request_id={})",
            middleware.name(),
            hook,
            request.provider(),
            request.model(),
            request.requestId(),
            e
        );
    }
}
