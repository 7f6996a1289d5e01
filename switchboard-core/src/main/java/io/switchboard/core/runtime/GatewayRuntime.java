package io.switchboard.core.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.alias.AliasResolverChain;
import io.switchboard.core.alias.AliasService;
import io.switchboard.core.alias.ResolutionCache;
import io.switchboard.core.config.ConfigurationReloader;
import io.switchboard.core.config.GatewayConfiguration;
import io.switchboard.core.config.model.CacheSettings;
import io.switchboard.core.config.model.MiddlewareSettings.ThoughtSignatureSettings;
import io.switchboard.core.conversion.ProtocolConverter;
import io.switchboard.core.dispatch.RequestDispatcher;
import io.switchboard.core.error.ErrorResponses;
import io.switchboard.core.middleware.MiddlewareChain;
import io.switchboard.core.middleware.ThoughtSignatureMiddleware;
import io.switchboard.core.middleware.ThoughtSignatureStore;
import io.switchboard.core.provider.ProviderRegistry;
import io.switchboard.core.tracking.InMemoryRequestTracker;
import io.switchboard.core.upstream.UpstreamClient;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything one gateway process needs, assembled from the current configuration and kept in
 * step with it on reload.
 *
 * <p>{@link #start()} initializes the middleware chain and {@link #close()} cleans it up; each
 * runs once, outside request processing.
 */
public final class GatewayRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayRuntime.class);

    private final ConfigurationReloader reloader;
    private final AliasService aliases;
    private final ProviderRegistry registry;
    private final MiddlewareChain middleware;
    private final InMemoryRequestTracker tracker;
    private final RequestDispatcher dispatcher;
    private final ErrorResponses errors;

    private GatewayRuntime(
        ConfigurationReloader reloader,
        AliasService aliases,
        ProviderRegistry registry,
        MiddlewareChain middleware,
        InMemoryRequestTracker tracker,
        RequestDispatcher dispatcher,
        ErrorResponses errors
    ) {
        this.reloader = reloader;
        this.aliases = aliases;
        this.registry = registry;
        this.middleware = middleware;
        this.tracker = tracker;
        this.dispatcher = dispatcher;
        this.errors = errors;
    }

    public static GatewayRuntime create(
        ConfigurationReloader reloader,
        UpstreamClient upstream,
        ObjectMapper mapper,
        Clock clock
    ) {
        GatewayConfiguration config = reloader.current();
        CacheSettings cache = config.cache();
        AliasService aliases = new AliasService(
            config.aliases(),
            new AliasResolverChain(cache.maxChainLength()),
            new ResolutionCache(Duration.ofSeconds(cache.ttlSeconds()), cache.maxSize(), clock)
        );
        ProviderRegistry registry = new ProviderRegistry(config.providers(), config.defaultProvider());

        MiddlewareChain middleware = new MiddlewareChain();
        ThoughtSignatureSettings signatures = config.middleware().thoughtSignatures();
        if (signatures.enabled()) {
            middleware.add(new ThoughtSignatureMiddleware(
                new ThoughtSignatureStore(Duration.ofSeconds(signatures.ttlSeconds()), signatures.maxConversations(), clock),
                Duration.ofSeconds(signatures.cleanupIntervalSeconds())
            ));
        }

        InMemoryRequestTracker tracker = new InMemoryRequestTracker();
        RequestDispatcher dispatcher = new RequestDispatcher(
            aliases,
            registry,
            middleware,
            new ProtocolConverter(mapper, clock),
            upstream,
            tracker,
            mapper
        );

        reloader.subscribe(next -> dispatcher.swapRouting(() -> {
            registry.replace(next.providers(), next.defaultProvider());
            aliases.reload(next.aliases());
        }));
        return new GatewayRuntime(reloader, aliases, registry, middleware, tracker, dispatcher, new ErrorResponses(mapper));
    }

    public void start() {
        middleware.initialize();
        LOG.info(
            "Gateway ready: providers={}, middleware={}",
            registry.names(),
            middleware.names()
        );
    }

    public ConfigurationReloader reloader() {
        return reloader;
    }

    public AliasService aliases() {
        return aliases;
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public MiddlewareChain middleware() {
        return middleware;
    }

    public InMemoryRequestTracker tracker() {
        return tracker;
    }

    public RequestDispatcher dispatcher() {
        return dispatcher;
    }

    public ErrorResponses errors() {
        return errors;
    }

    @Override
    public void close() {
        if (middleware.isInitialized()) {
            middleware.cleanup();
        }
    }
}
