package io.switchboard.core.config;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current configuration and republishes it on {@link #reload()}.
 *
 * <p>A reload that fails to load or validate leaves the previous snapshot in force.
 */
public final class ConfigurationReloader {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationReloader.class);

    private final ConfigurationLoader loader;
    private final AtomicReference<GatewayConfiguration> current;
    private final List<Consumer<GatewayConfiguration>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Loads the initial snapshot; configuration errors propagate so startup fails.
     */
    public ConfigurationReloader(ConfigurationLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.current = new AtomicReference<>(loader.load());
    }

    public GatewayConfiguration current() {
        return current.get();
    }

    public void subscribe(Consumer<GatewayConfiguration> listener) {
        listeners.add(listener);
    }

    /**
     * @return {@code true} when a new snapshot was published
     */
    public synchronized boolean reload() {
        GatewayConfiguration next;
        try {
            next = loader.load();
        } catch (RuntimeException e) {
            LOG.error("Configuration reload from {} failed, keeping previous configuration", loader.configPath(), e);
            return false;
        }
        current.set(next);
        for (Consumer<GatewayConfiguration> listener : listeners) {
            listener.accept(next);
        }
        LOG.info(
            "Configuration reloaded: {} providers, {} aliases, default provider {}",
            next.providers().size(),
            next.aliases().size(),
            next.defaultProvider()
        );
        return true;
    }
}
