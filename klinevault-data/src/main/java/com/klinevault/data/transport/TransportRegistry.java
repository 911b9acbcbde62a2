package com.klinevault.data.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves transport adapters by identifier.
 *
 * Adapters come from providers (created lazily on first use) or are registered directly.
 * A request for an unknown or unavailable backend resolves to the JDK transport, which
 * every runtime has. Owned by one orchestrator; closing it closes every adapter it created.
 */
public class TransportRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransportRegistry.class);

    public static final String DEFAULT_BACKEND = JdkHttpTransport.ID;

    private final TransportSettings settings;
    private final Map<String, TransportProvider> providers;
    private final Map<String, Transport> adapters = new ConcurrentHashMap<>();
    private final Set<String> registeredIds = ConcurrentHashMap.newKeySet();
    // Registered adapters live in the parent; this registry only creates provider adapters
    private final TransportRegistry parent;

    public TransportRegistry(TransportSettings settings) {
        this(settings, new ConcurrentHashMap<>(), null);
        registerProvider(JdkHttpTransport.PROVIDER);
    }

    private TransportRegistry(TransportSettings settings, Map<String, TransportProvider> providers,
                              TransportRegistry parent) {
        this.settings = settings;
        this.providers = providers;
        this.parent = parent;
    }

    /**
     * Registry with the OkHttp and JDK providers.
     */
    public static TransportRegistry withBuiltins(TransportSettings settings) {
        TransportRegistry registry = new TransportRegistry(settings);
        registry.registerProvider(OkHttpTransport.PROVIDER);
        return registry;
    }

    /**
     * View over the same providers and registered adapters whose provider adapters are built
     * with other settings, e.g. {@link TransportSettings#forBulkDownloads()}. Closing the view
     * closes only the adapters it built.
     */
    public TransportRegistry withSettings(TransportSettings other) {
        return new TransportRegistry(other, providers, parent != null ? parent : this);
    }

    public TransportSettings getSettings() {
        return settings;
    }

    public void registerProvider(TransportProvider provider) {
        providers.put(provider.id(), provider);
    }

    /**
     * Register a ready-made adapter. Replaces (and closes) any adapter already under that id.
     */
    public void register(String id, Transport adapter) {
        if (parent != null) {
            parent.register(id, adapter);
            return;
        }
        registeredIds.add(id);
        Transport previous = adapters.put(id, adapter);
        if (previous != null && previous != adapter) {
            previous.close();
        }
        log.info("Registered transport backend '{}'", id);
    }

    public boolean isRegistered(String id) {
        if (parent != null) {
            return parent.isRegistered(id);
        }
        return adapters.containsKey(id) || providers.containsKey(id);
    }

    /**
     * Identifiers of every registered backend.
     */
    public Set<String> ids() {
        if (parent != null) {
            return parent.ids();
        }
        Set<String> ids = new LinkedHashSet<>(providers.keySet());
        ids.addAll(adapters.keySet());
        return ids;
    }

    /**
     * Adapter for the given id, or the default adapter when the id is unknown or unavailable.
     */
    public Transport resolve(String id) {
        Transport registered = parent != null ? parent.registered(id) : null;
        if (registered != null) {
            return registered;
        }
        Transport adapter = adapters.get(id);
        if (adapter != null) {
            return adapter;
        }
        TransportProvider provider = providers.get(id);
        if (provider != null && provider.isAvailable()) {
            return adapters.computeIfAbsent(id, k -> provider.create(settings));
        }
        if (DEFAULT_BACKEND.equals(id)) {
            // The default provider is always registered and available
            return adapters.computeIfAbsent(id, k -> JdkHttpTransport.PROVIDER.create(settings));
        }
        log.warn("Transport backend '{}' is {}; falling back to '{}'",
            id, provider == null ? "not registered" : "unavailable", DEFAULT_BACKEND);
        return resolve(DEFAULT_BACKEND);
    }

    private Transport registered(String id) {
        return registeredIds.contains(id) ? adapters.get(id) : null;
    }

    @Override
    public void close() {
        for (Transport adapter : adapters.values()) {
            try {
                adapter.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close transport '{}': {}", adapter.id(), e.getMessage());
            }
        }
        adapters.clear();
        registeredIds.clear();
    }
}
