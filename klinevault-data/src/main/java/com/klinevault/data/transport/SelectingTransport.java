package com.klinevault.data.transport;

import com.klinevault.core.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies a {@link SelectionStrategy} over an ordered list of registry backends.
 * Backends are resolved through the registry on every call, so adapters registered
 * later take effect immediately. Rotation state belongs to this instance only.
 */
public class SelectingTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(SelectingTransport.class);

    private final TransportRegistry registry;
    private final SelectionStrategy strategy;
    private final List<String> backendIds;
    private final AtomicInteger cursor = new AtomicInteger();
    private final Random random;

    public SelectingTransport(TransportRegistry registry, SelectionStrategy strategy, List<String> backendIds) {
        this(registry, strategy, backendIds, new Random());
    }

    public SelectingTransport(TransportRegistry registry, SelectionStrategy strategy,
                              List<String> backendIds, Random random) {
        if (backendIds == null || backendIds.isEmpty()) {
            throw new IllegalArgumentException("At least one transport backend is required");
        }
        this.registry = registry;
        this.strategy = strategy;
        this.backendIds = new CopyOnWriteArrayList<>(backendIds);
        this.random = random;
    }

    @Override
    public String id() {
        return strategy.name().toLowerCase() + backendIds;
    }

    public SelectionStrategy getStrategy() {
        return strategy;
    }

    public List<String> getBackendIds() {
        return List.copyOf(backendIds);
    }

    /**
     * Append a backend at the lowest priority, if not already listed.
     */
    public void addBackend(String id) {
        if (!backendIds.contains(id)) {
            backendIds.add(id);
        }
    }

    @Override
    public TransportResponse request(TransportRequest request) throws TransportException {
        return switch (strategy) {
            case SINGLE -> registry.resolve(backendIds.get(0)).request(request);
            case ROUND_ROBIN -> {
                int index = Math.floorMod(cursor.getAndIncrement(), backendIds.size());
                yield registry.resolve(backendIds.get(index)).request(request);
            }
            case RANDOM -> {
                int index = random.nextInt(backendIds.size());
                yield registry.resolve(backendIds.get(index)).request(request);
            }
            case FAILOVER -> requestWithFailover(request);
        };
    }

    private TransportResponse requestWithFailover(TransportRequest request) throws TransportException {
        TransportException lastError = null;
        for (String id : backendIds) {
            try {
                return registry.resolve(id).request(request);
            } catch (TransportException e) {
                lastError = e;
                log.warn("Transport '{}' failed ({}), trying next backend", id, e.getKind());
            }
        }
        throw lastError;
    }

    @Override
    public void close() {
        // Adapters are owned by the registry
    }
}
