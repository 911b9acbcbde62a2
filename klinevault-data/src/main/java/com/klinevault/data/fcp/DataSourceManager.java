package com.klinevault.data.fcp;

import com.klinevault.core.error.AllBackendsFailedException;
import com.klinevault.core.error.CircuitOpenException;
import com.klinevault.core.error.ClientErrorException;
import com.klinevault.core.error.DataSourceException;
import com.klinevault.core.error.RateLimitedException;
import com.klinevault.core.error.TransportException;
import com.klinevault.core.error.ValidationException;
import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;
import com.klinevault.core.model.TimeWindow;
import com.klinevault.data.boundary.BoundaryRulesFile;
import com.klinevault.data.boundary.BoundaryValidator;
import com.klinevault.data.cache.CacheEntry;
import com.klinevault.data.cache.CacheLookup;
import com.klinevault.data.cache.CachePaths;
import com.klinevault.data.cache.CacheStore;
import com.klinevault.data.cache.ValidationResult;
import com.klinevault.data.config.VaultConfig;
import com.klinevault.data.resilience.CircuitBreaker;
import com.klinevault.data.resilience.CircuitBreakerRegistry;
import com.klinevault.data.resilience.CircuitKey;
import com.klinevault.data.resilience.CircuitState;
import com.klinevault.data.resilience.Deadline;
import com.klinevault.data.resilience.ResilienceWrapper;
import com.klinevault.data.resilience.Sleeper;
import com.klinevault.data.source.BarSource;
import com.klinevault.data.source.BinanceRestSource;
import com.klinevault.data.source.BinanceVisionSource;
import com.klinevault.data.source.SourceRole;
import com.klinevault.data.transport.SelectingTransport;
import com.klinevault.data.transport.Transport;
import com.klinevault.data.transport.TransportRegistry;
import com.klinevault.data.transport.TransportSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Entry point of the data layer: serves bars for a window from cache, the incremental API or the archive.
 *
 * The window is split into UTC days. Each day is resolved on its own: the decision engine picks
 * between cache and backends, the chosen backend is called through its resilience wrapper, the
 * answer is checked against the boundary validator, and complete days are written to the cache.
 * A failed or mismatched backend gets exactly one failover attempt on the other backend.
 *
 * One instance owns its transports, circuit breakers and in-flight table. Close it to release
 * pooled connections.
 */
public class DataSourceManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DataSourceManager.class);

    private final VaultConfig config;
    private final TransportRegistry registry;
    private final List<SelectingTransport> transports;
    private final List<TransportRegistry> views;
    private final Map<SourceRole, BarSource> sources = new EnumMap<>(SourceRole.class);
    private final Map<SourceRole, ResilienceWrapper> wrappers = new EnumMap<>(SourceRole.class);
    private final BoundaryValidator validator;
    private final CacheStore cache;
    private final FetchDecisionEngine engine;
    private final InFlightRequests inFlight = new InFlightRequests();
    private final Clock clock;

    DataSourceManager(VaultConfig config, TransportRegistry registry, List<TransportRegistry> views,
                      List<SelectingTransport> transports, BarSource incremental, BarSource archive,
                      BoundaryValidator validator, Clock clock, Sleeper sleeper) {
        if (incremental.role() != SourceRole.INCREMENTAL || archive.role() != SourceRole.ARCHIVE) {
            throw new IllegalArgumentException("Expected one incremental and one archive source");
        }
        this.config = config;
        this.registry = registry;
        this.views = List.copyOf(views);
        this.transports = List.copyOf(transports);
        this.validator = validator;
        this.clock = clock;
        this.engine = new FetchDecisionEngine(config.getFreshnessThreshold(), config.getConsolidationDelay());
        this.cache = config.isCacheEnabled()
            ? new CacheStore(config.getCacheDir(), config.getMarketType(), validator, clock)
            : null;

        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(config.getCircuitBreakerPolicy(), clock);
        Random random = new Random();
        for (BarSource source : List.of(incremental, archive)) {
            sources.put(source.role(), source);
            CircuitBreaker breaker = breakers.get(new CircuitKey(source.id(), config.getTransportStrategy()));
            wrappers.put(source.role(), new ResilienceWrapper(config.getRetryPolicy(), breaker, sleeper, random));
        }
        log.info("Data source manager ready: market={}, cache={}, transports={} {}",
            config.getMarketType().getConfigKey(),
            cache != null ? config.getCacheDir() : "disabled",
            config.getTransportStrategy(), config.getTransportBackends());
    }

    /**
     * Manager over the Binance REST and Vision backends with the built-in transports.
     */
    public static DataSourceManager create(VaultConfig config) {
        return create(config, TransportRegistry.withBuiltins(config.getTransportSettings()),
            Clock.systemUTC(), Sleeper.SYSTEM);
    }

    /**
     * Manager over the Binance backends, resolving transports from the given registry.
     * The registry becomes owned by the manager. Archive downloads go through clients built
     * with {@link TransportSettings#forBulkDownloads()}.
     */
    public static DataSourceManager create(VaultConfig config, TransportRegistry registry, Clock clock, Sleeper sleeper) {
        MarketType market = config.getMarketType();
        SelectingTransport apiTransport = new SelectingTransport(
            registry, config.getTransportStrategy(), config.getTransportBackends());
        TransportSettings bulkSettings = config.getTransportSettings().forBulkDownloads();
        TransportRegistry bulkRegistry = registry.withSettings(bulkSettings);
        SelectingTransport bulkTransport = new SelectingTransport(
            bulkRegistry, config.getTransportStrategy(), config.getTransportBackends());

        BinanceRestSource rest = new BinanceRestSource(apiTransport, market, config.getRequestTimeout());
        BinanceVisionSource vision = new BinanceVisionSource(bulkTransport, market,
            bulkSettings.requestTimeout(), config.isVerifyChecksums());
        BoundaryRulesFile rulesFile = config.isCacheEnabled()
            ? new BoundaryRulesFile(new CachePaths(config.getCacheDir()).rulesFile(market))
            : null;
        BoundaryValidator validator = new BoundaryValidator(rest, rulesFile, clock);
        return new DataSourceManager(config, registry, List.of(bulkRegistry), List.of(apiTransport, bulkTransport),
            rest, vision, validator, clock, sleeper);
    }

    /**
     * Manager over arbitrary sources. Transport backends registered later are only kept for closing.
     */
    public static DataSourceManager withSources(VaultConfig config, BarSource incremental, BarSource archive,
                                                BoundaryValidator validator, Clock clock, Sleeper sleeper) {
        return new DataSourceManager(config, new TransportRegistry(config.getTransportSettings()), List.of(),
            List.of(), incremental, archive, validator, clock, sleeper);
    }

    // ========== Retrieval ==========

    public List<Bar> getData(String symbol, TimeWindow window) throws DataSourceException {
        return getData(symbol, window, SourceOverride.AUTO, Deadline.none());
    }

    public List<Bar> getData(String symbol, TimeWindow window, SourceOverride override) throws DataSourceException {
        return getData(symbol, window, override, Deadline.none());
    }

    public List<Bar> getData(String symbol, Instant start, Instant end, Interval interval, SourceOverride override)
            throws DataSourceException {
        return getData(symbol, TimeWindow.of(start, end, interval), override, Deadline.none());
    }

    /**
     * Bars whose open time falls in the half-open window, ascending, validated.
     *
     * @param deadline end-to-end budget across retries and failover
     * @throws TransportException       TIMEOUT once the deadline has run out, without further failover
     * @throws IllegalArgumentException for a blank symbol, an interval the market doesn't offer,
     *                                  or a window starting in the future
     */
    public List<Bar> getData(String symbol, TimeWindow window, SourceOverride override, Deadline deadline)
            throws DataSourceException {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        Interval interval = window.interval();
        MarketType market = config.getMarketType();
        if (!market.supports(interval)) {
            throw new IllegalArgumentException(interval + " klines are not available on " + market);
        }
        if (!validator.isValidRange(window.start(), window.end(), interval)) {
            throw new IllegalArgumentException("Window " + window + " holds no bars or starts in the future");
        }
        SourceOverride effective = override != null ? override : SourceOverride.AUTO;

        long now = clock.millis();
        List<Bar> result = new ArrayList<>();
        for (LocalDate date : window.dates()) {
            TimeWindow day = TimeWindow.ofDay(date, interval);
            if (day.start() >= now) {
                break;
            }
            PartitionKey key = new PartitionKey(market, symbol, interval, date);
            List<Bar> partition = inFlight.execute(key, deadline, () -> loadPartition(key, effective, deadline));
            result.addAll(validator.clip(partition, window));
        }
        log.debug("Served {} bars for {} {}", result.size(), symbol, window);
        return result;
    }

    /**
     * Resolve one day. Runs on the leader thread only.
     */
    private List<Bar> loadPartition(PartitionKey key, SourceOverride override, Deadline deadline)
            throws DataSourceException {
        Instant now = clock.instant();
        TimeWindow day = TimeWindow.ofDay(key.date(), key.interval());
        boolean complete = day.end() <= now.toEpochMilli();

        // Only closed bars: the bar opening at floor(now) is still forming
        TimeWindow fetchWindow = complete ? day : day.truncateAt(key.interval().floor(now.toEpochMilli()));
        if (fetchWindow == null) {
            return List.of();
        }

        CacheLookup lookup = complete ? lookupCache(key) : CacheLookup.miss();
        CacheEntry cached = lookup.isHit() ? lookup.entry() : null;
        Duration age = cached != null ? cached.age(clock) : null;

        FetchPlan plan = engine.decide(new DecisionInputs(lookup.status(), age, day.endInstant(), now,
            effectiveState(SourceRole.INCREMENTAL), effectiveState(SourceRole.ARCHIVE), override));
        log.debug("{}: {} via {}", key, plan.decision(), plan.primary());

        if (plan.decision() == FetchDecision.USE_CACHE) {
            return cached.bars();
        }

        Fetched fetched;
        try {
            if (validator.needsCalibration(key.interval())) {
                validator.calibrate(key.interval(), deadline, wrappers.get(SourceRole.INCREMENTAL));
            }
            fetched = fetchWithFailover(key, plan, fetchWindow, deadline);
        } catch (DataSourceException e) {
            if (cached != null && age.compareTo(config.getMaxStaleness()) <= 0) {
                log.warn("Refetch of {} failed ({}); serving cached copy from {}",
                    key, e.getMessage(), cached.footer().writtenAt());
                return cached.bars();
            }
            throw e;
        }

        if (complete && cache != null) {
            writeCache(key, fetched);
        }
        return fetched.bars();
    }

    /**
     * Bars from one backend together with that backend's id.
     */
    private record Fetched(List<Bar> bars, String source) {}

    /**
     * Primary backend, then at most one attempt on the alternate.
     */
    private Fetched fetchWithFailover(PartitionKey key, FetchPlan plan, TimeWindow fetchWindow, Deadline deadline)
            throws DataSourceException {
        List<String> attempted = new ArrayList<>();
        DataSourceException primaryError;
        try {
            return fetchValidated(plan.primary(), key, fetchWindow, deadline, attempted);
        } catch (ClientErrorException e) {
            if (!isFailoverEligible(e, plan.primary())) {
                throw e;
            }
            primaryError = e;
        } catch (DataSourceException e) {
            primaryError = e;
        }

        if (deadline.isExpired()) {
            throw deadlineExceeded(key, primaryError);
        }
        if (!plan.hasAlternate()) {
            if (primaryError instanceof ValidationException) {
                throw primaryError;
            }
            throw new AllBackendsFailedException(key.toString(), attempted, primaryError);
        }

        if (primaryError instanceof CircuitOpenException) {
            log.warn("Circuit for {} is open; failing over to {} for {}", plan.primary(), plan.alternate(), key);
        } else {
            log.warn("{} failed for {} ({}); failing over to {}",
                plan.primary(), key, primaryError.getMessage(), plan.alternate());
        }

        try {
            return fetchValidated(plan.alternate(), key, fetchWindow, deadline, attempted);
        } catch (ValidationException e) {
            throw e;
        } catch (ClientErrorException e) {
            if (!isFailoverEligible(e, plan.alternate())) {
                throw e;
            }
            throw new AllBackendsFailedException(key.toString(), attempted, e);
        } catch (DataSourceException e) {
            if (deadline.isExpired()) {
                throw deadlineExceeded(key, e);
            }
            throw new AllBackendsFailedException(key.toString(), attempted, e);
        }
    }

    /**
     * The caller's budget ran out: surface a timeout rather than blaming the backends.
     */
    private static TransportException deadlineExceeded(PartitionKey key, DataSourceException cause) {
        if (cause instanceof TransportException transport && transport.isTimeout()) {
            return transport;
        }
        return TransportException.timeout("Deadline exceeded while fetching " + key, cause);
    }

    /**
     * Call one backend through its resilience wrapper, trim to the window and check the result.
     */
    private Fetched fetchValidated(SourceRole role, PartitionKey key, TimeWindow fetchWindow, Deadline deadline,
                                   List<String> attempted) throws DataSourceException {
        BarSource source = sources.get(role);
        attempted.add(source.id());

        List<Bar> raw = wrappers.get(role).execute(
            () -> source.fetch(key.symbol(), key.interval(), fetchWindow, deadline), deadline);

        List<Bar> bars = validator.clip(raw, fetchWindow);
        CacheStore.checkStructure(bars, key.interval(), key.date(), false);
        if (!validator.matchesExpectedRange(bars, fetchWindow)) {
            throw new ValidationException(ValidationException.Kind.BOUNDARY_MISMATCH,
                source.id() + " returned " + bars.size() + " bars for " + key + ", expected "
                    + validator.resolveWindow(fetchWindow).expectedCount());
        }
        log.info("Fetched {} bars for {} from {}", bars.size(), key, source.id());
        return new Fetched(bars, source.id());
    }

    /**
     * Rate limits that outlast the retries, and archive days not yet published, warrant trying the other backend.
     */
    private static boolean isFailoverEligible(ClientErrorException e, SourceRole role) {
        return e instanceof RateLimitedException || (role == SourceRole.ARCHIVE && e.isNotFound());
    }

    private CircuitState effectiveState(SourceRole role) {
        CircuitBreaker breaker = wrappers.get(role).getCircuitBreaker();
        CircuitState state = breaker.getState();
        // Past its recovery timeout an open circuit admits a probe, so route to it again
        if (state == CircuitState.OPEN && breaker.isCallPermitted()) {
            return CircuitState.HALF_OPEN;
        }
        return state;
    }

    private CacheLookup lookupCache(PartitionKey key) {
        if (cache == null) {
            return CacheLookup.miss();
        }
        CacheLookup lookup = cache.load(key.symbol(), key.interval(), key.date());
        if (lookup.status() == CacheLookup.Status.INVALID) {
            log.warn("Discarding invalid cache entry {}: {}", key, lookup.error().getMessage());
            try {
                cache.invalidate(key.symbol(), key.interval(), key.date());
            } catch (IOException e) {
                log.warn("Could not delete invalid cache entry {}: {}", key, e.getMessage());
            }
            return CacheLookup.miss();
        }
        return lookup;
    }

    private void writeCache(PartitionKey key, Fetched fetched) throws ValidationException {
        try {
            cache.save(fetched.bars(), key.symbol(), key.interval(), key.date(), fetched.source());
        } catch (IOException e) {
            // The bars are valid; a failed write only costs a refetch next time
            log.warn("Could not cache {}: {}", key, e.getMessage());
        }
    }

    // ========== Cache and backend management ==========

    /**
     * Report on one cached day.
     */
    public ValidationResult validateCache(String symbol, Interval interval, LocalDate date) {
        if (cache == null) {
            return ValidationResult.failed("Cache is disabled");
        }
        return cache.validate(symbol, interval, date);
    }

    /**
     * Register a transport adapter at runtime. It is appended at the lowest priority of the
     * transport selection and closed with this manager.
     */
    public void registerBackend(String id, Transport adapter) {
        registry.register(id, adapter);
        for (SelectingTransport transport : transports) {
            transport.addBackend(id);
        }
    }

    public CircuitState circuitState(SourceRole role) {
        return wrappers.get(role).getCircuitBreaker().getState();
    }

    public CircuitBreaker.Status circuitStatus(SourceRole role) {
        return wrappers.get(role).getCircuitBreaker().getStatus();
    }

    /**
     * Cache store, or null when caching is disabled.
     */
    public CacheStore getCache() {
        return cache;
    }

    public BoundaryValidator getValidator() {
        return validator;
    }

    public VaultConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        for (TransportRegistry view : views) {
            view.close();
        }
        registry.close();
        log.info("Data source manager closed");
    }
}
