package com.klinevault.data.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.klinevault.core.error.ValidationException;
import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Gap;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;
import com.klinevault.core.model.TimeWindow;
import com.klinevault.data.boundary.BoundaryValidator;
import com.klinevault.data.boundary.GapDetector;
import com.klinevault.data.boundary.ResolvedBoundaries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * File-backed store of daily bar partitions for one market.
 *
 * Files are written to a temp file and moved into place, so readers only ever see
 * complete partitions. Writes and deletes of one key are serialized by a per-key lock.
 * Every read re-checks the integrity footer; anything that fails comes back as
 * {@link CacheLookup.Status#INVALID}, never as partial data.
 */
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final CachePaths paths;
    private final MarketType market;
    private final BoundaryValidator validator;
    private final Clock clock;
    private final Map<CacheKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * @param validator boundary authority for write-time checks and metadata; may be null
     */
    public CacheStore(Path root, MarketType market, BoundaryValidator validator, Clock clock) {
        this.paths = new CachePaths(root);
        this.market = market;
        this.validator = validator;
        this.clock = clock;
    }

    public MarketType getMarket() {
        return market;
    }

    public CachePaths getPaths() {
        return paths;
    }

    public CacheKey key(String symbol, Interval interval, LocalDate date) {
        return new CacheKey(market, symbol, interval, date);
    }

    // ========== Write ==========

    public void save(List<Bar> bars, String symbol, Interval interval, LocalDate date, String source)
            throws ValidationException, IOException {
        save(bars, symbol, interval, date, source, false);
    }

    /**
     * Validate and persist one day. Replaces any existing entry for the key.
     */
    public void save(List<Bar> bars, String symbol, Interval interval, LocalDate date, String source,
                     boolean allowEmpty) throws ValidationException, IOException {
        CacheKey key = key(symbol, interval, date);
        validateBars(bars, interval, date, allowEmpty);

        String body = BarCsv.render(bars);
        IntegrityFooter footer = footerFor(bars, interval, date, body, source);
        Path target = paths.file(key);

        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, body + footer.toLine() + "\n", StandardCharsets.UTF_8);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } finally {
            lock.unlock();
        }
        log.info("Cached {} bars for {} from {}", bars.size(), key, source);
    }

    private IntegrityFooter footerFor(List<Bar> bars, Interval interval, LocalDate date, String body, String source) {
        long first;
        long last;
        long expected;
        if (bars.isEmpty()) {
            first = -1;
            last = -1;
            expected = 0;
        } else if (validator != null) {
            ResolvedBoundaries resolved = validator.resolveWindow(TimeWindow.ofDay(date, interval));
            first = resolved.firstOpenTime();
            last = resolved.lastOpenTime();
            expected = resolved.expectedCount();
        } else {
            first = bars.get(0).openTime();
            last = bars.get(bars.size() - 1).openTime();
            expected = bars.size();
        }
        return new IntegrityFooter(bars.size(), sha256(body), first, last, expected, source, clock.instant());
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // ========== Read ==========

    public CacheLookup load(String symbol, Interval interval, LocalDate date) {
        return load(symbol, interval, date, null);
    }

    /**
     * Read one day. With a non-empty column set the entry is projected to those columns.
     */
    public CacheLookup load(String symbol, Interval interval, LocalDate date, Set<BarColumn> columns) {
        CacheKey key = key(symbol, interval, date);
        Path file = paths.file(key);

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return CacheLookup.miss();
        } catch (IOException e) {
            return CacheLookup.invalid(new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                "Unreadable cache file " + file + ": " + e.getMessage(), e));
        }

        try {
            CacheEntry entry = parse(key, content);
            log.debug("Cache hit for {} ({} bars)", key, entry.bars().size());
            return CacheLookup.hit(columns == null ? entry : entry.select(columns));
        } catch (ValidationException e) {
            log.warn("Cache entry {} is invalid: {}", key, e.getMessage());
            return CacheLookup.invalid(e);
        }
    }

    private CacheEntry parse(CacheKey key, String content) throws ValidationException {
        int footerStart = content.lastIndexOf("\n" + IntegrityFooter.PREFIX);
        if (footerStart < 0) {
            throw new ValidationException(ValidationException.Kind.INTEGRITY_CHECK_FAILED,
                "Missing integrity footer in " + key);
        }
        String body = content.substring(0, footerStart + 1);
        String footerLine = content.substring(footerStart + 1).trim();

        IntegrityFooter footer;
        try {
            footer = IntegrityFooter.fromLine(footerLine);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException(ValidationException.Kind.INTEGRITY_CHECK_FAILED,
                "Corrupt integrity footer in " + key, e);
        }

        if (!body.startsWith(Bar.CSV_HEADER + "\n")) {
            throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                "Unexpected column header in " + key);
        }
        if (!sha256(body).equals(footer.sha256())) {
            throw new ValidationException(ValidationException.Kind.INTEGRITY_CHECK_FAILED,
                "Checksum mismatch in " + key);
        }

        List<Bar> bars;
        try {
            bars = BarCsv.read(new BufferedReader(new StringReader(body)));
        } catch (IOException | IllegalArgumentException e) {
            throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                "Malformed row in " + key + ": " + e.getMessage(), e);
        }
        if (bars.size() != footer.rows()) {
            throw new ValidationException(ValidationException.Kind.INTEGRITY_CHECK_FAILED,
                "Row count " + bars.size() + " does not match footer " + footer.rows() + " in " + key);
        }

        boolean empty = footer.rows() == 0;
        checkStructure(bars, key.interval(), key.date(), empty);
        if (!empty && (bars.get(0).openTime() != footer.firstOpenTime()
                || bars.get(bars.size() - 1).openTime() != footer.lastOpenTime()
                || bars.size() != footer.expectedCount())) {
            throw new ValidationException(ValidationException.Kind.BOUNDARY_MISMATCH,
                "Bars in " + key + " do not cover the recorded boundaries");
        }
        return new CacheEntry(key, bars, footer);
    }

    // ========== Validation ==========

    /**
     * Full check of bars for one day, including agreement with the boundary validator when present.
     */
    public void validateBars(List<Bar> bars, Interval interval, LocalDate date, boolean allowEmpty)
            throws ValidationException {
        checkStructure(bars, interval, date, allowEmpty);
        if (!bars.isEmpty() && validator != null) {
            TimeWindow day = TimeWindow.ofDay(date, interval);
            if (!validator.matchesExpectedRange(bars, day)) {
                ResolvedBoundaries expected = validator.resolveWindow(day);
                throw new ValidationException(ValidationException.Kind.BOUNDARY_MISMATCH,
                    "Expected " + expected.expectedCount() + " bars for " + date + " " + interval
                        + " but got " + bars.size());
            }
        }
    }

    /**
     * Shape checks that need no boundary rules: grid alignment, OHLC sanity, ordering, all bars inside the day.
     */
    public static void checkStructure(List<Bar> bars, Interval interval, LocalDate date, boolean allowEmpty)
            throws ValidationException {
        if (bars.isEmpty()) {
            if (allowEmpty) return;
            throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID, "No bars for " + date);
        }
        TimeWindow day = TimeWindow.ofDay(date, interval);
        long previous = Long.MIN_VALUE;
        for (Bar bar : bars) {
            if (!bar.isAlignedTo(interval)) {
                throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                    "Bar at " + bar.openTime() + " is not a " + interval + " bar");
            }
            if (!bar.isSane()) {
                throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                    "Bar at " + bar.openTime() + " violates low <= open, close <= high");
            }
            if (bar.openTime() <= previous) {
                throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                    "open_time not strictly increasing at " + bar.openTime());
            }
            if (!day.contains(bar.openTime())) {
                throw new ValidationException(ValidationException.Kind.BOUNDARY_MISMATCH,
                    "Bar at " + bar.openTime() + " is outside " + date);
            }
            previous = bar.openTime();
        }
    }

    /**
     * Report on one cached day: validity, row count and missing grid slots.
     */
    public ValidationResult validate(String symbol, Interval interval, LocalDate date) {
        CacheLookup lookup = load(symbol, interval, date);
        switch (lookup.status()) {
            case MISS:
                return ValidationResult.failed("No cache entry for " + key(symbol, interval, date));
            case INVALID:
                return new ValidationResult(false,
                    List.of(lookup.error().getKind() + ": " + lookup.error().getMessage()), 0, List.of());
            default:
                break;
        }
        CacheEntry entry = lookup.entry();
        List<Gap> gaps;
        if (validator != null) {
            gaps = GapDetector.findGaps(entry.bars(), validator.resolveWindow(TimeWindow.ofDay(date, interval)));
        } else {
            gaps = GapDetector.findGaps(entry.bars(), interval);
        }
        return ValidationResult.ok(entry.bars().size(), gaps);
    }

    // ========== Maintenance ==========

    /**
     * Delete one entry so the next read misses.
     *
     * @return true if a file was removed
     */
    public boolean invalidate(String symbol, Interval interval, LocalDate date) throws IOException {
        CacheKey key = key(symbol, interval, date);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            boolean deleted = Files.deleteIfExists(paths.file(key));
            if (deleted) {
                log.info("Invalidated cache entry {}", key);
            }
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove everything cached for this store's market.
     */
    public void clear() throws IOException {
        Path dir = paths.marketDir(market);
        if (!Files.exists(dir)) {
            return;
        }
        List<Path> toDelete;
        try (Stream<Path> walk = Files.walk(dir)) {
            toDelete = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : toDelete) {
            Files.deleteIfExists(path);
        }
        log.info("Cleared cache for market {}", market.getConfigKey());
    }

    /**
     * Dates cached for a series, ascending.
     */
    public List<LocalDate> listDates(String symbol, Interval interval) throws IOException {
        Path dir = paths.seriesDir(market, symbol, interval);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<LocalDate> dates = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.forEach(file -> {
                LocalDate date = CachePaths.dateOf(file);
                if (date != null) {
                    dates.add(date);
                }
            });
        }
        dates.sort(null);
        return dates;
    }

    private ReentrantLock lockFor(CacheKey key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
