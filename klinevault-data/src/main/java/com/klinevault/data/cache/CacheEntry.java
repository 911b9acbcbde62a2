package com.klinevault.data.cache;

import com.klinevault.core.model.Bar;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One validated cached day. Immutable once loaded.
 */
public record CacheEntry(CacheKey key, List<Bar> bars, IntegrityFooter footer, Set<BarColumn> columns) {

    public CacheEntry {
        bars = List.copyOf(bars);
        columns = columns == null || columns.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.allOf(BarColumn.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(columns));
    }

    public CacheEntry(CacheKey key, List<Bar> bars, IntegrityFooter footer) {
        this(key, bars, footer, null);
    }

    public Duration age(Clock clock) {
        Duration age = Duration.between(footer.writtenAt(), clock.instant());
        return age.isNegative() ? Duration.ZERO : age;
    }

    public String source() {
        return footer.source();
    }

    /**
     * Same entry restricted to the given columns.
     */
    public CacheEntry select(Set<BarColumn> selected) {
        return new CacheEntry(key, bars, footer, selected);
    }

    /**
     * Rows as column maps, restricted to the selected columns.
     */
    public List<Map<BarColumn, Number>> rows() {
        List<Map<BarColumn, Number>> rows = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            Map<BarColumn, Number> row = new EnumMap<>(BarColumn.class);
            for (BarColumn column : columns) {
                row.put(column, column.valueOf(bar));
            }
            rows.add(row);
        }
        return rows;
    }
}
