package com.klinevault.data.cache;

import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;

import java.time.LocalDate;

/**
 * Identifies one cached day of bars.
 */
public record CacheKey(MarketType market, String symbol, Interval interval, LocalDate date) {

    public CacheKey {
        if (market == null || symbol == null || interval == null || date == null) {
            throw new IllegalArgumentException("market, symbol, interval and date are required");
        }
        symbol = symbol.toUpperCase();
    }

    @Override
    public String toString() {
        return market.getConfigKey() + ":" + symbol + ":" + interval + ":" + date;
    }
}
