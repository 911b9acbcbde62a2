package com.klinevault.data.fcp;

import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;

import java.time.LocalDate;

/**
 * One UTC day of one series: the unit of fetching, caching and deduplication.
 */
public record PartitionKey(MarketType market, String symbol, Interval interval, LocalDate date) {

    public PartitionKey {
        symbol = symbol.toUpperCase();
    }

    @Override
    public String toString() {
        return symbol + " " + interval + " " + date + " (" + market.getConfigKey() + ")";
    }
}
