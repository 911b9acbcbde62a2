package com.klinevault.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Locale;

/**
 * One OHLCV kline with the extended Binance fields.
 *
 * Extended fields from the klines payload:
 * - quoteVolume (index 7): Volume in quote asset
 * - tradeCount (index 8): Number of trades in the bar
 * - takerBuyVolume (index 9): Aggressive buy volume (base asset)
 * - takerBuyQuoteVolume (index 10): Aggressive buy volume (quote asset)
 *
 * Extended fields default to -1 when the source doesn't provide them.
 */
public record Bar(
    long openTime,
    double open,
    double high,
    double low,
    double close,
    double volume,
    long closeTime,
    double quoteVolume,
    int tradeCount,
    double takerBuyVolume,
    double takerBuyQuoteVolume
) {
    public static final String CSV_HEADER =
        "open_time,open,high,low,close,volume,close_time,quote_volume,count,taker_buy_volume,taker_buy_quote_volume";

    /**
     * Constructor without extended fields.
     */
    public Bar(long openTime, double open, double high, double low, double close, double volume, long closeTime) {
        this(openTime, open, high, low, close, volume, closeTime, -1, -1, -1, -1);
    }

    /**
     * Check the OHLC invariant: low <= open, close <= high, all values finite, volume not negative.
     */
    @JsonIgnore
    public boolean isSane() {
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low)
                || !Double.isFinite(close) || !Double.isFinite(volume)) {
            return false;
        }
        return low <= open && low <= close && open <= high && close <= high && low <= high && volume >= 0;
    }

    /**
     * Check that the bar spans exactly one interval starting on the grid.
     */
    @JsonIgnore
    public boolean isAlignedTo(Interval interval) {
        return interval.isAligned(openTime) && closeTime == openTime + interval.getMillis() - 1;
    }

    @JsonIgnore
    public boolean hasExtendedVolume() {
        return takerBuyVolume >= 0;
    }

    /**
     * Parse a CSV line in cache/archive column order.
     * Format: open_time,open,high,low,close,volume,close_time[,quote_volume,count,taker_buy_volume,taker_buy_quote_volume[,ignore]]
     */
    public static Bar fromCsv(String line) {
        String[] parts = line.split(",");
        if (parts.length < 7) {
            throw new IllegalArgumentException("Invalid bar CSV line: " + line);
        }

        long openTime = Long.parseLong(parts[0].trim());
        double open = Double.parseDouble(parts[1].trim());
        double high = Double.parseDouble(parts[2].trim());
        double low = Double.parseDouble(parts[3].trim());
        double close = Double.parseDouble(parts[4].trim());
        double volume = Double.parseDouble(parts[5].trim());
        long closeTime = Long.parseLong(parts[6].trim());

        double quoteVolume = parts.length > 7 ? Double.parseDouble(parts[7].trim()) : -1;
        int tradeCount = parts.length > 8 ? Integer.parseInt(parts[8].trim()) : -1;
        double takerBuyVolume = parts.length > 9 ? Double.parseDouble(parts[9].trim()) : -1;
        double takerBuyQuoteVolume = parts.length > 10 ? Double.parseDouble(parts[10].trim()) : -1;

        return new Bar(openTime, open, high, low, close, volume, closeTime,
            quoteVolume, tradeCount, takerBuyVolume, takerBuyQuoteVolume);
    }

    /**
     * Convert to CSV in {@link #CSV_HEADER} column order.
     */
    public String toCsv() {
        return String.format(Locale.ROOT, "%d,%s,%s,%s,%s,%s,%d,%s,%d,%s,%s",
            openTime, fmt(open), fmt(high), fmt(low), fmt(close), fmt(volume), closeTime,
            fmt(quoteVolume), tradeCount, fmt(takerBuyVolume), fmt(takerBuyQuoteVolume));
    }

    // Shortest representation that parses back to the same double
    private static String fmt(double value) {
        return Double.toString(value);
    }
}
