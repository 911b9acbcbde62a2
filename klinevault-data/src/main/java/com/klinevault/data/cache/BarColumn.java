package com.klinevault.data.cache;

import com.klinevault.core.model.Bar;

import java.util.function.Function;

/**
 * Columns of the cache file schema, in file order.
 */
public enum BarColumn {
    OPEN_TIME("open_time", Bar::openTime),
    OPEN("open", Bar::open),
    HIGH("high", Bar::high),
    LOW("low", Bar::low),
    CLOSE("close", Bar::close),
    VOLUME("volume", Bar::volume),
    CLOSE_TIME("close_time", Bar::closeTime),
    QUOTE_VOLUME("quote_volume", Bar::quoteVolume),
    COUNT("count", Bar::tradeCount),
    TAKER_BUY_VOLUME("taker_buy_volume", Bar::takerBuyVolume),
    TAKER_BUY_QUOTE_VOLUME("taker_buy_quote_volume", Bar::takerBuyQuoteVolume);

    private final String header;
    private final Function<Bar, Number> extractor;

    BarColumn(String header, Function<Bar, Number> extractor) {
        this.header = header;
        this.extractor = extractor;
    }

    public String getHeader() {
        return header;
    }

    public Number valueOf(Bar bar) {
        return extractor.apply(bar);
    }

    public static BarColumn fromHeader(String header) {
        for (BarColumn column : values()) {
            if (column.header.equalsIgnoreCase(header)) {
                return column;
            }
        }
        throw new IllegalArgumentException("Unknown column: " + header);
    }
}
