package com.klinevault.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Binance market a kline series belongs to.
 * Identifies the REST endpoint and the archive path for the series.
 */
public enum MarketType {
    /**
     * Spot market (api.binance.com). The only market with 1s klines.
     */
    SPOT("spot", "https://api.binance.com/api/v3", "spot"),

    /**
     * USDⓈ-margined perpetual futures (fapi.binance.com).
     */
    FUTURES_USDT("um", "https://fapi.binance.com/fapi/v1", "futures/um"),

    /**
     * Coin-margined perpetual futures (dapi.binance.com).
     * Archive files use the {@code _PERP} contract name.
     */
    FUTURES_COIN("cm", "https://dapi.binance.com/dapi/v1", "futures/cm");

    private final String configKey;
    private final String restBaseUrl;
    private final String visionPath;

    MarketType(String configKey, String restBaseUrl, String visionPath) {
        this.configKey = configKey;
        this.restBaseUrl = restBaseUrl;
        this.visionPath = visionPath;
    }

    @JsonValue
    public String getConfigKey() {
        return configKey;
    }

    public String getRestBaseUrl() {
        return restBaseUrl;
    }

    /**
     * Path segment under data.binance.vision/data/ (e.g. "futures/um").
     */
    public String getVisionPath() {
        return visionPath;
    }

    public boolean supports(Interval interval) {
        return interval != Interval.SECOND_1 || this == SPOT;
    }

    /**
     * Symbol as it appears in archive file names.
     */
    public String archiveSymbol(String symbol) {
        String upper = symbol.toUpperCase();
        if (this == FUTURES_COIN && !upper.endsWith("_PERP")) {
            return upper + "_PERP";
        }
        return upper;
    }

    /**
     * Parse market type from config key (case-insensitive).
     */
    @JsonCreator
    public static MarketType fromConfigKey(String key) {
        if (key == null) return SPOT;
        String lower = key.toLowerCase();
        for (MarketType m : values()) {
            if (m.configKey.equals(lower)) {
                return m;
            }
        }
        return switch (lower) {
            case "futures_usdt", "usdm", "futures" -> FUTURES_USDT;
            case "futures_coin", "coinm" -> FUTURES_COIN;
            default -> throw new IllegalArgumentException("Unknown market type: " + key);
        };
    }
}
