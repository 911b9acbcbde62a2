package com.klinevault.data.source;

import com.klinevault.core.error.DataSourceException;
import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;
import com.klinevault.core.model.TimeWindow;
import com.klinevault.data.resilience.Deadline;

import java.util.List;

/**
 * A backend that serves bars for a time window.
 *
 * Implementations pass the window to the backend as-is and return what it answers,
 * in ascending open-time order. Trimming to the caller's window is done by the
 * boundary validator, never here.
 */
public interface BarSource {

    /**
     * Identifier used for circuit keys and cache metadata, e.g. "binance-rest".
     */
    String id();

    SourceRole role();

    MarketType market();

    List<Bar> fetch(String symbol, Interval interval, TimeWindow window, Deadline deadline)
        throws DataSourceException;
}
