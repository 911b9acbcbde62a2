package com.klinevault.data.boundary;

import com.klinevault.core.error.DataSourceException;
import com.klinevault.core.model.Interval;
import com.klinevault.data.resilience.Deadline;

/**
 * A backend that can be asked how it treats range edges.
 * Implemented by the incremental source; one small request per interval.
 */
@FunctionalInterface
public interface BoundaryProbe {

    /**
     * @param referenceTime a time in the past; the probe window ends on the grid point at or before it
     * @param deadline      budget of the request that triggered the probe
     */
    BoundaryRules probe(Interval interval, long referenceTime, Deadline deadline) throws DataSourceException;
}
