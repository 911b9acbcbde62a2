package com.klinevault.data.fcp;

import com.klinevault.data.cache.CacheLookup;
import com.klinevault.data.resilience.CircuitState;
import com.klinevault.data.source.SourceRole;

import java.time.Duration;

/**
 * Pure decision function of the fetch protocol. Same inputs, same plan; no state.
 */
public class FetchDecisionEngine {

    private final Duration freshnessThreshold;
    private final Duration consolidationDelay;

    public FetchDecisionEngine(Duration freshnessThreshold, Duration consolidationDelay) {
        this.freshnessThreshold = freshnessThreshold;
        this.consolidationDelay = consolidationDelay;
    }

    public FetchPlan decide(DecisionInputs in) {
        boolean hit = in.cacheStatus() == CacheLookup.Status.HIT;
        boolean fresh = hit && in.cacheAge() != null && in.cacheAge().compareTo(freshnessThreshold) < 0;

        FetchDecision decision;
        if (hit && fresh && in.override() != SourceOverride.REFRESH) {
            decision = FetchDecision.USE_CACHE;
        } else if (hit) {
            decision = FetchDecision.CACHE_STALE;
        } else {
            decision = FetchDecision.FETCH_FRESH;
        }

        if (in.override() == SourceOverride.INCREMENTAL) {
            return new FetchPlan(decision, SourceRole.INCREMENTAL, null);
        }
        if (in.override() == SourceOverride.ARCHIVE) {
            return new FetchPlan(decision, SourceRole.ARCHIVE, null);
        }

        SourceRole primary = preferredRole(in);
        SourceRole alternate = primary.other();
        if (decision != FetchDecision.USE_CACHE
                && stateOf(primary, in) == CircuitState.OPEN
                && stateOf(alternate, in) != CircuitState.OPEN) {
            return new FetchPlan(FetchDecision.FAILOVER, alternate, primary);
        }
        return new FetchPlan(decision, primary, alternate);
    }

    /**
     * The archive publishes a day only after the consolidation delay; until then the incremental API is the source.
     */
    SourceRole preferredRole(DecisionInputs in) {
        boolean recent = in.partitionEnd().isAfter(in.now().minus(consolidationDelay));
        return recent ? SourceRole.INCREMENTAL : SourceRole.ARCHIVE;
    }

    private static CircuitState stateOf(SourceRole role, DecisionInputs in) {
        CircuitState state = role == SourceRole.INCREMENTAL ? in.incrementalState() : in.archiveState();
        return state != null ? state : CircuitState.CLOSED;
    }

    public Duration getFreshnessThreshold() {
        return freshnessThreshold;
    }

    public Duration getConsolidationDelay() {
        return consolidationDelay;
    }
}
