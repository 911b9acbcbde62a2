package com.klinevault.data.fcp;

import com.klinevault.data.source.SourceRole;

/**
 * Decision plus the backends to use. {@code alternate} is null when failover is not allowed.
 */
public record FetchPlan(FetchDecision decision, SourceRole primary, SourceRole alternate) {

    public boolean hasAlternate() {
        return alternate != null;
    }
}
