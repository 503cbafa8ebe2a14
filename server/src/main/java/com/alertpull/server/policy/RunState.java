/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.policy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping of one run. Owned and mutated by the driver thread only.
 */
public final class RunState {

    private long acceptedCount;
    private long receipts;
    private Instant lastActivity;
    private TerminationReason terminationReason;
    private final List<Map<String, Object>> results;

    public RunState(boolean collect, Instant startedAt) {
        this.results = collect ? new ArrayList<>() : null;
        this.lastActivity = startedAt;
    }

    /**
     * Record one handshake: {@code increment} is 0 or 1, {@code result} is collected
     * only when counted.
     */
    public void record(int increment, Map<String, Object> result, Instant at) {
        receipts++;
        lastActivity = at;
        if (increment > 0) {
            acceptedCount += increment;
            if (results != null && result != null) results.add(result);
        }
    }

    /** First reason wins. */
    public void terminate(TerminationReason reason) {
        if (terminationReason == null) terminationReason = reason;
    }

    public long getAcceptedCount() { return acceptedCount; }
    public long getReceipts() { return receipts; }
    public Instant getLastActivity() { return lastActivity; }
    public TerminationReason getTerminationReason() { return terminationReason; }

    /** Collected results, or {@code null} when the run does not collect. */
    public List<Map<String, Object>> getResults() {
        return results != null ? Collections.unmodifiableList(results) : null;
    }
}
