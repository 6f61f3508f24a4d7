package com.stocksignal.runner;

import com.stocksignal.core.diagnostics.CauseCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregated counts for one batch run.
 */
public final class BatchSummary {
    public final int total;
    public final int succeeded;
    public final int skipped;
    public final int failed;
    public final boolean cancelled;
    // Instruments that did not produce a result, keyed by code.
    public final Map<String, CauseCode> causes;

    public BatchSummary(int total, int succeeded, int skipped, int failed, boolean cancelled, Map<String, CauseCode> causes) {
        this.total = Math.max(0, total);
        this.succeeded = Math.max(0, succeeded);
        this.skipped = Math.max(0, skipped);
        this.failed = Math.max(0, failed);
        this.cancelled = cancelled;
        this.causes = causes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(causes));
    }

    public int processed() {
        return succeeded + skipped + failed;
    }

    public Map<CauseCode, Integer> causeCounts() {
        Map<CauseCode, Integer> out = new EnumMap<>(CauseCode.class);
        for (CauseCode cause : causes.values()) {
            out.merge(cause, 1, Integer::sum);
        }
        return out;
    }

    public String toSummaryText() {
        return String.format(
                Locale.US,
                "BATCH total=%d succeeded=%d skipped=%d failed=%d cancelled=%s causes=%s",
                total,
                succeeded,
                skipped,
                failed,
                cancelled,
                causeCounts()
        );
    }
}
