package com.stocksignal.backtest;

import com.stocksignal.core.diagnostics.CauseCode;
import com.stocksignal.model.PerformanceRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A performance record together with how many instruments fed it and why the others were left out.
 */
public final class PerformanceEvaluation {
    public final PerformanceRecord record;
    public final int evaluatedInstruments;
    public final Map<String, CauseCode> skippedInstruments;

    public PerformanceEvaluation(PerformanceRecord record, int evaluatedInstruments, Map<String, CauseCode> skippedInstruments) {
        this.record = record;
        this.evaluatedInstruments = Math.max(0, evaluatedInstruments);
        this.skippedInstruments = skippedInstruments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(skippedInstruments));
    }

    public int skipCount() {
        return skippedInstruments.size();
    }
}
