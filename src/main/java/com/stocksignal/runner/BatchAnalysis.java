package com.stocksignal.runner;

import com.stocksignal.model.AnalysisResult;

import java.util.Collections;
import java.util.List;

public final class BatchAnalysis {
    public final List<AnalysisResult> results;
    public final BatchSummary summary;

    public BatchAnalysis(List<AnalysisResult> results, BatchSummary summary) {
        this.results = results == null ? List.of() : Collections.unmodifiableList(results);
        this.summary = summary;
    }
}
