package com.stocksignal.runner;

import com.stocksignal.core.diagnostics.CauseCode;
import com.stocksignal.core.diagnostics.Diagnostics;
import com.stocksignal.core.diagnostics.Outcome;
import com.stocksignal.data.BarSource;
import com.stocksignal.model.AnalysisResult;
import com.stocksignal.model.Bar;
import com.stocksignal.strategy.InsufficientHistoryException;
import com.stocksignal.strategy.TechnicalAnalyzer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * 模块说明：BatchAnalyzer（class）。
 * 主要职责：逐只标的调用 TechnicalAnalyzer 生成最新评级，单只失败只影响该标的，汇总成功/跳过/失败数量。
 * 使用建议：每处理完一只标的检查一次停止标志；已生成的结果在取消后仍然有效。
 */
public final class BatchAnalyzer {
    private static final Logger LOG = LogManager.getLogger(BatchAnalyzer.class);
    private static final String OWNER = "batch_analyzer";

    private final TechnicalAnalyzer analyzer;

    public BatchAnalyzer(TechnicalAnalyzer analyzer) {
        if (analyzer == null) {
            throw new IllegalArgumentException("analyzer is required");
        }
        this.analyzer = analyzer;
    }

    /**
     * Rates the latest bar of every instrument, in code order.
     */
    public BatchAnalysis analyzeAll(Map<String, List<Bar>> barsByInstrument, BooleanSupplier stopRequested) {
        Map<String, List<Bar>> ordered = new TreeMap<>();
        if (barsByInstrument != null) {
            for (Map.Entry<String, List<Bar>> e : barsByInstrument.entrySet()) {
                if (e.getKey() != null) {
                    ordered.put(e.getKey(), e.getValue());
                }
            }
        }

        Tally tally = new Tally(ordered.size());
        for (Map.Entry<String, List<Bar>> e : ordered.entrySet()) {
            if (stopRequested(stopRequested)) {
                tally.cancelled = true;
                break;
            }
            tally.record(e.getKey(), analyzeOne(e.getKey(), e.getValue()));
        }
        return tally.finish();
    }

    /**
     * Fetches each code from {@code source} and rates its latest bar. Fetch errors fail only that code.
     */
    public BatchAnalysis analyzeFromSource(
            BarSource source,
            List<String> codes,
            LocalDate start,
            LocalDate end,
            BooleanSupplier stopRequested
    ) {
        if (source == null) {
            throw new IllegalArgumentException("bar source is required");
        }
        List<String> unique = new ArrayList<>();
        if (codes != null) {
            for (String code : new LinkedHashSet<>(codes)) {
                if (code != null && !code.isBlank()) {
                    unique.add(code.trim());
                }
            }
        }

        Tally tally = new Tally(unique.size());
        for (String code : unique) {
            if (stopRequested(stopRequested)) {
                tally.cancelled = true;
                break;
            }
            List<Bar> bars;
            try {
                bars = source.fetchBars(code, start, end);
            } catch (IOException e) {
                LOG.warn("fetch failed code={} error={}", code, e.getMessage());
                tally.record(code, Outcome.failure(CauseCode.FETCH_FAILED, OWNER, Map.of("error", describe(e))));
                continue;
            }
            tally.record(code, analyzeOne(code, bars));
        }
        return tally.finish();
    }

    private Outcome<AnalysisResult> analyzeOne(String code, List<Bar> bars) {
        if (bars == null || bars.isEmpty()) {
            return Outcome.failure(CauseCode.NO_BARS, OWNER);
        }
        try {
            AnalysisResult result = analyzer.analyze(bars, new Diagnostics());
            return Outcome.success(result, OWNER);
        } catch (InsufficientHistoryException e) {
            return Outcome.failure(CauseCode.HISTORY_SHORT, OWNER, Map.of("required", e.required(), "actual", e.actual()));
        } catch (RuntimeException e) {
            LOG.error("analysis failed code={}", code, e);
            return Outcome.failure(CauseCode.RUNTIME_ERROR, OWNER, Map.of("error", describe(e)));
        }
    }

    private static boolean stopRequested(BooleanSupplier stopRequested) {
        return stopRequested != null && stopRequested.getAsBoolean();
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static final class Tally {
        private final int total;
        private final List<AnalysisResult> results = new ArrayList<>();
        private final Map<String, CauseCode> causes = new LinkedHashMap<>();
        private int succeeded;
        private int skipped;
        private int failed;
        private boolean cancelled;

        private Tally(int total) {
            this.total = total;
        }

        private void record(String code, Outcome<AnalysisResult> outcome) {
            if (outcome.success) {
                results.add(outcome.value);
                succeeded++;
                return;
            }
            causes.put(code, outcome.causeCode);
            if (outcome.skipped()) {
                skipped++;
                LOG.debug("skip code={} cause={} details={}", code, outcome.causeCode, outcome.details);
            } else {
                failed++;
            }
        }

        private BatchAnalysis finish() {
            BatchSummary summary = new BatchSummary(total, succeeded, skipped, failed, cancelled, causes);
            if (cancelled) {
                LOG.warn("batch cancelled after {} of {} instruments", summary.processed(), total);
            }
            LOG.info(summary.toSummaryText());
            return new BatchAnalysis(results, summary);
        }
    }
}
