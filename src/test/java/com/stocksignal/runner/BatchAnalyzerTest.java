package com.stocksignal.runner;

import com.stocksignal.core.diagnostics.CauseCode;
import com.stocksignal.data.BarSource;
import com.stocksignal.model.Bar;
import com.stocksignal.strategy.TechnicalAnalyzer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchAnalyzerTest {

    private final BatchAnalyzer batch = new BatchAnalyzer(TechnicalAnalyzer.withDefaults());

    @Test
    void analyzeAll_shouldTallySuccessSkipAndFailure() {
        Map<String, List<Bar>> bars = new HashMap<>();
        bars.put("600000", buildBars("600000", 40));
        bars.put("600001", buildBars("600001", 10));
        bars.put("600002", List.of());
        List<Bar> broken = new ArrayList<>(buildBars("600003", 30));
        broken.set(10, null);
        bars.put("600003", broken);

        BatchAnalysis analysis = batch.analyzeAll(bars, () -> false);
        BatchSummary summary = analysis.summary;

        assertEquals(4, summary.total);
        assertEquals(1, summary.succeeded);
        assertEquals(2, summary.skipped);
        assertEquals(1, summary.failed);
        assertFalse(summary.cancelled);
        assertEquals(CauseCode.HISTORY_SHORT, summary.causes.get("600001"));
        assertEquals(CauseCode.NO_BARS, summary.causes.get("600002"));
        assertEquals(CauseCode.RUNTIME_ERROR, summary.causes.get("600003"));
        assertEquals(1, analysis.results.size());
        assertEquals("600000", analysis.results.get(0).code);
    }

    @Test
    void analyzeAll_shouldStopBetweenInstrumentsAndKeepFinishedResults() {
        Map<String, List<Bar>> bars = new HashMap<>();
        bars.put("A", buildBars("A", 30));
        bars.put("B", buildBars("B", 30));
        bars.put("C", buildBars("C", 30));
        AtomicInteger checks = new AtomicInteger();

        BatchAnalysis analysis = batch.analyzeAll(bars, () -> checks.incrementAndGet() > 1);

        assertTrue(analysis.summary.cancelled);
        assertEquals(3, analysis.summary.total);
        assertEquals(1, analysis.summary.processed());
        assertEquals(1, analysis.results.size());
        assertEquals("A", analysis.results.get(0).code);
    }

    @Test
    void analyzeFromSource_shouldRecordFetchFailures() {
        BarSource source = new BarSource() {
            @Override
            public List<Bar> fetchBars(String code, LocalDate start, LocalDate end) throws IOException {
                if (code.equals("BAD")) {
                    throw new IOException("connection reset");
                }
                return buildBars(code, 35);
            }

            @Override
            public boolean healthCheck() {
                return true;
            }
        };

        BatchAnalysis analysis = batch.analyzeFromSource(source, List.of("GOOD", "BAD", "GOOD", " "), null, null, null);

        assertEquals(2, analysis.summary.total);
        assertEquals(1, analysis.summary.succeeded);
        assertEquals(1, analysis.summary.failed);
        assertEquals(CauseCode.FETCH_FAILED, analysis.summary.causes.get("BAD"));
        assertEquals(1, analysis.summary.causeCounts().get(CauseCode.FETCH_FAILED));
        assertTrue(analysis.summary.toSummaryText().startsWith("BATCH total=2 succeeded=1"));
    }

    private List<Bar> buildBars(String code, int count) {
        List<Bar> bars = new ArrayList<>(count);
        LocalDate day = LocalDate.of(2024, 4, 1);
        double close = 20.0;
        for (int i = 0; i < count; i++) {
            double open = close;
            close = close * (1.0 + ((i % 3) - 1) * 0.015);
            bars.add(Bar.of(code, day.plusDays(i), open, Math.max(open, close) * 1.005, Math.min(open, close) * 0.995, close, 1_000.0 + i));
        }
        return bars;
    }
}
