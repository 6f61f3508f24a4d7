package com.stocksignal.strategy;

import com.stocksignal.model.AnalysisResult;
import com.stocksignal.model.Bar;
import com.stocksignal.model.Rating;
import com.stocksignal.model.RiskLevel;
import com.stocksignal.model.Signal;
import com.stocksignal.model.SignalFamily;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();

    @Test
    void compositeScore_shouldAddAndSubtractWeights() {
        assertEquals(50, engine.compositeScore(signals(Signal.HOLD)));
        assertEquals(75, engine.compositeScore(Map.of(SignalFamily.MACD, Signal.BUY)));
        assertEquals(95, engine.compositeScore(Map.of(SignalFamily.MACD, Signal.BUY, SignalFamily.MA, Signal.BUY)));
        assertEquals(10, engine.compositeScore(Map.of(SignalFamily.RSI, Signal.SELL, SignalFamily.KDJ, Signal.SELL)));
    }

    @Test
    void compositeScore_shouldClampToZeroAndHundred() {
        assertEquals(100, engine.compositeScore(signals(Signal.BUY)));
        assertEquals(0, engine.compositeScore(signals(Signal.SELL)));
    }

    @Test
    void rate_shouldHonourBoundariesExactly() {
        assertEquals(Rating.BUY, engine.rate(70));
        assertEquals(Rating.HOLD, engine.rate(69));
        assertEquals(Rating.SELL, engine.rate(30));
        assertEquals(Rating.HOLD, engine.rate(31));
        assertEquals(Rating.BUY, engine.rate(100));
        assertEquals(Rating.SELL, engine.rate(0));
    }

    @Test
    void score_shouldRejectShortHistory() {
        InsufficientHistoryException e = assertThrows(
                InsufficientHistoryException.class,
                () -> engine.score("traditional_technical_analysis", bars(25, 0.0), signals(Signal.HOLD))
        );
        assertEquals(26, e.required());
        assertEquals(25, e.actual());
        assertEquals("600519", e.code());
        assertThrows(InsufficientHistoryException.class, () -> engine.score("s", List.of(), Map.of()));
    }

    @Test
    void score_shouldStampLastBarAndFillMissingFamilies() {
        List<Bar> bars = bars(26, 0.0);
        AnalysisResult result = engine.score("traditional_technical_analysis", bars, Map.of(SignalFamily.MACD, Signal.BUY));

        assertEquals("600519", result.code);
        assertEquals(bars.get(25).tradeDate, result.analysisDate);
        assertEquals("traditional_technical_analysis", result.strategy);
        assertEquals(SignalFamily.values().length, result.signals.size());
        assertEquals(Signal.HOLD, result.signal(SignalFamily.RSI));
        assertEquals(75, result.score);
        assertEquals(Rating.BUY, result.rating);
        assertEquals(RiskLevel.LOW, result.riskLevel);
        assertEquals(0.0, result.expectedReturn, 0.0);
    }

    @Test
    void riskLevel_shouldBucketAnnualizedVolatility() {
        assertEquals(RiskLevel.LOW, engine.riskLevel(bars(40, 0.0)));
        // +/-2% swings annualize to about 0.32
        assertEquals(RiskLevel.MEDIUM, engine.riskLevel(alternating(40, 0.02)));
        // +/-5% swings annualize to about 0.8
        assertEquals(RiskLevel.HIGH, engine.riskLevel(alternating(40, 0.05)));
    }

    @Test
    void expectedReturn_shouldAnnualizeTrailingMean() {
        List<Bar> bars = new ArrayList<>();
        double close = 100.0;
        LocalDate day = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < 40; i++) {
            bars.add(Bar.of("600519", day.plusDays(i), close, close, close, close, 1.0));
            close *= 1.001;
        }
        assertEquals(0.001 * 252, engine.expectedReturn(bars), 1e-9);
        assertEquals(0.0, engine.expectedReturn(bars.subList(0, 1)), 0.0);
    }

    @Test
    void dailyReturns_shouldLimitToTrailingPairs() {
        List<Bar> bars = bars(10, 1.0);
        assertEquals(9, ScoringEngine.dailyReturns(bars, Integer.MAX_VALUE).length);
        assertEquals(3, ScoringEngine.dailyReturns(bars, 3).length);
    }

    @Test
    void config_shouldRejectInvertedThresholds() {
        assertThrows(IllegalArgumentException.class,
                () -> ScoringConfig.builder().buyThreshold(30).sellThreshold(70).build());
        assertThrows(IllegalArgumentException.class,
                () -> ScoringConfig.builder().weight(SignalFamily.MACD, -1).build());
    }

    @Test
    void customWeights_shouldChangeScore() {
        ScoringEngine custom = new ScoringEngine(ScoringConfig.builder().weight(SignalFamily.MACD, 40).build());
        assertEquals(90, custom.compositeScore(Map.of(SignalFamily.MACD, Signal.BUY)));
    }

    private Map<SignalFamily, Signal> signals(Signal value) {
        Map<SignalFamily, Signal> out = new EnumMap<>(SignalFamily.class);
        for (SignalFamily family : SignalFamily.values()) {
            out.put(family, value);
        }
        return out;
    }

    private List<Bar> bars(int count, double step) {
        List<Bar> bars = new ArrayList<>(count);
        LocalDate day = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < count; i++) {
            double close = 100.0 + step * i;
            bars.add(Bar.of("600519", day.plusDays(i), close, close, close, close, 1_000.0));
        }
        return bars;
    }

    private List<Bar> alternating(int count, double move) {
        List<Bar> bars = new ArrayList<>(count);
        LocalDate day = LocalDate.of(2024, 1, 1);
        double close = 100.0;
        for (int i = 0; i < count; i++) {
            bars.add(Bar.of("600519", day.plusDays(i), close, close, close, close, 1_000.0));
            close *= (i % 2 == 0) ? 1.0 + move : 1.0 - move;
        }
        return bars;
    }
}
