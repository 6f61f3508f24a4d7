package com.stocksignal.backtest;

import com.stocksignal.model.PerformanceRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StrategyComparisonTest {

    @Test
    void of_shouldRankByAnnualReturnAndPickBestPerMetric() {
        PerformanceRecord momentum = record("momentum", 0.20, 1.0, 0.10, 0.50);
        PerformanceRecord meanReversion = record("mean_reversion", 0.10, 2.0, 0.05, 0.60);
        PerformanceRecord breakout = record("breakout", 0.15, 0.5, 0.20, 0.40);

        StrategyComparison comparison = StrategyComparison.of(List.of(meanReversion, breakout, momentum));

        assertEquals(List.of(momentum, breakout, meanReversion), comparison.ranked);
        assertEquals(momentum, comparison.best(ComparisonMetric.ANNUAL_RETURN).get());
        assertEquals(meanReversion, comparison.best(ComparisonMetric.SHARPE_RATIO).get());
        assertEquals(meanReversion, comparison.best(ComparisonMetric.MAX_DRAWDOWN).get());
        assertEquals(meanReversion, comparison.best(ComparisonMetric.WIN_RATE).get());
    }

    @Test
    void of_shouldBreakTiesByStrategyId() {
        PerformanceRecord b = record("b", 0.10, 1.0, 0.10, 0.5);
        PerformanceRecord a = record("a", 0.10, 1.0, 0.10, 0.5);

        StrategyComparison comparison = StrategyComparison.of(List.of(b, a));

        assertEquals(List.of(a, b), comparison.ranked);
        assertEquals(a, comparison.best(ComparisonMetric.SHARPE_RATIO).get());
        assertEquals(a, comparison.best(ComparisonMetric.MAX_DRAWDOWN).get());
    }

    @Test
    void of_shouldHandleEmptyAndNullInput() {
        assertTrue(StrategyComparison.of(null).isEmpty());
        StrategyComparison comparison = StrategyComparison.of(Arrays.asList(null, record("x", 0.0, 0.0, 0.0, 0.0)));
        assertEquals(1, comparison.ranked.size());
        assertFalse(StrategyComparison.of(List.of()).best(ComparisonMetric.WIN_RATE).isPresent());
    }

    private PerformanceRecord record(String strategy, double annual, double sharpe, double drawdown, double winRate) {
        return PerformanceRecord.builder()
                .strategy(strategy)
                .windowStart(LocalDate.of(2024, 1, 1))
                .windowEnd(LocalDate.of(2024, 12, 31))
                .totalReturn(annual)
                .annualReturn(annual)
                .maxDrawdown(drawdown)
                .sharpeRatio(sharpe)
                .winRate(winRate)
                .profitLossRatio(1.0)
                .tradeCount(10)
                .build();
    }
}
