package com.stocksignal.backtest;

import com.stocksignal.model.PerformanceRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records ranked by annual return (highest first, ties by strategy id), plus the best record per
 * metric. The smallest drawdown is the best one; ties keep the higher-ranked record.
 */
public final class StrategyComparison {
    private static final Comparator<PerformanceRecord> RANKING = Comparator
            .comparingDouble((PerformanceRecord r) -> r.annualReturn).reversed()
            .thenComparing(r -> r.strategy == null ? "" : r.strategy);

    public final List<PerformanceRecord> ranked;
    private final Map<ComparisonMetric, PerformanceRecord> best;

    private StrategyComparison(List<PerformanceRecord> ranked, Map<ComparisonMetric, PerformanceRecord> best) {
        this.ranked = ranked;
        this.best = best;
    }

    public static StrategyComparison of(List<PerformanceRecord> records) {
        List<PerformanceRecord> sorted = new ArrayList<>();
        if (records != null) {
            for (PerformanceRecord record : records) {
                if (record != null) {
                    sorted.add(record);
                }
            }
        }
        sorted.sort(RANKING);

        Map<ComparisonMetric, PerformanceRecord> best = new EnumMap<>(ComparisonMetric.class);
        for (PerformanceRecord record : sorted) {
            pick(best, ComparisonMetric.ANNUAL_RETURN, record, record.annualReturn, true);
            pick(best, ComparisonMetric.SHARPE_RATIO, record, record.sharpeRatio, true);
            pick(best, ComparisonMetric.MAX_DRAWDOWN, record, record.maxDrawdown, false);
            pick(best, ComparisonMetric.WIN_RATE, record, record.winRate, true);
        }
        return new StrategyComparison(Collections.unmodifiableList(sorted), Collections.unmodifiableMap(best));
    }

    public Optional<PerformanceRecord> best(ComparisonMetric metric) {
        return Optional.ofNullable(best.get(metric));
    }

    public boolean isEmpty() {
        return ranked.isEmpty();
    }

    private static void pick(
            Map<ComparisonMetric, PerformanceRecord> best,
            ComparisonMetric metric,
            PerformanceRecord candidate,
            double value,
            boolean higherIsBetter
    ) {
        PerformanceRecord current = best.get(metric);
        if (current == null) {
            best.put(metric, candidate);
            return;
        }
        double currentValue = metricValue(current, metric);
        boolean better = higherIsBetter ? value > currentValue : value < currentValue;
        if (better) {
            best.put(metric, candidate);
        }
    }

    private static double metricValue(PerformanceRecord record, ComparisonMetric metric) {
        switch (metric) {
            case ANNUAL_RETURN:
                return record.annualReturn;
            case SHARPE_RATIO:
                return record.sharpeRatio;
            case MAX_DRAWDOWN:
                return record.maxDrawdown;
            case WIN_RATE:
                return record.winRate;
            default:
                throw new IllegalArgumentException("unknown metric: " + metric);
        }
    }
}
