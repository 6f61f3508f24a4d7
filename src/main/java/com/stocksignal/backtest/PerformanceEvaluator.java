package com.stocksignal.backtest;

import com.stocksignal.core.diagnostics.CauseCode;
import com.stocksignal.model.AnalysisResult;
import com.stocksignal.model.Bar;
import com.stocksignal.model.PerformanceRecord;
import com.stocksignal.model.Rating;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 模块说明：PerformanceEvaluator（class）。
 * 主要职责：把历史评级与行情收盘价对齐，计算某策略在评估窗口内的收益、回撤、夏普、胜率与盈亏比。
 * 使用建议：评估结果只依赖输入，不做任何 I/O；同样的输入得到完全一致的输出。
 */
public final class PerformanceEvaluator {
    private static final Logger LOG = LogManager.getLogger(PerformanceEvaluator.class);

    private final EvaluationConfig config;

    public PerformanceEvaluator() {
        this(EvaluationConfig.defaults());
    }

    public PerformanceEvaluator(EvaluationConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("evaluation config is required");
        }
        this.config = config;
    }

    public PerformanceEvaluation evaluate(
            String strategy,
            LocalDate start,
            LocalDate end,
            List<AnalysisResult> results,
            Map<String, List<Bar>> barsByInstrument
    ) {
        if (strategy == null || strategy.isBlank()) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("evaluation window requires start and end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("evaluation window end " + end + " is before start " + start);
        }

        Map<String, Map<LocalDate, Rating>> ratings = ratingsByInstrument(strategy, start, end, results);
        Map<String, List<Bar>> bars = barsByInstrument == null ? Map.of() : barsByInstrument;

        List<Double> totals = new ArrayList<>();
        List<Double> drawdowns = new ArrayList<>();
        List<Double> dailyReturns = new ArrayList<>();
        List<Double> wins = new ArrayList<>();
        List<Double> losses = new ArrayList<>();
        int trades = 0;
        Map<String, CauseCode> skipped = new LinkedHashMap<>();

        for (Map.Entry<String, Map<LocalDate, Rating>> entry : ratings.entrySet()) {
            String code = entry.getKey();
            List<Bar> instrumentBars = bars.get(code);
            if (instrumentBars == null || instrumentBars.isEmpty()) {
                skip(skipped, code, CauseCode.NO_BARS);
                continue;
            }
            List<Bar> series = new ArrayList<>();
            List<Rating> seriesRatings = new ArrayList<>();
            join(instrumentBars, entry.getValue(), end, series, seriesRatings);
            if (series.isEmpty()) {
                skip(skipped, code, CauseCode.EMPTY_JOIN);
                continue;
            }
            if (series.size() < 2) {
                skip(skipped, code, CauseCode.HISTORY_SHORT);
                continue;
            }

            double first = series.get(0).close;
            double last = series.get(series.size() - 1).close;
            totals.add(last / first - 1.0);
            drawdowns.add(maxDrawdown(series));

            for (int i = 1; i < series.size(); i++) {
                double prev = series.get(i - 1).close;
                double cur = series.get(i).close;
                double change = (cur - prev) / prev;
                dailyReturns.add(change);
                if (seriesRatings.get(i - 1) == Rating.BUY) {
                    trades++;
                    if (change > 0.0) {
                        wins.add(change);
                    } else if (change < 0.0) {
                        losses.add(change);
                    }
                }
            }
        }

        double totalReturn = mean(totals);
        PerformanceRecord record = PerformanceRecord.builder()
                .strategy(strategy)
                .windowStart(start)
                .windowEnd(end)
                .totalReturn(totalReturn)
                .annualReturn(annualize(totalReturn, start, end))
                .maxDrawdown(mean(drawdowns))
                .sharpeRatio(sharpe(dailyReturns))
                .winRate(trades == 0 ? 0.0 : wins.size() / (double) trades)
                .profitLossRatio(profitLossRatio(wins, losses))
                .tradeCount(trades)
                .build();

        PerformanceEvaluation evaluation = new PerformanceEvaluation(record, totals.size(), skipped);
        LOG.info("{} evaluated={} skipped={}", toSummaryText(record), evaluation.evaluatedInstruments, evaluation.skipCount());
        return evaluation;
    }

    public StrategyComparison compare(List<PerformanceRecord> records) {
        return StrategyComparison.of(records);
    }

    /**
     * Evaluates every listed strategy that has at least one result inside the window, then ranks them.
     */
    public StrategyComparison compareStrategies(
            List<String> strategies,
            LocalDate start,
            LocalDate end,
            List<AnalysisResult> results,
            Map<String, List<Bar>> barsByInstrument
    ) {
        List<PerformanceRecord> records = new ArrayList<>();
        if (strategies != null) {
            for (String strategy : new LinkedHashSet<>(strategies)) {
                if (strategy == null || strategy.isBlank()) {
                    continue;
                }
                if (ratingsByInstrument(strategy, start, end, results).isEmpty()) {
                    LOG.warn("strategy {} has no results between {} and {}", strategy, start, end);
                    continue;
                }
                records.add(evaluate(strategy, start, end, results, barsByInstrument).record);
            }
        }
        return compare(records);
    }

    public String toSummaryText(PerformanceRecord record) {
        return String.format(
                Locale.US,
                "PERFORMANCE strategy=%s window=%s..%s total=%.2f%% annual=%.2f%% max_dd=%.2f%% sharpe=%.2f win_rate=%.2f%% pl_ratio=%.2f trades=%d",
                record.strategy,
                record.windowStart,
                record.windowEnd,
                record.totalReturn * 100.0,
                record.annualReturn * 100.0,
                record.maxDrawdown * 100.0,
                record.sharpeRatio,
                record.winRate * 100.0,
                record.profitLossRatio,
                record.tradeCount
        );
    }

    private Map<String, Map<LocalDate, Rating>> ratingsByInstrument(
            String strategy,
            LocalDate start,
            LocalDate end,
            List<AnalysisResult> results
    ) {
        Map<String, Map<LocalDate, Rating>> out = new TreeMap<>();
        if (results == null || start == null || end == null) {
            return out;
        }
        for (AnalysisResult result : results) {
            if (result == null || result.code == null || result.analysisDate == null) {
                continue;
            }
            if (!strategy.equals(result.strategy)) {
                continue;
            }
            if (result.analysisDate.isBefore(start) || result.analysisDate.isAfter(end)) {
                continue;
            }
            out.computeIfAbsent(result.code, k -> new HashMap<>()).putIfAbsent(result.analysisDate, result.rating);
        }
        return out;
    }

    // Starts at the first bar whose date has a rating, runs to the window end.
    private static void join(
            List<Bar> bars,
            Map<LocalDate, Rating> ratings,
            LocalDate end,
            List<Bar> series,
            List<Rating> seriesRatings
    ) {
        boolean anchored = false;
        for (Bar bar : bars) {
            if (bar == null || bar.tradeDate == null || bar.tradeDate.isAfter(end)) {
                continue;
            }
            if (!anchored && !ratings.containsKey(bar.tradeDate)) {
                continue;
            }
            anchored = true;
            series.add(bar);
            seriesRatings.add(ratings.get(bar.tradeDate));
        }
    }

    static double maxDrawdown(List<Bar> series) {
        double base = series.get(0).close;
        double runMax = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (Bar bar : series) {
            double cumulative = bar.close / base - 1.0;
            runMax = Math.max(runMax, cumulative);
            double drawdown = (runMax - cumulative) / (1.0 + runMax);
            worst = Math.max(worst, drawdown);
        }
        return worst;
    }

    double annualize(double totalReturn, LocalDate start, LocalDate end) {
        long days = ChronoUnit.DAYS.between(start, end);
        if (days <= 0) {
            return 0.0;
        }
        return Math.pow(1.0 + totalReturn, config.calendarDays / (double) days) - 1.0;
    }

    double sharpe(List<Double> dailyReturns) {
        if (dailyReturns.size() < 2) {
            return 0.0;
        }
        double mean = mean(dailyReturns);
        double sumSq = 0.0;
        for (double r : dailyReturns) {
            sumSq += (r - mean) * (r - mean);
        }
        double stdev = Math.sqrt(sumSq / dailyReturns.size());
        if (stdev == 0.0 || !Double.isFinite(stdev)) {
            return 0.0;
        }
        double excess = mean - config.riskFreeRate / config.tradingDays;
        return excess / stdev * Math.sqrt(config.tradingDays);
    }

    private static double profitLossRatio(List<Double> wins, List<Double> losses) {
        if (wins.isEmpty() || losses.isEmpty()) {
            return 0.0;
        }
        double avgLoss = 0.0;
        for (double loss : losses) {
            avgLoss += Math.abs(loss);
        }
        avgLoss /= losses.size();
        return avgLoss == 0.0 ? 0.0 : mean(wins) / avgLoss;
    }

    private static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static void skip(Map<String, CauseCode> skipped, String code, CauseCode cause) {
        skipped.put(code, cause);
        LOG.debug("performance skip code={} cause={}", code, cause);
    }
}
