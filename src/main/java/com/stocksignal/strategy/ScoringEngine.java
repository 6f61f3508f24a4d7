package com.stocksignal.strategy;

import com.stocksignal.model.AnalysisResult;
import com.stocksignal.model.Bar;
import com.stocksignal.model.Rating;
import com.stocksignal.model.RiskLevel;
import com.stocksignal.model.Signal;
import com.stocksignal.model.SignalFamily;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a signal set into a composite score, a rating, a risk level and an expected-return
 * estimate. Output depends only on the arguments of each call.
 */
public final class ScoringEngine {
    private final ScoringConfig config;

    public ScoringEngine() {
        this(ScoringConfig.defaults());
    }

    public ScoringEngine(ScoringConfig config) {
        this.config = config == null ? ScoringConfig.defaults() : config;
    }

    public ScoringConfig config() {
        return config;
    }

    public AnalysisResult score(String strategy, List<Bar> bars, Map<SignalFamily, Signal> signals) {
        requireHistory(bars);
        Bar last = bars.get(bars.size() - 1);

        Map<SignalFamily, Signal> complete = new EnumMap<>(SignalFamily.class);
        for (SignalFamily family : SignalFamily.values()) {
            Signal signal = signals == null ? null : signals.get(family);
            complete.put(family, signal == null ? Signal.HOLD : signal);
        }
        int score = compositeScore(complete);

        return AnalysisResult.builder()
                .code(last.code)
                .analysisDate(last.tradeDate)
                .strategy(strategy)
                .signals(Collections.unmodifiableMap(complete))
                .score(score)
                .rating(rate(score))
                .riskLevel(riskLevel(bars))
                .expectedReturn(expectedReturn(bars))
                .build();
    }

    /**
     * Fails the unit of work when the window is shorter than the configured minimum
     * (26 bars by default, the slow MACD span).
     */
    public void requireHistory(List<Bar> bars) {
        int size = bars == null ? 0 : bars.size();
        if (size < config.minHistoryBars) {
            String code = size == 0 ? "" : bars.get(size - 1).code;
            throw new InsufficientHistoryException(code, config.minHistoryBars, size);
        }
    }

    public int compositeScore(Map<SignalFamily, Signal> signals) {
        int score = config.baseline;
        if (signals != null) {
            for (Map.Entry<SignalFamily, Signal> e : signals.entrySet()) {
                int weight = config.weight(e.getKey());
                if (e.getValue() == Signal.BUY) {
                    score += weight;
                } else if (e.getValue() == Signal.SELL) {
                    score -= weight;
                }
            }
        }
        return Math.max(0, Math.min(100, score));
    }

    public Rating rate(int score) {
        if (score >= config.buyThreshold) {
            return Rating.BUY;
        }
        if (score <= config.sellThreshold) {
            return Rating.SELL;
        }
        return Rating.HOLD;
    }

    /**
     * Annualized volatility of daily close changes over the whole window, bucketed by the
     * configured cut-offs.
     */
    public RiskLevel riskLevel(List<Bar> bars) {
        double[] returns = dailyReturns(bars, Integer.MAX_VALUE);
        double volatility = sampleStdev(returns) * Math.sqrt(config.tradingDays);
        if (Double.isNaN(volatility) || volatility < config.lowVolatility) {
            return RiskLevel.LOW;
        }
        if (volatility < config.mediumVolatility) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }

    public double expectedReturn(List<Bar> bars) {
        double[] returns = dailyReturns(bars, config.expectedReturnWindow);
        if (returns.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double r : returns) {
            sum += r;
        }
        return sum / returns.length * config.tradingDays;
    }

    /**
     * Close-to-close changes for the trailing {@code limit} bar pairs; pairs with a
     * non-positive previous close are left out.
     */
    static double[] dailyReturns(List<Bar> bars, int limit) {
        if (bars == null || bars.size() < 2) {
            return new double[0];
        }
        int pairs = bars.size() - 1;
        int start = Math.max(1, bars.size() - Math.min(pairs, limit));
        double[] buffer = new double[bars.size() - start];
        int n = 0;
        for (int i = start; i < bars.size(); i++) {
            double prev = bars.get(i - 1).close;
            if (prev > 0.0) {
                buffer[n++] = bars.get(i).close / prev - 1.0;
            }
        }
        return n == buffer.length ? buffer : Arrays.copyOf(buffer, n);
    }

    static double sampleStdev(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (values.length - 1));
    }
}
