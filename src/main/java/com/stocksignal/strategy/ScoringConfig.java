package com.stocksignal.strategy;

import com.stocksignal.config.Config;
import com.stocksignal.model.SignalFamily;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Weights and thresholds of the composite score, plus the risk and expected-return windows.
 */
public final class ScoringConfig {
    private static final Map<SignalFamily, Integer> DEFAULT_WEIGHTS = Map.of(
            SignalFamily.MACD, 25,
            SignalFamily.RSI, 20,
            SignalFamily.KDJ, 20,
            SignalFamily.BOLLINGER, 15,
            SignalFamily.MA, 20
    );

    public final int baseline;
    public final Map<SignalFamily, Integer> weights;
    public final int buyThreshold;
    public final int sellThreshold;
    public final int minHistoryBars;
    public final double lowVolatility;
    public final double mediumVolatility;
    public final int expectedReturnWindow;
    public final int tradingDays;

    private ScoringConfig(Builder b) {
        if (b.baseline < 0 || b.baseline > 100) {
            throw new IllegalArgumentException("score.baseline must be within [0,100]: " + b.baseline);
        }
        Map<SignalFamily, Integer> w = new EnumMap<>(SignalFamily.class);
        for (SignalFamily family : SignalFamily.values()) {
            Integer weight = b.weights.get(family);
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("score.weight." + family.code() + " must be >= 0: " + weight);
            }
            w.put(family, weight);
        }
        if (!(b.sellThreshold < b.buyThreshold) || b.sellThreshold < 0 || b.buyThreshold > 100) {
            throw new IllegalArgumentException(
                    "score thresholds must satisfy 0 <= sell < buy <= 100: " + b.sellThreshold + "/" + b.buyThreshold);
        }
        if (b.minHistoryBars < 2) {
            throw new IllegalArgumentException("score.min_history_bars must be >= 2: " + b.minHistoryBars);
        }
        if (!(b.lowVolatility > 0.0) || !(b.lowVolatility < b.mediumVolatility)) {
            throw new IllegalArgumentException(
                    "risk volatility cut-offs must satisfy 0 < low < medium: " + b.lowVolatility + "/" + b.mediumVolatility);
        }
        if (b.expectedReturnWindow <= 0 || b.tradingDays <= 0) {
            throw new IllegalArgumentException("expected_return_window and trading_days must be positive");
        }
        this.baseline = b.baseline;
        this.weights = Collections.unmodifiableMap(w);
        this.buyThreshold = b.buyThreshold;
        this.sellThreshold = b.sellThreshold;
        this.minHistoryBars = b.minHistoryBars;
        this.lowVolatility = b.lowVolatility;
        this.mediumVolatility = b.mediumVolatility;
        this.expectedReturnWindow = b.expectedReturnWindow;
        this.tradingDays = b.tradingDays;
    }

    public int weight(SignalFamily family) {
        return weights.getOrDefault(family, 0);
    }

    public static ScoringConfig defaults() {
        return builder().build();
    }

    public static ScoringConfig fromConfig(Config config) {
        Builder b = builder()
                .baseline(config.getInt("score.baseline", 50))
                .buyThreshold(config.getInt("score.buy_threshold", 70))
                .sellThreshold(config.getInt("score.sell_threshold", 30))
                .minHistoryBars(config.getInt("score.min_history_bars", 26))
                .lowVolatility(config.getDouble("score.risk.low_volatility", 0.2))
                .mediumVolatility(config.getDouble("score.risk.medium_volatility", 0.4))
                .expectedReturnWindow(config.getInt("score.expected_return_window", 30))
                .tradingDays(config.getInt("score.trading_days", 252));
        for (SignalFamily family : SignalFamily.values()) {
            b.weight(family, config.getInt("score.weight." + family.code(), DEFAULT_WEIGHTS.get(family)));
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int baseline = 50;
        private final Map<SignalFamily, Integer> weights = new EnumMap<>(DEFAULT_WEIGHTS);
        private int buyThreshold = 70;
        private int sellThreshold = 30;
        private int minHistoryBars = 26;
        private double lowVolatility = 0.2;
        private double mediumVolatility = 0.4;
        private int expectedReturnWindow = 30;
        private int tradingDays = 252;

        private Builder() {
        }

        public Builder baseline(int baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder weight(SignalFamily family, int weight) {
            this.weights.put(family, weight);
            return this;
        }

        public Builder buyThreshold(int buyThreshold) {
            this.buyThreshold = buyThreshold;
            return this;
        }

        public Builder sellThreshold(int sellThreshold) {
            this.sellThreshold = sellThreshold;
            return this;
        }

        public Builder minHistoryBars(int minHistoryBars) {
            this.minHistoryBars = minHistoryBars;
            return this;
        }

        public Builder lowVolatility(double lowVolatility) {
            this.lowVolatility = lowVolatility;
            return this;
        }

        public Builder mediumVolatility(double mediumVolatility) {
            this.mediumVolatility = mediumVolatility;
            return this;
        }

        public Builder expectedReturnWindow(int expectedReturnWindow) {
            this.expectedReturnWindow = expectedReturnWindow;
            return this;
        }

        public Builder tradingDays(int tradingDays) {
            this.tradingDays = tradingDays;
            return this;
        }

        public ScoringConfig build() {
            return new ScoringConfig(this);
        }
    }
}
