package com.stocksignal.indicator;

import com.stocksignal.config.Config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Indicator windows and spans, passed explicitly on every {@link IndicatorEngine#compute} call.
 * Invalid values are rejected at construction.
 */
public final class IndicatorConfig {
    public static final List<Integer> DEFAULT_MA_PERIODS = List.of(5, 10, 20, 60, 120, 250);
    public static final List<Integer> DEFAULT_RSI_PERIODS = List.of(6, 12, 24);
    public static final List<Integer> DEFAULT_VOLUME_MA_PERIODS = List.of(5, 10, 20);

    public final List<Integer> maPeriods;
    public final int macdFast;
    public final int macdSlow;
    public final int macdSignal;
    public final List<Integer> rsiPeriods;
    public final int kdjLength;
    public final int kdjSignal;
    public final int bollingerLength;
    public final double bollingerStd;
    public final List<Integer> volumeMaPeriods;

    private IndicatorConfig(Builder b) {
        this.maPeriods = normalizePeriods("ma_periods", b.maPeriods);
        this.rsiPeriods = normalizePeriods("rsi_periods", b.rsiPeriods);
        this.volumeMaPeriods = normalizePeriods("volume_ma_periods", b.volumeMaPeriods);
        this.macdFast = requirePositive("macd.fast", b.macdFast);
        this.macdSlow = requirePositive("macd.slow", b.macdSlow);
        this.macdSignal = requirePositive("macd.signal", b.macdSignal);
        if (macdFast >= macdSlow) {
            throw new IllegalArgumentException("macd.fast must be below macd.slow: " + macdFast + " >= " + macdSlow);
        }
        this.kdjLength = requirePositive("kdj.length", b.kdjLength);
        this.kdjSignal = requirePositive("kdj.signal", b.kdjSignal);
        this.bollingerLength = requirePositive("bollinger.length", b.bollingerLength);
        if (!(b.bollingerStd > 0.0) || Double.isInfinite(b.bollingerStd)) {
            throw new IllegalArgumentException("bollinger.std must be positive: " + b.bollingerStd);
        }
        this.bollingerStd = b.bollingerStd;
    }

    public static IndicatorConfig defaults() {
        return builder().build();
    }

    public static IndicatorConfig fromConfig(Config config) {
        return builder()
                .maPeriods(config.getIntList("indicator.ma_periods", DEFAULT_MA_PERIODS))
                .macdFast(config.getInt("indicator.macd.fast", 12))
                .macdSlow(config.getInt("indicator.macd.slow", 26))
                .macdSignal(config.getInt("indicator.macd.signal", 9))
                .rsiPeriods(config.getIntList("indicator.rsi_periods", DEFAULT_RSI_PERIODS))
                .kdjLength(config.getInt("indicator.kdj.length", 9))
                .kdjSignal(config.getInt("indicator.kdj.signal", 3))
                .bollingerLength(config.getInt("indicator.bollinger.length", 20))
                .bollingerStd(config.getDouble("indicator.bollinger.std", 2.0))
                .volumeMaPeriods(config.getIntList("indicator.volume_ma_periods", DEFAULT_VOLUME_MA_PERIODS))
                .build();
    }

    /**
     * Copy that also covers the given moving-average and RSI windows, so rules reading them
     * never see a window that was not computed.
     */
    public IndicatorConfig withRequiredPeriods(Collection<Integer> requiredMa, Collection<Integer> requiredRsi) {
        return toBuilder()
                .maPeriods(union(maPeriods, requiredMa))
                .rsiPeriods(union(rsiPeriods, requiredRsi))
                .build();
    }

    public Builder toBuilder() {
        return builder()
                .maPeriods(maPeriods)
                .macdFast(macdFast)
                .macdSlow(macdSlow)
                .macdSignal(macdSignal)
                .rsiPeriods(rsiPeriods)
                .kdjLength(kdjLength)
                .kdjSignal(kdjSignal)
                .bollingerLength(bollingerLength)
                .bollingerStd(bollingerStd)
                .volumeMaPeriods(volumeMaPeriods);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "IndicatorConfig{ma=" + maPeriods
                + ", macd=" + macdFast + "/" + macdSlow + "/" + macdSignal
                + ", rsi=" + rsiPeriods
                + ", kdj=" + kdjLength + "/" + kdjSignal
                + ", boll=" + bollingerLength + "x" + bollingerStd
                + ", vol=" + volumeMaPeriods + "}";
    }

    private static List<Integer> union(Collection<Integer> base, Collection<Integer> extra) {
        TreeSet<Integer> out = new TreeSet<>(base);
        if (extra != null) {
            out.addAll(extra);
        }
        return new ArrayList<>(out);
    }

    private static List<Integer> normalizePeriods(String name, List<Integer> periods) {
        if (periods == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer period : periods) {
            if (period == null || period <= 0) {
                throw new IllegalArgumentException(name + " contains a non-positive window: " + period);
            }
            sorted.add(period);
        }
        return List.copyOf(sorted);
    }

    private static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    public static final class Builder {
        private List<Integer> maPeriods = DEFAULT_MA_PERIODS;
        private int macdFast = 12;
        private int macdSlow = 26;
        private int macdSignal = 9;
        private List<Integer> rsiPeriods = DEFAULT_RSI_PERIODS;
        private int kdjLength = 9;
        private int kdjSignal = 3;
        private int bollingerLength = 20;
        private double bollingerStd = 2.0;
        private List<Integer> volumeMaPeriods = DEFAULT_VOLUME_MA_PERIODS;

        private Builder() {
        }

        public Builder maPeriods(List<Integer> maPeriods) {
            this.maPeriods = maPeriods;
            return this;
        }

        public Builder macdFast(int macdFast) {
            this.macdFast = macdFast;
            return this;
        }

        public Builder macdSlow(int macdSlow) {
            this.macdSlow = macdSlow;
            return this;
        }

        public Builder macdSignal(int macdSignal) {
            this.macdSignal = macdSignal;
            return this;
        }

        public Builder rsiPeriods(List<Integer> rsiPeriods) {
            this.rsiPeriods = rsiPeriods;
            return this;
        }

        public Builder kdjLength(int kdjLength) {
            this.kdjLength = kdjLength;
            return this;
        }

        public Builder kdjSignal(int kdjSignal) {
            this.kdjSignal = kdjSignal;
            return this;
        }

        public Builder bollingerLength(int bollingerLength) {
            this.bollingerLength = bollingerLength;
            return this;
        }

        public Builder bollingerStd(double bollingerStd) {
            this.bollingerStd = bollingerStd;
            return this;
        }

        public Builder volumeMaPeriods(List<Integer> volumeMaPeriods) {
            this.volumeMaPeriods = volumeMaPeriods;
            return this;
        }

        public IndicatorConfig build() {
            return new IndicatorConfig(this);
        }
    }
}
