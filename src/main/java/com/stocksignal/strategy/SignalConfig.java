package com.stocksignal.strategy;

import com.stocksignal.config.Config;

/**
 * Windows and thresholds read by {@link SignalEngine}.
 */
public final class SignalConfig {
    public final int maShort;
    public final int maLong;
    public final int rsiPeriod;
    public final double rsiOversold;
    public final double rsiOverbought;

    public SignalConfig(int maShort, int maLong, int rsiPeriod, double rsiOversold, double rsiOverbought) {
        if (maShort <= 0 || maLong <= 0 || maShort >= maLong) {
            throw new IllegalArgumentException("signal.ma windows must satisfy 0 < short < long: " + maShort + "/" + maLong);
        }
        if (rsiPeriod <= 0) {
            throw new IllegalArgumentException("signal.rsi.period must be positive: " + rsiPeriod);
        }
        if (!(rsiOversold < rsiOverbought) || rsiOversold < 0.0 || rsiOverbought > 100.0) {
            throw new IllegalArgumentException(
                    "signal.rsi thresholds must satisfy 0 <= oversold < overbought <= 100: " + rsiOversold + "/" + rsiOverbought);
        }
        this.maShort = maShort;
        this.maLong = maLong;
        this.rsiPeriod = rsiPeriod;
        this.rsiOversold = rsiOversold;
        this.rsiOverbought = rsiOverbought;
    }

    public static SignalConfig defaults() {
        return new SignalConfig(5, 20, 14, 30.0, 70.0);
    }

    public static SignalConfig fromConfig(Config config) {
        return new SignalConfig(
                config.getInt("signal.ma.short", 5),
                config.getInt("signal.ma.long", 20),
                config.getInt("signal.rsi.period", 14),
                config.getDouble("signal.rsi.oversold", 30.0),
                config.getDouble("signal.rsi.overbought", 70.0)
        );
    }
}
