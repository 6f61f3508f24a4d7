package com.stocksignal.backtest;

import com.stocksignal.config.Config;

public final class EvaluationConfig {
    public final double riskFreeRate;
    public final int tradingDays;
    public final int calendarDays;

    public EvaluationConfig(double riskFreeRate, int tradingDays, int calendarDays) {
        if (!Double.isFinite(riskFreeRate)) {
            throw new IllegalArgumentException("evaluation.risk_free_rate must be finite: " + riskFreeRate);
        }
        if (tradingDays <= 0 || calendarDays <= 0) {
            throw new IllegalArgumentException("evaluation day counts must be positive: " + tradingDays + "/" + calendarDays);
        }
        this.riskFreeRate = riskFreeRate;
        this.tradingDays = tradingDays;
        this.calendarDays = calendarDays;
    }

    public static EvaluationConfig defaults() {
        return new EvaluationConfig(0.03, 252, 365);
    }

    public static EvaluationConfig fromConfig(Config config) {
        return new EvaluationConfig(
                config.getDouble("evaluation.risk_free_rate", 0.03),
                config.getInt("evaluation.trading_days", 252),
                config.getInt("evaluation.calendar_days", 365)
        );
    }
}
