package com.stocksignal.backtest;

/**
 * Metrics for which a comparison names a best strategy.
 */
public enum ComparisonMetric {
    ANNUAL_RETURN,
    SHARPE_RATIO,
    MAX_DRAWDOWN,
    WIN_RATE
}
