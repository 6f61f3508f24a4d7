package com.stocksignal.model;

import java.util.Locale;

/**
 * Indicator families that each contribute one directional signal.
 */
public enum SignalFamily {
    MACD,
    RSI,
    KDJ,
    BOLLINGER,
    MA;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
