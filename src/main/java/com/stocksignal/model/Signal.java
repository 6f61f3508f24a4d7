package com.stocksignal.model;

import java.util.Locale;

public enum Signal {
    BUY,
    SELL,
    HOLD;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
