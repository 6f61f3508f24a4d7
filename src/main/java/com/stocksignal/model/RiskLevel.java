package com.stocksignal.model;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
