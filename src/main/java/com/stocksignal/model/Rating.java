package com.stocksignal.model;

import java.util.Locale;

/**
 * 模块说明：Rating（enum）。
 * 主要职责：综合评分映射出的投资评级。
 */
public enum Rating {
    BUY,
    HOLD,
    SELL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
