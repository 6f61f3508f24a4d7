package com.stocksignal.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * 模块说明：Bar（class）。
 * 主要职责：一只标的在一个交易日的 OHLCV 记录，按日期升序、每日唯一地交给计算核心。
 * 使用建议：核心不会重新排序或去重，上游负责校验。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Bar {
    public final String code;
    public final LocalDate tradeDate;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double preclose;
    public final double volume;
    public final double amount;
    public final double turnover;
    public final String adjustFlag;
    public final String tradeStatus;
    public final double pctChg;
    public final Fundamentals fundamentals;

    public static Bar of(String code, LocalDate tradeDate, double open, double high, double low, double close, double volume) {
        return Bar.builder()
                .code(code)
                .tradeDate(tradeDate)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .preclose(Double.NaN)
                .volume(volume)
                .amount(Double.NaN)
                .turnover(Double.NaN)
                .pctChg(Double.NaN)
                .build();
    }
}
