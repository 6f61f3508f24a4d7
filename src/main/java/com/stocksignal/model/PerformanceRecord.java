package com.stocksignal.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PerformanceRecord {
    public final String strategy;
    public final LocalDate windowStart;
    public final LocalDate windowEnd;
    public final double totalReturn;
    public final double annualReturn;
    public final double maxDrawdown;
    public final double sharpeRatio;
    public final double winRate;
    public final double profitLossRatio;
    public final int tradeCount;
}
