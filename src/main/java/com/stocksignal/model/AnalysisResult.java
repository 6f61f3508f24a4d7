package com.stocksignal.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * 模块说明：AnalysisResult（class）。
 * 主要职责：某标的、某日期、某策略下的一次评级结论，生成后不可变，交由外部持久化。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AnalysisResult {
    public final String code;
    public final LocalDate analysisDate;
    public final String strategy;
    public final Map<SignalFamily, Signal> signals;
    public final int score;
    public final Rating rating;
    public final RiskLevel riskLevel;
    public final double expectedReturn;

    public Signal signal(SignalFamily family) {
        if (signals == null || family == null) {
            return Signal.HOLD;
        }
        return signals.getOrDefault(family, Signal.HOLD);
    }
}
