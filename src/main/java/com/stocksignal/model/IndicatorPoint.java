package com.stocksignal.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Indicator values for one bar. An empty value means the indicator is not defined yet at this
 * position (window not filled, or a degenerate range), which is a normal state.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class IndicatorPoint {
    public final LocalDate tradeDate;
    public final double close;
    public final Map<Integer, OptionalDouble> movingAverages;
    public final OptionalDouble macdDif;
    public final OptionalDouble macdDea;
    public final OptionalDouble macdHist;
    public final Map<Integer, OptionalDouble> rsi;
    public final OptionalDouble kdjK;
    public final OptionalDouble kdjD;
    public final OptionalDouble kdjJ;
    public final OptionalDouble bollingerUpper;
    public final OptionalDouble bollingerMiddle;
    public final OptionalDouble bollingerLower;
    public final Map<Integer, OptionalDouble> volumeMovingAverages;

    public OptionalDouble ma(int period) {
        return lookup(movingAverages, period);
    }

    public OptionalDouble rsi(int period) {
        return lookup(rsi, period);
    }

    public OptionalDouble volumeMa(int period) {
        return lookup(volumeMovingAverages, period);
    }

    private static OptionalDouble lookup(Map<Integer, OptionalDouble> values, int period) {
        if (values == null) {
            return OptionalDouble.empty();
        }
        OptionalDouble value = values.get(period);
        return value == null ? OptionalDouble.empty() : value;
    }
}
