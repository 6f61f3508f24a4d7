package com.stocksignal.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Valuation fields some providers attach to a daily bar. Absent values are NaN.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Fundamentals {
    public final double peTtm;
    public final double pbMrq;
    public final double psTtm;
    public final double pcfNcfTtm;
    public final boolean specialTreatment;
}
