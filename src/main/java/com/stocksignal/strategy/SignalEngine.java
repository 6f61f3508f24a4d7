package com.stocksignal.strategy;

import com.stocksignal.core.diagnostics.CauseCode;
import com.stocksignal.core.diagnostics.Diagnostics;
import com.stocksignal.model.IndicatorPoint;
import com.stocksignal.model.Signal;
import com.stocksignal.model.SignalFamily;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Reduces the latest indicator points to one signal per family. Missing history or an
 * undefined value never fails the call: the family falls back to HOLD and the reason goes
 * to the supplied {@link Diagnostics}.
 */
public final class SignalEngine {
    private static final String OWNER = "signal";

    public Map<SignalFamily, Signal> evaluate(List<IndicatorPoint> points, SignalConfig config, Diagnostics sink) {
        SignalConfig cfg = config == null ? SignalConfig.defaults() : config;
        Diagnostics diagnostics = sink == null ? new Diagnostics() : sink;
        List<IndicatorPoint> safePoints = points == null ? List.of() : points;

        Map<SignalFamily, Signal> out = new EnumMap<>(SignalFamily.class);
        if (safePoints.isEmpty()) {
            for (SignalFamily family : SignalFamily.values()) {
                diagnostics.add(CauseCode.HISTORY_SHORT, OWNER, family.code() + " points=0");
                out.put(family, Signal.HOLD);
            }
            return Collections.unmodifiableMap(out);
        }

        IndicatorPoint latest = safePoints.get(safePoints.size() - 1);
        IndicatorPoint previous = safePoints.size() >= 2 ? safePoints.get(safePoints.size() - 2) : null;

        out.put(SignalFamily.MACD, crossover(SignalFamily.MACD, previous, latest,
                p -> p.macdDif, p -> p.macdDea, diagnostics));
        out.put(SignalFamily.RSI, rsi(latest, cfg, diagnostics));
        out.put(SignalFamily.KDJ, crossover(SignalFamily.KDJ, previous, latest,
                p -> p.kdjK, p -> p.kdjD, diagnostics));
        out.put(SignalFamily.BOLLINGER, bollinger(latest, diagnostics));
        out.put(SignalFamily.MA, crossover(SignalFamily.MA, previous, latest,
                p -> p.ma(cfg.maShort), p -> p.ma(cfg.maLong), diagnostics));
        return Collections.unmodifiableMap(out);
    }

    /**
     * BUY when the fast line moves from strictly below to strictly above the slow line between
     * the previous and the latest point, SELL for the reverse crossing.
     */
    Signal crossover(
            SignalFamily family,
            IndicatorPoint previous,
            IndicatorPoint latest,
            Function<IndicatorPoint, OptionalDouble> fastLine,
            Function<IndicatorPoint, OptionalDouble> slowLine,
            Diagnostics diagnostics
    ) {
        if (previous == null) {
            diagnostics.add(CauseCode.HISTORY_SHORT, OWNER, family.code() + " needs two points");
            return Signal.HOLD;
        }
        OptionalDouble prevFast = fastLine.apply(previous);
        OptionalDouble prevSlow = slowLine.apply(previous);
        OptionalDouble lastFast = fastLine.apply(latest);
        OptionalDouble lastSlow = slowLine.apply(latest);
        if (prevFast.isEmpty() || prevSlow.isEmpty() || lastFast.isEmpty() || lastSlow.isEmpty()) {
            diagnostics.add(CauseCode.UNDEFINED_INDICATOR, OWNER, family.code() + " date=" + latest.tradeDate);
            return Signal.HOLD;
        }
        if (prevFast.getAsDouble() < prevSlow.getAsDouble() && lastFast.getAsDouble() > lastSlow.getAsDouble()) {
            return Signal.BUY;
        }
        if (prevFast.getAsDouble() > prevSlow.getAsDouble() && lastFast.getAsDouble() < lastSlow.getAsDouble()) {
            return Signal.SELL;
        }
        return Signal.HOLD;
    }

    private Signal rsi(IndicatorPoint latest, SignalConfig cfg, Diagnostics diagnostics) {
        OptionalDouble value = latest.rsi(cfg.rsiPeriod);
        if (value.isEmpty()) {
            diagnostics.add(
                    CauseCode.UNDEFINED_INDICATOR,
                    OWNER,
                    String.format(Locale.US, "rsi%d date=%s", cfg.rsiPeriod, latest.tradeDate)
            );
            return Signal.HOLD;
        }
        double rsi = value.getAsDouble();
        if (rsi < cfg.rsiOversold) {
            return Signal.BUY;
        }
        if (rsi > cfg.rsiOverbought) {
            return Signal.SELL;
        }
        return Signal.HOLD;
    }

    private Signal bollinger(IndicatorPoint latest, Diagnostics diagnostics) {
        if (latest.bollingerUpper.isEmpty() || latest.bollingerLower.isEmpty() || !Double.isFinite(latest.close)) {
            diagnostics.add(CauseCode.UNDEFINED_INDICATOR, OWNER, "bollinger date=" + latest.tradeDate);
            return Signal.HOLD;
        }
        if (latest.close > latest.bollingerUpper.getAsDouble()) {
            return Signal.BUY;
        }
        if (latest.close < latest.bollingerLower.getAsDouble()) {
            return Signal.SELL;
        }
        return Signal.HOLD;
    }
}
