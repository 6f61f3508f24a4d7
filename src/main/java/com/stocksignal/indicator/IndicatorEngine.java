package com.stocksignal.indicator;

import com.stocksignal.model.Bar;
import com.stocksignal.model.IndicatorPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 模块说明：IndicatorEngine（class）。
 * 主要职责：把一只标的的日线序列转换为逐根对齐的技术指标序列（均线、MACD、RSI、KDJ、布林带、成交量均线）。
 * 使用建议：历史不足时对应位置为空值而不是抛异常；引擎无状态，可被多个线程共享。
 */
public final class IndicatorEngine {
    private static final Logger LOG = LogManager.getLogger(IndicatorEngine.class);

    public List<IndicatorPoint> compute(List<Bar> bars, IndicatorConfig config) {
        if (bars == null || bars.isEmpty()) {
            return List.of();
        }
        IndicatorConfig cfg = config == null ? IndicatorConfig.defaults() : config;

        int size = bars.size();
        double[] closes = new double[size];
        double[] highs = new double[size];
        double[] lows = new double[size];
        double[] volumes = new double[size];
        for (int i = 0; i < size; i++) {
            Bar bar = bars.get(i);
            closes[i] = bar.close;
            highs[i] = bar.high;
            lows[i] = bar.low;
            volumes[i] = bar.volume;
        }

        Map<Integer, double[]> ma = new LinkedHashMap<>();
        for (int period : cfg.maPeriods) {
            ma.put(period, rollingMean(closes, period));
        }

        double[] emaFast = ewm(closes, spanAlpha(cfg.macdFast));
        double[] emaSlow = ewm(closes, spanAlpha(cfg.macdSlow));
        double[] dif = new double[size];
        for (int i = 0; i < size; i++) {
            dif[i] = emaFast[i] - emaSlow[i];
        }
        double[] dea = ewm(dif, spanAlpha(cfg.macdSignal));
        double[] hist = new double[size];
        for (int i = 0; i < size; i++) {
            hist[i] = 2.0 * (dif[i] - dea[i]);
        }

        Map<Integer, double[]> rsi = new LinkedHashMap<>();
        double[] gains = new double[size];
        double[] losses = new double[size];
        for (int i = 1; i < size; i++) {
            double delta = closes[i] - closes[i - 1];
            gains[i] = delta > 0 ? delta : 0.0;
            losses[i] = delta < 0 ? -delta : 0.0;
        }
        for (int period : cfg.rsiPeriods) {
            rsi.put(period, rsi(gains, losses, period));
        }

        Kdj kdj = kdj(highs, lows, closes, cfg.kdjLength, cfg.kdjSignal);
        Bollinger band = bollinger(closes, cfg.bollingerLength, cfg.bollingerStd);

        Map<Integer, double[]> volumeMa = new LinkedHashMap<>();
        for (int period : cfg.volumeMaPeriods) {
            volumeMa.put(period, rollingMean(volumes, period));
        }

        List<IndicatorPoint> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(IndicatorPoint.builder()
                    .tradeDate(bars.get(i).tradeDate)
                    .close(closes[i])
                    .movingAverages(column(ma, i))
                    .macdDif(value(dif[i]))
                    .macdDea(value(dea[i]))
                    .macdHist(value(hist[i]))
                    .rsi(column(rsi, i))
                    .kdjK(value(kdj.k[i]))
                    .kdjD(value(kdj.d[i]))
                    .kdjJ(value(kdj.j[i]))
                    .bollingerUpper(value(band.upper[i]))
                    .bollingerMiddle(value(band.middle[i]))
                    .bollingerLower(value(band.lower[i]))
                    .volumeMovingAverages(column(volumeMa, i))
                    .build());
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("indicators computed code={} bars={} config={}", bars.get(0).code, size, cfg);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Mean of the trailing {@code period} values; NaN until the window is full.
     */
    static double[] rollingMean(double[] values, int period) {
        double[] out = nanArray(values.length);
        for (int i = period - 1; i < values.length; i++) {
            double sum = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                sum += values[j];
            }
            out[i] = sum / period;
        }
        return out;
    }

    /**
     * Recursive exponential smoothing without bias adjustment, seeded from the first defined
     * value. A missing input decays the previous weight and carries the last value forward.
     */
    static double[] ewm(double[] values, double alpha) {
        double[] out = nanArray(values.length);
        double decay = 1.0 - alpha;
        double weighted = Double.NaN;
        double oldWeight = 1.0;
        for (int i = 0; i < values.length; i++) {
            double cur = values[i];
            boolean observed = !Double.isNaN(cur);
            if (!Double.isNaN(weighted)) {
                oldWeight *= decay;
                if (observed) {
                    if (weighted != cur) {
                        weighted = (oldWeight * weighted + alpha * cur) / (oldWeight + alpha);
                    }
                    oldWeight = 1.0;
                }
            } else if (observed) {
                weighted = cur;
            }
            out[i] = weighted;
        }
        return out;
    }

    static double spanAlpha(int span) {
        return 2.0 / (span + 1.0);
    }

    private double[] rsi(double[] gains, double[] losses, int period) {
        double[] avgGain = rollingMean(gains, period);
        double[] avgLoss = rollingMean(losses, period);
        double[] out = nanArray(gains.length);
        for (int i = 0; i < gains.length; i++) {
            if (Double.isNaN(avgGain[i]) || Double.isNaN(avgLoss[i])) {
                continue;
            }
            if (avgLoss[i] == 0.0) {
                // no losses in the window: saturates high, flat windows included
                out[i] = 100.0;
            } else if (avgGain[i] == 0.0) {
                out[i] = 0.0;
            } else {
                double rs = avgGain[i] / avgLoss[i];
                out[i] = 100.0 - 100.0 / (1.0 + rs);
            }
        }
        return out;
    }

    private Kdj kdj(double[] highs, double[] lows, double[] closes, int length, int signal) {
        int size = closes.length;
        double[] rsv = nanArray(size);
        for (int i = length - 1; i < size; i++) {
            double highest = Double.NEGATIVE_INFINITY;
            double lowest = Double.POSITIVE_INFINITY;
            for (int j = i - length + 1; j <= i; j++) {
                highest = Math.max(highest, highs[j]);
                lowest = Math.min(lowest, lows[j]);
            }
            double range = highest - lowest;
            if (range > 0.0) {
                rsv[i] = (closes[i] - lowest) / range * 100.0;
            }
        }
        double alpha = 1.0 / signal;
        double[] k = ewm(rsv, alpha);
        double[] d = ewm(k, alpha);
        double[] j = new double[size];
        for (int i = 0; i < size; i++) {
            j[i] = 3.0 * k[i] - 2.0 * d[i];
        }
        return new Kdj(k, d, j);
    }

    private Bollinger bollinger(double[] closes, int period, double multiplier) {
        int size = closes.length;
        double[] middle = rollingMean(closes, period);
        double[] upper = nanArray(size);
        double[] lower = nanArray(size);
        if (period < 2) {
            return new Bollinger(upper, middle, lower);
        }
        for (int i = period - 1; i < size; i++) {
            double mean = middle[i];
            double sumSq = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double d = closes[j] - mean;
                sumSq += d * d;
            }
            double stdev = Math.sqrt(sumSq / (period - 1));
            upper[i] = mean + multiplier * stdev;
            lower[i] = mean - multiplier * stdev;
        }
        return new Bollinger(upper, middle, lower);
    }

    private static Map<Integer, OptionalDouble> column(Map<Integer, double[]> series, int index) {
        Map<Integer, OptionalDouble> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, double[]> e : series.entrySet()) {
            out.put(e.getKey(), value(e.getValue()[index]));
        }
        return Collections.unmodifiableMap(out);
    }

    private static OptionalDouble value(double raw) {
        return Double.isFinite(raw) ? OptionalDouble.of(raw) : OptionalDouble.empty();
    }

    private static double[] nanArray(int size) {
        double[] out = new double[size];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    private static final class Kdj {
        final double[] k;
        final double[] d;
        final double[] j;

        private Kdj(double[] k, double[] d, double[] j) {
            this.k = k;
            this.d = d;
            this.j = j;
        }
    }

    private static final class Bollinger {
        final double[] upper;
        final double[] middle;
        final double[] lower;

        private Bollinger(double[] upper, double[] middle, double[] lower) {
            this.upper = upper;
            this.middle = middle;
            this.lower = lower;
        }
    }
}
