package com.stocksignal.strategy;

import com.stocksignal.config.Config;
import com.stocksignal.core.diagnostics.CauseCode;
import com.stocksignal.core.diagnostics.Diagnostics;
import com.stocksignal.indicator.IndicatorConfig;
import com.stocksignal.indicator.IndicatorEngine;
import com.stocksignal.model.AnalysisResult;
import com.stocksignal.model.Bar;
import com.stocksignal.model.IndicatorPoint;
import com.stocksignal.model.Signal;
import com.stocksignal.model.SignalFamily;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：TechnicalAnalyzer（class）。
 * 主要职责：单只标的的完整流水线：日线 -> 指标 -> 信号 -> 评分结果；并可按历史逐日回放生成评级序列。
 * 使用建议：不持有跨调用状态，不同标的可并发调用。
 */
public final class TechnicalAnalyzer {
    public static final String DEFAULT_STRATEGY = "traditional_technical_analysis";

    private static final Logger LOG = LogManager.getLogger(TechnicalAnalyzer.class);

    private final String strategy;
    private final IndicatorConfig indicatorConfig;
    private final SignalConfig signalConfig;
    private final IndicatorEngine indicatorEngine;
    private final SignalEngine signalEngine;
    private final ScoringEngine scoringEngine;
    private final int lookbackBars;

    public TechnicalAnalyzer(
            String strategy,
            IndicatorConfig indicatorConfig,
            SignalConfig signalConfig,
            ScoringConfig scoringConfig,
            int lookbackBars
    ) {
        this.strategy = strategy == null || strategy.trim().isEmpty() ? DEFAULT_STRATEGY : strategy.trim();
        this.signalConfig = signalConfig == null ? SignalConfig.defaults() : signalConfig;
        IndicatorConfig baseIndicators = indicatorConfig == null ? IndicatorConfig.defaults() : indicatorConfig;
        this.indicatorConfig = baseIndicators.withRequiredPeriods(
                List.of(this.signalConfig.maShort, this.signalConfig.maLong),
                List.of(this.signalConfig.rsiPeriod)
        );
        this.indicatorEngine = new IndicatorEngine();
        this.signalEngine = new SignalEngine();
        this.scoringEngine = new ScoringEngine(scoringConfig);
        int minHistory = this.scoringEngine.config().minHistoryBars;
        if (lookbackBars < minHistory) {
            throw new IllegalArgumentException("analysis.lookback_bars must be >= " + minHistory + ": " + lookbackBars);
        }
        this.lookbackBars = lookbackBars;
    }

    public static TechnicalAnalyzer withDefaults() {
        return new TechnicalAnalyzer(DEFAULT_STRATEGY, null, null, null, 250);
    }

    public static TechnicalAnalyzer fromConfig(Config config) {
        return new TechnicalAnalyzer(
                config.getString("analysis.strategy", DEFAULT_STRATEGY),
                IndicatorConfig.fromConfig(config),
                SignalConfig.fromConfig(config),
                ScoringConfig.fromConfig(config),
                config.getInt("analysis.lookback_bars", 250)
        );
    }

    public String strategy() {
        return strategy;
    }

    public IndicatorConfig indicatorConfig() {
        return indicatorConfig;
    }

    /**
     * Rates the last bar of {@code window}.
     *
     * @throws InsufficientHistoryException when the window is shorter than the scoring minimum
     */
    public AnalysisResult analyze(List<Bar> window, Diagnostics sink) {
        scoringEngine.requireHistory(window);
        List<IndicatorPoint> points = indicatorEngine.compute(window, indicatorConfig);
        Map<SignalFamily, Signal> signals = signalEngine.evaluate(points, signalConfig, sink);
        AnalysisResult result = scoringEngine.score(strategy, window, signals);
        if (LOG.isDebugEnabled()) {
            LOG.debug("analyzed code={} date={} rating={} score={} risk={}",
                    result.code, result.analysisDate, result.rating.code(), result.score, result.riskLevel.code());
        }
        return result;
    }

    /**
     * One result per bar dated within [from, to], each computed from at most
     * {@code lookbackBars} trailing bars ending at that date. Dates without enough history are
     * reported to {@code sink} and skipped.
     */
    public List<AnalysisResult> replay(List<Bar> history, LocalDate from, LocalDate to, Diagnostics sink) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        Diagnostics diagnostics = sink == null ? new Diagnostics() : sink;
        int minHistory = scoringEngine.config().minHistoryBars;
        List<AnalysisResult> out = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < history.size(); i++) {
            Bar bar = history.get(i);
            if ((from != null && bar.tradeDate.isBefore(from)) || (to != null && bar.tradeDate.isAfter(to))) {
                continue;
            }
            if (i + 1 < minHistory) {
                diagnostics.add(CauseCode.HISTORY_SHORT, bar.code, "date=" + bar.tradeDate + " bars=" + (i + 1));
                skipped++;
                continue;
            }
            int start = Math.max(0, i + 1 - lookbackBars);
            out.add(analyze(history.subList(start, i + 1), diagnostics));
        }
        LOG.info("replay finished code={} strategy={} results={} skipped={}",
                history.get(0).code, strategy, out.size(), skipped);
        return Collections.unmodifiableList(out);
    }
}
