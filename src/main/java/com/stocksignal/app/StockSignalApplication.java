package com.stocksignal.app;

import com.stocksignal.backtest.EvaluationConfig;
import com.stocksignal.backtest.PerformanceEvaluation;
import com.stocksignal.backtest.PerformanceEvaluator;
import com.stocksignal.config.Config;
import com.stocksignal.core.diagnostics.Diagnostics;
import com.stocksignal.data.BarSource;
import com.stocksignal.data.CsvBarSource;
import com.stocksignal.indicator.IndicatorConfig;
import com.stocksignal.model.AnalysisResult;
import com.stocksignal.model.Bar;
import com.stocksignal.strategy.ScoringConfig;
import com.stocksignal.strategy.SignalConfig;
import com.stocksignal.strategy.TechnicalAnalyzer;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry: replays the technical analysis over a window of CSV bars and evaluates the
 * resulting ratings.
 */
public final class StockSignalApplication {
    private static final Logger LOG = LogManager.getLogger(StockSignalApplication.class);
    private static final String COMMAND = "stock-signal";

    public static void main(String[] args) {
        int exit = new StockSignalApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp(COMMAND, options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }
        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp(COMMAND, options);
            return 0;
        }

        String[] missing = missingRequired(cmd);
        if (missing.length > 0) {
            new HelpFormatter().printHelp(COMMAND, options);
            System.err.println("ERROR: missing required option(s): " + String.join(", ", missing));
            return 2;
        }

        LocalDate start;
        LocalDate end;
        try {
            start = LocalDate.parse(cmd.getOptionValue("start").trim());
            end = LocalDate.parse(cmd.getOptionValue("end").trim());
        } catch (DateTimeParseException e) {
            System.err.println("ERROR: dates must be yyyy-MM-dd: " + e.getParsedString());
            return 2;
        }
        if (end.isBefore(start)) {
            System.err.println("ERROR: --end must not be before --start.");
            return 2;
        }

        List<String> codes = parseCodes(cmd.getOptionValue("codes"));
        if (codes.isEmpty()) {
            System.err.println("ERROR: --codes must name at least one instrument.");
            return 2;
        }

        Config config = Config.load(cmd.hasOption("config") ? Path.of(cmd.getOptionValue("config")) : null);
        TechnicalAnalyzer analyzer;
        PerformanceEvaluator evaluator;
        try {
            String strategy = cmd.hasOption("strategy")
                    ? cmd.getOptionValue("strategy")
                    : config.getString("analysis.strategy", TechnicalAnalyzer.DEFAULT_STRATEGY);
            analyzer = new TechnicalAnalyzer(
                    strategy,
                    IndicatorConfig.fromConfig(config),
                    SignalConfig.fromConfig(config),
                    ScoringConfig.fromConfig(config),
                    config.getInt("analysis.lookback_bars", 250)
            );
            evaluator = new PerformanceEvaluator(EvaluationConfig.fromConfig(config));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: invalid configuration: " + e.getMessage());
            return 2;
        }

        BarSource source = new CsvBarSource(Path.of(cmd.getOptionValue("data-dir")));
        if (!source.healthCheck()) {
            System.err.println("ERROR: data directory is not readable: " + cmd.getOptionValue("data-dir"));
            return 2;
        }

        try {
            return runAnalysis(analyzer, evaluator, source, codes, start, end);
        } catch (RuntimeException e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int runAnalysis(
            TechnicalAnalyzer analyzer,
            PerformanceEvaluator evaluator,
            BarSource source,
            List<String> codes,
            LocalDate start,
            LocalDate end
    ) {
        Diagnostics diagnostics = new Diagnostics();
        List<AnalysisResult> results = new ArrayList<>();
        Map<String, List<Bar>> barsByCode = new LinkedHashMap<>();
        int fetchFailures = 0;

        for (String code : codes) {
            List<Bar> history;
            try {
                // Bars before the window warm up the indicators.
                history = source.fetchBars(code, null, end);
            } catch (IOException e) {
                fetchFailures++;
                LOG.warn("fetch failed code={} error={}", code, e.getMessage());
                continue;
            }
            barsByCode.put(code, history);
            for (AnalysisResult result : analyzer.replay(history, start, end, diagnostics)) {
                results.add(result);
                LOG.info(formatResult(result));
            }
        }

        if (!diagnostics.isEmpty()) {
            LOG.info("diagnostics entries={}", diagnostics.entries().size());
            for (String note : diagnostics.notes()) {
                LOG.debug(note);
            }
        }

        PerformanceEvaluation evaluation = evaluator.evaluate(analyzer.strategy(), start, end, results, barsByCode);
        LOG.info(evaluator.toSummaryText(evaluation.record));
        if (!evaluation.skippedInstruments.isEmpty()) {
            LOG.info("evaluation skipped instruments={}", evaluation.skippedInstruments);
        }
        if (fetchFailures > 0) {
            LOG.warn("fetch failures={} of {} codes", fetchFailures, codes.size());
        }
        return 0;
    }

    static String formatResult(AnalysisResult result) {
        return String.format(
                Locale.US,
                "RESULT code=%s date=%s strategy=%s rating=%s score=%d risk=%s expected_return=%.4f",
                result.code,
                result.analysisDate,
                result.strategy,
                result.rating.code(),
                result.score,
                result.riskLevel.code(),
                result.expectedReturn
        );
    }

    static List<String> parseCodes(String raw) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        if (raw == null) {
            return new ArrayList<>();
        }
        for (String token : raw.split(",")) {
            String code = token.trim();
            if (!code.isEmpty()) {
                out.add(code);
            }
        }
        return new ArrayList<>(out);
    }

    private String[] missingRequired(CommandLine cmd) {
        List<String> missing = new ArrayList<>();
        for (String name : new String[]{"data-dir", "codes", "start", "end"}) {
            String value = cmd.getOptionValue(name);
            if (value == null || value.trim().isEmpty()) {
                missing.add("--" + name);
            }
        }
        return missing.toArray(new String[0]);
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        options.addOption(Option.builder().longOpt("data-dir").hasArg().argName("dir")
                .desc("Directory holding <code>.csv daily bar files").build());
        options.addOption(Option.builder().longOpt("codes").hasArg().argName("list")
                .desc("Comma separated instrument codes").build());
        options.addOption(Option.builder().longOpt("start").hasArg().argName("yyyy-MM-dd")
                .desc("First analysis date").build());
        options.addOption(Option.builder().longOpt("end").hasArg().argName("yyyy-MM-dd")
                .desc("Last analysis date").build());
        options.addOption(Option.builder().longOpt("strategy").hasArg().argName("id")
                .desc("Strategy id recorded on results").build());
        options.addOption(Option.builder().longOpt("config").hasArg().argName("file")
                .desc("Properties file overriding config.properties").build());
        return options;
    }
}
