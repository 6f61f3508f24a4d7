package com.stocksignal.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：分层读取 properties（内置默认值 -> classpath config.properties -> 本地覆盖文件），
 * 为各组件的强类型配置提供原始取值。
 * 使用建议：组件不直接持有 Config，而是通过 XxxConfig.fromConfig(config) 在构造时一次性校验。
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();

    private Config() {
    }

    public static Config load(Path overrideFile) {
        Config config = new Config();

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        if (overrideFile != null && Files.exists(overrideFile)) {
            try (InputStream in = Files.newInputStream(overrideFile)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", overrideFile, e.getMessage());
            }
        }
        return config;
    }

    public static Config defaultsOnly() {
        return new Config();
    }

    /**
     * Builds a Config from explicit key/value overrides on top of the built-in defaults.
     */
    public static Config fromMap(Map<String, ?> values) {
        Config config = new Config();
        if (values == null) {
            return config;
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = entry.getKey() == null ? "" : entry.getKey().trim();
            if (key.isEmpty()) {
                continue;
            }
            String value = entry.getValue() == null ? "" : stringify(entry.getValue());
            config.overrideProps.setProperty(key, value);
            config.props.setProperty(key, value);
        }
        return config;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Comma separated integers. A malformed token fails loudly: a silently dropped window
     * would change every indicator downstream.
     */
    public List<Integer> getIntList(String key, List<Integer> fallback) {
        List<String> tokens = getList(key);
        if (tokens.isEmpty()) {
            return fallback;
        }
        List<Integer> out = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            try {
                out.add(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid integer in " + key + ": " + token, e);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static String stringify(Object value) {
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>(list.size());
            for (Object item : list) {
                parts.add(String.valueOf(item));
            }
            return String.join(",", parts);
        }
        return String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("indicator.ma_periods", "5,10,20,60,120,250");
        defaults.put("indicator.macd.fast", "12");
        defaults.put("indicator.macd.slow", "26");
        defaults.put("indicator.macd.signal", "9");
        defaults.put("indicator.rsi_periods", "6,12,24");
        defaults.put("indicator.kdj.length", "9");
        defaults.put("indicator.kdj.signal", "3");
        defaults.put("indicator.bollinger.length", "20");
        defaults.put("indicator.bollinger.std", "2");
        defaults.put("indicator.volume_ma_periods", "5,10,20");

        defaults.put("signal.ma.short", "5");
        defaults.put("signal.ma.long", "20");
        defaults.put("signal.rsi.period", "14");
        defaults.put("signal.rsi.oversold", "30");
        defaults.put("signal.rsi.overbought", "70");

        defaults.put("score.baseline", "50");
        defaults.put("score.weight.macd", "25");
        defaults.put("score.weight.rsi", "20");
        defaults.put("score.weight.kdj", "20");
        defaults.put("score.weight.bollinger", "15");
        defaults.put("score.weight.ma", "20");
        defaults.put("score.buy_threshold", "70");
        defaults.put("score.sell_threshold", "30");
        defaults.put("score.min_history_bars", "26");
        defaults.put("score.risk.low_volatility", "0.2");
        defaults.put("score.risk.medium_volatility", "0.4");
        defaults.put("score.expected_return_window", "30");
        defaults.put("score.trading_days", "252");

        defaults.put("analysis.strategy", "traditional_technical_analysis");
        defaults.put("analysis.lookback_bars", "250");

        defaults.put("evaluation.risk_free_rate", "0.03");
        defaults.put("evaluation.trading_days", "252");
        defaults.put("evaluation.calendar_days", "365");

        return Collections.unmodifiableMap(defaults);
    }
}
