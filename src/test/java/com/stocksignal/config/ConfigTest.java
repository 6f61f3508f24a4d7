package com.stocksignal.config;

import com.stocksignal.backtest.EvaluationConfig;
import com.stocksignal.strategy.ScoringConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigTest {

    @Test
    void defaultsOnly_shouldExposeBuiltInValues() {
        Config config = Config.defaultsOnly();

        assertEquals(50, config.getInt("score.baseline", -1));
        assertEquals(List.of(6, 12, 24), config.getIntList("indicator.rsi_periods", List.of()));
        assertEquals(0.03, config.getDouble("evaluation.risk_free_rate", 0.0), 0.0);
        assertEquals("default", config.sourceOf("score.baseline"));
        assertEquals("fallback", config.getString("unknown.key", "fallback"));
    }

    @Test
    void fromMap_shouldOverrideDefaults() {
        Config config = Config.fromMap(Map.of(
                "indicator.ma_periods", List.of(3, 7),
                "score.buy_threshold", 80,
                "evaluation.risk_free_rate", "0.02"
        ));

        assertEquals(List.of(3, 7), config.getIntList("indicator.ma_periods", List.of()));
        assertEquals("override", config.sourceOf("score.buy_threshold"));
        assertEquals(80, ScoringConfig.fromConfig(config).buyThreshold);
        assertEquals(0.02, EvaluationConfig.fromConfig(config).riskFreeRate, 0.0);
    }

    @Test
    void getIntList_shouldRejectMalformedTokens() {
        Config config = Config.fromMap(Map.of("indicator.ma_periods", "5,ten,20"));
        assertThrows(IllegalArgumentException.class, () -> config.getIntList("indicator.ma_periods", List.of()));
    }

    @Test
    void typedGetters_shouldFallBackOnBadValues() {
        Config config = Config.fromMap(Map.of("a.int", "x", "a.bool", "yes", "a.long", "12"));

        assertEquals(7, config.getInt("a.int", 7));
        assertEquals(true, config.getBoolean("a.bool", false));
        assertEquals(12L, config.getLong("a.long", 0L));
    }

    @Test
    void load_shouldLayerOverrideFileOnClasspathProperties(@TempDir Path dir) throws IOException {
        Path override = dir.resolve("local.properties");
        Files.writeString(override, "score.sell_threshold=20\nanalysis.strategy=custom\n");

        Config config = Config.load(override);

        assertEquals(20, config.getInt("score.sell_threshold", -1));
        assertEquals("override", config.sourceOf("score.sell_threshold"));
        assertEquals("resource", config.sourceOf("score.baseline"));
        assertEquals("custom", config.getString("analysis.strategy"));
    }

    @Test
    void load_shouldIgnoreMissingOverrideFile(@TempDir Path dir) {
        Config config = Config.load(dir.resolve("absent.properties"));
        assertEquals(70, config.getInt("score.buy_threshold", -1));
    }
}
