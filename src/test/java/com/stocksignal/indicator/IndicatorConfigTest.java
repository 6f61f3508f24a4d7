package com.stocksignal.indicator;

import com.stocksignal.config.Config;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IndicatorConfigTest {

    @Test
    void defaults_shouldMatchConventionalWindows() {
        IndicatorConfig config = IndicatorConfig.defaults();

        assertEquals(List.of(5, 10, 20, 60, 120, 250), config.maPeriods);
        assertEquals(12, config.macdFast);
        assertEquals(26, config.macdSlow);
        assertEquals(9, config.macdSignal);
        assertEquals(List.of(6, 12, 24), config.rsiPeriods);
        assertEquals(9, config.kdjLength);
        assertEquals(3, config.kdjSignal);
        assertEquals(20, config.bollingerLength);
        assertEquals(2.0, config.bollingerStd, 0.0);
        assertEquals(List.of(5, 10, 20), config.volumeMaPeriods);
    }

    @Test
    void builder_shouldSortAndDeduplicatePeriods() {
        IndicatorConfig config = IndicatorConfig.builder().maPeriods(List.of(20, 5, 20, 10)).build();
        assertEquals(List.of(5, 10, 20), config.maPeriods);
    }

    @Test
    void builder_shouldRejectInvalidWindows() {
        assertThrows(IllegalArgumentException.class, () -> IndicatorConfig.builder().maPeriods(List.of(5, 0)).build());
        assertThrows(IllegalArgumentException.class, () -> IndicatorConfig.builder().macdFast(26).macdSlow(12).build());
        assertThrows(IllegalArgumentException.class, () -> IndicatorConfig.builder().bollingerStd(0.0).build());
        assertThrows(IllegalArgumentException.class, () -> IndicatorConfig.builder().kdjSignal(0).build());
    }

    @Test
    void withRequiredPeriods_shouldAddMissingWindowsOnly() {
        IndicatorConfig config = IndicatorConfig.defaults().withRequiredPeriods(List.of(5, 30), List.of(14));

        assertEquals(List.of(5, 10, 20, 30, 60, 120, 250), config.maPeriods);
        assertEquals(List.of(6, 12, 14, 24), config.rsiPeriods);
        assertEquals(12, config.macdFast);
    }

    @Test
    void fromConfig_shouldReadOverrides() {
        Config config = Config.fromMap(Map.of(
                "indicator.ma_periods", List.of(3, 8),
                "indicator.macd.fast", 6,
                "indicator.bollinger.std", "2.5"
        ));
        IndicatorConfig indicators = IndicatorConfig.fromConfig(config);

        assertEquals(List.of(3, 8), indicators.maPeriods);
        assertEquals(6, indicators.macdFast);
        assertEquals(26, indicators.macdSlow);
        assertEquals(2.5, indicators.bollingerStd, 0.0);
    }
}
