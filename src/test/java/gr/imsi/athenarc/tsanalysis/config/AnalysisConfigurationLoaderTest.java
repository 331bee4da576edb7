package gr.imsi.athenarc.tsanalysis.config;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsanalysis.anomaly.AnomalyRuleType;
import gr.imsi.athenarc.tsanalysis.anomaly.ZeroVariancePolicy;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.forecast.ForecastMethodType;
import gr.imsi.athenarc.tsanalysis.resample.FillPolicy;
import gr.imsi.athenarc.tsanalysis.stats.WindowSpec;
import gr.imsi.athenarc.tsanalysis.store.DuplicatePolicy;

public class AnalysisConfigurationLoaderTest {

    @Test
    public void testBundledDefaultsMatchBuilderDefaults() {
        AnalysisConfiguration loaded = AnalysisConfigurationLoader.fromResource();
        AnalysisConfiguration defaults = AnalysisConfiguration.defaults();

        assertEquals(defaults.getWindowSize(), loaded.getWindowSize());
        assertEquals(20, loaded.getMinHistory());
        assertEquals(FillPolicy.NONE, loaded.getFillPolicy());
        assertEquals(AnomalyRuleType.Z_SCORE, loaded.getAnomalyRule());
        assertEquals(3.0, loaded.getAnomalyK());
        assertEquals(ZeroVariancePolicy.FLAG_ANY_DEVIATION, loaded.getZeroVariancePolicy());
        assertEquals(ForecastMethodType.DOUBLE_EXPONENTIAL_SMOOTHING, loaded.getForecastMethod());
        assertEquals(ForecastMethodType.NAIVE_LAST_VALUE, loaded.getFallbackMethod());
        assertEquals(10, loaded.getForecastMinHistory());
        assertEquals(DuplicatePolicy.REJECT, loaded.getDuplicatePolicy());
        assertArrayEquals(new double[]{0.25, 0.5, 0.75}, loaded.getQuantiles());
        assertNull(loaded.getSamplingInterval());
        assertFalse(loaded.isAllowOutOfOrder());
    }

    @Test
    public void testSeasonalResource() {
        AnalysisConfiguration config = AnalysisConfigurationLoader.fromResource("/seasonal-analysis.properties");

        assertEquals(12, config.getWindowSize());
        assertEquals(12, config.getMinHistory());
        assertEquals(FillPolicy.LINEAR_INTERPOLATE, config.getFillPolicy());
        assertEquals(SamplingInterval.of(Duration.ofHours(1)).toMillis(), config.getSamplingInterval().toMillis());
        assertEquals(AnomalyRuleType.RESIDUAL, config.getAnomalyRule());
        assertEquals(4.0, config.getAnomalyK());
        assertEquals(6, config.getSeasonalPeriod());
        assertEquals(ForecastMethodType.HOLT_WINTERS_ADDITIVE, config.getForecastMethod());
        assertEquals(ForecastMethodType.NAIVE_MEAN, config.getFallbackMethod());
        assertEquals(12, config.getForecastMinHistory());
        assertEquals(6, config.getForecastHorizon());
    }

    @Test
    public void testMissingResource() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfigurationLoader.fromResource("/nope.properties"));
    }

    @Test
    public void testInvalidValueNamesKey() {
        Properties properties = new Properties();
        properties.setProperty("anomalyK", "-2");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> AnalysisConfigurationLoader.fromProperties(properties));
        assertTrue(e.getMessage().contains("anomalyK"), e.getMessage());

        Properties badEnum = new Properties();
        badEnum.setProperty("fillPolicy", "sideways");
        e = assertThrows(IllegalArgumentException.class, () -> AnalysisConfigurationLoader.fromProperties(badEnum));
        assertTrue(e.getMessage().contains("fillPolicy"), e.getMessage());

        Properties subMillisecond = new Properties();
        subMillisecond.setProperty("samplingInterval", "PT0.0005S");
        e = assertThrows(IllegalArgumentException.class, () -> AnalysisConfigurationLoader.fromProperties(subMillisecond));
        assertTrue(e.getMessage().contains("samplingInterval"), e.getMessage());

        Properties badBoolean = new Properties();
        badBoolean.setProperty("allowOutOfOrder", "yes");
        e = assertThrows(IllegalArgumentException.class, () -> AnalysisConfigurationLoader.fromProperties(badBoolean));
        assertTrue(e.getMessage().contains("allowOutOfOrder"), e.getMessage());
    }

    @Test
    public void testLenientParsing() {
        Properties properties = new Properties();
        properties.setProperty("windowDuration", "30m");
        properties.setProperty("quantiles", " 0.1, 0.9 ,");
        properties.setProperty("duplicatePolicy", "keep-last");
        properties.setProperty("somethingElse", "ignored");

        AnalysisConfiguration config = AnalysisConfigurationLoader.fromProperties(properties);
        assertArrayEquals(new double[]{0.1, 0.9}, config.getQuantiles());
        assertEquals(DuplicatePolicy.KEEP_LAST, config.getDuplicatePolicy());
        WindowSpec window = config.getWindowSpec();
        assertFalse(window.isCountBased());
        assertEquals(Duration.ofMinutes(30), window.getDuration());
    }

    @Test
    public void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisConfiguration.builder().forecastMethod(ForecastMethodType.HOLT_WINTERS_ADDITIVE).build());
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisConfiguration.builder().fallbackMethod(ForecastMethodType.DOUBLE_EXPONENTIAL_SMOOTHING).build());
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfiguration.builder().windowSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfiguration.builder().quantiles(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfiguration.builder().confidenceLevel(1.0).build());

        AnalysisConfiguration config = AnalysisConfiguration.builder()
                .seasonalPeriod(4)
                .forecastMethod(ForecastMethodType.HOLT_WINTERS_ADDITIVE)
                .build();
        assertEquals(8, config.getForecastMinHistory());
        assertTrue(config.getWindowSpec().isCountBased());
    }
}
