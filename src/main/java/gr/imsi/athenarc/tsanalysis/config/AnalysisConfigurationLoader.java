package gr.imsi.athenarc.tsanalysis.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

import gr.imsi.athenarc.tsanalysis.anomaly.AnomalyRuleType;
import gr.imsi.athenarc.tsanalysis.anomaly.ZeroVariancePolicy;
import gr.imsi.athenarc.tsanalysis.domain.DateTimeUtil;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.forecast.ForecastMethodType;
import gr.imsi.athenarc.tsanalysis.resample.BucketAggregation;
import gr.imsi.athenarc.tsanalysis.resample.FillPolicy;
import gr.imsi.athenarc.tsanalysis.stats.StatisticsMode;
import gr.imsi.athenarc.tsanalysis.store.DuplicatePolicy;

/**
 * Reads an {@link AnalysisConfiguration} from {@code .properties} entries. Keys are the configuration
 * setting names; absent keys keep their defaults. Durations accept {@code 500ms}, {@code 15m},
 * {@code 2h}, {@code 1d} or ISO-8601.
 */
public class AnalysisConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigurationLoader.class);

    public static final String DEFAULT_RESOURCE = "/analysis.properties";

    private AnalysisConfigurationLoader() {
    }

    /**
     * Loads the configuration from {@link #DEFAULT_RESOURCE} on the classpath.
     */
    public static AnalysisConfiguration fromResource() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static AnalysisConfiguration fromResource(String resource) {
        Properties properties = new Properties();
        try (InputStream input = AnalysisConfigurationLoader.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalArgumentException("Unable to find " + resource + " in resources");
            }
            properties.load(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        LOG.info("Loaded {} settings from {}", properties.size(), resource);
        return fromProperties(properties);
    }

    /**
     * @throws IllegalArgumentException naming the key of the first malformed or out-of-range value
     */
    public static AnalysisConfiguration fromProperties(Properties properties) {
        AnalysisConfiguration.Builder builder = AnalysisConfiguration.builder();
        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key).trim();
            try {
                apply(builder, key, value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value '" + value + "' for " + key + ": " + e.getMessage(), e);
            }
        }
        AnalysisConfiguration configuration = builder.build();
        LOG.debug("Configuration {}", configuration);
        return configuration;
    }

    private static void apply(AnalysisConfiguration.Builder builder, String key, String value) {
        switch (key) {
            case "windowSize":
                builder.windowSize(Integer.parseInt(value));
                break;
            case "windowDuration":
                builder.windowDuration(DateTimeUtil.parseDuration(value));
                break;
            case "fillPolicy":
                builder.fillPolicy(parseEnum(value, FillPolicy::valueOf));
                break;
            case "bucketAggregation":
                builder.bucketAggregation(parseEnum(value, BucketAggregation::valueOf));
                break;
            case "maxFillGap":
                builder.maxFillGap(Integer.parseInt(value));
                break;
            case "samplingInterval":
                builder.samplingInterval(SamplingInterval.of(DateTimeUtil.parseDuration(value)));
                break;
            case "statisticsMode":
                builder.statisticsMode(parseEnum(value, StatisticsMode::valueOf));
                break;
            case "quantiles":
                builder.quantiles(Splitter.on(',').trimResults().omitEmptyStrings().splitToStream(value)
                        .mapToDouble(Double::parseDouble).toArray());
                break;
            case "anomalyRule":
                builder.anomalyRule(parseEnum(value, AnomalyRuleType::valueOf));
                break;
            case "anomalyK":
                builder.anomalyK(Double.parseDouble(value));
                break;
            case "zeroVariancePolicy":
                builder.zeroVariancePolicy(parseEnum(value, ZeroVariancePolicy::valueOf));
                break;
            case "imputedConfidence":
                builder.imputedConfidence(Double.parseDouble(value));
                break;
            case "minHistory":
                builder.minHistory(Integer.parseInt(value));
                break;
            case "seasonalPeriod":
                builder.seasonalPeriod(Integer.parseInt(value));
                break;
            case "forecastMethod":
                builder.forecastMethod(parseEnum(value, ForecastMethodType::valueOf));
                break;
            case "fallbackMethod":
                builder.fallbackMethod(parseEnum(value, ForecastMethodType::valueOf));
                break;
            case "confidenceLevel":
                builder.confidenceLevel(Double.parseDouble(value));
                break;
            case "forecastMinHistory":
                builder.forecastMinHistory(Integer.parseInt(value));
                break;
            case "forecastHorizon":
                builder.forecastHorizon(Integer.parseInt(value));
                break;
            case "maxEvaluations":
                builder.maxEvaluations(Integer.parseInt(value));
                break;
            case "duplicatePolicy":
                builder.duplicatePolicy(parseEnum(value, DuplicatePolicy::valueOf));
                break;
            case "allowOutOfOrder":
                builder.allowOutOfOrder(parseBoolean(value));
                break;
            default:
                LOG.warn("Ignoring unknown setting {}", key);
        }
    }

    private static <E extends Enum<E>> E parseEnum(String value, Function<String, E> valueOf) {
        return valueOf.apply(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    private static boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Expected true or false");
    }
}
