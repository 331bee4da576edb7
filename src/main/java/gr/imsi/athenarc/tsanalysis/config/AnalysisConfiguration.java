package gr.imsi.athenarc.tsanalysis.config;

import java.time.Duration;
import java.util.Arrays;

import org.jetbrains.annotations.Nullable;

import gr.imsi.athenarc.tsanalysis.anomaly.AnomalyRuleType;
import gr.imsi.athenarc.tsanalysis.anomaly.ZeroVariancePolicy;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.forecast.ForecastMethodType;
import gr.imsi.athenarc.tsanalysis.resample.BucketAggregation;
import gr.imsi.athenarc.tsanalysis.resample.FillPolicy;
import gr.imsi.athenarc.tsanalysis.stats.StatisticsMode;
import gr.imsi.athenarc.tsanalysis.stats.WindowSpec;
import gr.imsi.athenarc.tsanalysis.store.DuplicatePolicy;

/**
 * Settings of one analysis pipeline. Immutable; create it with {@link #builder()} or load it with
 * {@link AnalysisConfigurationLoader}.
 */
public class AnalysisConfiguration {

    private int windowSize;
    @Nullable
    private Duration windowDuration;
    private FillPolicy fillPolicy;
    private BucketAggregation bucketAggregation;
    private int maxFillGap;
    @Nullable
    private SamplingInterval samplingInterval;
    private StatisticsMode statisticsMode;
    private double[] quantiles;
    private AnomalyRuleType anomalyRule;
    private double anomalyK;
    private ZeroVariancePolicy zeroVariancePolicy;
    private double imputedConfidence;
    private int minHistory;
    private int seasonalPeriod;
    private ForecastMethodType forecastMethod;
    private ForecastMethodType fallbackMethod;
    private double confidenceLevel;
    private int forecastMinHistory;
    private int forecastHorizon;
    private int maxEvaluations;
    private DuplicatePolicy duplicatePolicy;
    private boolean allowOutOfOrder;

    private AnalysisConfiguration() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a configuration holding every default.
     */
    public static AnalysisConfiguration defaults() {
        return builder().build();
    }

    public static class Builder {
        private int windowSize = 20;
        private Duration windowDuration;
        private FillPolicy fillPolicy = FillPolicy.NONE;
        private BucketAggregation bucketAggregation = BucketAggregation.MEAN;
        private int maxFillGap = 0;
        private SamplingInterval samplingInterval;
        private StatisticsMode statisticsMode = StatisticsMode.RAW;
        private double[] quantiles = {0.25, 0.5, 0.75};
        private AnomalyRuleType anomalyRule = AnomalyRuleType.Z_SCORE;
        private double anomalyK = 3.0;
        private ZeroVariancePolicy zeroVariancePolicy = ZeroVariancePolicy.FLAG_ANY_DEVIATION;
        private double imputedConfidence = 0.5;
        private Integer minHistory;
        private int seasonalPeriod = 0;
        private ForecastMethodType forecastMethod = ForecastMethodType.DOUBLE_EXPONENTIAL_SMOOTHING;
        private ForecastMethodType fallbackMethod = ForecastMethodType.NAIVE_LAST_VALUE;
        private double confidenceLevel = 0.95;
        private Integer forecastMinHistory;
        private int forecastHorizon = 10;
        private int maxEvaluations = 2000;
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.REJECT;
        private boolean allowOutOfOrder = false;

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        /**
         * Switches the rolling window from a slot count to a time span.
         */
        public Builder windowDuration(Duration windowDuration) {
            this.windowDuration = windowDuration;
            return this;
        }

        public Builder fillPolicy(FillPolicy fillPolicy) {
            this.fillPolicy = fillPolicy;
            return this;
        }

        public Builder bucketAggregation(BucketAggregation bucketAggregation) {
            this.bucketAggregation = bucketAggregation;
            return this;
        }

        public Builder maxFillGap(int maxFillGap) {
            this.maxFillGap = maxFillGap;
            return this;
        }

        /**
         * Sets the resampling grid step. When unset the median spacing of each series is used.
         */
        public Builder samplingInterval(SamplingInterval samplingInterval) {
            this.samplingInterval = samplingInterval;
            return this;
        }

        public Builder statisticsMode(StatisticsMode statisticsMode) {
            this.statisticsMode = statisticsMode;
            return this;
        }

        public Builder quantiles(double... quantiles) {
            this.quantiles = quantiles.clone();
            return this;
        }

        public Builder anomalyRule(AnomalyRuleType anomalyRule) {
            this.anomalyRule = anomalyRule;
            return this;
        }

        public Builder anomalyK(double anomalyK) {
            this.anomalyK = anomalyK;
            return this;
        }

        public Builder zeroVariancePolicy(ZeroVariancePolicy zeroVariancePolicy) {
            this.zeroVariancePolicy = zeroVariancePolicy;
            return this;
        }

        public Builder imputedConfidence(double imputedConfidence) {
            this.imputedConfidence = imputedConfidence;
            return this;
        }

        public Builder minHistory(int minHistory) {
            this.minHistory = minHistory;
            return this;
        }

        public Builder seasonalPeriod(int seasonalPeriod) {
            this.seasonalPeriod = seasonalPeriod;
            return this;
        }

        public Builder forecastMethod(ForecastMethodType forecastMethod) {
            this.forecastMethod = forecastMethod;
            return this;
        }

        public Builder fallbackMethod(ForecastMethodType fallbackMethod) {
            this.fallbackMethod = fallbackMethod;
            return this;
        }

        public Builder confidenceLevel(double confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
            return this;
        }

        public Builder forecastMinHistory(int forecastMinHistory) {
            this.forecastMinHistory = forecastMinHistory;
            return this;
        }

        public Builder forecastHorizon(int forecastHorizon) {
            this.forecastHorizon = forecastHorizon;
            return this;
        }

        public Builder maxEvaluations(int maxEvaluations) {
            this.maxEvaluations = maxEvaluations;
            return this;
        }

        public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public Builder allowOutOfOrder(boolean allowOutOfOrder) {
            this.allowOutOfOrder = allowOutOfOrder;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a setting is out of range
         */
        public AnalysisConfiguration build() {
            require(windowSize >= 1, "windowSize must be at least 1, got " + windowSize);
            require(windowDuration == null || (!windowDuration.isNegative() && !windowDuration.isZero()),
                    "windowDuration must be positive, got " + windowDuration);
            require(fillPolicy != null && bucketAggregation != null && statisticsMode != null && anomalyRule != null
                    && zeroVariancePolicy != null && forecastMethod != null && fallbackMethod != null
                    && duplicatePolicy != null, "Enumerated settings must not be null");
            require(maxFillGap >= 0, "maxFillGap must not be negative, got " + maxFillGap);
            for (double p : quantiles) {
                require(p >= 0.0 && p <= 1.0, "quantiles must lie in [0, 1], got " + p);
            }
            require(anomalyK > 0 && !Double.isInfinite(anomalyK), "anomalyK must be a positive number, got " + anomalyK);
            require(imputedConfidence > 0.0 && imputedConfidence <= 1.0,
                    "imputedConfidence must be in (0, 1], got " + imputedConfidence);
            require(minHistory == null || minHistory >= 0, "minHistory must not be negative, got " + minHistory);
            require(seasonalPeriod >= 0, "seasonalPeriod must not be negative, got " + seasonalPeriod);
            require(forecastMethod != ForecastMethodType.HOLT_WINTERS_ADDITIVE || seasonalPeriod >= 2,
                    "HOLT_WINTERS_ADDITIVE needs a seasonalPeriod of at least 2, got " + seasonalPeriod);
            require(fallbackMethod == ForecastMethodType.NAIVE_LAST_VALUE || fallbackMethod == ForecastMethodType.NAIVE_MEAN
                            || fallbackMethod == ForecastMethodType.LINEAR_REGRESSION,
                    "fallbackMethod must not need a parameter search, got " + fallbackMethod);
            require(confidenceLevel > 0.0 && confidenceLevel < 1.0,
                    "confidenceLevel must be in (0, 1), got " + confidenceLevel);
            require(forecastMinHistory == null || forecastMinHistory >= 1,
                    "forecastMinHistory must be positive, got " + forecastMinHistory);
            require(forecastHorizon >= 1, "forecastHorizon must be positive, got " + forecastHorizon);
            require(maxEvaluations >= 1, "maxEvaluations must be positive, got " + maxEvaluations);

            AnalysisConfiguration config = new AnalysisConfiguration();
            config.windowSize = this.windowSize;
            config.windowDuration = this.windowDuration;
            config.fillPolicy = this.fillPolicy;
            config.bucketAggregation = this.bucketAggregation;
            config.maxFillGap = this.maxFillGap;
            config.samplingInterval = this.samplingInterval;
            config.statisticsMode = this.statisticsMode;
            config.quantiles = this.quantiles.clone();
            config.anomalyRule = this.anomalyRule;
            config.anomalyK = this.anomalyK;
            config.zeroVariancePolicy = this.zeroVariancePolicy;
            config.imputedConfidence = this.imputedConfidence;
            config.minHistory = this.minHistory != null ? this.minHistory : this.windowSize;
            config.seasonalPeriod = this.seasonalPeriod;
            config.forecastMethod = this.forecastMethod;
            config.fallbackMethod = this.fallbackMethod;
            config.confidenceLevel = this.confidenceLevel;
            config.forecastMinHistory = this.forecastMinHistory != null ? this.forecastMinHistory
                    : this.seasonalPeriod > 1 ? 2 * this.seasonalPeriod : 10;
            config.forecastHorizon = this.forecastHorizon;
            config.maxEvaluations = this.maxEvaluations;
            config.duplicatePolicy = this.duplicatePolicy;
            config.allowOutOfOrder = this.allowOutOfOrder;
            return config;
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }

    /**
     * Returns the rolling window: the time span if one is set, the slot count otherwise.
     */
    public WindowSpec getWindowSpec() {
        return windowDuration != null ? WindowSpec.ofDuration(windowDuration) : WindowSpec.ofCount(windowSize);
    }

    public int getWindowSize() { return windowSize; }
    @Nullable
    public Duration getWindowDuration() { return windowDuration; }
    public FillPolicy getFillPolicy() { return fillPolicy; }
    public BucketAggregation getBucketAggregation() { return bucketAggregation; }
    public int getMaxFillGap() { return maxFillGap; }
    @Nullable
    public SamplingInterval getSamplingInterval() { return samplingInterval; }
    public StatisticsMode getStatisticsMode() { return statisticsMode; }
    public double[] getQuantiles() { return quantiles.clone(); }
    public AnomalyRuleType getAnomalyRule() { return anomalyRule; }
    public double getAnomalyK() { return anomalyK; }
    public ZeroVariancePolicy getZeroVariancePolicy() { return zeroVariancePolicy; }
    public double getImputedConfidence() { return imputedConfidence; }
    public int getMinHistory() { return minHistory; }
    public int getSeasonalPeriod() { return seasonalPeriod; }
    public ForecastMethodType getForecastMethod() { return forecastMethod; }
    public ForecastMethodType getFallbackMethod() { return fallbackMethod; }
    public double getConfidenceLevel() { return confidenceLevel; }
    public int getForecastMinHistory() { return forecastMinHistory; }
    public int getForecastHorizon() { return forecastHorizon; }
    public int getMaxEvaluations() { return maxEvaluations; }
    public DuplicatePolicy getDuplicatePolicy() { return duplicatePolicy; }
    public boolean isAllowOutOfOrder() { return allowOutOfOrder; }

    @Override
    public String toString() {
        return "AnalysisConfiguration{" +
                "window=" + getWindowSpec() +
                ", fillPolicy=" + fillPolicy +
                ", bucketAggregation=" + bucketAggregation +
                ", maxFillGap=" + maxFillGap +
                ", samplingInterval=" + samplingInterval +
                ", statisticsMode=" + statisticsMode +
                ", quantiles=" + Arrays.toString(quantiles) +
                ", anomalyRule=" + anomalyRule +
                ", anomalyK=" + anomalyK +
                ", zeroVariancePolicy=" + zeroVariancePolicy +
                ", imputedConfidence=" + imputedConfidence +
                ", minHistory=" + minHistory +
                ", seasonalPeriod=" + seasonalPeriod +
                ", forecastMethod=" + forecastMethod +
                ", fallbackMethod=" + fallbackMethod +
                ", confidenceLevel=" + confidenceLevel +
                ", forecastMinHistory=" + forecastMinHistory +
                ", forecastHorizon=" + forecastHorizon +
                ", maxEvaluations=" + maxEvaluations +
                ", duplicatePolicy=" + duplicatePolicy +
                ", allowOutOfOrder=" + allowOutOfOrder +
                '}';
    }
}
