package gr.imsi.athenarc.tsanalysis.manager;

import gr.imsi.athenarc.tsanalysis.anomaly.AnomalyDetector;
import gr.imsi.athenarc.tsanalysis.anomaly.AnomalyRuleFactory;
import gr.imsi.athenarc.tsanalysis.config.AnalysisConfiguration;
import gr.imsi.athenarc.tsanalysis.forecast.ForecastMethodFactory;
import gr.imsi.athenarc.tsanalysis.forecast.Forecaster;
import gr.imsi.athenarc.tsanalysis.resample.Resampler;
import gr.imsi.athenarc.tsanalysis.stats.RollingStatisticsEngine;
import gr.imsi.athenarc.tsanalysis.store.TemporalSeriesStore;

/**
 * The components analysing one series, all built from one configuration. A context is confined to
 * the thread running its series.
 */
public class SeriesAnalysisContext {

    private final String seriesId;
    private final AnalysisConfiguration configuration;
    private final TemporalSeriesStore store;
    private final Resampler resampler;
    private final RollingStatisticsEngine statisticsEngine;
    private final AnomalyDetector anomalyDetector;
    private final Forecaster forecaster;

    public SeriesAnalysisContext(String seriesId, AnalysisConfiguration configuration) {
        this.seriesId = seriesId;
        this.configuration = configuration;
        this.store = TemporalSeriesStore.builder()
                .duplicatePolicy(configuration.getDuplicatePolicy())
                .allowOutOfOrder(configuration.isAllowOutOfOrder())
                .build();
        this.resampler = new Resampler(configuration.getBucketAggregation(), configuration.getMaxFillGap());
        this.statisticsEngine = new RollingStatisticsEngine(configuration.getWindowSpec(),
                configuration.getStatisticsMode(), configuration.getQuantiles());
        this.anomalyDetector = new AnomalyDetector(AnomalyRuleFactory.createRule(configuration),
                configuration.getWindowSpec(), configuration.getStatisticsMode(),
                configuration.getMinHistory(), configuration.getImputedConfidence());
        this.forecaster = new Forecaster(
                ForecastMethodFactory.createMethod(configuration.getForecastMethod(),
                        configuration.getSeasonalPeriod(), configuration.getMaxEvaluations()),
                ForecastMethodFactory.createMethod(configuration.getFallbackMethod(),
                        configuration.getSeasonalPeriod(), configuration.getMaxEvaluations()),
                configuration.getConfidenceLevel(), configuration.getForecastMinHistory());
    }

    public String getSeriesId() {
        return seriesId;
    }

    public AnalysisConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Returns the store raw pairs are ingested into.
     */
    public TemporalSeriesStore getStore() {
        return store;
    }

    public Resampler getResampler() {
        return resampler;
    }

    public RollingStatisticsEngine getStatisticsEngine() {
        return statisticsEngine;
    }

    public AnomalyDetector getAnomalyDetector() {
        return anomalyDetector;
    }

    public Forecaster getForecaster() {
        return forecaster;
    }
}
