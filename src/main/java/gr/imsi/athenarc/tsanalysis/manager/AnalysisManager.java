package gr.imsi.athenarc.tsanalysis.manager;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import gr.imsi.athenarc.tsanalysis.config.AnalysisConfiguration;
import gr.imsi.athenarc.tsanalysis.domain.AnomalyReport;
import gr.imsi.athenarc.tsanalysis.domain.DateTimeUtil;
import gr.imsi.athenarc.tsanalysis.domain.DescriptiveStats;
import gr.imsi.athenarc.tsanalysis.domain.ForecastResult;
import gr.imsi.athenarc.tsanalysis.domain.LinearTrend;
import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.domain.StatSnapshot;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;
import gr.imsi.athenarc.tsanalysis.domain.TimestampedValue;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientDataException;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientHistoryException;
import gr.imsi.athenarc.tsanalysis.forecast.ForecastModel;
import gr.imsi.athenarc.tsanalysis.resample.ResampleResult;
import gr.imsi.athenarc.tsanalysis.stats.StatisticsMode;
import gr.imsi.athenarc.tsanalysis.store.TemporalSeriesStore;

/**
 * Runs the analysis pipeline: raw pairs are ingested into a store, resampled onto a regular grid,
 * then summarized, scanned for anomalies and forecast.
 */
public class AnalysisManager {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisManager.class);

    private final AnalysisConfiguration configuration;
    private final int parallelism;

    private AnalysisManager(AnalysisConfiguration configuration, int parallelism) {
        this.configuration = configuration;
        this.parallelism = parallelism;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AnalysisManager createDefault() {
        return builder().build();
    }

    /**
     * Ingests {@code pairs} and analyses them.
     *
     * @throws gr.imsi.athenarc.tsanalysis.exception.TimeSeriesException if a pair is rejected by the store
     * @throws InsufficientDataException if fewer than 2 values are present
     */
    public AnalysisResults analyze(String seriesId, Iterable<? extends TimestampedValue> pairs) {
        SeriesAnalysisContext context = newContext(seriesId);
        context.getStore().insertAll(pairs);
        return analyze(context, context.getStore().snapshot());
    }

    /**
     * Analyses an existing series.
     */
    public AnalysisResults analyze(String seriesId, TimeSeries series) {
        return analyze(newContext(seriesId), series);
    }

    /**
     * Analyses independent series in parallel on a fixed pool. Results keep the order of {@code series}.
     *
     * @throws IllegalStateException wrapping the first failure; runtime failures are rethrown as-is
     */
    public Map<String, AnalysisResults> analyzeAll(Map<String, ? extends Iterable<? extends TimestampedValue>> series) {
        ExecutorService executor = Executors.newFixedThreadPool(parallelism,
                new ThreadFactoryBuilder().setNameFormat("series-analysis-%d").setDaemon(true).build());
        try {
            List<String> ids = new ArrayList<>(series.keySet());
            List<Future<AnalysisResults>> futures = new ArrayList<>(ids.size());
            for (String id : ids) {
                Iterable<? extends TimestampedValue> pairs = series.get(id);
                futures.add(executor.submit(() -> analyze(id, pairs)));
            }
            Map<String, AnalysisResults> results = new LinkedHashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                results.put(ids.get(i), await(ids.get(i), futures.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static AnalysisResults await(String seriesId, Future<AnalysisResults> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analysing " + seriesId, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Analysis of " + seriesId + " failed", e.getCause());
        }
    }

    public SeriesAnalysisContext newContext(String seriesId) {
        return new SeriesAnalysisContext(seriesId, configuration);
    }

    AnalysisResults analyze(SeriesAnalysisContext context, TimeSeries series) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        LOG.info("Analysing series {} with {} observations", context.getSeriesId(), series.size());

        SamplingInterval interval = configuration.getSamplingInterval() != null
                ? configuration.getSamplingInterval()
                : DateTimeUtil.inferSamplingInterval(series)
                        .orElseThrow(() -> new InsufficientDataException("Resampling", series.size(), 2));
        ResampleResult resampled = context.getResampler().resample(series, interval, configuration.getFillPolicy());
        TemporalSeriesStore cleaned = resampled.getSeries();

        boolean includeImputed = configuration.getStatisticsMode() == StatisticsMode.FILLED;
        DescriptiveStats descriptive = DescriptiveStats.of(cleaned, includeImputed);
        LinearTrend trend = fitTrend(cleaned, includeImputed);
        List<StatSnapshot> statistics = context.getStatisticsEngine().compute(cleaned);
        List<AnomalyReport> anomalies = context.getAnomalyDetector().detect(cleaned);

        ForecastModel model = null;
        List<ForecastResult> forecasts = List.of();
        try {
            model = context.getForecaster().fitWithFallback(cleaned);
            forecasts = context.getForecaster().forecast(model, configuration.getForecastHorizon());
        } catch (InsufficientHistoryException e) {
            LOG.warn("Skipping forecast of series {}: {}", context.getSeriesId(), e.getMessage());
        }

        long elapsed = stopwatch.stop().elapsed(TimeUnit.MILLISECONDS);
        LOG.info("Analysed series {} in {} ms", context.getSeriesId(), elapsed);
        return new AnalysisResults(context.getSeriesId(), resampled, descriptive, trend, statistics, anomalies,
                model, forecasts, elapsed);
    }

    @Nullable
    private static LinearTrend fitTrend(TimeSeries series, boolean includeImputed) {
        List<Double> positions = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            Observation observation = series.get(i);
            if (observation.isObserved() || (includeImputed && observation.isImputed())) {
                positions.add((double) i);
                values.add(observation.getValue());
            }
        }
        if (values.size() < 2) {
            return null;
        }
        return LinearTrend.fit(positions.stream().mapToDouble(Double::doubleValue).toArray(),
                values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public AnalysisConfiguration getConfiguration() {
        return configuration;
    }

    public static class Builder {
        private AnalysisConfiguration configuration = AnalysisConfiguration.defaults();
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

        public Builder withConfiguration(AnalysisConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        /**
         * Sets the number of threads {@link AnalysisManager#analyzeAll(Map)} uses.
         */
        public Builder withParallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public AnalysisManager build() {
            return new AnalysisManager(configuration, parallelism);
        }
    }
}
