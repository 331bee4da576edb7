package gr.imsi.athenarc.tsanalysis.manager;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.jetbrains.annotations.Nullable;

import gr.imsi.athenarc.tsanalysis.domain.AnomalyReport;
import gr.imsi.athenarc.tsanalysis.domain.DescriptiveStats;
import gr.imsi.athenarc.tsanalysis.domain.ForecastResult;
import gr.imsi.athenarc.tsanalysis.domain.LinearTrend;
import gr.imsi.athenarc.tsanalysis.domain.StatSnapshot;
import gr.imsi.athenarc.tsanalysis.forecast.ForecastModel;
import gr.imsi.athenarc.tsanalysis.resample.ResampleResult;

/**
 * Everything one pipeline run produced for a series.
 */
public class AnalysisResults {

    private final String seriesId;
    private final ResampleResult resampleResult;
    private final DescriptiveStats descriptiveStats;
    @Nullable
    private final LinearTrend trend;
    private final List<StatSnapshot> statistics;
    private final List<AnomalyReport> anomalies;
    @Nullable
    private final ForecastModel forecastModel;
    private final List<ForecastResult> forecasts;
    private final long analysisTime;

    AnalysisResults(String seriesId, ResampleResult resampleResult, DescriptiveStats descriptiveStats,
                    @Nullable LinearTrend trend, List<StatSnapshot> statistics, List<AnomalyReport> anomalies,
                    @Nullable ForecastModel forecastModel, List<ForecastResult> forecasts, long analysisTime) {
        this.seriesId = seriesId;
        this.resampleResult = resampleResult;
        this.descriptiveStats = descriptiveStats;
        this.trend = trend;
        this.statistics = List.copyOf(statistics);
        this.anomalies = List.copyOf(anomalies);
        this.forecastModel = forecastModel;
        this.forecasts = List.copyOf(forecasts);
        this.analysisTime = analysisTime;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public ResampleResult getResampleResult() {
        return resampleResult;
    }

    public DescriptiveStats getDescriptiveStats() {
        return descriptiveStats;
    }

    /**
     * Returns the least squares trend of the cleaned series, empty if fewer than 2 values counted.
     */
    public Optional<LinearTrend> getTrend() {
        return Optional.ofNullable(trend);
    }

    public List<StatSnapshot> getStatistics() {
        return statistics;
    }

    public List<AnomalyReport> getAnomalies() {
        return anomalies;
    }

    /**
     * Returns only the reports flagged as anomalous.
     */
    public List<AnomalyReport> getFlaggedAnomalies() {
        return anomalies.stream().filter(AnomalyReport::isAnomaly).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Returns the fitted forecast model, empty when the history was too short to forecast.
     */
    public Optional<ForecastModel> getForecastModel() {
        return Optional.ofNullable(forecastModel);
    }

    public List<ForecastResult> getForecasts() {
        return forecasts;
    }

    /**
     * Returns the pipeline run time in milliseconds.
     */
    public long getAnalysisTime() {
        return analysisTime;
    }

    @Override
    public String toString() {
        return "AnalysisResults{" +
                "seriesId=" + seriesId +
                ", slots=" + resampleResult.getSeries().size() +
                ", statistics=" + statistics.size() +
                ", anomalies=" + getFlaggedAnomalies().size() +
                ", forecasts=" + forecasts.size() +
                ", analysisTime=" + analysisTime +
                '}';
    }
}
