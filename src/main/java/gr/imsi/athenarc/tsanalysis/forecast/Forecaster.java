package gr.imsi.athenarc.tsanalysis.forecast;

import java.util.List;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsanalysis.domain.DateTimeUtil;
import gr.imsi.athenarc.tsanalysis.domain.ForecastResult;
import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientDataException;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientHistoryException;
import gr.imsi.athenarc.tsanalysis.exception.NonConvergenceException;

/**
 * Fits forecast models, keeps them current and produces point forecasts with prediction intervals.
 * <p>
 * The interval half-width at step {@code h} is {@code z * sqrt(residualVariance * h)}, with {@code z}
 * the two-sided normal quantile of the configured confidence level.
 */
public class Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(Forecaster.class);

    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;
    public static final int DEFAULT_MIN_HISTORY = 10;

    private final ForecastMethod method;
    private final ForecastMethod fallback;
    private final double confidenceLevel;
    private final double z;
    private final int minHistory;

    public Forecaster(ForecastMethod method) {
        this(method, new NaiveLastValueMethod(), DEFAULT_CONFIDENCE_LEVEL, DEFAULT_MIN_HISTORY);
    }

    /**
     * @param method the preferred method
     * @param fallback the method substituted when {@code method} fails to converge
     * @param confidenceLevel coverage of the prediction intervals, in (0, 1)
     * @param minHistory observed values required before fitting
     */
    public Forecaster(ForecastMethod method, ForecastMethod fallback, double confidenceLevel, int minHistory) {
        if (method == null || fallback == null) {
            throw new IllegalArgumentException("Forecast method and fallback are required");
        }
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1), got " + confidenceLevel);
        }
        if (minHistory < 1) {
            throw new IllegalArgumentException("Min history must be positive, got " + minHistory);
        }
        this.method = method;
        this.fallback = fallback;
        this.confidenceLevel = confidenceLevel;
        this.z = new NormalDistribution().inverseCumulativeProbability(0.5 + confidenceLevel / 2);
        this.minHistory = minHistory;
    }

    /**
     * Fits the preferred method to {@code series}.
     *
     * @throws InsufficientHistoryException if the series has fewer observed values than required
     * @throws NonConvergenceException if the parameter search exhausts its budget
     */
    public ForecastModel fit(TimeSeries series) throws NonConvergenceException {
        return fit(method, series);
    }

    private ForecastModel fit(ForecastMethod forecastMethod, TimeSeries series) throws NonConvergenceException {
        int observed = (int) series.stream().filter(Observation::isObserved).count();
        int required = Math.max(minHistory, forecastMethod.getRequiredHistory());
        if (observed < required) {
            throw new InsufficientHistoryException(forecastMethod.getName(), observed, required);
        }
        SamplingInterval interval = intervalOf(series);
        Stopwatch stopwatch = Stopwatch.createStarted();
        ForecastModel model = forecastMethod.fit(series, interval);
        LOG.info("Fitted {} on {} observations at {} in {}", forecastMethod.getName(), observed, interval, stopwatch.stop());
        LOG.debug("Fitted model {}", model);
        return model;
    }

    private static SamplingInterval intervalOf(TimeSeries series) {
        return series.getSamplingInterval()
                .or(() -> DateTimeUtil.inferSamplingInterval(series))
                .orElseThrow(() -> new InsufficientDataException("Sampling interval inference", series.size(), 2));
    }

    /**
     * Fits the preferred method again on {@code series}, superseding {@code previous}. The new model's
     * version follows the previous one.
     */
    public ForecastModel refit(ForecastModel previous, TimeSeries series) throws NonConvergenceException {
        ForecastModel model = fit(previous.getMethod(), series);
        model.version = previous.getVersion() + 1;
        return model;
    }

    /**
     * Absorbs an observation newer than the model's last timestamp.
     */
    public void update(ForecastModel model, Observation observation) {
        model.getMethod().update(model, observation);
    }

    /**
     * Forecasts {@code horizon} slots past the model's last timestamp.
     */
    public List<ForecastResult> forecast(ForecastModel model, int horizon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("Horizon must be positive, got " + horizon);
        }
        ForecastMethod modelMethod = model.getMethod();
        double variance = model.getResidualVariance();
        ImmutableList.Builder<ForecastResult> results = ImmutableList.builder();
        for (int h = 1; h <= horizon; h++) {
            double point = modelMethod.forecast(model, h);
            double halfWidth = z * Math.sqrt(variance * h);
            results.add(new ForecastResult(model.getInterval().advance(model.getLastTimestamp(), h), h,
                    point, point - halfWidth, point + halfWidth, model.getVersion(), modelMethod.getName()));
        }
        return results.build();
    }

    /**
     * Fits the preferred method and forecasts {@code horizon} slots.
     */
    public List<ForecastResult> forecast(TimeSeries series, int horizon) throws NonConvergenceException {
        return forecast(fit(series), horizon);
    }

    /**
     * Like {@link #forecast(TimeSeries, int)}, substituting the fallback method when the preferred one
     * does not converge.
     */
    public List<ForecastResult> forecastWithFallback(TimeSeries series, int horizon) {
        return forecast(fitWithFallback(series), horizon);
    }

    /**
     * Fits the preferred method, or the fallback one if the preferred does not converge.
     */
    public ForecastModel fitWithFallback(TimeSeries series) {
        try {
            return fit(method, series);
        } catch (NonConvergenceException e) {
            LOG.warn("{}; falling back to {}", e.getMessage(), fallback.getName());
            try {
                return fit(fallback, series);
            } catch (NonConvergenceException fallbackFailure) {
                throw new IllegalStateException("Fallback method " + fallback.getName() + " did not converge", fallbackFailure);
            }
        }
    }

    public ForecastMethod getMethod() {
        return method;
    }

    public ForecastMethod getFallback() {
        return fallback;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public int getMinHistory() {
        return minHistory;
    }
}
