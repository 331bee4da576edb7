package gr.imsi.athenarc.tsanalysis.forecast;

import java.util.Arrays;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.jetbrains.annotations.Nullable;

import gr.imsi.athenarc.tsanalysis.domain.DateTimeUtil;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.exception.OutOfOrderException;

/**
 * The fitted state of a {@link ForecastMethod} over one series.
 * <p>
 * The state is mutated in place by {@link Forecaster#update(ForecastModel, gr.imsi.athenarc.tsanalysis.domain.Observation)},
 * each update bumping {@link #getVersion()}. Not thread-safe.
 */
public class ForecastModel {

    private final ForecastMethod method;
    private final SamplingInterval interval;
    private final double[] parameters;

    double level;
    double trend;
    final double[] seasonals;
    int seasonPosition;

    // Slot index of the last absorbed slot, counted from the first present one
    long position;
    int valueCount;
    @Nullable
    SimpleRegression regression;

    private double sumSquaredErrors;
    private int errorCount;
    int observationCount;
    long lastTimestamp;
    long version;

    ForecastModel(ForecastMethod method, SamplingInterval interval, double[] parameters, int seasonalPeriod) {
        this.method = method;
        this.interval = interval;
        this.parameters = parameters.clone();
        this.seasonals = new double[seasonalPeriod];
    }

    void recordError(double error) {
        sumSquaredErrors += error * error;
        errorCount++;
    }

    double getSumSquaredErrors() {
        return sumSquaredErrors;
    }

    /**
     * Returns how many slots separate {@code timestamp} from the last absorbed slot, at least 1.
     *
     * @throws OutOfOrderException if {@code timestamp} is not after the last absorbed slot
     */
    long stepsTo(long timestamp) {
        if (timestamp <= lastTimestamp) {
            throw new OutOfOrderException(timestamp, lastTimestamp);
        }
        return Math.max(1L, Math.round((double) (timestamp - lastTimestamp) / interval.toMillis()));
    }

    double parameter(int index) {
        return parameters[index];
    }

    ForecastMethod getMethod() {
        return method;
    }

    public String getMethodName() {
        return method.getName();
    }

    public SamplingInterval getInterval() {
        return interval;
    }

    /**
     * Returns the fitted smoothing parameters, empty for methods without any.
     */
    public double[] getParameters() {
        return parameters.clone();
    }

    public double getLevel() {
        return level;
    }

    public double getTrend() {
        return trend;
    }

    public double[] getSeasonals() {
        return seasonals.clone();
    }

    /**
     * Returns the mean squared one-step-ahead error over observed values, 0 before any was made.
     */
    public double getResidualVariance() {
        return errorCount == 0 ? 0.0 : sumSquaredErrors / errorCount;
    }

    public int getObservationCount() {
        return observationCount;
    }

    public long getLastTimestamp() {
        return lastTimestamp;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "ForecastModel{" +
                "method=" + method.getName() +
                ", parameters=" + Arrays.toString(parameters) +
                ", level=" + level +
                ", trend=" + trend +
                ", residualVariance=" + getResidualVariance() +
                ", observations=" + observationCount +
                ", last=" + DateTimeUtil.format(lastTimestamp) +
                ", version=" + version +
                '}';
    }
}
