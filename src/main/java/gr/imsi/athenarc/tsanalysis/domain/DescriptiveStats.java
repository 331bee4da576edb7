package gr.imsi.athenarc.tsanalysis.domain;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import gr.imsi.athenarc.tsanalysis.exception.InsufficientDataException;

/**
 * Whole-series summary: mean, population standard deviation, min and max of the present values.
 */
public final class DescriptiveStats {

    private final long count;
    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;

    private DescriptiveStats(SummaryStatistics summary) {
        this.count = summary.getN();
        this.mean = summary.getMean();
        this.stdDev = Math.sqrt(summary.getPopulationVariance());
        this.min = summary.getMin();
        this.max = summary.getMax();
    }

    /**
     * Summarizes the values of {@code series}.
     *
     * @param series the series to summarize
     * @param includeImputed whether imputed slots contribute
     * @throws InsufficientDataException if no value contributes
     */
    public static DescriptiveStats of(TimeSeries series, boolean includeImputed) {
        SummaryStatistics summary = new SummaryStatistics();
        for (Observation observation : series) {
            if (observation.isObserved() || (includeImputed && observation.isImputed())) {
                summary.addValue(observation.getValue());
            }
        }
        if (summary.getN() == 0) {
            throw new InsufficientDataException("Descriptive statistics", 0, 1);
        }
        return new DescriptiveStats(summary);
    }

    public static DescriptiveStats of(double... values) {
        if (values.length == 0) {
            throw new InsufficientDataException("Descriptive statistics", 0, 1);
        }
        SummaryStatistics summary = new SummaryStatistics();
        for (double value : values) {
            summary.addValue(value);
        }
        return new DescriptiveStats(summary);
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "DescriptiveStats{count=" + count + ", mean=" + mean + ", stdDev=" + stdDev
                + ", min=" + min + ", max=" + max + '}';
    }
}
