package gr.imsi.athenarc.tsanalysis.stats;

import gr.imsi.athenarc.tsanalysis.domain.StatSnapshot;

/**
 * Incremental aggregates of the values currently inside a window.
 * <p>
 * The mean is the window's compensated (Neumaier) sum over its count, so evicting a value far larger
 * than the rest leaves the mean of the remaining values intact. The sum of squared deviations follows
 * Welford's recurrences for admission and eviction, and is recomputed from the window's values when an
 * eviction cancels nearly all of it. Min, max and quantiles come from an {@link OrderStatisticTree} in
 * O(log w).
 */
public class RollingWindow {

    /** An eviction leaving less than this fraction of the previous sum of squares triggers a recount. */
    private static final double CANCELLATION_RATIO = 1e-6;

    private int count;
    private double sum;
    private double compensation;
    private double m2;
    private final OrderStatisticTree orderStatistics;

    public RollingWindow() {
        this.orderStatistics = new OrderStatisticTree();
    }

    public void add(double value) {
        double previousMean = getMean();
        count++;
        accumulate(value);
        m2 += (value - previousMean) * (value - getMean());
        orderStatistics.add(value);
    }

    /**
     * Removes a value previously added.
     *
     * @throws IllegalStateException if the value is not in the window
     */
    public void remove(double value) {
        if (!orderStatistics.remove(value)) {
            throw new IllegalStateException("Value " + value + " is not in the window");
        }
        count--;
        if (count == 0) {
            sum = 0.0;
            compensation = 0.0;
            m2 = 0.0;
            return;
        }
        double previousMean = (sum + compensation) / (count + 1);
        double previousM2 = m2;
        accumulate(-value);
        m2 -= (value - previousMean) * (value - getMean());
        if (m2 < CANCELLATION_RATIO * previousM2) {
            m2 = sumOfSquaredDeviations();
        }
    }

    private void accumulate(double value) {
        double total = sum + value;
        if (Math.abs(sum) >= Math.abs(value)) {
            compensation += (sum - total) + value;
        } else {
            compensation += (value - total) + sum;
        }
        sum = total;
    }

    private double sumOfSquaredDeviations() {
        double mean = getMean();
        double squares = 0.0;
        for (int rank = 0; rank < count; rank++) {
            double deviation = orderStatistics.select(rank) - mean;
            squares += deviation * deviation;
        }
        return squares;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return count == 0 ? 0.0 : (sum + compensation) / count;
    }

    /**
     * Returns the unbiased sample variance, or 0 for a single value.
     */
    public double getVariance() {
        return count < 2 ? 0.0 : m2 / (count - 1);
    }

    /**
     * Captures the current aggregates.
     *
     * @param timestamp timestamp of the window's last slot
     * @param quantileProbabilities probabilities to evaluate
     */
    public StatSnapshot snapshot(long timestamp, double[] quantileProbabilities) {
        if (count == 0) {
            return StatSnapshot.insufficient(timestamp);
        }
        double[] quantileValues = new double[quantileProbabilities.length];
        for (int i = 0; i < quantileProbabilities.length; i++) {
            quantileValues[i] = orderStatistics.quantile(quantileProbabilities[i]);
        }
        return StatSnapshot.of(timestamp, count, getMean(), getVariance(), orderStatistics.min(), orderStatistics.max(),
                quantileProbabilities, quantileValues);
    }

    public void clear() {
        count = 0;
        sum = 0.0;
        compensation = 0.0;
        m2 = 0.0;
        orderStatistics.clear();
    }
}
