package gr.imsi.athenarc.tsanalysis.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Aggregate statistics of one window, reported at the timestamp of the window's last slot.
 * <p>
 * A window without any counted value is {@linkplain #isInsufficient() insufficient}: its aggregate
 * accessors return an empty {@link OptionalDouble} rather than a number.
 */
public final class StatSnapshot {

    private final long timestamp;
    private final int count;
    private final double mean;
    private final double variance;
    private final double min;
    private final double max;
    private final double[] quantileProbabilities;
    private final double[] quantileValues;
    private final boolean insufficient;

    private StatSnapshot(long timestamp, int count, double mean, double variance, double min, double max,
                         double[] quantileProbabilities, double[] quantileValues, boolean insufficient) {
        this.timestamp = timestamp;
        this.count = count;
        this.mean = mean;
        this.variance = variance;
        this.min = min;
        this.max = max;
        this.quantileProbabilities = quantileProbabilities;
        this.quantileValues = quantileValues;
        this.insufficient = insufficient;
    }

    public static StatSnapshot of(long timestamp, int count, double mean, double variance, double min, double max,
                                  double[] quantileProbabilities, double[] quantileValues) {
        if (count <= 0) {
            throw new IllegalArgumentException("A snapshot with values needs a positive count, got " + count);
        }
        if (quantileProbabilities.length != quantileValues.length) {
            throw new IllegalArgumentException("Quantile probabilities and values differ in length");
        }
        return new StatSnapshot(timestamp, count, mean, variance, min, max,
                quantileProbabilities.clone(), quantileValues.clone(), false);
    }

    /**
     * Creates the snapshot of a window that held no counted value.
     */
    public static StatSnapshot insufficient(long timestamp) {
        return new StatSnapshot(timestamp, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                new double[0], new double[0], true);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getCount() {
        return count;
    }

    public boolean isInsufficient() {
        return insufficient;
    }

    public OptionalDouble getMean() {
        return insufficient ? OptionalDouble.empty() : OptionalDouble.of(mean);
    }

    /**
     * Returns the unbiased sample variance, 0 for a single value.
     */
    public OptionalDouble getVariance() {
        return insufficient ? OptionalDouble.empty() : OptionalDouble.of(variance);
    }

    public OptionalDouble getStdDev() {
        return insufficient ? OptionalDouble.empty() : OptionalDouble.of(Math.sqrt(variance));
    }

    public OptionalDouble getMin() {
        return insufficient ? OptionalDouble.empty() : OptionalDouble.of(min);
    }

    public OptionalDouble getMax() {
        return insufficient ? OptionalDouble.empty() : OptionalDouble.of(max);
    }

    /**
     * Returns the quantile computed for probability {@code p}, or empty if the window is insufficient
     * or {@code p} was not requested.
     */
    public OptionalDouble getQuantile(double p) {
        for (int i = 0; i < quantileProbabilities.length; i++) {
            if (Double.compare(quantileProbabilities[i], p) == 0) {
                return OptionalDouble.of(quantileValues[i]);
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Returns the quantiles keyed by probability in ascending order. Empty for an insufficient window.
     */
    public Map<Double, Double> getQuantiles() {
        Map<Double, Double> quantiles = new LinkedHashMap<>();
        for (int i = 0; i < quantileProbabilities.length; i++) {
            quantiles.put(quantileProbabilities[i], quantileValues[i]);
        }
        return Collections.unmodifiableMap(quantiles);
    }

    @Override
    public String toString() {
        if (insufficient) {
            return "StatSnapshot{timestamp=" + DateTimeUtil.format(timestamp) + ", insufficient}";
        }
        return "StatSnapshot{" +
                "timestamp=" + DateTimeUtil.format(timestamp) +
                ", count=" + count +
                ", mean=" + mean +
                ", variance=" + variance +
                ", min=" + min +
                ", max=" + max +
                ", quantiles=" + Arrays.toString(quantileValues) +
                '}';
    }
}
