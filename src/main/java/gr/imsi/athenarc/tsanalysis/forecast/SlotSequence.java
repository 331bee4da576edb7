package gr.imsi.athenarc.tsanalysis.forecast;

import java.util.Arrays;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;

/**
 * A series laid out on a regular grid starting at its first present observation. Missing slots,
 * including the ones implied by timestamp gaps, hold NaN.
 */
final class SlotSequence {

    private final double[] values;
    private final boolean[] imputed;
    private final int size;
    private final int observedCount;
    private final int presentCount;
    private final long lastTimestamp;

    private SlotSequence(double[] values, boolean[] imputed, int size, int observedCount, int presentCount, long lastTimestamp) {
        this.values = values;
        this.imputed = imputed;
        this.size = size;
        this.observedCount = observedCount;
        this.presentCount = presentCount;
        this.lastTimestamp = lastTimestamp;
    }

    static SlotSequence of(TimeSeries series, SamplingInterval interval) {
        long step = interval.toMillis();
        double[] values = new double[Math.max(16, series.size())];
        boolean[] imputed = new boolean[values.length];
        int size = 0;
        int observed = 0;
        int present = 0;
        long last = Long.MIN_VALUE;
        for (Observation observation : series) {
            if (size == 0 && !observation.isPresent()) {
                continue;
            }
            if (size > 0) {
                long steps = Math.max(1L, Math.round((double) (observation.getTimestamp() - last) / step));
                if (size + steps > Integer.MAX_VALUE - 8) {
                    throw new IllegalArgumentException("Interval " + interval + " produces too many slots");
                }
                int required = size + (int) steps;
                if (required > values.length) {
                    int capacity = Math.max(required, values.length + (values.length >> 1));
                    values = Arrays.copyOf(values, capacity);
                    imputed = Arrays.copyOf(imputed, capacity);
                }
                for (long k = 1; k < steps; k++) {
                    values[size++] = Double.NaN;
                }
            }
            if (observation.isPresent()) {
                values[size] = observation.getValue();
                imputed[size] = observation.isImputed();
                present++;
                if (observation.isObserved()) {
                    observed++;
                }
            } else {
                values[size] = Double.NaN;
            }
            size++;
            last = observation.getTimestamp();
        }
        return new SlotSequence(values, imputed, size, observed, present, last);
    }

    int size() {
        return size;
    }

    double value(int index) {
        return values[index];
    }

    boolean isPresent(int index) {
        return !Double.isNaN(values[index]);
    }

    boolean isImputed(int index) {
        return imputed[index];
    }

    /**
     * Returns the index of the first present slot after {@code index}, or -1.
     */
    int nextPresent(int index) {
        for (int i = index + 1; i < size; i++) {
            if (isPresent(i)) {
                return i;
            }
        }
        return -1;
    }

    int getObservedCount() {
        return observedCount;
    }

    int getPresentCount() {
        return presentCount;
    }

    long getLastTimestamp() {
        return lastTimestamp;
    }
}
