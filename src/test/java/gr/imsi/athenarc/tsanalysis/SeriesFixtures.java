package gr.imsi.athenarc.tsanalysis;

import java.time.temporal.ChronoUnit;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.store.TemporalSeriesStore;

/**
 * Series builders shared by the tests. Slots are one minute apart starting at {@link #START}.
 */
public final class SeriesFixtures {

    public static final long START = 1_700_000_000_000L;
    public static final long MINUTE = 60_000L;
    public static final SamplingInterval ONE_MINUTE = SamplingInterval.of(1, ChronoUnit.MINUTES);

    private SeriesFixtures() {
    }

    public static long at(int slot) {
        return START + slot * MINUTE;
    }

    /**
     * Observed values at consecutive minutes; NaN entries become missing slots.
     */
    public static TemporalSeriesStore minutely(double... values) {
        TemporalSeriesStore store = TemporalSeriesStore.builder().samplingInterval(ONE_MINUTE).build();
        for (int i = 0; i < values.length; i++) {
            store.insert(Double.isNaN(values[i]) ? Observation.missing(at(i)) : Observation.observed(at(i), values[i]));
        }
        return store;
    }

    public static double[] linear(int n, double intercept, double slope) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = intercept + slope * i;
        }
        return values;
    }
}
