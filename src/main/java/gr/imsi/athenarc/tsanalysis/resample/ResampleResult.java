package gr.imsi.athenarc.tsanalysis.resample;

import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.RangeSet;

import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.store.TemporalSeriesStore;

/**
 * The outcome of a resampling run: the cleaned regular series and where its gaps were.
 */
public class ResampleResult {

    private final TemporalSeriesStore series;
    private final SamplingInterval interval;
    private final FillPolicy fillPolicy;
    private final ImmutableRangeSet<Long> gaps;
    private final int observedCount;
    private final int imputedCount;
    private final int missingCount;

    ResampleResult(TemporalSeriesStore series, SamplingInterval interval, FillPolicy fillPolicy,
                   RangeSet<Long> gaps, int observedCount, int imputedCount, int missingCount) {
        this.series = series;
        this.interval = interval;
        this.fillPolicy = fillPolicy;
        this.gaps = ImmutableRangeSet.copyOf(gaps);
        this.observedCount = observedCount;
        this.imputedCount = imputedCount;
        this.missingCount = missingCount;
    }

    public TemporalSeriesStore getSeries() {
        return series;
    }

    public SamplingInterval getInterval() {
        return interval;
    }

    public FillPolicy getFillPolicy() {
        return fillPolicy;
    }

    /**
     * Returns the time ranges {@code [from, to)} of the slots that had no present input,
     * whether they were filled or left missing.
     */
    public ImmutableRangeSet<Long> getGaps() {
        return gaps;
    }

    public int getObservedCount() {
        return observedCount;
    }

    public int getImputedCount() {
        return imputedCount;
    }

    public int getMissingCount() {
        return missingCount;
    }

    @Override
    public String toString() {
        return "ResampleResult{interval=" + interval + ", fillPolicy=" + fillPolicy
                + ", observed=" + observedCount + ", imputed=" + imputedCount
                + ", missing=" + missingCount + ", gaps=" + gaps + '}';
    }
}
