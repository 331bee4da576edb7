package gr.imsi.athenarc.tsanalysis.resample;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.Provenance;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientDataException;
import gr.imsi.athenarc.tsanalysis.store.TemporalSeriesStore;

/**
 * Converts an arbitrary series into a regular-interval series with an explicit missing-data policy.
 * <p>
 * The grid is anchored at the first present observation: bucket {@code k} covers
 * {@code [first + k * interval, first + (k + 1) * interval)} and the last bucket is the one holding the
 * last present observation, so leading and trailing gaps are never extrapolated.
 */
public class Resampler {

    private static final Logger LOG = LoggerFactory.getLogger(Resampler.class);

    private final BucketAggregation bucketAggregation;
    private final int maxFillGap;

    public Resampler() {
        this(BucketAggregation.MEAN, 0);
    }

    /**
     * @param bucketAggregation how observations sharing a bucket are reduced
     * @param maxFillGap longest run of empty slots that is filled, 0 for no limit
     */
    public Resampler(BucketAggregation bucketAggregation, int maxFillGap) {
        if (bucketAggregation == null) {
            throw new IllegalArgumentException("Bucket aggregation must not be null");
        }
        if (maxFillGap < 0) {
            throw new IllegalArgumentException("Max fill gap must not be negative, got " + maxFillGap);
        }
        this.bucketAggregation = bucketAggregation;
        this.maxFillGap = maxFillGap;
    }

    /**
     * Resamples {@code series} onto a regular grid.
     *
     * @param series the input series, left untouched
     * @param interval the grid step
     * @param fillPolicy how empty slots are treated
     * @return the cleaned series and its gaps
     * @throws InsufficientDataException if the series has fewer than 2 present observations
     */
    public ResampleResult resample(TimeSeries series, SamplingInterval interval, FillPolicy fillPolicy) {
        if (interval == null || fillPolicy == null) {
            throw new IllegalArgumentException("Interval and fill policy are required");
        }
        int present = series.countPresent();
        if (present < 2) {
            throw new InsufficientDataException("Resampling", present, 2);
        }

        long step = interval.toMillis();
        long first = Long.MIN_VALUE;
        long last = Long.MIN_VALUE;
        for (Observation observation : series) {
            if (observation.isPresent()) {
                if (first == Long.MIN_VALUE) {
                    first = observation.getTimestamp();
                }
                last = observation.getTimestamp();
            }
        }
        long bucketCount = (last - first) / step + 1;
        if (bucketCount > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Interval " + interval + " produces too many slots (" + bucketCount + ")");
        }
        int buckets = (int) bucketCount;

        double[] bucketValues = new double[buckets];
        Provenance[] bucketProvenances = new Provenance[buckets];
        fillBuckets(series, first, step, bucketValues, bucketProvenances);

        RangeSet<Long> gaps = TreeRangeSet.create();
        int filled = 0;
        int missing = 0;
        int k = 0;
        while (k < buckets) {
            if (bucketProvenances[k] != null) {
                k++;
                continue;
            }
            // The first and last buckets always hold a present value, so every gap is interior
            int gapStart = k;
            while (bucketProvenances[k] == null) {
                k++;
            }
            int gapEnd = k; // exclusive, first present bucket after the gap
            int gapLength = gapEnd - gapStart;
            gaps.add(Range.closedOpen(first + gapStart * step, first + gapEnd * step));
            boolean fill = fillPolicy != FillPolicy.NONE && (maxFillGap == 0 || gapLength <= maxFillGap);
            for (int slot = gapStart; slot < gapEnd; slot++) {
                if (fill) {
                    bucketValues[slot] = fillValue(fillPolicy, bucketValues, gapStart - 1, gapEnd, slot);
                    bucketProvenances[slot] = Provenance.IMPUTED;
                    filled++;
                } else {
                    bucketProvenances[slot] = Provenance.MISSING;
                    missing++;
                }
            }
        }

        TemporalSeriesStore cleaned = TemporalSeriesStore.builder()
                .samplingInterval(interval)
                .initialCapacity(Math.max(1, buckets))
                .build();
        int observed = 0;
        int imputedSlots = 0;
        for (int slot = 0; slot < buckets; slot++) {
            Provenance provenance = bucketProvenances[slot];
            if (provenance == Provenance.OBSERVED) {
                observed++;
            } else if (provenance == Provenance.IMPUTED) {
                imputedSlots++;
            }
            cleaned.insert(Observation.of(first + slot * step, bucketValues[slot], provenance));
        }
        LOG.info("Resampled {} observations into {} slots at {} ({} observed, {} imputed of which {} filled now, {} missing, policy {})",
                series.size(), buckets, interval, observed, imputedSlots, filled, missing, fillPolicy);
        return new ResampleResult(cleaned, interval, fillPolicy, gaps, observed, imputedSlots, missing);
    }

    /**
     * Reduces the present observations of every bucket. Observed values take precedence over
     * imputed ones sharing a bucket.
     */
    private void fillBuckets(TimeSeries series, long first, long step, double[] bucketValues, Provenance[] bucketProvenances) {
        int[] observedCounts = new int[bucketValues.length];
        int[] imputedCounts = new int[bucketValues.length];
        double[] imputedValues = new double[bucketValues.length];
        for (Observation observation : series) {
            if (!observation.isPresent() || observation.getTimestamp() < first) {
                continue;
            }
            int bucket = (int) ((observation.getTimestamp() - first) / step);
            if (bucket >= bucketValues.length) {
                break;
            }
            double value = observation.getValue();
            if (observation.isObserved()) {
                bucketValues[bucket] = observedCounts[bucket] == 0
                        ? value : bucketAggregation.reduce(bucketValues[bucket], observedCounts[bucket], value);
                observedCounts[bucket]++;
            } else {
                imputedValues[bucket] = imputedCounts[bucket] == 0
                        ? value : bucketAggregation.reduce(imputedValues[bucket], imputedCounts[bucket], value);
                imputedCounts[bucket]++;
            }
        }
        for (int bucket = 0; bucket < bucketValues.length; bucket++) {
            if (observedCounts[bucket] > 0) {
                bucketProvenances[bucket] = Provenance.OBSERVED;
            } else if (imputedCounts[bucket] > 0) {
                bucketValues[bucket] = imputedValues[bucket];
                bucketProvenances[bucket] = Provenance.IMPUTED;
            }
        }
    }

    private static double fillValue(FillPolicy fillPolicy, double[] values, int before, int after, int slot) {
        switch (fillPolicy) {
            case FORWARD_FILL:
                return values[before];
            case LINEAR_INTERPOLATE:
                double fraction = (double) (slot - before) / (after - before);
                return values[before] + (values[after] - values[before]) * fraction;
            case ZERO_FILL:
                return 0.0;
            default:
                throw new IllegalStateException("Fill policy " + fillPolicy + " does not fill slots");
        }
    }

    public BucketAggregation getBucketAggregation() {
        return bucketAggregation;
    }

    public int getMaxFillGap() {
        return maxFillGap;
    }
}
