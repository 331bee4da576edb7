package gr.imsi.athenarc.tsanalysis.resample;

import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.MINUTE;
import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.ONE_MINUTE;
import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.at;
import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.minutely;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.Provenance;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientDataException;
import gr.imsi.athenarc.tsanalysis.store.TemporalSeriesStore;

public class ResamplerTest {

    private final Resampler resampler = new Resampler();

    private static List<Observation> toList(TimeSeries series) {
        List<Observation> observations = new ArrayList<>();
        series.forEach(observations::add);
        return observations;
    }

    @Test
    public void testRegularSeriesIsUnchanged() {
        TemporalSeriesStore series = minutely(1.0, 4.0, 2.0, 8.0, 5.0);
        ResampleResult result = resampler.resample(series, ONE_MINUTE, FillPolicy.LINEAR_INTERPOLATE);

        assertEquals(toList(series), toList(result.getSeries()));
        assertEquals(5, result.getObservedCount());
        assertEquals(0, result.getImputedCount());
        assertTrue(result.getGaps().isEmpty());
        assertEquals(ONE_MINUTE, result.getSeries().getSamplingInterval().get());
    }

    @Test
    public void testResamplingTwiceIsIdempotent() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(at(0), 1.0);
        series.insert(at(1) + 10_000, 3.0);
        series.insert(at(4), 7.0);
        ResampleResult once = resampler.resample(series, ONE_MINUTE, FillPolicy.FORWARD_FILL);
        ResampleResult twice = resampler.resample(once.getSeries(), ONE_MINUTE, FillPolicy.FORWARD_FILL);

        assertEquals(toList(once.getSeries()), toList(twice.getSeries()));
    }

    @Test
    public void testForwardFillMarksImputedSlots() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(at(0), 1.0);
        series.insert(at(1), 2.0);
        series.insert(at(3), 4.0);
        ResampleResult result = resampler.resample(series, ONE_MINUTE, FillPolicy.FORWARD_FILL);
        TemporalSeriesStore cleaned = result.getSeries();

        assertEquals(4, cleaned.size());
        assertEquals(Observation.imputed(at(2), 2.0), cleaned.get(2));
        assertEquals(Provenance.OBSERVED, cleaned.get(3).getProvenance());
        assertEquals(3, result.getObservedCount());
        assertEquals(1, result.getImputedCount());
        assertTrue(result.getGaps().contains(at(2)));
        assertFalse(result.getGaps().contains(at(3)));
    }

    @Test
    public void testLinearInterpolation() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(at(0), 0.0);
        series.insert(at(3), 30.0);
        TemporalSeriesStore cleaned = resampler.resample(series, ONE_MINUTE, FillPolicy.LINEAR_INTERPOLATE).getSeries();

        assertEquals(10.0, cleaned.at(at(1)).getValue(), 1e-12);
        assertEquals(20.0, cleaned.at(at(2)).getValue(), 1e-12);
        assertTrue(cleaned.at(at(2)).isImputed());
    }

    @Test
    public void testZeroFill() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(at(0), 5.0);
        series.insert(at(2), 5.0);
        TemporalSeriesStore cleaned = resampler.resample(series, ONE_MINUTE, FillPolicy.ZERO_FILL).getSeries();
        assertEquals(Observation.imputed(at(1), 0.0), cleaned.get(1));
    }

    @Test
    public void testNoFillLeavesMissingSlots() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(at(0), 1.0);
        series.insert(at(3), 4.0);
        ResampleResult result = resampler.resample(series, ONE_MINUTE, FillPolicy.NONE);

        assertEquals(4, result.getSeries().size());
        assertEquals(Provenance.MISSING, result.getSeries().get(1).getProvenance());
        assertEquals(Provenance.MISSING, result.getSeries().get(2).getProvenance());
        assertEquals(2, result.getMissingCount());
        assertEquals(1, result.getGaps().asRanges().size());
    }

    @Test
    public void testMaxFillGapLeavesLongGapsMissing() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(at(0), 1.0);
        series.insert(at(2), 3.0);
        series.insert(at(5), 6.0);
        ResampleResult result = new Resampler(BucketAggregation.MEAN, 1)
                .resample(series, ONE_MINUTE, FillPolicy.LINEAR_INTERPOLATE);

        assertTrue(result.getSeries().at(at(1)).isImputed());
        assertEquals(Provenance.MISSING, result.getSeries().at(at(3)).getProvenance());
        assertEquals(Provenance.MISSING, result.getSeries().at(at(4)).getProvenance());
        assertEquals(2, result.getGaps().asRanges().size());
    }

    @Test
    public void testBucketsAreReduced() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(at(0), 1.0);
        series.insert(at(0) + MINUTE / 2, 3.0);
        series.insert(at(1), 5.0);

        assertEquals(2.0, resampler.resample(series, ONE_MINUTE, FillPolicy.NONE).getSeries().get(0).getValue(), 1e-12);
        assertEquals(3.0, new Resampler(BucketAggregation.MAX_VALUE, 0)
                .resample(series, ONE_MINUTE, FillPolicy.NONE).getSeries().get(0).getValue());
        assertEquals(1.0, new Resampler(BucketAggregation.FIRST_VALUE, 0)
                .resample(series, ONE_MINUTE, FillPolicy.NONE).getSeries().get(0).getValue());
    }

    @Test
    public void testObservedValuesWinOverImputedInABucket() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(Observation.imputed(at(0), 100.0));
        series.insert(Observation.observed(at(0) + 1_000, 2.0));
        series.insert(Observation.observed(at(1), 4.0));
        Observation first = resampler.resample(series, ONE_MINUTE, FillPolicy.NONE).getSeries().get(0);

        assertEquals(Observation.observed(at(0), 2.0), first);
    }

    @Test
    public void testLeadingAndTrailingMissingSlotsAreTrimmed() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(Observation.missing(at(0)));
        series.insert(Observation.observed(at(1), 1.0));
        series.insert(Observation.observed(at(2), 2.0));
        series.insert(Observation.missing(at(3)));
        TemporalSeriesStore cleaned = resampler.resample(series, ONE_MINUTE, FillPolicy.FORWARD_FILL).getSeries();

        assertEquals(2, cleaned.size());
        assertEquals(at(1), cleaned.getFirstTimestamp());
        assertEquals(at(2), cleaned.getLastTimestamp());
    }

    @Test
    public void testTooFewPresentObservations() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(at(0), 1.0);
        series.insert(Observation.missing(at(1)));
        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> resampler.resample(series, ONE_MINUTE, FillPolicy.NONE));
        assertEquals(1, e.getAvailable());
        assertEquals(2, e.getRequired());
    }
}
