package gr.imsi.athenarc.tsanalysis.domain;

import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsanalysis.exception.InsufficientDataException;
import gr.imsi.athenarc.tsanalysis.store.TemporalSeriesStore;

public class DescriptiveStatsTest {

    @Test
    public void testSummary() {
        DescriptiveStats stats = DescriptiveStats.of(1, 2, 3, 4, 5);
        assertEquals(5, stats.getCount());
        assertEquals(3.0, stats.getMean(), 1e-10);
        assertEquals(Math.sqrt(2.0), stats.getStdDev(), 1e-10);
        assertEquals(1.0, stats.getMin());
        assertEquals(5.0, stats.getMax());
    }

    @Test
    public void testImputedValuesAreOptIn() {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(Observation.observed(at(0), 2.0));
        series.insert(Observation.imputed(at(1), 10.0));
        series.insert(Observation.missing(at(2)));
        series.insert(Observation.observed(at(3), 4.0));

        assertEquals(3.0, DescriptiveStats.of(series, false).getMean(), 1e-12);
        assertEquals(2, DescriptiveStats.of(series, false).getCount());
        assertEquals(16.0 / 3, DescriptiveStats.of(series, true).getMean(), 1e-12);
    }

    @Test
    public void testEmptyInput() {
        assertThrows(InsufficientDataException.class, () -> DescriptiveStats.of(new double[0]));
        TemporalSeriesStore series = TemporalSeriesStore.create();
        series.insert(Observation.missing(at(0)));
        assertThrows(InsufficientDataException.class, () -> DescriptiveStats.of(series, true));
    }
}
