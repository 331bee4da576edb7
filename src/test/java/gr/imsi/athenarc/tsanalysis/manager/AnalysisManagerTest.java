package gr.imsi.athenarc.tsanalysis.manager;

import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsanalysis.config.AnalysisConfiguration;
import gr.imsi.athenarc.tsanalysis.domain.AnomalyReport;
import gr.imsi.athenarc.tsanalysis.domain.ForecastResult;
import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientDataException;
import gr.imsi.athenarc.tsanalysis.exception.OutOfOrderException;
import gr.imsi.athenarc.tsanalysis.resample.FillPolicy;

public class AnalysisManagerTest {

    /**
     * A five-slot cycle around 52 with a spike at slot 40 and slot 30 never reported.
     */
    private static List<Observation> cycleWithSpike() {
        List<Observation> pairs = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            if (i == 30) {
                continue;
            }
            pairs.add(Observation.observed(at(i), i == 40 ? 90.0 : 50.0 + (i * 7) % 5));
        }
        return pairs;
    }

    @Test
    public void testEndToEnd() {
        AnalysisManager manager = AnalysisManager.builder().withParallelism(1).build();
        AnalysisResults results = manager.analyze("cpu", cycleWithSpike());

        assertEquals("cpu", results.getSeriesId());
        assertEquals(60, results.getResampleResult().getSeries().size());
        assertEquals(1, results.getResampleResult().getMissingCount());
        assertEquals(59, results.getDescriptiveStats().getCount());
        assertTrue(results.getTrend().isPresent());

        List<AnomalyReport> flagged = results.getFlaggedAnomalies();
        assertEquals(1, flagged.size());
        assertEquals(at(40), flagged.get(0).getTimestamp());
        assertEquals(90.0, flagged.get(0).getValue());

        List<ForecastResult> forecasts = results.getForecasts();
        assertEquals(10, forecasts.size());
        assertEquals(at(60), forecasts.get(0).getHorizonTimestamp());
        for (ForecastResult forecast : forecasts) {
            assertTrue(forecast.getLowerBound() <= forecast.getPointEstimate());
            assertTrue(forecast.getPointEstimate() <= forecast.getUpperBound());
        }
        assertTrue(results.getForecastModel().isPresent());
    }

    @Test
    public void testFilledSlotIsImputed() {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder()
                .fillPolicy(FillPolicy.LINEAR_INTERPOLATE)
                .build();
        AnalysisResults results = AnalysisManager.builder().withConfiguration(configuration).build()
                .analyze("cpu", cycleWithSpike());

        assertEquals(0, results.getResampleResult().getMissingCount());
        assertEquals(1, results.getResampleResult().getImputedCount());
        assertTrue(results.getResampleResult().getSeries().get(30).isImputed());
    }

    @Test
    public void testShortSeriesSkipsForecast() {
        List<Observation> pairs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            pairs.add(Observation.observed(at(i), i));
        }
        AnalysisResults results = AnalysisManager.createDefault().analyze("short", pairs);

        assertTrue(results.getForecasts().isEmpty());
        assertTrue(results.getFlaggedAnomalies().isEmpty());
        assertEquals(1.0, results.getTrend().get().getSlope(), 1e-12);
    }

    @Test
    public void testAnalyzeAllKeepsInputOrder() {
        Map<String, List<Observation>> series = new LinkedHashMap<>();
        series.put("zeta", cycleWithSpike());
        series.put("alpha", cycleWithSpike());
        series.put("mu", cycleWithSpike());

        Map<String, AnalysisResults> results = AnalysisManager.builder().withParallelism(3).build().analyzeAll(series);

        assertEquals(List.of("zeta", "alpha", "mu"), new ArrayList<>(results.keySet()));
        for (Map.Entry<String, AnalysisResults> entry : results.entrySet()) {
            assertEquals(entry.getKey(), entry.getValue().getSeriesId());
            assertEquals(1, entry.getValue().getFlaggedAnomalies().size());
        }
    }

    @Test
    public void testFailuresPropagate() {
        AnalysisManager manager = AnalysisManager.createDefault();
        assertThrows(InsufficientDataException.class,
                () -> manager.analyze("single", List.of(Observation.observed(at(0), 1.0))));
        assertThrows(OutOfOrderException.class,
                () -> manager.analyze("unordered", List.of(Observation.observed(at(1), 1.0), Observation.observed(at(0), 2.0))));

        Map<String, List<Observation>> series = new LinkedHashMap<>();
        series.put("ok", cycleWithSpike());
        series.put("single", List.of(Observation.observed(at(0), 1.0)));
        assertThrows(InsufficientDataException.class, () -> manager.analyzeAll(series));
    }

    @Test
    public void testInvalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisManager.builder().withParallelism(0));
    }
}
