package gr.imsi.athenarc.tsanalysis.forecast;

import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.at;
import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.linear;
import static gr.imsi.athenarc.tsanalysis.SeriesFixtures.minutely;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsanalysis.domain.ForecastResult;
import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientHistoryException;
import gr.imsi.athenarc.tsanalysis.exception.NonConvergenceException;
import gr.imsi.athenarc.tsanalysis.exception.OutOfOrderException;
import gr.imsi.athenarc.tsanalysis.store.TemporalSeriesStore;

public class ForecasterTest {

    private static final double[] SEASON = {3, -1, -3, 1};

    private static Forecaster holt(int maxEvaluations) {
        return new Forecaster(new DoubleExponentialSmoothing(new SmoothingParameterFitter(maxEvaluations)),
                new NaiveLastValueMethod(), 0.95, 10);
    }

    private static TemporalSeriesStore noisy(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = 5 * Math.sin(i) + 0.3 * i;
        }
        return minutely(values);
    }

    @Test
    public void testLinearSeriesIsFittedExactly() throws NonConvergenceException {
        Forecaster forecaster = holt(SmoothingParameterFitter.DEFAULT_MAX_EVALUATIONS);
        ForecastModel model = forecaster.fit(minutely(linear(20, 3, 2)));

        assertEquals(2.0, model.getTrend(), 1e-9);
        assertEquals(41.0, model.getLevel(), 1e-9);
        assertEquals(0.0, model.getResidualVariance(), 1e-12);
        assertEquals(20, model.getObservationCount());
        assertEquals(0, model.getVersion());

        List<ForecastResult> results = forecaster.forecast(model, 3);
        assertEquals(3, results.size());
        ForecastResult first = results.get(0);
        assertEquals(at(20), first.getHorizonTimestamp());
        assertEquals(1, first.getHorizonStep());
        assertEquals(43.0, first.getPointEstimate(), 1e-9);
        assertEquals(first.getPointEstimate(), first.getLowerBound(), 1e-6);
        assertEquals(first.getPointEstimate(), first.getUpperBound(), 1e-6);
        assertEquals(47.0, results.get(2).getPointEstimate(), 1e-9);
        assertEquals(at(22), results.get(2).getHorizonTimestamp());
    }

    @Test
    public void testShortHistoryIsRejected() {
        InsufficientHistoryException e = assertThrows(InsufficientHistoryException.class,
                () -> holt(100).fit(minutely(1, 2, 3, 4, 5)));
        assertEquals(5, e.getAvailable());
        assertEquals(10, e.getRequired());
    }

    @Test
    public void testExhaustedBudgetFallsBack() {
        Forecaster forecaster = holt(3);
        TemporalSeriesStore series = noisy(30);

        NonConvergenceException e = assertThrows(NonConvergenceException.class, () -> forecaster.fit(series));
        assertEquals(3, e.getEvaluationBudget());

        List<ForecastResult> results = forecaster.forecastWithFallback(series, 2);
        assertEquals("naive-last-value", results.get(0).getMethod());
        assertEquals(series.get(29).getValue(), results.get(0).getPointEstimate());
        assertEquals(series.get(29).getValue(), results.get(1).getPointEstimate());
    }

    @Test
    public void testSearchConvergesOnNoisySeries() throws NonConvergenceException {
        ForecastModel model = holt(SmoothingParameterFitter.DEFAULT_MAX_EVALUATIONS).fit(noisy(60));
        for (double parameter : model.getParameters()) {
            assertTrue(parameter >= 0.0 && parameter <= 1.0);
        }
        assertTrue(model.getResidualVariance() > 0.0);
    }

    @Test
    public void testBoundsWidenWithHorizon() throws NonConvergenceException {
        Forecaster forecaster = new Forecaster(new NaiveLastValueMethod(), new NaiveMeanMethod(), 0.95, 10);
        ForecastModel model = forecaster.fit(minutely(1, 3, 1, 3, 1, 3, 1, 3, 1, 3));
        List<ForecastResult> results = forecaster.forecast(model, 4);

        assertEquals(4.0, model.getResidualVariance(), 1e-12);
        assertEquals(3.0, results.get(0).getPointEstimate());
        assertEquals(3.0 + 1.959964 * 2, results.get(0).getUpperBound(), 1e-5);
        assertEquals(3.0 - 1.959964 * 4, results.get(3).getLowerBound(), 1e-5);
    }

    @Test
    public void testUpdateAdvancesStateAndVersion() throws NonConvergenceException {
        Forecaster forecaster = holt(SmoothingParameterFitter.DEFAULT_MAX_EVALUATIONS);
        ForecastModel model = forecaster.fit(minutely(linear(20, 3, 2)));

        forecaster.update(model, Observation.observed(at(20), 43.0));
        assertEquals(1, model.getVersion());
        assertEquals(21, model.getObservationCount());
        ForecastResult next = forecaster.forecast(model, 1).get(0);
        assertEquals(45.0, next.getPointEstimate(), 1e-9);
        assertEquals(at(21), next.getHorizonTimestamp());
        assertEquals(1, next.getModelStateVersion());

        assertThrows(OutOfOrderException.class, () -> forecaster.update(model, Observation.observed(at(20), 1.0)));
    }

    @Test
    public void testMissingSlotAdvancesWithoutCorrection() throws NonConvergenceException {
        Forecaster forecaster = holt(SmoothingParameterFitter.DEFAULT_MAX_EVALUATIONS);
        ForecastModel model = forecaster.fit(minutely(linear(20, 3, 2)));

        forecaster.update(model, Observation.missing(at(20)));
        assertEquals(43.0, model.getLevel(), 1e-9);
        assertEquals(20, model.getObservationCount());
        assertEquals(1, model.getVersion());
        assertEquals(at(20), model.getLastTimestamp());
    }

    @Test
    public void testImputedValueLeavesResidualVarianceUntouched() throws NonConvergenceException {
        Forecaster forecaster = new Forecaster(new NaiveLastValueMethod(), new NaiveMeanMethod(), 0.95, 10);
        ForecastModel model = forecaster.fit(noisy(20));
        double variance = model.getResidualVariance();

        forecaster.update(model, Observation.imputed(at(20), 1000.0));
        assertEquals(variance, model.getResidualVariance());
        assertEquals(1000.0, model.getLevel());
    }

    @Test
    public void testRefitSupersedesVersion() throws NonConvergenceException {
        Forecaster forecaster = holt(SmoothingParameterFitter.DEFAULT_MAX_EVALUATIONS);
        ForecastModel model = forecaster.fit(minutely(linear(20, 3, 2)));
        forecaster.update(model, Observation.observed(at(20), 43.0));

        ForecastModel refitted = forecaster.refit(model, minutely(linear(21, 3, 2)));
        assertEquals(2, refitted.getVersion());
        assertEquals(43.0, refitted.getLevel(), 1e-9);
    }

    @Test
    public void testHoltWintersFollowsSeasonAndTrend() throws NonConvergenceException {
        double[] values = new double[24];
        for (int i = 0; i < values.length; i++) {
            values[i] = 10 + 0.5 * i + SEASON[i % 4];
        }
        Forecaster forecaster = new Forecaster(new HoltWintersAdditive(4, new SmoothingParameterFitter()),
                new NaiveLastValueMethod(), 0.95, 8);
        List<ForecastResult> results = forecaster.forecast(minutely(values), 4);

        for (int k = 0; k < 4; k++) {
            assertEquals(10 + 0.5 * (24 + k) + SEASON[k], results.get(k).getPointEstimate(), 1e-6);
        }
    }

    @Test
    public void testLinearRegressionSkipsMissingSlots() throws NonConvergenceException {
        double[] values = linear(15, 1, 0.5);
        values[7] = Double.NaN;
        Forecaster forecaster = new Forecaster(new LinearRegressionMethod(), new NaiveLastValueMethod(), 0.95, 10);
        ForecastModel model = forecaster.fit(minutely(values));

        assertEquals(14, model.getObservationCount());
        assertEquals(8.5, forecaster.forecast(model, 1).get(0).getPointEstimate(), 1e-9);
    }

    @Test
    public void testNaiveMean() throws NonConvergenceException {
        Forecaster forecaster = new Forecaster(new NaiveMeanMethod(), new NaiveLastValueMethod(), 0.9, 10);
        ForecastResult result = forecaster.forecast(minutely(linear(10, 1, 1)), 1).get(0);
        assertEquals(5.5, result.getPointEstimate(), 1e-12);
        assertEquals("naive-mean", result.getMethod());
    }

    @Test
    public void testHorizonUsesInferredSpacing() throws NonConvergenceException {
        TemporalSeriesStore series = TemporalSeriesStore.create();
        double[] values = linear(12, 0, 1);
        for (int i = 0; i < values.length; i++) {
            series.insert(at(i), values[i]);
        }
        ForecastResult result = holt(SmoothingParameterFitter.DEFAULT_MAX_EVALUATIONS).forecast(series, 1).get(0);
        assertEquals(at(12), result.getHorizonTimestamp());
        assertEquals(12.0, result.getPointEstimate(), 1e-9);
    }

    @Test
    public void testMethodFactory() {
        assertTrue(ForecastMethodFactory.createMethod(ForecastMethodType.NAIVE_MEAN, 0, 10) instanceof NaiveMeanMethod);
        ForecastMethod seasonal = ForecastMethodFactory.createMethod(ForecastMethodType.HOLT_WINTERS_ADDITIVE, 12, 10);
        assertEquals(24, seasonal.getRequiredHistory());
        assertThrows(IllegalArgumentException.class,
                () -> ForecastMethodFactory.createMethod(ForecastMethodType.HOLT_WINTERS_ADDITIVE, 1, 10));
    }
}
