package gr.imsi.athenarc.tsanalysis.forecast;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;
import gr.imsi.athenarc.tsanalysis.exception.NonConvergenceException;

/**
 * A forecasting strategy. Implementations keep all of their state in the {@link ForecastModel} they
 * produce, so one method instance can serve any number of series.
 */
public interface ForecastMethod {

    String getName();

    /**
     * Returns the fewest present slots this method can be fitted on.
     */
    int getRequiredHistory();

    /**
     * Fits a model to {@code series}, treating it as regular with step {@code interval}.
     *
     * @throws NonConvergenceException if the parameter search exhausts its evaluation budget
     */
    ForecastModel fit(TimeSeries series, SamplingInterval interval) throws NonConvergenceException;

    /**
     * Absorbs one observation newer than the model's last timestamp in O(1) per elapsed slot.
     */
    void update(ForecastModel model, Observation observation);

    /**
     * Returns the point forecast {@code steps} slots past the model's last timestamp.
     */
    double forecast(ForecastModel model, int steps);
}
