package gr.imsi.athenarc.tsanalysis.forecast;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;
import gr.imsi.athenarc.tsanalysis.exception.InsufficientHistoryException;
import gr.imsi.athenarc.tsanalysis.exception.NonConvergenceException;

/**
 * Skeleton of a recursive forecast method: initialize the state from the leading slots, then replay
 * every later slot through {@link #advance(ForecastModel)} or {@link #absorb(ForecastModel, double)}.
 * <p>
 * Before a present value is absorbed its one-step forecast error is recorded, for observed values only,
 * so imputed values move the state without shaping the prediction intervals.
 */
abstract class AbstractForecastMethod implements ForecastMethod {

    /**
     * Returns the season length this method keeps indices for, 0 if none.
     */
    int seasonalPeriod() {
        return 0;
    }

    /**
     * Chooses the method parameters for {@code slots}, searching if the method has any.
     */
    double[] fitParameters(SlotSequence slots, SamplingInterval interval) throws NonConvergenceException {
        return new double[0];
    }

    /**
     * Sets up the state from the leading slots and returns the index of the first slot to replay.
     */
    abstract int initialize(ForecastModel model, SlotSequence slots);

    /**
     * Moves the state one slot forward without a value.
     */
    abstract void advance(ForecastModel model);

    /**
     * Moves the state one slot forward, correcting it with {@code value}.
     */
    abstract void absorb(ForecastModel model, double value);

    @Override
    public ForecastModel fit(TimeSeries series, SamplingInterval interval) throws NonConvergenceException {
        SlotSequence slots = SlotSequence.of(series, interval);
        if (slots.getPresentCount() < getRequiredHistory()) {
            throw new InsufficientHistoryException(getName(), slots.getPresentCount(), getRequiredHistory());
        }
        return replay(slots, interval, fitParameters(slots, interval));
    }

    ForecastModel replay(SlotSequence slots, SamplingInterval interval, double[] parameters) {
        ForecastModel model = new ForecastModel(this, interval, parameters, seasonalPeriod());
        int next = initialize(model, slots);
        model.position = next - 1;
        for (int i = next; i < slots.size(); i++) {
            step(model, slots.value(i), slots.isImputed(i));
        }
        model.observationCount = slots.getObservedCount();
        model.lastTimestamp = slots.getLastTimestamp();
        return model;
    }

    private void step(ForecastModel model, double value, boolean imputed) {
        if (Double.isNaN(value)) {
            model.position++;
            advance(model);
            return;
        }
        if (!imputed) {
            model.recordError(value - forecast(model, 1));
        }
        model.position++;
        absorb(model, value);
    }

    @Override
    public void update(ForecastModel model, Observation observation) {
        long steps = model.stepsTo(observation.getTimestamp());
        for (long k = 1; k < steps; k++) {
            step(model, Double.NaN, false);
        }
        if (observation.isPresent()) {
            step(model, observation.getValue(), observation.isImputed());
            if (observation.isObserved()) {
                model.observationCount++;
            }
        } else {
            step(model, Double.NaN, false);
        }
        model.lastTimestamp = observation.getTimestamp();
        model.version++;
    }

    @Override
    public String toString() {
        return getName();
    }
}
