package gr.imsi.athenarc.tsanalysis.forecast;

import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.exception.NonConvergenceException;

/**
 * Holt's linear method: a smoothed level and a smoothed trend, with α and β fitted by minimizing the
 * one-step-ahead squared error.
 * <p>
 * The state starts at the first present value with the slope to the second one, so a perfectly
 * linear series is fitted with zero error.
 */
public class DoubleExponentialSmoothing extends AbstractForecastMethod {

    private static final double[] INITIAL_GUESS = {0.5, 0.1};

    private final SmoothingParameterFitter fitter;

    public DoubleExponentialSmoothing(SmoothingParameterFitter fitter) {
        this.fitter = fitter;
    }

    @Override
    public String getName() {
        return "double-exponential-smoothing";
    }

    @Override
    public int getRequiredHistory() {
        return 2;
    }

    @Override
    double[] fitParameters(SlotSequence slots, SamplingInterval interval) throws NonConvergenceException {
        return fitter.fit(getName(), INITIAL_GUESS,
                parameters -> replay(slots, interval, parameters).getSumSquaredErrors());
    }

    @Override
    int initialize(ForecastModel model, SlotSequence slots) {
        int second = slots.nextPresent(0);
        model.level = slots.value(0);
        model.trend = (slots.value(second) - slots.value(0)) / second;
        return 1;
    }

    @Override
    void advance(ForecastModel model) {
        model.level += model.trend;
    }

    @Override
    void absorb(ForecastModel model, double value) {
        double alpha = model.parameter(0);
        double beta = model.parameter(1);
        double previousLevel = model.level;
        model.level = alpha * value + (1 - alpha) * (model.level + model.trend);
        model.trend = beta * (model.level - previousLevel) + (1 - beta) * model.trend;
    }

    @Override
    public double forecast(ForecastModel model, int steps) {
        return model.level + steps * model.trend;
    }
}
