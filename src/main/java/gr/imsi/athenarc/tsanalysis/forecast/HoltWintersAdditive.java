package gr.imsi.athenarc.tsanalysis.forecast;

import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.exception.NonConvergenceException;

/**
 * Additive Holt-Winters: level, trend and one seasonal index per phase, with α, β and γ fitted by
 * minimizing the one-step-ahead squared error. The first season seeds the state.
 */
public class HoltWintersAdditive extends AbstractForecastMethod {

    private static final double[] INITIAL_GUESS = {0.4, 0.1, 0.3};

    private final int period;
    private final SmoothingParameterFitter fitter;

    public HoltWintersAdditive(int period, SmoothingParameterFitter fitter) {
        if (period < 2) {
            throw new IllegalArgumentException("Seasonal period must be at least 2, got " + period);
        }
        this.period = period;
        this.fitter = fitter;
    }

    @Override
    public String getName() {
        return "holt-winters-additive(period=" + period + ")";
    }

    @Override
    public int getRequiredHistory() {
        return 2 * period;
    }

    @Override
    int seasonalPeriod() {
        return period;
    }

    @Override
    double[] fitParameters(SlotSequence slots, SamplingInterval interval) throws NonConvergenceException {
        return fitter.fit(getName(), INITIAL_GUESS,
                parameters -> replay(slots, interval, parameters).getSumSquaredErrors());
    }

    @Override
    int initialize(ForecastModel model, SlotSequence slots) {
        double firstSeason = seasonMean(slots, 0);
        double secondSeason = slots.size() >= 2 * period ? seasonMean(slots, period) : Double.NaN;
        double trend = Double.isNaN(secondSeason) ? 0.0 : (secondSeason - firstSeason) / period;
        double center = (period - 1) / 2.0;
        for (int phase = 0; phase < period; phase++) {
            model.seasonals[phase] = phase < slots.size() && slots.isPresent(phase)
                    ? slots.value(phase) - (firstSeason + (phase - center) * trend)
                    : 0.0;
        }
        // State as of the last slot of the first season
        model.level = firstSeason + center * trend;
        model.trend = trend;
        model.seasonPosition = 0;
        return Math.min(period, slots.size());
    }

    private double seasonMean(SlotSequence slots, int from) {
        double sum = 0.0;
        int count = 0;
        for (int i = from; i < from + period && i < slots.size(); i++) {
            if (slots.isPresent(i)) {
                sum += slots.value(i);
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    @Override
    void advance(ForecastModel model) {
        model.level += model.trend;
        model.seasonPosition = (model.seasonPosition + 1) % period;
    }

    @Override
    void absorb(ForecastModel model, double value) {
        double alpha = model.parameter(0);
        double beta = model.parameter(1);
        double gamma = model.parameter(2);
        int phase = model.seasonPosition;
        double previousLevel = model.level;
        model.level = alpha * (value - model.seasonals[phase]) + (1 - alpha) * (model.level + model.trend);
        model.trend = beta * (model.level - previousLevel) + (1 - beta) * model.trend;
        model.seasonals[phase] = gamma * (value - model.level) + (1 - gamma) * model.seasonals[phase];
        model.seasonPosition = (phase + 1) % period;
    }

    @Override
    public double forecast(ForecastModel model, int steps) {
        return model.level + steps * model.trend + model.seasonals[(model.seasonPosition + steps - 1) % period];
    }

    public int getPeriod() {
        return period;
    }
}
