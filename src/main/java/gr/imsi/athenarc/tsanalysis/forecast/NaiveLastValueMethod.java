package gr.imsi.athenarc.tsanalysis.forecast;

/**
 * Repeats the last present value. Used as a fallback, it has nothing to fit.
 */
public class NaiveLastValueMethod extends AbstractForecastMethod {

    @Override
    public String getName() {
        return "naive-last-value";
    }

    @Override
    public int getRequiredHistory() {
        return 1;
    }

    @Override
    int initialize(ForecastModel model, SlotSequence slots) {
        model.level = slots.value(0);
        return 1;
    }

    @Override
    void advance(ForecastModel model) {
    }

    @Override
    void absorb(ForecastModel model, double value) {
        model.level = value;
    }

    @Override
    public double forecast(ForecastModel model, int steps) {
        return model.level;
    }
}
