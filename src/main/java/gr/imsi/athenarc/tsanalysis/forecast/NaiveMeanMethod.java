package gr.imsi.athenarc.tsanalysis.forecast;

/**
 * Forecasts the running mean of all present values.
 */
public class NaiveMeanMethod extends AbstractForecastMethod {

    @Override
    public String getName() {
        return "naive-mean";
    }

    @Override
    public int getRequiredHistory() {
        return 1;
    }

    @Override
    int initialize(ForecastModel model, SlotSequence slots) {
        model.level = slots.value(0);
        model.valueCount = 1;
        return 1;
    }

    @Override
    void advance(ForecastModel model) {
    }

    @Override
    void absorb(ForecastModel model, double value) {
        model.valueCount++;
        model.level += (value - model.level) / model.valueCount;
    }

    @Override
    public double forecast(ForecastModel model, int steps) {
        return model.level;
    }
}
