package gr.imsi.athenarc.tsanalysis.forecast;

import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Ordinary least squares line over every present slot, extrapolated forward. The regression sums are
 * kept in the model so updates stay O(1).
 */
public class LinearRegressionMethod extends AbstractForecastMethod {

    @Override
    public String getName() {
        return "linear-regression";
    }

    @Override
    public int getRequiredHistory() {
        return 2;
    }

    @Override
    int initialize(ForecastModel model, SlotSequence slots) {
        SimpleRegression regression = new SimpleRegression();
        int second = slots.nextPresent(0);
        regression.addData(0, slots.value(0));
        regression.addData(second, slots.value(second));
        model.regression = regression;
        refresh(model, second);
        return second + 1;
    }

    @Override
    void advance(ForecastModel model) {
        model.level += model.trend;
    }

    @Override
    void absorb(ForecastModel model, double value) {
        model.regression.addData(model.position, value);
        refresh(model, model.position);
    }

    private static void refresh(ForecastModel model, long position) {
        model.trend = model.regression.getSlope();
        model.level = model.regression.predict(position);
    }

    @Override
    public double forecast(ForecastModel model, int steps) {
        return model.level + steps * model.trend;
    }
}
