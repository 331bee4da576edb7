package gr.imsi.athenarc.tsanalysis.forecast;

public class ForecastMethodFactory {

    private ForecastMethodFactory() {
    }

    /**
     * @param type the method to create
     * @param seasonalPeriod season length in slots, used by seasonal methods only
     * @param maxEvaluations objective evaluation budget of smoothing parameter searches
     */
    public static ForecastMethod createMethod(ForecastMethodType type, int seasonalPeriod, int maxEvaluations) {
        switch (type) {
            case DOUBLE_EXPONENTIAL_SMOOTHING:
                return new DoubleExponentialSmoothing(new SmoothingParameterFitter(maxEvaluations));
            case HOLT_WINTERS_ADDITIVE:
                return new HoltWintersAdditive(seasonalPeriod, new SmoothingParameterFitter(maxEvaluations));
            case LINEAR_REGRESSION:
                return new LinearRegressionMethod();
            case NAIVE_LAST_VALUE:
                return new NaiveLastValueMethod();
            case NAIVE_MEAN:
                return new NaiveMeanMethod();
            default:
                throw new IllegalArgumentException("Unsupported forecast method: " + type);
        }
    }
}
