package gr.imsi.athenarc.tsanalysis.forecast;

/** The forecast methods that can be selected by configuration. */
public enum ForecastMethodType {
    DOUBLE_EXPONENTIAL_SMOOTHING,
    HOLT_WINTERS_ADDITIVE,
    LINEAR_REGRESSION,
    NAIVE_LAST_VALUE,
    NAIVE_MEAN,
}
