package gr.imsi.athenarc.tsanalysis.anomaly;

/** The anomaly rules that can be selected by configuration. */
public enum AnomalyRuleType {
    Z_SCORE,
    RESIDUAL,
}
