package gr.imsi.athenarc.tsanalysis.anomaly;

/**
 * Lifecycle of a detection run. {@code ACTIVE} is terminal.
 */
public enum DetectionState {
    WARMING_UP,
    ACTIVE
}
