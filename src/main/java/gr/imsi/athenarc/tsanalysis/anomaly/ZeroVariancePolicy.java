package gr.imsi.athenarc.tsanalysis.anomaly;

/**
 * Verdict for a value tested against a reference whose spread is zero. A value equal to the
 * reference center (within a relative tolerance of 1e-9) is never flagged under either policy.
 */
public enum ZeroVariancePolicy {
    /** Any other value is flagged with an infinite score. */
    FLAG_ANY_DEVIATION,
    /** Nothing is flagged, scores are 0. */
    NEVER_FLAG;

    private static final double SPREAD_TOLERANCE = 1e-12;
    private static final double EQUALITY_TOLERANCE = 1e-9;

    /**
     * Returns true if {@code spread} is indistinguishable from zero at the scale of {@code center}.
     */
    public static boolean isZeroSpread(double spread, double center) {
        return spread <= SPREAD_TOLERANCE * Math.max(1.0, Math.abs(center));
    }

    public RuleScore resolve(double value, double center) {
        if (this == NEVER_FLAG || Math.abs(value - center) <= EQUALITY_TOLERANCE * Math.max(1.0, Math.abs(center))) {
            return RuleScore.of(0.0, false);
        }
        return RuleScore.of(Double.POSITIVE_INFINITY, true);
    }
}
