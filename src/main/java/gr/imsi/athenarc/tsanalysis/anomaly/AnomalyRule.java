package gr.imsi.athenarc.tsanalysis.anomaly;

/**
 * Scores an observation against its local statistical context.
 */
public interface AnomalyRule {

    /**
     * Scores {@code value} against {@code context}.
     *
     * @param context the reference window preceding the value
     * @param value the value under test
     * @return the score, unscored if the context cannot support a verdict
     */
    RuleScore score(DetectionContext context, double value);

    /**
     * Gets a short name recorded in every report this rule produces.
     */
    String getName();

    /**
     * Whether imputed values receive a weighted score instead of a binary verdict.
     */
    default boolean supportsConfidenceWeighting() {
        return true;
    }
}
