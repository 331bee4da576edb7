package gr.imsi.athenarc.tsanalysis.anomaly;

/**
 * The raw output of an {@link AnomalyRule}: a non-negative score and whether it crosses the rule's
 * threshold. An unscored result means the reference context could not support a verdict.
 */
public final class RuleScore {

    private static final RuleScore UNSCORED = new RuleScore(Double.NaN, false);

    private final double score;
    private final boolean exceedsThreshold;

    private RuleScore(double score, boolean exceedsThreshold) {
        this.score = score;
        this.exceedsThreshold = exceedsThreshold;
    }

    public static RuleScore of(double score, boolean exceedsThreshold) {
        if (Double.isNaN(score) || score < 0) {
            throw new IllegalArgumentException("Score must be a non-negative number, got " + score);
        }
        return new RuleScore(score, exceedsThreshold);
    }

    public static RuleScore unscored() {
        return UNSCORED;
    }

    public boolean isScored() {
        return !Double.isNaN(score);
    }

    public double getScore() {
        return score;
    }

    public boolean exceedsThreshold() {
        return exceedsThreshold;
    }

    @Override
    public String toString() {
        return isScored() ? "RuleScore{score=" + score + ", exceeds=" + exceedsThreshold + '}' : "RuleScore{unscored}";
    }
}
