package gr.imsi.athenarc.tsanalysis.domain;

import java.util.OptionalDouble;

/**
 * The verdict of an anomaly rule on one observation. Immutable once created.
 */
public final class AnomalyReport {

    private final long timestamp;
    private final double value;
    private final double score;
    private final boolean anomaly;
    private final String ruleApplied;
    private final Provenance provenance;
    private final double confidence;

    private AnomalyReport(long timestamp, double value, double score, boolean anomaly, String ruleApplied,
                          Provenance provenance, double confidence) {
        this.timestamp = timestamp;
        this.value = value;
        this.score = score;
        this.anomaly = anomaly;
        this.ruleApplied = ruleApplied;
        this.provenance = provenance;
        this.confidence = confidence;
    }

    public static AnomalyReport scored(Observation observation, double score, boolean anomaly, String ruleApplied, double confidence) {
        return new AnomalyReport(observation.getTimestamp(), observation.getValue(), score, anomaly, ruleApplied,
                observation.getProvenance(), confidence);
    }

    /**
     * Creates the report of an observation whose reference window held no usable value. It carries no
     * score and is never flagged.
     */
    public static AnomalyReport unscored(Observation observation, String ruleApplied, double confidence) {
        return new AnomalyReport(observation.getTimestamp(), observation.getValue(), Double.NaN, false, ruleApplied,
                observation.getProvenance(), confidence);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * Returns the rule score, already weighted by {@link #getConfidence()}, or empty if the
     * reference window was insufficient.
     */
    public OptionalDouble getScore() {
        return Double.isNaN(score) ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public String getRuleApplied() {
        return ruleApplied;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    /**
     * Returns 1 for observed values and the configured imputed confidence for imputed ones.
     */
    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "AnomalyReport{" +
                "timestamp=" + DateTimeUtil.format(timestamp) +
                ", value=" + value +
                ", score=" + (Double.isNaN(score) ? "-" : String.valueOf(score)) +
                ", anomaly=" + anomaly +
                ", rule=" + ruleApplied +
                ", provenance=" + provenance +
                ", confidence=" + confidence +
                '}';
    }
}
