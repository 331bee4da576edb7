package gr.imsi.athenarc.tsanalysis.anomaly;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsanalysis.domain.AnomalyReport;
import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.StatSnapshot;
import gr.imsi.athenarc.tsanalysis.stats.RollingStatisticsEngine;

/**
 * One pass of an {@link AnomalyDetector} over a series, fed one slot at a time.
 * <p>
 * Each observation is scored against the window that ends right before it, then admitted to that
 * window. Not thread-safe.
 */
public class DetectionRun {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionRun.class);

    private final AnomalyDetector detector;
    private final RollingStatisticsEngine.WindowCursor cursor;
    private DetectionState state = DetectionState.WARMING_UP;
    private int history;

    DetectionRun(AnomalyDetector detector, RollingStatisticsEngine.WindowCursor cursor) {
        this.detector = detector;
        this.cursor = cursor;
    }

    /**
     * Scores {@code observation} and admits it to the reference window.
     *
     * @return the report, or empty for missing slots and while warming up
     */
    public Optional<AnomalyReport> offer(Observation observation) {
        Optional<AnomalyReport> report = Optional.empty();
        if (observation.isPresent()) {
            if (state == DetectionState.WARMING_UP && history >= detector.getMinHistory()) {
                state = DetectionState.ACTIVE;
                LOG.debug("Detection active at {} after {} values", observation.getTimestamp(), history);
            }
            if (state == DetectionState.ACTIVE) {
                report = Optional.of(score(observation));
            }
        }
        cursor.advance(observation);
        if (detector.getMode().counts(observation)) {
            history++;
        }
        return report;
    }

    private AnomalyReport score(Observation observation) {
        AnomalyRule rule = detector.getRule();
        boolean imputed = observation.isImputed();
        double confidence = imputed ? detector.getImputedConfidence() : 1.0;
        Optional<StatSnapshot> reference = cursor.current();
        if (reference.isEmpty() || reference.get().isInsufficient()) {
            return AnomalyReport.unscored(observation, rule.getName(), confidence);
        }
        DetectionContext context = new DetectionContext(reference.get(), cursor.windowSlots(), detector.getMode());
        RuleScore ruleScore = rule.score(context, observation.getValue());
        if (!ruleScore.isScored()) {
            return AnomalyReport.unscored(observation, rule.getName(), confidence);
        }
        if (imputed && rule.supportsConfidenceWeighting()) {
            return AnomalyReport.scored(observation, ruleScore.getScore() * confidence, false, rule.getName(), confidence);
        }
        if (ruleScore.exceedsThreshold()) {
            LOG.debug("Anomaly at {}: value {} scored {}", observation.getTimestamp(), observation.getValue(), ruleScore.getScore());
        }
        return AnomalyReport.scored(observation, ruleScore.getScore(), ruleScore.exceedsThreshold(), rule.getName(), confidence);
    }

    public DetectionState getState() {
        return state;
    }

    /**
     * Returns the number of values counted so far under the detector's statistics mode.
     */
    public int getHistory() {
        return history;
    }
}
