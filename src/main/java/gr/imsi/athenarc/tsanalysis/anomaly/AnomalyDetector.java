package gr.imsi.athenarc.tsanalysis.anomaly;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsanalysis.domain.AnomalyReport;
import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;
import gr.imsi.athenarc.tsanalysis.stats.RollingStatisticsEngine;
import gr.imsi.athenarc.tsanalysis.stats.StatisticsMode;
import gr.imsi.athenarc.tsanalysis.stats.WindowSpec;

/**
 * Flags observations that deviate from the window preceding them, using a pluggable {@link AnomalyRule}.
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final double DEFAULT_IMPUTED_CONFIDENCE = 0.5;

    private final AnomalyRule rule;
    private final RollingStatisticsEngine engine;
    private final int minHistory;
    private final double imputedConfidence;

    /**
     * Creates a detector over a count window of {@code windowSize} slots that activates once
     * {@code windowSize} values have been seen.
     */
    public AnomalyDetector(AnomalyRule rule, int windowSize) {
        this(rule, WindowSpec.ofCount(windowSize), StatisticsMode.RAW, windowSize, DEFAULT_IMPUTED_CONFIDENCE);
    }

    /**
     * @param rule the scoring rule
     * @param windowSpec the reference window preceding each tested observation
     * @param mode which slots count as values of the reference window
     * @param minHistory counted values required before the first report
     * @param imputedConfidence weight of scores of imputed observations, in (0, 1]
     */
    public AnomalyDetector(AnomalyRule rule, WindowSpec windowSpec, StatisticsMode mode, int minHistory, double imputedConfidence) {
        if (rule == null) {
            throw new IllegalArgumentException("Anomaly rule must not be null");
        }
        if (minHistory < 0) {
            throw new IllegalArgumentException("Min history must not be negative, got " + minHistory);
        }
        if (!(imputedConfidence > 0.0 && imputedConfidence <= 1.0)) {
            throw new IllegalArgumentException("Imputed confidence must be in (0, 1], got " + imputedConfidence);
        }
        this.rule = rule;
        this.engine = new RollingStatisticsEngine(windowSpec, mode, new double[0]);
        this.minHistory = minHistory;
        this.imputedConfidence = imputedConfidence;
    }

    /**
     * Runs the detector over {@code series}.
     *
     * @return one report per present observation after warm-up, in time order
     */
    public List<AnomalyReport> detect(TimeSeries series) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        DetectionRun run = newRun();
        ImmutableList.Builder<AnomalyReport> reports = ImmutableList.builder();
        int flagged = 0;
        for (Observation observation : series) {
            Optional<AnomalyReport> report = run.offer(observation);
            if (report.isPresent()) {
                reports.add(report.get());
                if (report.get().isAnomaly()) {
                    flagged++;
                }
            }
        }
        LOG.info("Detected {} anomalies in {} slots with {} in {}", flagged, series.size(), rule.getName(), stopwatch.stop());
        return reports.build();
    }

    public DetectionRun newRun() {
        return new DetectionRun(this, engine.newCursor());
    }

    public AnomalyRule getRule() {
        return rule;
    }

    public WindowSpec getWindowSpec() {
        return engine.getWindowSpec();
    }

    public StatisticsMode getMode() {
        return engine.getMode();
    }

    public int getMinHistory() {
        return minHistory;
    }

    public double getImputedConfidence() {
        return imputedConfidence;
    }
}
