package gr.imsi.athenarc.tsanalysis.anomaly;

import gr.imsi.athenarc.tsanalysis.domain.StatSnapshot;

/**
 * Flags a value when {@code |value - mean| > k * stdDev} of the reference window.
 * The score is the distance from the mean in standard deviations.
 */
public class ZScoreRule implements AnomalyRule {

    public static final double DEFAULT_K = 3.0;

    private final double k;
    private final ZeroVariancePolicy zeroVariancePolicy;

    public ZScoreRule() {
        this(DEFAULT_K, ZeroVariancePolicy.FLAG_ANY_DEVIATION);
    }

    public ZScoreRule(double k, ZeroVariancePolicy zeroVariancePolicy) {
        if (!(k > 0) || Double.isInfinite(k)) {
            throw new IllegalArgumentException("k must be a positive number, got " + k);
        }
        this.k = k;
        this.zeroVariancePolicy = zeroVariancePolicy;
    }

    @Override
    public RuleScore score(DetectionContext context, double value) {
        StatSnapshot reference = context.getReference();
        if (reference.isInsufficient()) {
            return RuleScore.unscored();
        }
        double mean = reference.getMean().getAsDouble();
        double stdDev = reference.getStdDev().getAsDouble();
        if (ZeroVariancePolicy.isZeroSpread(stdDev, mean)) {
            return zeroVariancePolicy.resolve(value, mean);
        }
        double deviation = Math.abs(value - mean);
        return RuleScore.of(deviation / stdDev, deviation > k * stdDev);
    }

    @Override
    public String getName() {
        return "z-score(k=" + k + ")";
    }

    public double getK() {
        return k;
    }
}
