package gr.imsi.athenarc.tsanalysis.anomaly;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsanalysis.domain.Observation;

/**
 * Decomposes the reference window into trend, seasonal and residual components, predicts the value
 * under test from trend and season, and flags it when the prediction residual exceeds
 * {@code k} residual standard deviations.
 */
public class ResidualRule implements AnomalyRule {

    private static final Logger LOG = LoggerFactory.getLogger(ResidualRule.class);

    private final double k;
    private final int seasonalPeriod;
    private final ZeroVariancePolicy zeroVariancePolicy;

    /**
     * @param k threshold in residual standard deviations
     * @param seasonalPeriod period in slots, 0 or 1 for a non-seasonal decomposition
     * @param zeroVariancePolicy verdict when the residuals have no spread
     */
    public ResidualRule(double k, int seasonalPeriod, ZeroVariancePolicy zeroVariancePolicy) {
        if (!(k > 0) || Double.isInfinite(k)) {
            throw new IllegalArgumentException("k must be a positive number, got " + k);
        }
        if (seasonalPeriod < 0) {
            throw new IllegalArgumentException("Seasonal period must not be negative, got " + seasonalPeriod);
        }
        this.k = k;
        this.seasonalPeriod = seasonalPeriod;
        this.zeroVariancePolicy = zeroVariancePolicy;
    }

    @Override
    public RuleScore score(DetectionContext context, double value) {
        List<Observation> slots = context.getWindowSlots();
        int counted = 0;
        for (Observation slot : slots) {
            if (context.getMode().counts(slot)) {
                counted++;
            }
        }
        if (counted < 2) {
            return RuleScore.unscored();
        }
        double[] positions = new double[counted];
        double[] values = new double[counted];
        int next = 0;
        for (int i = 0; i < slots.size(); i++) {
            Observation slot = slots.get(i);
            if (context.getMode().counts(slot)) {
                positions[next] = i;
                values[next] = slot.getValue();
                next++;
            }
        }
        // A season is only estimated when every phase can be seen twice
        int period = seasonalPeriod >= 2 && counted >= 2 * seasonalPeriod ? seasonalPeriod : 0;
        SeasonalDecomposition decomposition = SeasonalDecomposition.decompose(positions, values, period);
        double expected = decomposition.expectedAt(slots.size());
        double spread = decomposition.getResidualStdDev();
        LOG.trace("Expected {} for {}, residual spread {}", expected, value, spread);
        if (ZeroVariancePolicy.isZeroSpread(spread, expected)) {
            return zeroVariancePolicy.resolve(value, expected);
        }
        double residual = Math.abs(value - expected);
        return RuleScore.of(residual / spread, residual > k * spread);
    }

    @Override
    public String getName() {
        return "residual(k=" + k + ", period=" + seasonalPeriod + ")";
    }

    public double getK() {
        return k;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }
}
