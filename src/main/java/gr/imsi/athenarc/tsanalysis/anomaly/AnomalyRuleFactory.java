package gr.imsi.athenarc.tsanalysis.anomaly;

import gr.imsi.athenarc.tsanalysis.config.AnalysisConfiguration;

public class AnomalyRuleFactory {

    private AnomalyRuleFactory() {
    }

    public static AnomalyRule createRule(AnalysisConfiguration configuration) {
        return createRule(configuration.getAnomalyRule(), configuration.getAnomalyK(),
                configuration.getSeasonalPeriod(), configuration.getZeroVariancePolicy());
    }

    public static AnomalyRule createRule(AnomalyRuleType type, double k, int seasonalPeriod, ZeroVariancePolicy zeroVariancePolicy) {
        switch (type) {
            case Z_SCORE:
                return new ZScoreRule(k, zeroVariancePolicy);
            case RESIDUAL:
                return new ResidualRule(k, seasonalPeriod, zeroVariancePolicy);
            default:
                throw new IllegalArgumentException("Unsupported anomaly rule: " + type);
        }
    }
}
