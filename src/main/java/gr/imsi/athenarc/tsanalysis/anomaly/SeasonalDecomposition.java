package gr.imsi.athenarc.tsanalysis.anomaly;

import gr.imsi.athenarc.tsanalysis.domain.LinearTrend;

/**
 * Additive decomposition of a short window into a linear trend, a periodic seasonal component and a
 * residual. Seasonal indices are the per-phase means of the detrended values, centered on zero.
 */
public final class SeasonalDecomposition {

    private final LinearTrend trend;
    private final double[] seasonal;
    private final double[] residuals;
    private final double residualStdDev;

    private SeasonalDecomposition(LinearTrend trend, double[] seasonal, double[] residuals, double residualStdDev) {
        this.trend = trend;
        this.seasonal = seasonal;
        this.residuals = residuals;
        this.residualStdDev = residualStdDev;
    }

    /**
     * Decomposes values observed at integer positions.
     *
     * @param positions slot positions, strictly increasing
     * @param values the values at those positions
     * @param period seasonal period in slots; values below 2 disable the seasonal component
     */
    public static SeasonalDecomposition decompose(double[] positions, double[] values, int period) {
        LinearTrend trend = LinearTrend.fit(positions, values);
        double[] detrended = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            detrended[i] = values[i] - trend.valueAt(positions[i]);
        }

        double[] seasonal = new double[Math.max(1, period)];
        if (period >= 2) {
            double[] sums = new double[period];
            int[] counts = new int[period];
            for (int i = 0; i < values.length; i++) {
                int phase = phaseOf(positions[i], period);
                sums[phase] += detrended[i];
                counts[phase]++;
            }
            double center = 0.0;
            int phases = 0;
            for (int phase = 0; phase < period; phase++) {
                if (counts[phase] > 0) {
                    seasonal[phase] = sums[phase] / counts[phase];
                    center += seasonal[phase];
                    phases++;
                }
            }
            center = phases == 0 ? 0.0 : center / phases;
            for (int phase = 0; phase < period; phase++) {
                if (counts[phase] > 0) {
                    seasonal[phase] -= center;
                }
            }
        }

        double[] residuals = new double[values.length];
        double squares = 0.0;
        for (int i = 0; i < values.length; i++) {
            residuals[i] = detrended[i] - seasonal[phaseOf(positions[i], seasonal.length)];
            squares += residuals[i] * residuals[i];
        }
        // Two degrees of freedom go to the trend line
        double residualStdDev = values.length > 2 ? Math.sqrt(squares / (values.length - 2)) : 0.0;
        return new SeasonalDecomposition(trend, seasonal, residuals, residualStdDev);
    }

    private static int phaseOf(double position, int period) {
        return (int) Math.floorMod((long) position, (long) period);
    }

    /**
     * Returns trend plus seasonal component at {@code position}.
     */
    public double expectedAt(double position) {
        return trend.valueAt(position) + seasonal[phaseOf(position, seasonal.length)];
    }

    public LinearTrend getTrend() {
        return trend;
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    public double[] getResiduals() {
        return residuals.clone();
    }

    public double getResidualStdDev() {
        return residualStdDev;
    }
}
