package gr.imsi.athenarc.tsanalysis.domain;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import gr.imsi.athenarc.tsanalysis.exception.InsufficientDataException;

/**
 * Ordinary least squares line {@code y = intercept + slope * x} fitted to a series of values,
 * with its goodness of fit.
 */
public final class LinearTrend {

    private static final double EPSILON = 1e-12;

    private final double slope;
    private final double intercept;
    private final double rSquared;
    private final double mse;
    private final double[] fitted;
    private final double lastPosition;

    private LinearTrend(double slope, double intercept, double rSquared, double mse, double[] fitted, double lastPosition) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.mse = mse;
        this.fitted = fitted;
        this.lastPosition = lastPosition;
    }

    /**
     * Fits values observed at positions {@code 0, 1, ..., n - 1}.
     */
    public static LinearTrend fit(double[] values) {
        double[] positions = new double[values.length];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i;
        }
        return fit(positions, values);
    }

    /**
     * Fits values observed at arbitrary, distinct positions.
     *
     * @throws InsufficientDataException if fewer than 2 points are given
     */
    public static LinearTrend fit(double[] positions, double[] values) {
        if (positions.length != values.length) {
            throw new IllegalArgumentException("Positions and values differ in length");
        }
        if (values.length < 2) {
            throw new InsufficientDataException("Linear regression", values.length, 2);
        }
        SimpleRegression regression = new SimpleRegression();
        double meanValue = 0.0;
        for (int i = 0; i < values.length; i++) {
            regression.addData(positions[i], values[i]);
            meanValue += (values[i] - meanValue) / (i + 1);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        if (Double.isNaN(slope)) {
            // All positions coincide
            slope = 0.0;
            intercept = meanValue;
        }

        double[] fitted = new double[values.length];
        double residualSum = 0.0;
        double totalSum = 0.0;
        double lastPosition = positions[0];
        for (int i = 0; i < values.length; i++) {
            fitted[i] = intercept + slope * positions[i];
            residualSum += (values[i] - fitted[i]) * (values[i] - fitted[i]);
            totalSum += (values[i] - meanValue) * (values[i] - meanValue);
            lastPosition = Math.max(lastPosition, positions[i]);
        }
        double rSquared = Math.abs(totalSum) < EPSILON ? 1.0 : 1.0 - residualSum / totalSum;
        return new LinearTrend(slope, intercept, rSquared, residualSum / values.length, fitted, lastPosition);
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getRSquared() {
        return rSquared;
    }

    /**
     * Returns the mean squared error of the fitted values.
     */
    public double getMse() {
        return mse;
    }

    public double[] getFitted() {
        return fitted.clone();
    }

    public double valueAt(double position) {
        return intercept + slope * position;
    }

    /**
     * Extrapolates the line {@code periods} steps past the last fitted position.
     */
    public double[] predict(int periods) {
        double[] predictions = new double[periods];
        for (int i = 0; i < periods; i++) {
            predictions[i] = valueAt(lastPosition + 1 + i);
        }
        return predictions;
    }

    @Override
    public String toString() {
        return "LinearTrend{slope=" + slope + ", intercept=" + intercept + ", rSquared=" + rSquared + ", mse=" + mse + '}';
    }
}
