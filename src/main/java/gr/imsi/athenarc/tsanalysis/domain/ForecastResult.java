package gr.imsi.athenarc.tsanalysis.domain;

/**
 * A point forecast with its prediction interval for one future timestamp.
 */
public final class ForecastResult {

    private final long horizonTimestamp;
    private final int horizonStep;
    private final double pointEstimate;
    private final double lowerBound;
    private final double upperBound;
    private final long modelStateVersion;
    private final String method;

    public ForecastResult(long horizonTimestamp, int horizonStep, double pointEstimate, double lowerBound,
                          double upperBound, long modelStateVersion, String method) {
        if (lowerBound > pointEstimate || upperBound < pointEstimate) {
            throw new IllegalArgumentException("Bounds [" + lowerBound + ", " + upperBound + "] do not contain " + pointEstimate);
        }
        this.horizonTimestamp = horizonTimestamp;
        this.horizonStep = horizonStep;
        this.pointEstimate = pointEstimate;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.modelStateVersion = modelStateVersion;
        this.method = method;
    }

    public long getHorizonTimestamp() {
        return horizonTimestamp;
    }

    /**
     * Returns how many sampling intervals past the last known timestamp this forecast lies.
     */
    public int getHorizonStep() {
        return horizonStep;
    }

    public double getPointEstimate() {
        return pointEstimate;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public long getModelStateVersion() {
        return modelStateVersion;
    }

    public String getMethod() {
        return method;
    }

    @Override
    public String toString() {
        return "ForecastResult{" +
                "horizon=" + DateTimeUtil.format(horizonTimestamp) +
                ", step=" + horizonStep +
                ", point=" + pointEstimate +
                ", bounds=[" + lowerBound + ", " + upperBound + "]" +
                ", version=" + modelStateVersion +
                ", method=" + method +
                '}';
    }
}
