package gr.imsi.athenarc.tsanalysis.resample;

/**
 * Defines how several observations falling into the same resampling bucket are reduced to one value.
 */
public enum BucketAggregation {
    MEAN {
        @Override
        double reduce(double accumulated, int accumulatedCount, double next) {
            return accumulated + (next - accumulated) / (accumulatedCount + 1);
        }
    },
    FIRST_VALUE {
        @Override
        double reduce(double accumulated, int accumulatedCount, double next) {
            return accumulated;
        }
    },
    LAST_VALUE {
        @Override
        double reduce(double accumulated, int accumulatedCount, double next) {
            return next;
        }
    },
    MIN_VALUE {
        @Override
        double reduce(double accumulated, int accumulatedCount, double next) {
            return Math.min(accumulated, next);
        }
    },
    MAX_VALUE {
        @Override
        double reduce(double accumulated, int accumulatedCount, double next) {
            return Math.max(accumulated, next);
        }
    };

    /**
     * Folds {@code next} into a bucket that already reduced {@code accumulatedCount} values to {@code accumulated}.
     */
    abstract double reduce(double accumulated, int accumulatedCount, double next);
}
