package gr.imsi.athenarc.tsanalysis.forecast;

import java.util.Arrays;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.tsanalysis.exception.NonConvergenceException;

/**
 * Minimizes a sum of squared one-step errors over smoothing parameters constrained to [0, 1], with
 * a bounded number of objective evaluations.
 */
public class SmoothingParameterFitter {

    private static final Logger LOG = LoggerFactory.getLogger(SmoothingParameterFitter.class);

    public static final int DEFAULT_MAX_EVALUATIONS = 2000;

    private static final double INITIAL_TRUST_REGION_RADIUS = 0.25;
    private static final double STOPPING_TRUST_REGION_RADIUS = 1e-6;
    private static final double EXACT_FIT_ERROR = 1e-18;

    private final int maxEvaluations;

    public SmoothingParameterFitter() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    public SmoothingParameterFitter(int maxEvaluations) {
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("Evaluation budget must be positive, got " + maxEvaluations);
        }
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * @param method name reported on failure
     * @param initialGuess starting parameters, each in [0, 1]
     * @param objective the error to minimize, finite and non-negative
     * @return the best parameters found
     * @throws NonConvergenceException if the budget runs out before the search settles
     */
    public double[] fit(String method, double[] initialGuess, MultivariateFunction objective) throws NonConvergenceException {
        // A vanishing error cannot be improved on
        if (objective.value(initialGuess) <= EXACT_FIT_ERROR) {
            LOG.debug("{} fits exactly at {}", method, Arrays.toString(initialGuess));
            return initialGuess.clone();
        }
        int dimension = initialGuess.length;
        double[] lower = new double[dimension];
        double[] upper = new double[dimension];
        Arrays.fill(upper, 1.0);
        BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * dimension + 1,
                INITIAL_TRUST_REGION_RADIUS, STOPPING_TRUST_REGION_RADIUS);
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            PointValuePair optimum = optimizer.optimize(
                    new MaxEval(maxEvaluations),
                    new ObjectiveFunction(objective),
                    GoalType.MINIMIZE,
                    new InitialGuess(initialGuess),
                    new SimpleBounds(lower, upper));
            LOG.debug("{} parameters {} with error {} after {} evaluations in {}", method,
                    Arrays.toString(optimum.getPoint()), optimum.getValue(), optimizer.getEvaluations(), stopwatch.stop());
            return optimum.getPoint();
        } catch (TooManyEvaluationsException e) {
            throw new NonConvergenceException(method, maxEvaluations, e);
        }
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }
}
