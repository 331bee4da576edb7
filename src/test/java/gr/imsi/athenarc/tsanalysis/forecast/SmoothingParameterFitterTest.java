package gr.imsi.athenarc.tsanalysis.forecast;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsanalysis.exception.NonConvergenceException;

public class SmoothingParameterFitterTest {

    private static final MultivariateFunction BOWL = p -> (p[0] - 0.3) * (p[0] - 0.3) + (p[1] - 0.7) * (p[1] - 0.7);

    @Test
    public void testFindsMinimumInsideBounds() throws NonConvergenceException {
        double[] optimum = new SmoothingParameterFitter().fit("bowl", new double[]{0.5, 0.5}, BOWL);
        assertEquals(0.3, optimum[0], 1e-4);
        assertEquals(0.7, optimum[1], 1e-4);
    }

    @Test
    public void testMinimumOnTheBoundary() throws NonConvergenceException {
        MultivariateFunction slope = p -> 2 + p[0] - p[1];
        double[] optimum = new SmoothingParameterFitter().fit("slope", new double[]{0.5, 0.5}, slope);
        assertEquals(0.0, optimum[0], 1e-4);
        assertEquals(1.0, optimum[1], 1e-4);
    }

    @Test
    public void testExactStartIsKept() throws NonConvergenceException {
        double[] optimum = new SmoothingParameterFitter(1).fit("exact", new double[]{0.3, 0.7}, BOWL);
        assertArrayEquals(new double[]{0.3, 0.7}, optimum);
    }

    @Test
    public void testBudgetExhaustion() {
        NonConvergenceException e = assertThrows(NonConvergenceException.class,
                () -> new SmoothingParameterFitter(2).fit("bowl", new double[]{0.5, 0.5}, BOWL));
        assertEquals(2, e.getEvaluationBudget());
        assertThrows(IllegalArgumentException.class, () -> new SmoothingParameterFitter(0));
    }
}
