package gr.imsi.athenarc.tsanalysis.exception;

/**
 * Raised when a parameter search exhausts its evaluation budget. This is a checked exception:
 * callers are expected to substitute a naive forecast method rather than retry.
 */
public class NonConvergenceException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int evaluationBudget;

    public NonConvergenceException(String method, int evaluationBudget, Throwable cause) {
        super("Parameter search for " + method + " did not converge within " + evaluationBudget + " evaluations", cause);
        this.evaluationBudget = evaluationBudget;
    }

    public int getEvaluationBudget() {
        return evaluationBudget;
    }
}
