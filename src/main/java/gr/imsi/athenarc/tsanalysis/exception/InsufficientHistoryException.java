package gr.imsi.athenarc.tsanalysis.exception;

/**
 * Raised by forecast methods when the history is shorter than the configured minimum.
 */
public class InsufficientHistoryException extends InsufficientDataException {

    private static final long serialVersionUID = 1L;

    public InsufficientHistoryException(String method, int available, int required) {
        super("Forecasting with " + method, available, required);
    }
}
