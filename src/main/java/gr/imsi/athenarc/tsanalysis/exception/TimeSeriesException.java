package gr.imsi.athenarc.tsanalysis.exception;

/**
 * Base class of the unchecked errors raised by the analysis core.
 */
public abstract class TimeSeriesException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected TimeSeriesException(String message) {
        super(message);
    }

    protected TimeSeriesException(String message, Throwable cause) {
        super(message, cause);
    }
}
