package gr.imsi.athenarc.tsanalysis.exception;

/**
 * Raised when there are too few observations to perform an operation. Callers can recover by
 * supplying more data or relaxing the requirement.
 */
public class InsufficientDataException extends TimeSeriesException {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(String operation, int available, int required) {
        super(operation + " requires at least " + required + " observations but only " + available + " are available");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
