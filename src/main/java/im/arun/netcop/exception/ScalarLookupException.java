package im.arun.netcop.exception;

/**
 * Raised when a scalar accessor needs exactly one following keyword and the node
 * does not have exactly one.
 */
public abstract class ScalarLookupException extends NetcopException {
    private final String trace;
    private final int lineNumber;

    protected ScalarLookupException(String message, String trace, int lineNumber) {
        super(message);
        this.trace = trace;
        this.lineNumber = lineNumber;
    }

    public String getTrace() {
        return trace;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
