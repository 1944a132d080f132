package im.arun.netcop.exception;

/**
 * Raised when a query key is malformed, e.g. a {@code ~} marker that is not the last token.
 */
public class InvalidQueryUsageException extends NetcopException {

    public InvalidQueryUsageException(String message) {
        super(message);
    }
}
