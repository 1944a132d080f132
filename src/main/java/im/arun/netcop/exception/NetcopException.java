package im.arun.netcop.exception;

/**
 * Base class for every error raised while querying a parsed config tree.
 * Building the tree itself never fails.
 */
public class NetcopException extends RuntimeException {

    public NetcopException(String message) {
        super(message);
    }

    public NetcopException(String message, Throwable cause) {
        super(message, cause);
    }
}
