package im.arun.netcop.exception;

public class NotANumberException extends NetcopException {

    public NotANumberException(String value, Throwable cause) {
        super("Not a decimal integer: '" + value + "'", cause);
    }
}
