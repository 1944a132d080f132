package im.arun.netcop.exception;

public class NotAnAddressException extends NetcopException {

    public NotAnAddressException(String value, Throwable cause) {
        super("Not an IP address: '" + value + "'", cause);
    }
}
