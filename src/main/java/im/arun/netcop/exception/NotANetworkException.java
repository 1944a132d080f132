package im.arun.netcop.exception;

public class NotANetworkException extends NetcopException {

    public NotANetworkException(String value, String reason) {
        super("Not an IP network: '" + value + "' (" + reason + ")");
    }

    public NotANetworkException(String value, Throwable cause) {
        super("Not an IP network: '" + value + "'", cause);
    }
}
