package im.arun.netcop.exception;

public class UnterminatedQuoteException extends NetcopException {

    public UnterminatedQuoteException(char quote, String trace, int lineNumber, String line) {
        super(String.format("No ending <%s> found in ['%s'], line %d: '%s'", quote, trace, lineNumber, line));
    }
}
