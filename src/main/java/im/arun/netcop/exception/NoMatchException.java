package im.arun.netcop.exception;

public class NoMatchException extends ScalarLookupException {

    public NoMatchException(String trace, int lineNumber) {
        super(String.format("No entries in node ['%s'], line %d", trace, lineNumber), trace, lineNumber);
    }
}
