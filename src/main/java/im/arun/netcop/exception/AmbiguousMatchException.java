package im.arun.netcop.exception;

public class AmbiguousMatchException extends ScalarLookupException {
    private final int matchCount;

    public AmbiguousMatchException(int matchCount, String trace, int lineNumber) {
        super(String.format("Multiple entries (%d) match the key ['%s'], line %d", matchCount, trace, lineNumber),
            trace, lineNumber);
        this.matchCount = matchCount;
    }

    public int getMatchCount() {
        return matchCount;
    }
}
