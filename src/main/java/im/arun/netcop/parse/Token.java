package im.arun.netcop.parse;

import lombok.Value;

/**
 * Leading keyword of a line together with the rest of that line.
 */
@Value
public class Token {
    public static final Token NONE = new Token("", "", "");

    /** Lowercase form used for matching. */
    String canonical;

    /** Keyword as written in the config. */
    String display;

    String rest;

    public boolean isPresent() {
        return !display.isEmpty();
    }
}
