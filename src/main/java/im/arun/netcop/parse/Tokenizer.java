package im.arun.netcop.parse;

import java.util.Locale;
import java.util.Set;

/**
 * Splits config lines into a leading keyword and the remainder.
 *
 * <p>Block delimiters and comment markers ({@code { } # !}) carry no keyword, and a
 * trailing {@code ;} statement terminator is dropped when nothing but a comment follows it.
 */
public final class Tokenizer {
    private static final Set<String> STRUCTURAL = Set.of("{", "}", "#", "!");

    private Tokenizer() {}

    /**
     * Extract the first keyword of the given text.
     *
     * @param text line text, may be {@code null}
     * @return the keyword and the rest of the text, or {@link Token#NONE}
     */
    public static Token next(String text) {
        if (text == null || text.isEmpty()) {
            return Token.NONE;
        }

        int start = skipWhitespace(text, 0);
        if (start == text.length()) {
            return Token.NONE;
        }
        int end = start;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end))) {
            end++;
        }

        String token = text.substring(start, end);
        if (STRUCTURAL.contains(token)) {
            return Token.NONE;
        }
        String rest = text.substring(skipWhitespace(text, end));

        if (token.endsWith(";") && (rest.isEmpty() || rest.startsWith("#") || rest.startsWith("!"))) {
            token = token.substring(0, token.length() - 1);
        }
        return new Token(token.toLowerCase(Locale.ROOT), token, rest);
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
