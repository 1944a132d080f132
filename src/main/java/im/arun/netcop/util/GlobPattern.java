package im.arun.netcop.util;

import im.arun.netcop.exception.InvalidQueryUsageException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Case-insensitive shell-style wildcard matching: {@code *} matches any run of characters,
 * {@code ?} any single character, {@code [seq]} any character in seq and {@code [!seq]} any
 * character not in seq. An unclosed {@code [} matches itself.
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        try {
            return new GlobPattern(glob,
                Pattern.compile(toRegex(glob), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL));
        } catch (PatternSyntaxException e) {
            throw new InvalidQueryUsageException("Invalid wildcard pattern '" + glob + "': " + e.getDescription());
        }
    }

    /** Whether the text contains any wildcard character. */
    public static boolean isGlob(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0 || text.indexOf('[') >= 0;
    }

    public boolean matches(String text) {
        return regex.matcher(text).matches();
    }

    public String getGlob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                sb.append(".*");
            } else if (c == '?') {
                sb.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    sb.append("\\[");
                } else {
                    sb.append(characterClass(glob.substring(i, j)));
                    i = j + 1;
                }
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }

    /** Ranges written high to low are empty and dropped; a class left with nothing matches nothing. */
    private static String characterClass(String body) {
        boolean negated = body.startsWith("!");
        StringBuilder members = new StringBuilder();
        int k = negated ? 1 : 0;
        while (k < body.length()) {
            char lo = body.charAt(k);
            if (k + 2 < body.length() && body.charAt(k + 1) == '-') {
                char hi = body.charAt(k + 2);
                if (lo <= hi) {
                    appendClassChar(members, lo);
                    members.append('-');
                    appendClassChar(members, hi);
                }
                k += 3;
            } else {
                appendClassChar(members, lo);
                k++;
            }
        }
        if (members.length() == 0) {
            return negated ? "." : "(?!)";
        }
        return (negated ? "[^" : "[") + members + "]";
    }

    private static void appendClassChar(StringBuilder sb, char c) {
        if (c == '\\' || c == '[' || c == ']' || c == '&' || c == '^' || c == '-') {
            sb.append('\\');
        }
        sb.append(c);
    }

    @Override
    public String toString() {
        return glob;
    }
}
