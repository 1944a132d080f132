package im.arun.netcop.tree;

import im.arun.netcop.exception.InvalidQueryUsageException;
import im.arun.netcop.parse.Token;
import im.arun.netcop.parse.Tokenizer;
import im.arun.netcop.util.GlobPattern;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One keyword of an {@code expand} query, classified by how it matches.
 */
@Value
public class KeySegment {

    public enum Kind {
        /** Matches one keyword exactly; not captured. */
        LITERAL,
        /** Shell-style wildcard; every matching keyword is captured. */
        GLOB,
        /** {@code ~}: captures the raw remaining line text. */
        TAIL_CAPTURE
    }

    public static final String TAIL_MARKER = "~";

    Kind kind;
    String text;

    public static KeySegment of(String text) {
        if (TAIL_MARKER.equals(text)) {
            return new KeySegment(Kind.TAIL_CAPTURE, text);
        }
        if (GlobPattern.isGlob(text)) {
            return new KeySegment(Kind.GLOB, text);
        }
        return new KeySegment(Kind.LITERAL, text);
    }

    /**
     * Split a query into segments.
     *
     * @throws InvalidQueryUsageException if {@code ~} is not the last segment
     */
    public static List<KeySegment> parse(String key) {
        List<KeySegment> segments = new ArrayList<>();
        Token token = Tokenizer.next(key);
        while (token.isPresent()) {
            KeySegment segment = of(token.getDisplay());
            if (segment.kind == Kind.TAIL_CAPTURE && !token.getRest().isEmpty()) {
                throw new InvalidQueryUsageException("'~' should be the last token in query: '" + key + "'");
            }
            segments.add(segment);
            token = Tokenizer.next(token.getRest());
        }
        return segments;
    }
}
