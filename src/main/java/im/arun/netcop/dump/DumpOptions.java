package im.arun.netcop.dump;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Formatting of {@link ConfDumper} output.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DumpOptions {
    public static final String DEFAULT_INDENT = "  ";

    /** Prefix repeated once per nesting level; {@code null} writes every line as is. */
    private String indent = DEFAULT_INDENT;

    /** Whether a {@code [trace]} header precedes a looked-up subtree. */
    private boolean showHeader = true;

    /** Whether to write source lines instead of the text left after the matched keywords. */
    private boolean useOriginalText = false;

    public static DumpOptions defaults() {
        return new DumpOptions();
    }

    public static DumpOptions withIndent(String indent) {
        DumpOptions options = new DumpOptions();
        options.setIndent(indent);
        return options;
    }

    /** One line per entry, written verbatim with no indentation added. */
    public static DumpOptions noIndent() {
        return withIndent(null);
    }
}
