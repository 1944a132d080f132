package im.arun.netcop.dump;

import im.arun.netcop.tree.ConfNode;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes a config subtree as indented text.
 *
 * <p>A looked-up subtree starts with a {@code [trace]} header; the node's own line follows
 * the header on the same line and its children are indented one level below it.
 */
public final class ConfDumper {

    private ConfDumper() {}

    public static void dump(ConfNode node, Writer out) throws IOException {
        dump(node, out, DumpOptions.defaults());
    }

    public static void dump(ConfNode node, Writer out, DumpOptions options) throws IOException {
        if (!node.isPresent()) {
            return;
        }

        boolean header = options.isShowHeader() && !node.getTrace().isEmpty();
        if (header) {
            out.write("[" + node.getTraceString() + "]");
            out.write(hasOwnLine(node) ? " " : "\n");
        }
        writeLines(node, header ? 0 : -1, out, options);
        out.flush();
    }

    public static String dumpToString(ConfNode node, DumpOptions options) {
        StringWriter writer = new StringWriter();
        try {
            dump(node, writer, options);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    private static void writeLines(ConfNode node, int level, Writer out, DumpOptions options) throws IOException {
        if (hasOwnLine(node)) {
            String text = options.isUseOriginalText() ? node.getOriginalText() : node.getContent();
            writeLine(text, level, out, options.getIndent());
        }
        for (ConfNode child : node.getChildren()) {
            writeLines(child, level + 1, out, options);
        }
    }

    private static void writeLine(String text, int level, Writer out, String indent) throws IOException {
        if (indent == null) {
            out.write(text);
        } else {
            out.write(indent.repeat(Math.max(level, 0)));
            out.write(text.strip());
        }
        out.write("\n");
    }

    private static boolean hasOwnLine(ConfNode node) {
        return node.getContent() != null && !node.getContent().isEmpty();
    }
}
