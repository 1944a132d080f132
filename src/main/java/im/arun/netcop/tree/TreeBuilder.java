package im.arun.netcop.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the config tree from indented lines.
 *
 * <p>A line indented deeper than the previous one becomes its child; otherwise the line is
 * attached to the closest preceding line that is indented less. Depth is compared by the
 * length of the leading whitespace only, so a tab counts the same as a space. Blank lines
 * are skipped. Any input is accepted.
 */
public final class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private TreeBuilder() {}

    /** Parse config text; any line terminator splits lines. */
    public static ConfNode parse(String text) {
        if (text == null || text.isEmpty()) {
            return parse(List.of());
        }
        return parse(Arrays.asList(text.split("\\R", -1)));
    }

    /** Parse config lines read to the end of the given reader. */
    public static ConfNode parse(Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader
            ? (BufferedReader) reader
            : new BufferedReader(reader);
        return parse(buffered.lines().collect(Collectors.toList()));
    }

    /** Parse config lines. */
    public static ConfNode parse(List<String> lines) {
        List<ConfNode> topLevel = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(null, 0));

        int lineNumber = -1;
        int nodeCount = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = raw.stripTrailing();
            int indent = leadingWhitespace(line);
            if (indent == line.length()) {
                continue;
            }

            ConfNode node = ConfNode.line(line, line, lineNumber, new ArrayList<>());
            nodeCount++;

            if (indent <= stack.peek().indent) {
                while (stack.peek().node != null && stack.peek().indent >= indent) {
                    stack.pop();
                }
            }
            Frame parent = stack.peek();
            if (parent.node == null) {
                topLevel.add(node);
            } else {
                parent.node.addChild(node);
            }
            stack.push(new Frame(node, indent));
        }

        logger.debug("Parsed {} lines into {} nodes, {} at top level", lineNumber + 1, nodeCount, topLevel.size());
        return ConfNode.root(topLevel);
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    private static final class Frame {
        final ConfNode node;
        final int indent;

        Frame(ConfNode node, int indent) {
            this.node = node;
            this.indent = indent;
        }
    }
}
