package im.arun.netcop.tree;

import im.arun.netcop.util.GlobPattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

/**
 * Depth-first enumeration of every path matching a wildcard query.
 */
final class WildcardExpander {

    private WildcardExpander() {}

    static Stream<ExpandMatch> expand(ConfNode node, String key, boolean withNode) {
        List<KeySegment> segments = KeySegment.parse(key);
        return expand(node, segments, 0, withNode);
    }

    private static Stream<ExpandMatch> expand(ConfNode node, List<KeySegment> segments, int pos, boolean withNode) {
        if (pos == segments.size()) {
            return Stream.of(ExpandMatch.of(List.of(), withNode ? node : null));
        }

        KeySegment segment = segments.get(pos);
        switch (segment.getKind()) {
            case TAIL_CAPTURE:
                return captureTails(node, withNode);
            case GLOB:
                GlobPattern pattern = GlobPattern.compile(segment.getText());
                return node.index().entries().stream()
                    .filter(entry -> pattern.matches(entry.getDisplay()))
                    .flatMap(entry -> expand(PathResolver.descend(node, entry), segments, pos + 1, withNode)
                        .map(match -> match.prepend(entry.getDisplay())));
            case LITERAL:
            default:
                ConfNode next = PathResolver.resolve(node, segment.getText());
                if (!next.isPresent()) {
                    return Stream.empty();
                }
                return expand(next, segments, pos + 1, withNode);
        }
    }

    private static Stream<ExpandMatch> captureTails(ConfNode node, boolean withNode) {
        String content = node.getContent();
        if (content != null && !content.isEmpty()) {
            return Stream.of(capture(node, node, withNode));
        }
        return node.children().stream().map(child -> capture(node, child, withNode));
    }

    private static ExpandMatch capture(ConfNode parent, ConfNode line, boolean withNode) {
        String text = line.getContent() == null ? "" : line.getContent().strip();
        if (!withNode) {
            return ExpandMatch.of(List.of(text), null);
        }
        List<String> trace = new ArrayList<>(parent.getTrace());
        if (!text.isEmpty()) {
            trace.addAll(Arrays.asList(text.split("\\s+")));
        }
        return ExpandMatch.of(List.of(text), ConfNode.captured(line, trace));
    }
}
