package im.arun.netcop.tree;

import im.arun.netcop.parse.Token;
import im.arun.netcop.parse.Tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves keyword paths against a node's keyword index, one keyword at a time.
 */
final class PathResolver {

    private PathResolver() {}

    static ConfNode resolve(ConfNode node, String key) {
        Token token = Tokenizer.next(key);
        if (!token.isPresent()) {
            return node;
        }

        IndexEntry entry = node.index().get(token.getCanonical());
        if (entry == null) {
            return ConfNode.empty();
        }

        ConfNode result = descend(node, entry);
        if (!token.getRest().isEmpty()) {
            return resolve(result, token.getRest());
        }
        return result;
    }

    /**
     * The node one keyword below {@code parent}: the sole contributor of the entry, or a
     * container merging all of them.
     */
    static ConfNode descend(ConfNode parent, IndexEntry entry) {
        List<ConfNode> contributors = entry.getContributors();
        ConfNode candidate = contributors.size() == 1
            ? contributors.get(0)
            : ConfNode.merge(contributors);

        List<String> trace = new ArrayList<>(parent.getTrace().size() + 1);
        trace.addAll(parent.getTrace());
        trace.add(entry.getDisplay());
        return candidate.withTrace(trace);
    }
}
