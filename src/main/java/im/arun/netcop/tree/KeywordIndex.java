package im.arun.netcop.tree;

import im.arun.netcop.parse.Token;
import im.arun.netcop.parse.Tokenizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the keywords that follow a node by their lowercase form.
 *
 * <p>A node that carries its own line is indexed by that line's next keyword only.
 * A container node (no keyword left on its own line) is indexed by the leading keyword
 * of each child line. Bucket order is the order keywords are first seen.
 */
public final class KeywordIndex {
    private final Map<String, IndexEntry> entries;

    private KeywordIndex(Map<String, IndexEntry> entries) {
        this.entries = entries;
    }

    static KeywordIndex build(ConfNode node) {
        Map<String, IndexEntry> entries = new LinkedHashMap<>();

        Token own = Tokenizer.next(node.getContent());
        if (own.isPresent()) {
            IndexEntry entry = new IndexEntry(own.getDisplay());
            entry.add(ConfNode.line(own.getRest(), node.getOriginalText(), node.getLineNumber(), node.children()));
            entries.put(own.getCanonical(), entry);
        } else {
            for (ConfNode child : node.children()) {
                Token token = Tokenizer.next(child.getContent());
                if (!token.isPresent()) {
                    continue;
                }
                entries.computeIfAbsent(token.getCanonical(), k -> new IndexEntry(token.getDisplay()))
                    .add(ConfNode.line(token.getRest(), child.getOriginalText(), child.getLineNumber(),
                        child.children()));
            }
        }
        return new KeywordIndex(Collections.unmodifiableMap(entries));
    }

    public IndexEntry get(String canonical) {
        return entries.get(canonical);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Collection<IndexEntry> entries() {
        return entries.values();
    }

    /** Keywords as written in the config, in first-seen order. */
    public List<String> displayKeywords() {
        List<String> keywords = new ArrayList<>(entries.size());
        for (IndexEntry entry : entries.values()) {
            keywords.add(entry.getDisplay());
        }
        return keywords;
    }
}
