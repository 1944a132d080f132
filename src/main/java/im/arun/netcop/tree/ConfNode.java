package im.arun.netcop.tree;

import im.arun.netcop.exception.AmbiguousMatchException;
import im.arun.netcop.exception.NoMatchException;
import im.arun.netcop.exception.NotANumberException;
import im.arun.netcop.exception.ScalarLookupException;
import im.arun.netcop.exception.UnterminatedQuoteException;
import im.arun.netcop.net.AddressParser;
import im.arun.netcop.net.IpNetwork;
import im.arun.netcop.parse.Token;
import im.arun.netcop.parse.Tokenizer;
import lombok.Getter;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A subtree of a parsed config, addressed by keyword paths.
 *
 * <p>Consider this config:
 * <pre>
 * interface Ethernet1/0/1
 *     ip address 10.0.0.1/24
 *     ip address 10.0.0.100/24 secondary
 *     spanning-tree enable
 * </pre>
 * {@code root.get("interface")} returns a node whose single keyword is {@code Ethernet1/0/1};
 * {@code root.get("interface Ethernet1/0/1 ip address")} returns a node with the two
 * address lines, and so does {@code root.get("interface").get("Ethernet1/0/1").get("ip").get("address")}.
 *
 * <p>Nodes are never modified after the tree is built, apart from the keyword index each
 * node computes the first time it is queried. Lookups return lightweight view nodes that
 * share child lists with the tree.
 */
public class ConfNode implements Iterable<String> {
    private static final ConfNode EMPTY = new ConfNode(null, "", 0, List.of(), List.of(), new AtomicReference<>());

    /** Text left on this node's line once the keywords leading to it were consumed; {@code null} if absent. */
    @Getter
    private final String content;

    /** The source line as written. */
    @Getter
    private final String originalText;

    /** Zero-based position of the source line. */
    @Getter
    private final int lineNumber;

    /** Display keywords matched from the root down to this node. */
    @Getter
    private final List<String> trace;

    private final List<ConfNode> children;
    private final AtomicReference<KeywordIndex> index;

    ConfNode(String content, String originalText, int lineNumber, List<ConfNode> children,
             List<String> trace, AtomicReference<KeywordIndex> index) {
        this.content = content;
        this.originalText = originalText;
        this.lineNumber = lineNumber;
        this.children = children;
        this.trace = trace;
        this.index = index;
    }

    /** The node every failed lookup returns. */
    public static ConfNode empty() {
        return EMPTY;
    }

    /** The root is present only if the config has at least one line. */
    static ConfNode root(List<ConfNode> topLevel) {
        return new ConfNode(topLevel.isEmpty() ? null : "", "", 0, topLevel, List.of(), new AtomicReference<>());
    }

    static ConfNode line(String content, String originalText, int lineNumber, List<ConfNode> children) {
        String original = originalText != null && !originalText.isEmpty()
            ? originalText
            : (content != null ? content : "");
        return new ConfNode(content, original, lineNumber, children, List.of(), new AtomicReference<>());
    }

    static ConfNode merge(List<ConfNode> contributors) {
        ConfNode first = contributors.get(0);
        return line("", first.originalText, first.lineNumber, contributors);
    }

    /**
     * A standalone view of one raw line and its subtree, traced by the words of that line.
     * Absent when the line has no subtree.
     */
    static ConfNode captured(ConfNode line, List<String> trace) {
        String capturedContent = line.children.isEmpty() ? null : "";
        return new ConfNode(capturedContent, line.originalText, line.lineNumber, line.children,
            List.copyOf(trace), new AtomicReference<>());
    }

    /** A view of this node under another trace; it shares this node's keyword index. */
    ConfNode withTrace(List<String> newTrace) {
        return new ConfNode(content, originalText, lineNumber, children, List.copyOf(newTrace), index);
    }

    List<ConfNode> children() {
        return children;
    }

    void addChild(ConfNode child) {
        children.add(child);
    }

    KeywordIndex index() {
        KeywordIndex current = index.get();
        if (current == null) {
            index.compareAndSet(null, KeywordIndex.build(this));
            current = index.get();
        }
        return current;
    }

    public List<ConfNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /** Space-joined trace, e.g. {@code interface IF1 ip}. */
    public String getTraceString() {
        return String.join(" ", trace);
    }

    /** Whether this node matched anything. */
    public boolean isPresent() {
        return content != null;
    }

    // ==== dict-like API

    /**
     * Look up a subtree by one keyword or a space-separated sequence of keywords.
     * Matching is case-insensitive. Returns {@link #empty()} if nothing matches.
     */
    public ConfNode get(String key) {
        return PathResolver.resolve(this, key);
    }

    /** Whether {@link #get(String)} returns a present node. */
    public boolean contains(String key) {
        return get(key).isPresent();
    }

    /** Unique keywords following this node, as written in the config. */
    @Override
    public Iterator<String> iterator() {
        return keys().iterator();
    }

    /** Number of unique keywords following this node. */
    public int size() {
        return index().size();
    }

    public List<String> keys() {
        return index().displayKeywords();
    }

    /** Subtrees of the following keywords, each merged across lines that share the keyword. */
    public List<ConfNode> values() {
        List<ConfNode> values = new ArrayList<>(size());
        for (IndexEntry entry : index().entries()) {
            values.add(PathResolver.descend(this, entry));
        }
        return values;
    }

    /**
     * The raw index buckets: for each following keyword, in config order, the lines that
     * contributed it. Unlike {@link #values()} nothing is merged or re-traced.
     */
    public List<List<ConfNode>> contributors() {
        List<List<ConfNode>> buckets = new ArrayList<>(size());
        for (IndexEntry entry : index().entries()) {
            buckets.add(entry.getContributors());
        }
        return buckets;
    }

    /** Following keywords mapped to their subtrees, in config order. */
    public Map<String, ConfNode> items() {
        Map<String, ConfNode> items = new LinkedHashMap<>();
        for (IndexEntry entry : index().entries()) {
            items.put(entry.getDisplay(), PathResolver.descend(this, entry));
        }
        return items;
    }

    /**
     * Enumerate every path matching a key with glob wildcards ({@code * ? [...]}) and an
     * optional trailing {@code ~}. Each match holds one value per wildcard segment, plus the
     * raw line text for {@code ~}.
     *
     * <pre>
     * root.expand("interface po* ip address *")
     *     .forEach(m -&gt; System.out.println(m.get(0) + " " + m.get(1)));
     * </pre>
     */
    public Stream<ExpandMatch> expand(String key) {
        return expand(key, false);
    }

    /**
     * Same as {@link #expand(String)}; with {@code withNode} set every match also carries the
     * node the path ended on, e.g. to check {@code m.getNode().contains("secondary")}.
     */
    public Stream<ExpandMatch> expand(String key, boolean withNode) {
        return WildcardExpander.expand(this, key, withNode);
    }

    /**
     * The single following keyword at {@code key}, or {@code defaultValue} if there is none
     * or more than one.
     */
    public String getWord(String key, String defaultValue) {
        return getWord(key, defaultValue, Function.identity());
    }

    public <T> T getWord(String key, T defaultValue, Function<String, T> caster) {
        String word;
        try {
            word = get(key).word();
        } catch (ScalarLookupException e) {
            return defaultValue;
        }
        return caster.apply(word);
    }

    // ==== scalar API

    /** The only keyword following this node. */
    public String word() {
        return requireSingleEntry().getDisplay();
    }

    /** Remaining keywords on the single matched line, joined by single spaces. */
    public String tail() {
        requireSingleEntry();
        List<String> items = new ArrayList<>();
        String rest = content;
        while (rest != null && !rest.isEmpty()) {
            Token token = Tokenizer.next(rest);
            if (token.isPresent()) {
                items.add(token.getDisplay());
            }
            rest = token.getRest();
        }
        return String.join(" ", items);
    }

    /** Raw text of every line directly under this node. */
    public List<String> tails() {
        return expand("~").map(m -> m.get(0)).collect(Collectors.toList());
    }

    /**
     * The quoted string (without quotes) following this node, or the next keyword when
     * the text is not quoted.
     */
    public String quoted() {
        IndexEntry entry = requireSingleEntry();
        char quote = content.isEmpty() ? 0 : content.charAt(0);
        if (quote == '"' || quote == '\'') {
            int end = content.indexOf(quote, 1);
            if (end < 0) {
                throw new UnterminatedQuoteException(quote, getTraceString(), lineNumber, content);
            }
            return content.substring(1, end);
        }
        return entry.getDisplay();
    }

    /** The single following keyword as a decimal integer; wide enough for 4-byte AS numbers. */
    public long asInt() {
        return parseLong(word());
    }

    /** Every following keyword as an integer. */
    public List<Long> ints() {
        List<Long> values = new ArrayList<>();
        for (String keyword : this) {
            values.add(parseLong(keyword));
        }
        return values;
    }

    /**
     * Keywords enclosed in JunOS-style {@code [ ... ]}, or the single following keyword
     * when there are no brackets.
     */
    public List<String> junosList() {
        requireSingleEntry();
        if (content.startsWith("[")) {
            String[] items = tail().split("\\s+");
            if (items.length >= 2 && items[0].equals("[") && items[items.length - 1].equals("]")) {
                return List.of(items).subList(1, items.length - 1);
            }
        }
        return List.of(word());
    }

    public InetAddress ip() {
        return AddressParser.parseAddress(word());
    }

    public List<InetAddress> ips() {
        List<InetAddress> addresses = new ArrayList<>();
        for (String keyword : this) {
            addresses.add(AddressParser.parseAddress(keyword));
        }
        return addresses;
    }

    public IpNetwork cidr() {
        return AddressParser.parseNetwork(word());
    }

    public List<IpNetwork> cidrs() {
        List<IpNetwork> networks = new ArrayList<>();
        for (String keyword : this) {
            networks.add(AddressParser.parseNetwork(keyword));
        }
        return networks;
    }

    /** Source line of the single matched keyword. */
    public int matchedLineNumber() {
        requireSingleEntry();
        return lineNumber;
    }

    /** Matched lines relative to the lookup prefix, own line first, then descendants. */
    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        collectLines(lines, false);
        return lines;
    }

    /** Original config lines of this subtree. */
    public List<String> originalLines() {
        List<String> lines = new ArrayList<>();
        collectLines(lines, true);
        return lines;
    }

    private void collectLines(List<String> lines, boolean original) {
        if (content != null && !content.isEmpty()) {
            lines.add(original ? originalText : content);
        }
        for (ConfNode child : children) {
            child.collectLines(lines, original);
        }
    }

    private IndexEntry requireSingleEntry() {
        KeywordIndex idx = index();
        if (idx.isEmpty()) {
            throw new NoMatchException(getTraceString(), lineNumber);
        }
        if (idx.size() > 1) {
            throw new AmbiguousMatchException(idx.size(), getTraceString(), lineNumber);
        }
        return idx.entries().iterator().next();
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new NotANumberException(value, e);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ConfNode(");
        if (content != null && !content.isEmpty()) {
            sb.append('\'').append(content).append('\'');
        }
        sb.append(')');
        if (!trace.isEmpty() || content != null) {
            sb.append("['").append(getTraceString()).append("']");
        }
        return sb.toString();
    }
}
