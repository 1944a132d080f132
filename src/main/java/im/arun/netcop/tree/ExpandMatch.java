package im.arun.netcop.tree;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One result of {@link ConfNode#expand(String, boolean)}: the captured values in query
 * order and, when requested, the node the query ended on.
 */
@Value
public class ExpandMatch {
    List<String> values;

    /** {@code null} unless the node was requested. */
    ConfNode node;

    static ExpandMatch of(List<String> values, ConfNode node) {
        return new ExpandMatch(List.copyOf(values), node);
    }

    public String get(int i) {
        return values.get(i);
    }

    public int size() {
        return values.size();
    }

    ExpandMatch prepend(String value) {
        List<String> prepended = new ArrayList<>(values.size() + 1);
        prepended.add(value);
        prepended.addAll(values);
        return new ExpandMatch(List.copyOf(prepended), node);
    }
}
