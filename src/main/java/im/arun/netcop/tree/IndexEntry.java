package im.arun.netcop.tree;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One bucket of a {@link KeywordIndex}: the keyword as first written and every node
 * that follows it, in document order.
 */
@Getter
public class IndexEntry {
    private final String display;
    private final List<ConfNode> contributors;

    IndexEntry(String display) {
        this.display = display;
        this.contributors = new ArrayList<>();
    }

    void add(ConfNode node) {
        contributors.add(node);
    }

    public List<ConfNode> getContributors() {
        return Collections.unmodifiableList(contributors);
    }
}
