package com.questrail.loadout.api;

import java.util.List;
import java.util.OptionalInt;

/**
 * SubtreeSelectorNode
 * -----------------------------------------------------------------------------
 * A choice node whose entries name sub-tree groups. Choosing an entry activates
 * the group of that name.
 *
 * <p>Selector nodes cost no points. Their ids are not stable across catalog
 * revisions, so callers locate them structurally through
 * {@code NodeCatalog.findSubtreeSelectorFor(String)} rather than by id.</p>
 */
public final class SubtreeSelectorNode extends TreeNode
{
    private final List<NodeEntry> entries;

    SubtreeSelectorNode(Builder b) {
        super(b);
        this.entries = List.copyOf(b.entryList());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUBTREE_SELECTOR;
    }

    @Override
    public List<NodeEntry> entries() {
        return entries;
    }

    /**
     * Returns the index of the entry naming the given group, compared exactly.
     */
    public OptionalInt indexOfGroup(String group) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).name().equals(group)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
