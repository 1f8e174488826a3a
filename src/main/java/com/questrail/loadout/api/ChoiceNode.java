package com.questrail.loadout.api;

import java.util.List;

/**
 * A node offering mutually exclusive named options. A selection of this node
 * records the index of the chosen entry.
 */
public final class ChoiceNode extends TreeNode
{
    private final List<NodeEntry> entries;

    ChoiceNode(Builder b) {
        super(b);
        if (b.entryList().isEmpty()) {
            throw new IllegalArgumentException("Choice node " + id() + " requires at least one entry");
        }
        this.entries = List.copyOf(b.entryList());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CHOICE;
    }

    @Override
    public List<NodeEntry> entries() {
        return entries;
    }
}
