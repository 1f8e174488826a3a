package com.questrail.loadout.api;

/**
 * A plain node: selected at some rank, no choice.
 */
public final class NormalNode extends TreeNode
{
    NormalNode(Builder b) {
        super(b);
        if (!b.entryList().isEmpty()) {
            throw new IllegalArgumentException("Normal node " + id() + " must not declare entries");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NORMAL;
    }
}
