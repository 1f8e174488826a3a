package com.questrail.loadout.api;

/**
 * Structural kind of a {@link TreeNode}.
 *
 * <p>The kind decides whether a node's wire record carries a choice field, and
 * whether the node costs points.</p>
 */
public enum NodeKind
{
    /** Plain node: rank only. */
    NORMAL,

    /** Mutually exclusive named options; a selection records which entry. */
    CHOICE,

    /** Choice node whose entries name whole sub-tree groups. Costs no points. */
    SUBTREE_SELECTOR;

    /**
     * Returns true if selections of this kind carry a choice index.
     */
    public boolean carriesChoice() {
        return switch (this) {
            case NORMAL -> false;
            case CHOICE, SUBTREE_SELECTOR -> true;
        };
    }
}
