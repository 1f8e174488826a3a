package com.questrail.loadout.catalog;

import com.questrail.loadout.api.TreeNode;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Result of a name lookup against a {@link NodeCatalog}.
 *
 * @param node       the node whose name or entry name matched
 * @param entryIndex index of the matching entry when the lookup matched one of
 *                   the node's entries; empty when it matched the node itself
 */
public record NameMatch(TreeNode node, OptionalInt entryIndex)
{
    public NameMatch {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(entryIndex, "entryIndex");
    }
}
