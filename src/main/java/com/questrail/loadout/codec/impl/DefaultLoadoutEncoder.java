package com.questrail.loadout.codec.impl;

import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.catalog.NodeCatalog;
import com.questrail.loadout.codec.LoadoutEncoder;

import java.util.Map;
import java.util.Objects;

/**
 * DefaultLoadoutEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link LoadoutEncoder}.
 *
 * <p>This encoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Precondition checks on the selections (all before any output)</li>
 *   <li>Header: version 2, tree identity, zero tree hash</li>
 *   <li>One record per catalog node, ascending id</li>
 *   <li>Flush of the final partial symbol</li>
 * </ol>
 *
 * <p>Every catalog node gets a record, including trailing unselected ones, so
 * the output matches the reference client symbol for symbol.</p>
 *
 * <p>Stateless and safe to share.</p>
 */
public final class DefaultLoadoutEncoder implements LoadoutEncoder
{
    @Override
    public String encode(int treeIdentity, NodeCatalog catalog, Selections selections)
    {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(selections, "selections");

        if (treeIdentity < 0 || treeIdentity > LoadoutFormat.MAX_TREE_IDENTITY) {
            throw new IllegalArgumentException(
                    "Tree identity must fit in " + LoadoutFormat.TREE_IDENTITY_BITS
                            + " bits (was " + treeIdentity + ")");
        }
        for (Map.Entry<Integer, NodeSelection> e : selections.asMap().entrySet()) {
            TreeNode node = catalog.node(e.getKey()).orElseThrow(() -> new IllegalArgumentException(
                    "Selection references node " + e.getKey() + ", which is not in the catalog"));
            checkRepresentable(node, node.isGrantedFor(treeIdentity), e.getValue());
        }

        final BitStreamWriter writer = new BitStreamWriter();
        final BitChannel ch = BitChannel.writingTo(writer);

        LoadoutFormat.version(ch);
        LoadoutFormat.treeIdentityAndHash(ch, treeIdentity);

        for (TreeNode node : catalog.nodes()) {
            LoadoutFormat.nodeRecord(ch, node, node.isGrantedFor(treeIdentity),
                    selections.get(node.id()).orElse(null));
        }

        return writer.flush();
    }

    /*
     * A selection the record layout cannot carry would otherwise be truncated
     * silently and decode to something else.
     */
    private static void checkRepresentable(TreeNode node, boolean granted, NodeSelection sel)
    {
        final int rank = sel.rank();
        if (rank > node.maxRank()) {
            throw new IllegalArgumentException(
                    "Node " + node.id() + " selected at rank " + rank + ", max is " + node.maxRank());
        }
        if (rank != node.maxRank() && rank > LoadoutFormat.MAX_PARTIAL_RANK) {
            throw new IllegalArgumentException(
                    "Node " + node.id() + " partial rank " + rank + " does not fit in "
                            + LoadoutFormat.RANK_BITS + " bits");
        }

        // At the granted baseline the record ends before the choice field.
        final boolean purchased = rank > (granted ? 1 : 0);
        if (!purchased) {
            return;
        }

        if (!node.kind().carriesChoice()) {
            if (sel.choiceIndex().isPresent()) {
                throw new IllegalArgumentException(
                        "Node " + node.id() + " is " + node.kind() + " and cannot carry a choice index");
            }
            return;
        }
        if (sel.choiceIndex().isEmpty()) {
            throw new IllegalArgumentException(
                    node.kind() + " node " + node.id() + " selected without a choice index");
        }
        final int choice = sel.choiceIndex().getAsInt();
        if (choice > LoadoutFormat.MAX_CHOICE_INDEX || choice >= node.entries().size()) {
            throw new IllegalArgumentException(
                    "Node " + node.id() + " choice index " + choice + " is out of range ("
                            + node.entries().size() + " entries)");
        }
    }
}
