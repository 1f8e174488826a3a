package com.questrail.loadout.codec.impl;

import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.codec.LoadoutDecodeException;

import java.util.OptionalInt;

/**
 * LoadoutFormat
 * -----------------------------------------------------------------------------
 * The version 2 loadout layout, expressed once as a sequence of
 * {@link BitChannel} fields and shared by {@link DefaultLoadoutEncoder} and
 * {@link DefaultLoadoutDecoder}.
 *
 * <h2>Header</h2>
 * <pre>
 *   version       8 bits   always 2
 *   treeIdentity 16 bits
 *   treeHash    128 bits   zero on write, ignored on read
 * </pre>
 *
 * <h2>Per-node record</h2>
 * <p>One record per catalog node, in ascending id order. Fields in brackets
 * are present only on the branch shown:</p>
 * <pre>
 *   selected      1        0 = rank 0, record ends
 *   purchased     1        0 = granted baseline (rank 1), record ends
 *   partial       1        0 = max rank
 *   [rank         6]       when partial
 *   hasChoice     1
 *   [choiceIndex  2]       when hasChoice
 * </pre>
 *
 * <p>The layout is positional. Nothing is length-prefixed, so one field out of
 * step misaligns every later node. Any change here applies to both directions
 * by construction.</p>
 */
final class LoadoutFormat
{
    static final int VERSION = 2;

    static final int VERSION_BITS = 8;
    static final int TREE_IDENTITY_BITS = 16;
    static final int TREE_HASH_BITS = 128;
    static final int HEADER_BITS = VERSION_BITS + TREE_IDENTITY_BITS + TREE_HASH_BITS;

    static final int RANK_BITS = 6;
    static final int CHOICE_BITS = 2;

    static final int MAX_TREE_IDENTITY = (1 << TREE_IDENTITY_BITS) - 1;
    static final int MAX_PARTIAL_RANK = (1 << RANK_BITS) - 1;
    static final int MAX_CHOICE_INDEX = (1 << CHOICE_BITS) - 1;

    private LoadoutFormat() {}

    /**
     * Version field. Always the first field of a loadout string, whatever the
     * version; everything after it is version-specific.
     */
    static int version(BitChannel ch) {
        return ch.field(VERSION_BITS, VERSION);
    }

    /**
     * Tree identity and the reserved tree hash.
     *
     * @return the tree identity written or read
     */
    static int treeIdentityAndHash(BitChannel ch, int treeIdentity) {
        int tree = ch.field(TREE_IDENTITY_BITS, treeIdentity);
        for (int i = 0; i < TREE_HASH_BITS / Integer.SIZE; i++) {
            ch.field(Integer.SIZE, 0);
        }
        return tree;
    }

    /**
     * One node record.
     *
     * @param node      catalog node the record belongs to
     * @param granted   whether the node is granted for the tree identity; sets
     *                  the baseline the purchased flag is measured against
     * @param selection the node's selection when writing, {@code null} when the
     *                  node is unselected or when reading
     * @return the selection written or read; {@code null} for an unselected node
     */
    static NodeSelection nodeRecord(BitChannel ch, TreeNode node, boolean granted, NodeSelection selection) {
        int rank = selection == null ? 0 : selection.rank();

        if (ch.field(1, rank > 0 ? 1 : 0) == 0) {
            return null;
        }

        int baseline = granted ? 1 : 0;
        if (ch.field(1, rank > baseline ? 1 : 0) == 0) {
            return NodeSelection.of(1);
        }

        int recordRank = node.maxRank();
        if (ch.field(1, rank == node.maxRank() ? 0 : 1) == 1) {
            recordRank = ch.field(RANK_BITS, rank);
            if (recordRank == 0) {
                throw new LoadoutDecodeException(LoadoutDecodeException.Reason.MALFORMED_RECORD,
                        "Node " + node.id() + " is selected with partial rank 0");
            }
        }

        OptionalInt choice = OptionalInt.empty();
        int choiceIndex = selection == null ? 0 : selection.choiceIndex().orElse(0);
        if (ch.field(1, node.kind().carriesChoice() ? 1 : 0) == 1) {
            choice = OptionalInt.of(ch.field(CHOICE_BITS, choiceIndex));
        }

        return new NodeSelection(recordRank, choice);
    }
}
