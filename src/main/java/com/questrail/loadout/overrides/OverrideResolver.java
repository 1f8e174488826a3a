package com.questrail.loadout.overrides;

import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.SubtreeSelectorNode;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.catalog.NameMatch;
import com.questrail.loadout.catalog.NodeCatalog;

import java.util.Map;
import java.util.Objects;

/**
 * OverrideResolver
 * -----------------------------------------------------------------------------
 * Translates a name-keyed {@link LoadoutOverrides} into a {@link Selections}
 * mapping the encoder can consume.
 *
 * <h2>Section parts</h2>
 * <p>Each {@code name[:rank]} item is looked up by normalized display name
 * within its own section; the rank defaults to 1. When the name matched an
 * entry of a choice node, the selection takes that entry's index.</p>
 *
 * <h2>Sub-tree part</h2>
 * <p>The named group is taken in full: every node of the group at its max
 * rank, plus the sub-tree selector offering the group at rank 1 choosing it.
 * A catalog with selectors, none of which offers the group, is an error.
 * Choice nodes of the group take the index given in {@code choiceLocks}, or
 * 0.</p>
 *
 * <p>Resolution does not validate budgets or gates; pass the result through
 * the validator for that.</p>
 */
public final class OverrideResolver
{
    private final NodeCatalog catalog;

    public OverrideResolver(NodeCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public Selections resolve(LoadoutOverrides overrides) {
        return resolve(overrides, Map.of());
    }

    /**
     * @param choiceLocks choice index per node id for choice nodes of the
     *                    sub-tree group
     * @throws UnknownNodeException     if a name or the sub-tree group is unknown
     * @throws IllegalArgumentException if a rank is not a positive integer
     */
    public Selections resolve(LoadoutOverrides overrides, Map<Integer, Integer> choiceLocks) {
        Objects.requireNonNull(overrides, "overrides");
        Objects.requireNonNull(choiceLocks, "choiceLocks");

        Selections.Builder out = Selections.builder();
        overrides.primaryPart().ifPresent(s -> resolveSection(s, Section.PRIMARY, out));
        overrides.specializationPart().ifPresent(s -> resolveSection(s, Section.SPECIALIZATION, out));
        overrides.subTreePart().ifPresent(s -> resolveSubTree(s, choiceLocks, out));
        return out.build();
    }

    private void resolveSection(String part, Section section, Selections.Builder out) {
        for (String item : part.split("/")) {
            if (item.isBlank()) {
                continue;
            }
            String[] nameAndRank = item.split(":", 2);
            String name = nameAndRank[0].trim();
            int rank = nameAndRank.length > 1 ? parseRank(nameAndRank[1], item) : 1;

            NameMatch match = catalog.findByName(name, section)
                    .orElseThrow(() -> new UnknownNodeException(name, section.label()));
            TreeNode node = match.node();
            if (node.kind().carriesChoice()) {
                out.select(node.id(), rank, match.entryIndex().orElse(0));
            } else {
                out.select(node.id(), rank);
            }
        }
    }

    private void resolveSubTree(String name, Map<Integer, Integer> choiceLocks, Selections.Builder out) {
        String group = catalog.resolveSubTreeGroup(name)
                .orElseThrow(() -> new UnknownNodeException(name, "sub-tree"));

        for (TreeNode node : catalog.nodesInSubTree(group)) {
            if (node.kind().carriesChoice()) {
                out.select(node.id(), node.maxRank(), choiceLocks.getOrDefault(node.id(), 0));
            } else {
                out.select(node.id(), node.maxRank());
            }
        }

        if (catalog.subtreeSelectors().isEmpty()) {
            return;
        }
        SubtreeSelectorNode selector = catalog.findSubtreeSelectorFor(group)
                .orElseThrow(() -> new UnknownNodeException(group, "sub-tree selectors"));
        out.put(selector.id(), NodeSelection.of(1, selector.indexOfGroup(group).getAsInt()));
    }

    private static int parseRank(String text, String item) {
        try {
            int rank = Integer.parseInt(text.trim());
            if (rank < 1) {
                throw new IllegalArgumentException("Rank must be positive in \"" + item + "\"");
            }
            return rank;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid rank in \"" + item + "\"", e);
        }
    }
}
