package com.questrail.loadout.validation;

import com.questrail.loadout.api.DecodedLoadout;
import com.questrail.loadout.api.NodeEntry;
import com.questrail.loadout.api.NodeKind;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.SubtreeSelectorNode;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.catalog.NodeCatalog;
import com.questrail.loadout.catalog.SelectionPartition;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * LoadoutValidator
 * -----------------------------------------------------------------------------
 * Structural legality checks for a selection mapping against a catalog.
 *
 * <h2>Checks</h2>
 * <ol>
 *   <li><b>Structure</b> - every selected id is in the catalog, ranks do not
 *       exceed the node's max rank, choice indices address an entry, and a
 *       purchased choice node carries one</li>
 *   <li><b>Budgets</b> - each section spends exactly its budget</li>
 *   <li><b>Gates</b> - for every gate threshold of a section, the points spent
 *       on nodes gated below it reach the threshold</li>
 *   <li><b>Sub-tree</b> - selections stay inside one sub-tree group, and the
 *       selector node agrees with that group</li>
 * </ol>
 *
 * <h2>Point counting</h2>
 * <p>Granted nodes and sub-tree selector nodes cost nothing and are left out of
 * both budget and gate sums. Nodes granted only for particular tree identities
 * count as granted only when the tree identity is known.</p>
 *
 * <h2>Error policy</h2>
 * <p>Rule violations never throw. Every check runs and every violation is
 * reported, so one pass shows the whole list.</p>
 *
 * <p>Instances are immutable and safe to share.</p>
 */
public final class LoadoutValidator
{
    private final SectionBudgets budgets;

    public LoadoutValidator() {
        this(SectionBudgets.defaults());
    }

    public LoadoutValidator(SectionBudgets budgets) {
        this.budgets = Objects.requireNonNull(budgets, "budgets");
    }

    public SectionBudgets budgets() {
        return budgets;
    }

    /**
     * Validates selections with no tree identity known; only unconditionally
     * granted nodes are free.
     */
    public ValidationReport validate(Selections selections, NodeCatalog catalog) {
        return check(selections, catalog, TreeNode::granted);
    }

    /**
     * Validates selections made for the given tree identity.
     */
    public ValidationReport validate(int treeIdentity, Selections selections, NodeCatalog catalog) {
        return check(selections, catalog, n -> n.isGrantedFor(treeIdentity));
    }

    public ValidationReport validate(DecodedLoadout loadout, NodeCatalog catalog) {
        Objects.requireNonNull(loadout, "loadout");
        return validate(loadout.treeIdentity(), loadout.selections(), catalog);
    }

    private ValidationReport check(Selections selections, NodeCatalog catalog, Predicate<TreeNode> free) {
        Objects.requireNonNull(selections, "selections");
        Objects.requireNonNull(catalog, "catalog");

        final List<String> errors = new ArrayList<>();
        final SelectionPartition partition = catalog.partition(selections);

        // 1) Structure
        for (Integer id : partition.unknown().nodeIds()) {
            errors.add("Node " + id + " is not in the catalog");
        }
        for (Map.Entry<Integer, NodeSelection> e : selections.asMap().entrySet()) {
            catalog.node(e.getKey()).ifPresent(node -> checkStructure(node, e.getValue(), free, errors));
        }

        // 2) Budgets
        final Map<Section, Integer> spent = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            Selections inSection = partition.section(section);
            int total = 0;
            for (Map.Entry<Integer, NodeSelection> e : inSection.asMap().entrySet()) {
                TreeNode node = catalog.node(e.getKey()).orElseThrow();
                if (costsPoints(node, free)) {
                    total += e.getValue().rank();
                }
            }
            spent.put(section, total);

            int budget = budgets.budgetFor(section);
            if (total != budget) {
                errors.add(section.displayName() + " section: " + total
                        + " points spent, expected " + budget);
            }
        }

        // 3) Gates
        for (Section section : Section.values()) {
            checkGates(section, catalog, partition.section(section), free, errors);
        }

        // 4) Sub-tree
        checkSubTree(catalog, selections, errors);

        return new ValidationReport(errors, spent, partition.subTree());
    }

    private static void checkStructure(TreeNode node, NodeSelection sel, Predicate<TreeNode> free,
                                       List<String> errors) {
        if (sel.rank() > node.maxRank()) {
            errors.add("Node " + describe(node) + " selected at rank " + sel.rank()
                    + ", max rank is " + node.maxRank());
        }
        if (sel.choiceIndex().isEmpty()) {
            // Above the granted baseline the record carries a choice. Selectors report this themselves.
            boolean purchased = sel.rank() > (free.test(node) ? 1 : 0);
            if (node.kind() == NodeKind.CHOICE && purchased) {
                errors.add("Node " + describe(node) + " is selected without a choice index");
            }
            return;
        }
        int choice = sel.choiceIndex().getAsInt();
        if (!node.kind().carriesChoice()) {
            errors.add("Node " + describe(node) + " carries choice index " + choice
                    + " but is not a choice node");
        } else if (choice >= node.entries().size()) {
            errors.add("Node " + describe(node) + " choice index " + choice
                    + " is out of range (" + node.entries().size() + " entries)");
        }
    }

    private static void checkGates(Section section, NodeCatalog catalog, Selections inSection,
                                   Predicate<TreeNode> free, List<String> errors) {
        for (int gate : catalog.gates(section)) {
            int spentBefore = 0;
            for (Map.Entry<Integer, NodeSelection> e : inSection.asMap().entrySet()) {
                TreeNode node = catalog.node(e.getKey()).orElseThrow();
                if (node.reqPoints() < gate && costsPoints(node, free)) {
                    spentBefore += e.getValue().rank();
                }
            }
            if (spentBefore < gate) {
                errors.add(section.displayName() + " gate " + gate + ": only " + spentBefore
                        + " points spent before it (short by " + (gate - spentBefore) + ")");
            }
        }
    }

    private static void checkSubTree(NodeCatalog catalog, Selections selections, List<String> errors) {
        Set<String> activeGroups = new LinkedHashSet<>();
        for (Integer id : selections.nodeIds()) {
            catalog.node(id).flatMap(TreeNode::subTreeGroup).ifPresent(activeGroups::add);
        }
        if (activeGroups.size() > 1) {
            errors.add("Selections span more than one sub-tree group: " + String.join(", ", activeGroups));
        }

        boolean selectorSelected = false;
        for (Map.Entry<Integer, NodeSelection> e : selections.asMap().entrySet()) {
            Optional<TreeNode> node = catalog.node(e.getKey());
            if (node.isEmpty() || node.get().kind() != NodeKind.SUBTREE_SELECTOR) {
                continue;
            }
            selectorSelected = true;
            checkSelector((SubtreeSelectorNode) node.get(), e.getValue(), activeGroups, errors);
        }

        if (!selectorSelected && !activeGroups.isEmpty()) {
            catalog.findSubtreeSelectorFor(activeGroups.iterator().next()).ifPresent(selector -> errors.add(
                    "Sub-tree nodes of " + String.join(", ", activeGroups)
                            + " are selected but sub-tree selector " + selector.id() + " is not"));
        }
    }

    private static void checkSelector(SubtreeSelectorNode selector, NodeSelection sel,
                                      Set<String> activeGroups, List<String> errors) {
        if (sel.choiceIndex().isEmpty()) {
            errors.add("Sub-tree selector " + selector.id() + " is selected without a choice");
            return;
        }
        int choice = sel.choiceIndex().getAsInt();
        if (choice >= selector.entries().size()) {
            return; // reported by the structure check
        }
        NodeEntry entry = selector.entries().get(choice);
        if (!activeGroups.contains(entry.name())) {
            errors.add("Sub-tree selector " + selector.id() + " chooses \"" + entry.name()
                    + "\" but no nodes of that sub-tree are selected");
        }
    }

    private static boolean costsPoints(TreeNode node, Predicate<TreeNode> free) {
        return node.kind() != NodeKind.SUBTREE_SELECTOR && !free.test(node);
    }

    private static String describe(TreeNode node) {
        return node.id() + " (" + node.displayName() + ")";
    }
}
