package com.questrail.loadout.fingerprint;

import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.catalog.NodeCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SelectionFingerprint
 * -----------------------------------------------------------------------------
 * Canonical text over the specialization and sub-tree selections of a build,
 * for deduplication.
 *
 * <pre>
 *   spec[30:3,31:1,40:2]sub[60:1,61:2:c1]
 * </pre>
 *
 * <p>Each item is {@code id:rank}, followed by {@code :cN} when the selection
 * carries choice index N; ids ascend. Primary selections are left out, and so
 * is the sub-tree selector node (its choice is implied by which sub-tree
 * nodes appear). Two builds with equal fingerprints differ at most in their
 * primary section.</p>
 *
 * <p>Items record the selected rank and the choice index, not the node's max
 * rank or the chosen entry's id or name. Fingerprints are stable within this
 * library but are not interchangeable with ones built from entry ids.</p>
 */
public final class SelectionFingerprint
{
    private SelectionFingerprint() {}

    public static String of(Selections selections, NodeCatalog catalog) {
        Objects.requireNonNull(selections, "selections");
        Objects.requireNonNull(catalog, "catalog");

        List<String> spec = new ArrayList<>();
        List<String> sub = new ArrayList<>();
        for (Map.Entry<Integer, NodeSelection> e : selections.asMap().entrySet()) {
            TreeNode node = catalog.node(e.getKey()).orElse(null);
            if (node == null) {
                continue;
            }
            if (node.section() == Section.SPECIALIZATION) {
                spec.add(item(e.getKey(), e.getValue()));
            } else if (node.subTreeGroup().isPresent()) {
                sub.add(item(e.getKey(), e.getValue()));
            }
        }
        return "spec[" + String.join(",", spec) + "]sub[" + String.join(",", sub) + "]";
    }

    private static String item(int id, NodeSelection sel) {
        String base = id + ":" + sel.rank();
        return sel.choiceIndex().isPresent() ? base + ":c" + sel.choiceIndex().getAsInt() : base;
    }
}
