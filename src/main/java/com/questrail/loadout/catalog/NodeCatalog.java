package com.questrail.loadout.catalog;

import com.questrail.loadout.api.NodeEntry;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.SubtreeSelectorNode;
import com.questrail.loadout.api.TreeNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * NodeCatalog
 * -----------------------------------------------------------------------------
 * The ordered, immutable node list a loadout string is encoded against.
 *
 * <h2>Ordering</h2>
 * <p>Nodes are held in ascending id order. That order is the only thing that
 * aligns an encoder with a decoder: both walk {@link #nodes()} front to back,
 * one record per node. A catalog built from a different node list (another
 * client revision, a subset of sections) will not decode strings produced
 * against this one.</p>
 *
 * <h2>Helper queries</h2>
 * <ul>
 *   <li>section and sub-tree membership ({@link #nodesIn(Section)},
 *       {@link #nodesInSubTree(String)})</li>
 *   <li>gate thresholds per section ({@link #gates(Section)})</li>
 *   <li>structural discovery of the sub-tree selector
 *       ({@link #findSubtreeSelector()}, {@link #findSubtreeSelectorFor(String)})</li>
 *   <li>partitioning a selection mapping by section ({@link #partition(Selections)})</li>
 *   <li>name lookup ({@link #findByName(String)})</li>
 * </ul>
 *
 * <p>The catalog is safe to share between threads.</p>
 */
public final class NodeCatalog
{
    private final List<TreeNode> nodes;
    private final Map<Integer, TreeNode> byId;
    private final Map<Section, List<TreeNode>> bySection;
    private final Map<String, List<TreeNode>> bySubTree;
    private final Map<String, NameMatch> byName;
    private final Map<Section, Map<String, NameMatch>> byNameInSection;

    private NodeCatalog(List<TreeNode> sorted) {
        this.nodes = List.copyOf(sorted);

        Map<Integer, TreeNode> ids = new HashMap<>(sorted.size() * 2);
        Map<Section, List<TreeNode>> sections = new EnumMap<>(Section.class);
        Map<String, List<TreeNode>> groups = new LinkedHashMap<>();
        Map<String, NameMatch> names = new HashMap<>();
        Map<Section, Map<String, NameMatch>> sectionNames = new EnumMap<>(Section.class);

        for (Section s : Section.values()) {
            sections.put(s, new ArrayList<>());
            sectionNames.put(s, new HashMap<>());
        }

        for (TreeNode node : sorted) {
            TreeNode prev = ids.put(node.id(), node);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate node id in catalog: " + node.id());
            }
            sections.get(node.section()).add(node);
            node.subTreeGroup().ifPresent(g -> groups.computeIfAbsent(g, k -> new ArrayList<>()).add(node));
            registerName(names, node);
            registerName(sectionNames.get(node.section()), node);
        }

        this.byId = Collections.unmodifiableMap(ids);
        sections.replaceAll((s, list) -> List.copyOf(list));
        this.bySection = Collections.unmodifiableMap(sections);
        groups.replaceAll((g, list) -> List.copyOf(list));
        this.bySubTree = Collections.unmodifiableMap(groups);
        this.byName = Collections.unmodifiableMap(names);
        sectionNames.replaceAll((s, m) -> Collections.unmodifiableMap(m));
        this.byNameInSection = Collections.unmodifiableMap(sectionNames);
    }

    /**
     * Creates a catalog from the given nodes, sorted ascending by id.
     *
     * @throws IllegalArgumentException if two nodes share an id
     */
    public static NodeCatalog of(Collection<? extends TreeNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        List<TreeNode> sorted = new ArrayList<>(nodes.size());
        for (TreeNode n : nodes) {
            sorted.add(Objects.requireNonNull(n, "node"));
        }
        sorted.sort(Comparator.comparingInt(TreeNode::id));
        return new NodeCatalog(sorted);
    }

    public static NodeCatalog of(TreeNode... nodes) {
        return of(List.of(nodes));
    }

    /** All nodes, ascending by id. */
    public List<TreeNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public Optional<TreeNode> node(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(int id) {
        return byId.containsKey(id);
    }

    /** Nodes of one section, ascending by id. */
    public List<TreeNode> nodesIn(Section section) {
        return bySection.get(Objects.requireNonNull(section, "section"));
    }

    /** Sub-tree group names in order of first appearance. */
    public Set<String> subTreeGroups() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(bySubTree.keySet()));
    }

    /** Nodes of the named sub-tree group; empty when the group is unknown. */
    public List<TreeNode> nodesInSubTree(String group) {
        return bySubTree.getOrDefault(Objects.requireNonNull(group, "group"), List.of());
    }

    /**
     * Distinct non-zero gate thresholds of a section, ascending.
     */
    public SortedSet<Integer> gates(Section section) {
        TreeSet<Integer> gates = new TreeSet<>();
        for (TreeNode n : nodesIn(section)) {
            if (n.reqPoints() > 0) {
                gates.add(n.reqPoints());
            }
        }
        return Collections.unmodifiableSortedSet(gates);
    }

    /**
     * Locates the sub-tree selector of this catalog: the first
     * {@link SubtreeSelectorNode} with at least one entry whose entries all
     * name sub-tree groups of this catalog.
     */
    public Optional<SubtreeSelectorNode> findSubtreeSelector() {
        return findSubtreeSelector(bySubTree.keySet());
    }

    /**
     * Locates the first {@link SubtreeSelectorNode} with at least one entry
     * whose entries all name one of the given groups. Catalogs spanning several
     * specializations hold one selector per specialization; passing the groups
     * of one specialization picks its selector.
     */
    public Optional<SubtreeSelectorNode> findSubtreeSelector(Collection<String> groupNames) {
        Objects.requireNonNull(groupNames, "groupNames");
        Set<String> known = new HashSet<>(groupNames);
        for (TreeNode n : nodes) {
            if (!(n instanceof SubtreeSelectorNode selector)) {
                continue;
            }
            List<NodeEntry> entries = selector.entries();
            if (!entries.isEmpty() && entries.stream().allMatch(e -> known.contains(e.name()))) {
                return Optional.of(selector);
            }
        }
        return Optional.empty();
    }

    /**
     * Locates the selector that offers the given group: the first
     * {@link SubtreeSelectorNode} with an entry naming it exactly. Catalogs
     * spanning several specializations share groups between selectors, so
     * the group alone does not always identify one; the lowest id wins.
     */
    public Optional<SubtreeSelectorNode> findSubtreeSelectorFor(String group) {
        Objects.requireNonNull(group, "group");
        for (SubtreeSelectorNode selector : subtreeSelectors()) {
            if (selector.indexOfGroup(group).isPresent()) {
                return Optional.of(selector);
            }
        }
        return Optional.empty();
    }

    /** All sub-tree selector nodes, ascending by id. */
    public List<SubtreeSelectorNode> subtreeSelectors() {
        List<SubtreeSelectorNode> out = new ArrayList<>();
        for (TreeNode n : nodes) {
            if (n instanceof SubtreeSelectorNode selector) {
                out.add(selector);
            }
        }
        return out;
    }

    /**
     * Splits a selection mapping by section and detects the active sub-tree
     * group (the group with the most selected nodes; ties go to the group
     * that appears first in the catalog).
     */
    public SelectionPartition partition(Selections selections) {
        Objects.requireNonNull(selections, "selections");
        Map<Section, Selections.Builder> parts = new EnumMap<>(Section.class);
        for (Section s : Section.values()) {
            parts.put(s, Selections.builder());
        }
        Selections.Builder unknown = Selections.builder();
        Map<String, Integer> groupCounts = new LinkedHashMap<>();
        for (String g : bySubTree.keySet()) {
            groupCounts.put(g, 0);
        }

        for (Map.Entry<Integer, NodeSelection> e : selections.asMap().entrySet()) {
            TreeNode node = byId.get(e.getKey());
            if (node == null) {
                unknown.put(e.getKey(), e.getValue());
                continue;
            }
            parts.get(node.section()).put(e.getKey(), e.getValue());
            node.subTreeGroup().ifPresent(g -> groupCounts.merge(g, 1, Integer::sum));
        }

        String detected = null;
        int best = 0;
        for (Map.Entry<String, Integer> e : groupCounts.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                detected = e.getKey();
            }
        }

        Map<Section, Selections> built = new EnumMap<>(Section.class);
        parts.forEach((s, b) -> built.put(s, b.build()));
        return new SelectionPartition(built, unknown.build(), Optional.ofNullable(detected));
    }

    /**
     * Looks a node up by display name (normalized, see {@link NodeNames}).
     * Node names match on their first tier; entry names of choice and
     * selector nodes match too, reporting the entry's index.
     */
    public Optional<NameMatch> findByName(String name) {
        return Optional.ofNullable(byName.get(NodeNames.normalize(name)));
    }

    /**
     * As {@link #findByName(String)}, restricted to one section.
     */
    public Optional<NameMatch> findByName(String name, Section section) {
        Objects.requireNonNull(section, "section");
        return Optional.ofNullable(byNameInSection.get(section).get(NodeNames.normalize(name)));
    }

    /**
     * Resolves a sub-tree group name case- and punctuation-insensitively.
     */
    public Optional<String> resolveSubTreeGroup(String name) {
        String key = NodeNames.normalize(name);
        for (String g : bySubTree.keySet()) {
            if (NodeNames.normalize(g).equals(key)) {
                return Optional.of(g);
            }
        }
        return Optional.empty();
    }

    private static void registerName(Map<String, NameMatch> index, TreeNode node) {
        List<NodeEntry> entries = node.entries();
        String own = NodeNames.normalize(NodeNames.firstTier(node.displayName()));
        if (!own.isEmpty()) {
            index.put(own, new NameMatch(node, entryIndexOf(entries, own)));
        }
        for (int i = 0; i < entries.size(); i++) {
            String key = NodeNames.normalize(entries.get(i).name());
            if (!key.isEmpty()) {
                index.putIfAbsent(key, new NameMatch(node, OptionalInt.of(i)));
            }
        }
    }

    private static OptionalInt entryIndexOf(List<NodeEntry> entries, String normalized) {
        for (int i = 0; i < entries.size(); i++) {
            if (NodeNames.normalize(entries.get(i).name()).equals(normalized)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "NodeCatalog[" + nodes.size() + " nodes, sub-trees=" + bySubTree.keySet() + "]";
    }
}
