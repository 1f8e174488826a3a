package com.questrail.loadout.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * TreeNode
 * -----------------------------------------------------------------------------
 * One entry of the node catalog.
 *
 * <h2>Kinds</h2>
 * <p>Node kind is a closed set, expressed as a sealed hierarchy:</p>
 * <ul>
 *   <li>{@link NormalNode} - rank only</li>
 *   <li>{@link ChoiceNode} - rank plus a choice among {@link #entries()}</li>
 *   <li>{@link SubtreeSelectorNode} - a choice among whole sub-tree groups</li>
 * </ul>
 * <p>{@link #kind()} mirrors the concrete class as an enum so that codec code
 * can branch with an exhaustive {@code switch}.</p>
 *
 * <h2>Identity</h2>
 * <p>Equality and hash code are based on {@link #id()} only. Names and other
 * metadata are descriptive and may differ between catalog revisions.</p>
 *
 * <h2>Granted nodes</h2>
 * <p>A granted node is active at rank 1 without spending a point. A node is
 * granted either unconditionally ({@link #granted()}) or only for particular
 * tree identities ({@link #grantedForTrees()}).</p>
 *
 * <p>Instances are immutable and are built through {@link #normal(int)},
 * {@link #choice(int)} or {@link #subtreeSelector(int)}.</p>
 */
public abstract sealed class TreeNode
        permits NormalNode, ChoiceNode, SubtreeSelectorNode
{
    private final int id;
    private final String name;
    private final int maxRank;
    private final boolean granted;
    private final Set<Integer> grantedForTrees;
    private final int reqPoints;
    private final Section section;
    private final String subTreeGroup;

    TreeNode(Builder b) {
        if (b.maxRank < 1) {
            throw new IllegalArgumentException("maxRank must be >= 1 (node " + b.id + ", was " + b.maxRank + ")");
        }
        if (b.reqPoints < 0) {
            throw new IllegalArgumentException("reqPoints must be >= 0 (node " + b.id + ", was " + b.reqPoints + ")");
        }
        if (b.subTreeGroup != null && b.section != Section.SUB_TREE) {
            throw new IllegalArgumentException("Only sub-tree nodes may name a sub-tree group (node " + b.id + ")");
        }
        this.id = b.id;
        this.name = b.name;
        this.maxRank = b.maxRank;
        this.granted = b.granted;
        this.grantedForTrees = Collections.unmodifiableSet(new TreeSet<>(b.grantedForTrees));
        this.reqPoints = b.reqPoints;
        this.section = b.section;
        this.subTreeGroup = b.subTreeGroup;
    }

    public final int id() {
        return id;
    }

    /**
     * Display name. May be empty for nodes the catalog leaves unnamed; choice
     * nodes often carry their names only on their entries.
     */
    public final String name() {
        return name;
    }

    public final int maxRank() {
        return maxRank;
    }

    /** True if the node is granted for every tree identity. */
    public final boolean granted() {
        return granted;
    }

    /** Tree identities for which this node is granted. */
    public final Set<Integer> grantedForTrees() {
        return grantedForTrees;
    }

    /**
     * Returns true if this node is granted when encoded or validated for the
     * given tree identity.
     */
    public final boolean isGrantedFor(int treeIdentity) {
        return granted || grantedForTrees.contains(treeIdentity);
    }

    /**
     * Gate threshold: points that must be spent on lower-gated nodes of the same
     * section before this node may be selected. 0 when ungated.
     */
    public final int reqPoints() {
        return reqPoints;
    }

    public final Section section() {
        return section;
    }

    /** Sub-tree group name; present only for grouped {@link Section#SUB_TREE} nodes. */
    public final Optional<String> subTreeGroup() {
        return Optional.ofNullable(subTreeGroup);
    }

    public abstract NodeKind kind();

    /**
     * Ordered named options. Empty for {@link NormalNode}.
     */
    public List<NodeEntry> entries() {
        return List.of();
    }

    /**
     * Name for display: the node's own name, or its first entry's name when
     * the node itself is unnamed.
     */
    public final String displayName() {
        if (!name.isEmpty()) {
            return name;
        }
        List<NodeEntry> e = entries();
        return e.isEmpty() ? "#" + id : e.get(0).name();
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreeNode that)) return false;
        return id == that.id;
    }

    @Override
    public final int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return kind() + "[" + id + " " + displayName() + "]";
    }

    public static Builder normal(int id) {
        return new Builder(id, NodeKind.NORMAL);
    }

    public static Builder choice(int id) {
        return new Builder(id, NodeKind.CHOICE);
    }

    public static Builder subtreeSelector(int id) {
        return new Builder(id, NodeKind.SUBTREE_SELECTOR);
    }

    public static Builder builder(int id, NodeKind kind) {
        return new Builder(id, Objects.requireNonNull(kind, "kind"));
    }

    public static final class Builder {
        private final int id;
        private final NodeKind kind;
        private String name = "";
        private int maxRank = 1;
        private boolean granted;
        private final Set<Integer> grantedForTrees = new TreeSet<>();
        private int reqPoints;
        private Section section = Section.PRIMARY;
        private String subTreeGroup;
        private final List<NodeEntry> entries = new ArrayList<>();

        private Builder(int id, NodeKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder maxRank(int maxRank) {
            this.maxRank = maxRank;
            return this;
        }

        public Builder granted(boolean granted) {
            this.granted = granted;
            return this;
        }

        public Builder grantedFor(Collection<Integer> treeIdentities) {
            this.grantedForTrees.addAll(Objects.requireNonNull(treeIdentities, "treeIdentities"));
            return this;
        }

        public Builder grantedFor(int treeIdentity) {
            this.grantedForTrees.add(treeIdentity);
            return this;
        }

        public Builder reqPoints(int reqPoints) {
            this.reqPoints = reqPoints;
            return this;
        }

        public Builder section(Section section) {
            this.section = Objects.requireNonNull(section, "section");
            return this;
        }

        /**
         * Places the node in the named sub-tree group; implies
         * {@link Section#SUB_TREE}.
         */
        public Builder subTree(String group) {
            this.subTreeGroup = Objects.requireNonNull(group, "group");
            this.section = Section.SUB_TREE;
            return this;
        }

        public Builder entry(int entryId, String name) {
            this.entries.add(new NodeEntry(entryId, name));
            return this;
        }

        public Builder entries(Collection<NodeEntry> entries) {
            this.entries.addAll(Objects.requireNonNull(entries, "entries"));
            return this;
        }

        List<NodeEntry> entryList() {
            return entries;
        }

        public TreeNode build() {
            return switch (kind) {
                case NORMAL -> new NormalNode(this);
                case CHOICE -> new ChoiceNode(this);
                case SUBTREE_SELECTOR -> new SubtreeSelectorNode(this);
            };
        }
    }
}
