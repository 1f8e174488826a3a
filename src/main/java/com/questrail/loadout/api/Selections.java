package com.questrail.loadout.api;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Selections
 * -----------------------------------------------------------------------------
 * A sparse, immutable mapping from node id to {@link NodeSelection}.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Absence of an id means rank 0 (not selected)</li>
 *   <li>Iteration is in ascending id order</li>
 *   <li>No catalog is attached: ids are not checked against any catalog here</li>
 * </ul>
 *
 * <h2>Mutability</h2>
 * <p>Instances never change. {@link #with(int, NodeSelection)} and
 * {@link #without(int)} return modified copies, so a mapping handed to an
 * encoder or validator is never altered by it. Use {@link #builder()} for
 * incremental construction.</p>
 */
public final class Selections
{
    private static final Selections EMPTY = new Selections(new TreeMap<>());

    private final NavigableMap<Integer, NodeSelection> byId;

    private Selections(NavigableMap<Integer, NodeSelection> byId) {
        this.byId = Collections.unmodifiableNavigableMap(byId);
    }

    public static Selections empty() {
        return EMPTY;
    }

    public static Selections of(Map<Integer, NodeSelection> selections) {
        Objects.requireNonNull(selections, "selections");
        TreeMap<Integer, NodeSelection> copy = new TreeMap<>();
        selections.forEach((id, sel) -> copy.put(
                Objects.requireNonNull(id, "id"),
                Objects.requireNonNull(sel, "selection of " + id)));
        return new Selections(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<NodeSelection> get(int nodeId) {
        return Optional.ofNullable(byId.get(nodeId));
    }

    /**
     * Returns the selected rank of a node, or 0 when it is not selected.
     */
    public int rankOf(int nodeId) {
        NodeSelection sel = byId.get(nodeId);
        return sel == null ? 0 : sel.rank();
    }

    public boolean contains(int nodeId) {
        return byId.containsKey(nodeId);
    }

    /** Selected node ids, ascending. */
    public Set<Integer> nodeIds() {
        return byId.keySet();
    }

    /** Read-only view of the mapping, ascending by id. */
    public Map<Integer, NodeSelection> asMap() {
        return byId;
    }

    public int size() {
        return byId.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    public Selections with(int nodeId, NodeSelection selection) {
        Objects.requireNonNull(selection, "selection");
        TreeMap<Integer, NodeSelection> copy = new TreeMap<>(byId);
        copy.put(nodeId, selection);
        return new Selections(copy);
    }

    public Selections without(int nodeId) {
        if (!byId.containsKey(nodeId)) {
            return this;
        }
        TreeMap<Integer, NodeSelection> copy = new TreeMap<>(byId);
        copy.remove(nodeId);
        return new Selections(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selections that)) return false;
        return byId.equals(that.byId);
    }

    @Override
    public int hashCode() {
        return byId.hashCode();
    }

    @Override
    public String toString() {
        return byId.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    /**
     * Mutable builder; later puts for the same id replace earlier ones.
     */
    public static final class Builder {
        private final TreeMap<Integer, NodeSelection> working = new TreeMap<>();

        private Builder() {}

        public Builder select(int nodeId, int rank) {
            working.put(nodeId, NodeSelection.of(rank));
            return this;
        }

        public Builder select(int nodeId, int rank, int choiceIndex) {
            working.put(nodeId, NodeSelection.of(rank, choiceIndex));
            return this;
        }

        public Builder put(int nodeId, NodeSelection selection) {
            working.put(nodeId, Objects.requireNonNull(selection, "selection"));
            return this;
        }

        public Builder remove(int nodeId) {
            working.remove(nodeId);
            return this;
        }

        public Builder putAll(Selections other) {
            working.putAll(Objects.requireNonNull(other, "other").byId);
            return this;
        }

        public Selections build() {
            return working.isEmpty() ? EMPTY : new Selections(new TreeMap<>(working));
        }
    }
}
