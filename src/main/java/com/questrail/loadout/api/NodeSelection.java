package com.questrail.loadout.api;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * The selection state of one node: a rank of at least 1 and, for choice and
 * selector nodes, the index of the chosen entry.
 *
 * <p>An unselected node (rank 0) is represented by absence from
 * {@link Selections}, never by a {@code NodeSelection}.</p>
 */
public record NodeSelection(int rank, OptionalInt choiceIndex)
{
    public NodeSelection {
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1 (was " + rank + ")");
        }
        Objects.requireNonNull(choiceIndex, "choiceIndex");
        if (choiceIndex.isPresent() && choiceIndex.getAsInt() < 0) {
            throw new IllegalArgumentException("choiceIndex must be >= 0 (was " + choiceIndex.getAsInt() + ")");
        }
    }

    public static NodeSelection of(int rank) {
        return new NodeSelection(rank, OptionalInt.empty());
    }

    public static NodeSelection of(int rank, int choiceIndex) {
        return new NodeSelection(rank, OptionalInt.of(choiceIndex));
    }

    @Override
    public String toString() {
        return choiceIndex.isPresent()
                ? "rank=" + rank + ",choice=" + choiceIndex.getAsInt()
                : "rank=" + rank;
    }
}
