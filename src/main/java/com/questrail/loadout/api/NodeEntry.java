package com.questrail.loadout.api;

import java.util.Objects;

/**
 * One named option of a {@link ChoiceNode} or {@link SubtreeSelectorNode}.
 *
 * <p>For selector nodes the name is the name of a sub-tree group.</p>
 */
public record NodeEntry(int entryId, String name)
{
    public NodeEntry {
        Objects.requireNonNull(name, "name");
    }
}
