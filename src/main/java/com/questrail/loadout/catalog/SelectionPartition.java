package com.questrail.loadout.catalog;

import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.Selections;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A selection mapping split by {@link Section}.
 *
 * @param bySection selections of each section (every section present, possibly empty)
 * @param unknown   selections whose node id is not in the catalog
 * @param subTree   detected active sub-tree group, if any sub-tree node is selected
 */
public record SelectionPartition(
        Map<Section, Selections> bySection,
        Selections unknown,
        Optional<String> subTree
)
{
    public SelectionPartition {
        Objects.requireNonNull(bySection, "bySection");
        Objects.requireNonNull(unknown, "unknown");
        Objects.requireNonNull(subTree, "subTree");
        Map<Section, Selections> copy = new EnumMap<>(Section.class);
        for (Section s : Section.values()) {
            copy.put(s, bySection.getOrDefault(s, Selections.empty()));
        }
        bySection = Collections.unmodifiableMap(copy);
    }

    public Selections section(Section section) {
        return bySection.get(Objects.requireNonNull(section, "section"));
    }
}
