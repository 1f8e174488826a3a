package com.questrail.loadout.validation;

import com.questrail.loadout.api.Section;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link LoadoutValidator} pass.
 *
 * <p>{@code errors} holds every violation found, in check order; the build is
 * valid exactly when it is empty. {@code pointsSpent} holds the counted total
 * of every section, and {@code subTree} the sub-tree group the selections
 * belong to, when any sub-tree node is selected.</p>
 */
public record ValidationReport(
        List<String> errors,
        Map<Section, Integer> pointsSpent,
        Optional<String> subTree
) {
    public ValidationReport {
        Objects.requireNonNull(errors, "errors");
        Objects.requireNonNull(pointsSpent, "pointsSpent");
        Objects.requireNonNull(subTree, "subTree");
        errors = List.copyOf(errors);
        EnumMap<Section, Integer> spent = new EnumMap<>(Section.class);
        for (Section s : Section.values()) {
            spent.put(s, pointsSpent.getOrDefault(s, 0));
        }
        pointsSpent = Collections.unmodifiableMap(spent);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public int pointsSpent(Section section) {
        return pointsSpent.get(Objects.requireNonNull(section, "section"));
    }
}
