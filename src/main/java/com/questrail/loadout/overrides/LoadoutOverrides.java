package com.questrail.loadout.overrides;

import java.util.Optional;

/**
 * A name-keyed build description.
 *
 * <ul>
 *   <li><b>primary</b> - {@code name[:rank]/name[:rank]/...} over the primary section</li>
 *   <li><b>specialization</b> - the same, over the specialization section</li>
 *   <li><b>subTree</b> - name of the sub-tree group to take in full</li>
 * </ul>
 *
 * <p>Any part may be absent ({@code null} or blank); an absent part selects
 * nothing.</p>
 */
public record LoadoutOverrides(
        String primary,
        String specialization,
        String subTree
) {
    public LoadoutOverrides {
        primary = blankToNull(primary);
        specialization = blankToNull(specialization);
        subTree = blankToNull(subTree);
    }

    public static LoadoutOverrides none() {
        return new LoadoutOverrides(null, null, null);
    }

    public Optional<String> primaryPart() {
        return Optional.ofNullable(primary);
    }

    public Optional<String> specializationPart() {
        return Optional.ofNullable(specialization);
    }

    public Optional<String> subTreePart() {
        return Optional.ofNullable(subTree);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
