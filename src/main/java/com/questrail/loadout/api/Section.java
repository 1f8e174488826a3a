package com.questrail.loadout.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Section
 * -----------------------------------------------------------------------------
 * The three partitions of a selection tree. Each section is budgeted and gated
 * independently of the others.
 *
 * <p>A {@link #SUB_TREE} node additionally belongs to a named sub-tree group
 * (see {@link TreeNode#subTreeGroup()}); only one group is active in a build.</p>
 */
public enum Section
{
    PRIMARY("primary", "class"),
    SPECIALIZATION("specialization", "spec"),
    SUB_TREE("sub-tree", "hero");

    private final String label;
    private final String alias;

    Section(String label, String alias) {
        this.label = label;
        this.alias = alias;
    }

    /**
     * Returns the canonical lower-case label ({@code "primary"},
     * {@code "specialization"}, {@code "sub-tree"}).
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a section from its canonical label or its catalog alias
     * ({@code "class"}, {@code "spec"}, {@code "hero"}), case-insensitively.
     *
     * @throws IllegalArgumentException if the text names no section
     */
    public static Section fromLabel(String text) {
        Objects.requireNonNull(text, "text");
        String key = text.trim().toLowerCase(Locale.ROOT);
        for (Section s : values()) {
            if (s.label.equals(key) || s.alias.equals(key) || s.name().equalsIgnoreCase(key)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown section: \"" + text + "\"");
    }

    /** Label with the first letter capitalized, for messages. */
    public String displayName() {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
