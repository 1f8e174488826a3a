package com.questrail.loadout.validation;

import com.questrail.loadout.api.Section;

import java.util.Objects;

/**
 * SectionBudgets
 * -----------------------------------------------------------------------------
 * The exact number of points each section of a complete build must spend.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>primary</b> - budget of the primary section (default 34)</li>
 *   <li><b>specialization</b> - budget of the specialization section (default 34)</li>
 *   <li><b>subTree</b> - budget of the active sub-tree group (default 13)</li>
 * </ul>
 *
 * <p>Budgets are exact: spending fewer points is as invalid as spending more.</p>
 */
public record SectionBudgets(
        int primary,
        int specialization,
        int subTree
) {
    public static final int DEFAULT_PRIMARY = 34;
    public static final int DEFAULT_SPECIALIZATION = 34;
    public static final int DEFAULT_SUB_TREE = 13;

    public SectionBudgets {
        if (primary < 0) {
            throw new IllegalArgumentException("primary budget must be non-negative");
        }
        if (specialization < 0) {
            throw new IllegalArgumentException("specialization budget must be non-negative");
        }
        if (subTree < 0) {
            throw new IllegalArgumentException("subTree budget must be non-negative");
        }
    }

    public static SectionBudgets defaults() {
        return new SectionBudgets(DEFAULT_PRIMARY, DEFAULT_SPECIALIZATION, DEFAULT_SUB_TREE);
    }

    public int budgetFor(Section section) {
        Objects.requireNonNull(section, "section");
        return switch (section) {
            case PRIMARY -> primary;
            case SPECIALIZATION -> specialization;
            case SUB_TREE -> subTree;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int primary = DEFAULT_PRIMARY;
        private int specialization = DEFAULT_SPECIALIZATION;
        private int subTree = DEFAULT_SUB_TREE;

        public Builder withPrimary(int primary) {
            this.primary = primary;
            return this;
        }

        public Builder withSpecialization(int specialization) {
            this.specialization = specialization;
            return this;
        }

        public Builder withSubTree(int subTree) {
            this.subTree = subTree;
            return this;
        }

        public SectionBudgets build() {
            return new SectionBudgets(primary, specialization, subTree);
        }
    }
}
