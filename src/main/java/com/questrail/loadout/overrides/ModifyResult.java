package com.questrail.loadout.overrides;

import com.questrail.loadout.validation.ValidationReport;

import java.util.Objects;

/**
 * Outcome of {@link LoadoutModifier#modify}. A modified build either passes
 * validation and is re-encoded, or is rejected with the validator's report and
 * no loadout string.
 */
public sealed interface ModifyResult
        permits ModifyResult.Accepted, ModifyResult.Rejected
{
    ValidationReport report();

    default boolean accepted() {
        return this instanceof Accepted;
    }

    record Accepted(String loadout, ValidationReport report) implements ModifyResult {
        public Accepted {
            Objects.requireNonNull(loadout, "loadout");
            Objects.requireNonNull(report, "report");
        }
    }

    record Rejected(ValidationReport report) implements ModifyResult {
        public Rejected {
            Objects.requireNonNull(report, "report");
        }
    }
}
