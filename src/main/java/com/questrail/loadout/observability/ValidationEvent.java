package com.questrail.loadout.observability;

import com.questrail.loadout.validation.ValidationReport;

import java.time.Instant;

/**
 * Record of a completed validation pass.
 */
public record ValidationEvent(
    Instant timestamp,
    int treeIdentity,
    ValidationReport report
) {
}
