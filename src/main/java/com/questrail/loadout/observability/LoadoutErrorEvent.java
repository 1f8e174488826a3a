package com.questrail.loadout.observability;

import java.time.Instant;

/**
 * Record representing a failed loadout operation.
 */
public record LoadoutErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
