package com.questrail.loadout.observability;

import com.questrail.loadout.api.NodeSelection;

import java.time.Instant;
import java.util.Optional;

/**
 * Record of one applied add or remove directive.
 *
 * @param directive the directive text as given
 * @param nodeId    node the directive resolved to
 * @param nodeName  display name of that node
 * @param before    the node's selection before the directive
 * @param after     the node's selection after it; empty when removed
 */
public record DirectiveAppliedEvent(
    Instant timestamp,
    String directive,
    int nodeId,
    String nodeName,
    Optional<NodeSelection> before,
    Optional<NodeSelection> after
) {
    public boolean removal() {
        return after.isEmpty();
    }
}
