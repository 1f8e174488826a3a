package com.questrail.loadout.observability;

import com.questrail.loadout.api.NodeSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LoadoutObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLoadoutObservabilitySink implements LoadoutObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLoadoutObservabilitySink.class);

    @Override
    public void onDirectiveApplied(DirectiveAppliedEvent event) {
        if (event.removal()) {
            log.info("Removed: {} (node {})", event.nodeName(), event.nodeId());
        } else {
            log.info("Set: {} (node {}) {} -> {}",
                event.nodeName(),
                event.nodeId(),
                event.before().map(NodeSelection::toString).orElse("unselected"),
                event.after().map(NodeSelection::toString).orElse("unselected"));
        }
    }

    @Override
    public void onValidation(ValidationEvent event) {
        if (event.report().valid()) {
            log.info("Validation PASS for tree {} (points {}, sub-tree {})",
                event.treeIdentity(),
                event.report().pointsSpent(),
                event.report().subTree().orElse("none"));
            return;
        }
        log.warn("Validation FAIL for tree {}: {} error(s)", event.treeIdentity(), event.report().errors().size());
        for (String error : event.report().errors()) {
            log.warn("  {}", error);
        }
    }

    @Override
    public void onError(LoadoutErrorEvent event) {
        log.error("Loadout Error: {}", event.message(), event.cause());
    }
}
