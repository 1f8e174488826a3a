package com.questrail.loadout.observability;

/**
 * Main interface for receiving loadout observability events.
 * Implementations can provide logging, metrics, or auditing.
 */
public interface LoadoutObservabilitySink {
    /**
     * Called after a directive has been applied to a decoded selection mapping.
     * @param event the directive and its effect
     */
    void onDirectiveApplied(DirectiveAppliedEvent event);

    /**
     * Called when a validation pass completes, valid or not.
     * @param event the validation outcome
     */
    void onValidation(ValidationEvent event);

    /**
     * Called when an operation fails with an exception.
     * @param event the error event
     */
    void onError(LoadoutErrorEvent event);
}
