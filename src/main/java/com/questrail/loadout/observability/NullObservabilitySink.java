package com.questrail.loadout.observability;

/**
 * No-op implementation of LoadoutObservabilitySink.
 */
public final class NullObservabilitySink implements LoadoutObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDirectiveApplied(DirectiveAppliedEvent event) {}

    @Override
    public void onValidation(ValidationEvent event) {}

    @Override
    public void onError(LoadoutErrorEvent event) {}
}
