package com.questrail.loadout.overrides;

import java.util.Objects;

/**
 * Raised when a display name used in an override or directive resolves to no
 * node (or sub-tree group) of the catalog.
 */
public final class UnknownNodeException extends RuntimeException
{
    private final String name;
    private final String context;

    /**
     * @param name    the unresolved display name, as given
     * @param context where the name appeared, e.g. {@code "specialization"} or
     *                {@code "directive +Foo:2"}
     */
    public UnknownNodeException(String name, String context) {
        super("Unknown node \"" + name + "\" in " + context);
        this.name = Objects.requireNonNull(name, "name");
        this.context = Objects.requireNonNull(context, "context");
    }

    public String name() {
        return name;
    }

    public String context() {
        return context;
    }
}
