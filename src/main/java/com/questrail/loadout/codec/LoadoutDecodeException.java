package com.questrail.loadout.codec;

import java.util.Objects;

/**
 * Indicates that a string could not be decoded as a loadout.
 *
 * <p>{@link #reason()} identifies which check failed:</p>
 * <ul>
 *   <li>{@link Reason#INVALID_CHARACTER} - a character outside the alphabet</li>
 *   <li>{@link Reason#TOO_SHORT} - fewer bits than the fixed header</li>
 *   <li>{@link Reason#UNSUPPORTED_VERSION} - a header version this decoder
 *       does not implement</li>
 *   <li>{@link Reason#MALFORMED_RECORD} - a node record no encoder can
 *       produce (partial rank 0)</li>
 * </ul>
 *
 * <p>Decoding is all-or-nothing: when this is thrown no selections are
 * returned.</p>
 */
public final class LoadoutDecodeException extends RuntimeException
{
    public enum Reason {
        INVALID_CHARACTER,
        TOO_SHORT,
        UNSUPPORTED_VERSION,
        MALFORMED_RECORD
    }

    private final Reason reason;

    public LoadoutDecodeException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
