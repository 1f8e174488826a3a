package com.questrail.loadout.catalog;

import java.util.Locale;
import java.util.Objects;

/**
 * Normalization of node and entry display names for lookup.
 *
 * <p>{@code "Collective Anguish"}, {@code "collective_anguish"} and
 * {@code "Collective_Anguish"} all normalize to {@code "collective_anguish"}:
 * lower case, spaces and apostrophes become underscores, anything else that
 * is not a letter, digit or underscore is dropped.</p>
 */
public final class NodeNames
{
    /** Separator between the tier names of a tiered node, e.g. {@code "A / B"}. */
    static final String TIER_SEPARATOR = " / ";

    private NodeNames() {}

    public static String normalize(String name) {
        Objects.requireNonNull(name, "name");
        String lower = name.trim().toLowerCase(Locale.ROOT);
        StringBuilder out = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c == ' ' || c == '\'') {
                out.append('_');
            }
            else if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_') {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Returns the first tier of a tiered name ({@code "A / B"} gives
     * {@code "A"}); other names are returned unchanged.
     */
    public static String firstTier(String name) {
        Objects.requireNonNull(name, "name");
        int sep = name.indexOf(TIER_SEPARATOR);
        return sep < 0 ? name : name.substring(0, sep);
    }
}
