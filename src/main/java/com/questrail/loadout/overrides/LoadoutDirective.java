package com.questrail.loadout.overrides;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One add or remove instruction of the modify operation.
 *
 * <pre>
 *   +Name        set Name to its max rank
 *   +Name:2      set Name to rank 2
 *   -Name        remove Name
 * </pre>
 *
 * <p>Underscores in the name read as spaces, so {@code +Fiery_Demise} and
 * {@code "+Fiery Demise"} are the same directive.</p>
 *
 * @param text   the directive as given
 * @param action add or remove
 * @param name   display name, underscores replaced by spaces
 * @param rank   explicit rank of an add directive
 */
public record LoadoutDirective(
        String text,
        Action action,
        String name,
        OptionalInt rank
) {
    public enum Action { ADD, REMOVE }

    public LoadoutDirective {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rank, "rank");
        if (action == Action.REMOVE && rank.isPresent()) {
            throw new IllegalArgumentException("Remove directive takes no rank: \"" + text + "\"");
        }
    }

    /**
     * Parses one directive.
     *
     * @throws IllegalArgumentException if the text does not start with
     *         {@code +} or {@code -}, names nothing, or carries a rank that is
     *         not a positive integer
     */
    public static LoadoutDirective parse(String text) {
        Objects.requireNonNull(text, "text");
        String t = text.trim();
        if (t.length() < 2 || (t.charAt(0) != '+' && t.charAt(0) != '-')) {
            throw new IllegalArgumentException("Invalid directive \"" + text + "\": must be +Name[:rank] or -Name");
        }
        Action action = t.charAt(0) == '+' ? Action.ADD : Action.REMOVE;

        String body = t.substring(1);
        OptionalInt rank = OptionalInt.empty();
        int colon = body.indexOf(':');
        if (colon >= 0) {
            String rankText = body.substring(colon + 1).trim();
            body = body.substring(0, colon);
            try {
                rank = OptionalInt.of(Integer.parseInt(rankText));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid rank in directive \"" + text + "\"", e);
            }
            if (rank.getAsInt() < 1) {
                throw new IllegalArgumentException("Rank must be positive in directive \"" + text + "\"");
            }
        }

        String name = body.replace('_', ' ').trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Directive \"" + text + "\" names no node");
        }
        return new LoadoutDirective(text, action, name, rank);
    }
}
