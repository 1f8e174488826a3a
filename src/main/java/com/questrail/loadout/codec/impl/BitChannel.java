package com.questrail.loadout.codec.impl;

/**
 * A direction-agnostic view of a bit stream, so the field sequence in
 * {@link LoadoutFormat} is written once and driven both ways.
 *
 * <ul>
 *   <li>A writing channel writes {@code value} and returns it (masked to
 *       {@code width}).</li>
 *   <li>A reading channel ignores {@code value} and returns the bits read.</li>
 * </ul>
 *
 * <p>Either way the caller branches on the returned value, so the encoder and
 * the decoder take the same path through the same fields.</p>
 */
@FunctionalInterface
interface BitChannel
{
    int field(int width, int value);

    static BitChannel writingTo(BitStreamWriter writer) {
        return (width, value) -> {
            writer.write(width, value);
            return width == Integer.SIZE ? value : value & ((1 << width) - 1);
        };
    }

    static BitChannel readingFrom(BitStreamReader reader) {
        return (width, ignored) -> reader.read(width);
    }
}
