package com.questrail.loadout.codec.impl;

import java.util.Objects;

/**
 * BitStreamReader
 * -----------------------------------------------------------------------------
 * Yields the bits of a loadout string on demand, least-significant bit of each
 * symbol first. Inverse of {@link BitStreamWriter}.
 *
 * <p>Reads past the end of the string return zero bits rather than failing,
 * mirroring the zero padding the writer applies to its last symbol.</p>
 *
 * <p>Not thread-safe; one reader per decode call.</p>
 */
final class BitStreamReader
{
    private final int[] symbols;
    private int head;

    /**
     * @throws IllegalArgumentException if the text contains a character
     *         outside the loadout alphabet
     */
    BitStreamReader(CharSequence text) {
        Objects.requireNonNull(text, "text");
        this.symbols = new int[text.length()];
        for (int i = 0; i < symbols.length; i++) {
            int v = LoadoutAlphabet.valueOf(text.charAt(i));
            if (v < 0) {
                throw new IllegalArgumentException(
                        "Character '" + text.charAt(i) + "' at index " + i + " is not in the loadout alphabet");
            }
            symbols[i] = v;
        }
    }

    /**
     * Returns the next {@code bitCount} bits as an unsigned value, first bit
     * read in bit 0.
     *
     * @param bitCount number of bits, 0 to 32
     */
    int read(int bitCount) {
        if (bitCount < 0 || bitCount > Integer.SIZE) {
            throw new IllegalArgumentException("bitCount must be 0-32 (was " + bitCount + ")");
        }
        int value = 0;
        for (int i = 0; i < bitCount; i++) {
            int index = head / LoadoutAlphabet.BITS_PER_SYMBOL;
            int bit = head % LoadoutAlphabet.BITS_PER_SYMBOL;
            head++;
            int symbol = index < symbols.length ? symbols[index] : 0;
            value |= ((symbol >>> bit) & 1) << i;
        }
        return value;
    }

    /**
     * Total bits in the string minus bits consumed; never negative.
     */
    int bitsRemaining() {
        return Math.max(0, symbols.length * LoadoutAlphabet.BITS_PER_SYMBOL - head);
    }
}
