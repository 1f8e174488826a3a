package com.questrail.loadout.codec.impl;

import java.util.Arrays;

/**
 * LoadoutAlphabet
 * -----------------------------------------------------------------------------
 * The 64-symbol alphabet of loadout strings. A symbol's position in
 * {@link #SYMBOLS} is the 6-bit value it carries; the assignment is the
 * standard base64 one and is order-significant.
 *
 * <p>Unlike RFC 4648 base64 there is no padding character and no byte
 * grouping: the string is a plain bit stream, six bits per symbol.</p>
 */
final class LoadoutAlphabet
{
    static final String SYMBOLS =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    /** Bits carried by one symbol. */
    static final int BITS_PER_SYMBOL = 6;

    private static final int[] VALUES = new int[128];

    static {
        Arrays.fill(VALUES, -1);
        for (int i = 0; i < SYMBOLS.length(); i++) {
            VALUES[SYMBOLS.charAt(i)] = i;
        }
    }

    private LoadoutAlphabet() {}

    /**
     * Returns the symbol carrying a 6-bit value.
     */
    static char symbolFor(int value) {
        if (value < 0 || value >= SYMBOLS.length()) {
            throw new IllegalArgumentException("Symbol value out of range: " + value);
        }
        return SYMBOLS.charAt(value);
    }

    /**
     * Returns the 6-bit value of a symbol, or -1 if the character is not in
     * the alphabet.
     */
    static int valueOf(char symbol) {
        return symbol < VALUES.length ? VALUES[symbol] : -1;
    }

    /**
     * Returns the index of the first character outside the alphabet, or -1
     * if every character belongs to it.
     */
    static int indexOfInvalid(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            if (valueOf(text.charAt(i)) < 0) {
                return i;
            }
        }
        return -1;
    }
}
