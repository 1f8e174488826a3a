package com.questrail.loadout.codec.impl;

/**
 * BitStreamWriter
 * -----------------------------------------------------------------------------
 * Packs bits into loadout alphabet symbols, least-significant bit first.
 *
 * <p>Bit {@code i} of the stream lands in bit {@code i % 6} of symbol
 * {@code i / 6}. A symbol is emitted as soon as its six bits are filled;
 * {@link #flush()} emits a trailing partial symbol with its unfilled high
 * bits zero.</p>
 *
 * <p>Not thread-safe; one writer per encode call.</p>
 */
final class BitStreamWriter
{
    private final StringBuilder out = new StringBuilder();
    private int head;
    private int symbol;

    /**
     * Appends the low {@code bitCount} bits of {@code value}, least-significant
     * bit first.
     *
     * @param bitCount number of bits, 0 to 32
     * @param value    source bits; bits above {@code bitCount} are ignored
     */
    void write(int bitCount, int value) {
        if (bitCount < 0 || bitCount > Integer.SIZE) {
            throw new IllegalArgumentException("bitCount must be 0-32 (was " + bitCount + ")");
        }
        for (int i = 0; i < bitCount; i++) {
            int bit = head % LoadoutAlphabet.BITS_PER_SYMBOL;
            head++;
            symbol |= ((value >>> i) & 1) << bit;
            if (bit == LoadoutAlphabet.BITS_PER_SYMBOL - 1) {
                out.append(LoadoutAlphabet.symbolFor(symbol));
                symbol = 0;
            }
        }
    }

    /** Bits written so far. */
    int bitsWritten() {
        return head;
    }

    /**
     * Emits any partial symbol and returns the complete string. Further writes
     * start a fresh symbol.
     */
    String flush() {
        int partial = head % LoadoutAlphabet.BITS_PER_SYMBOL;
        if (partial != 0) {
            out.append(LoadoutAlphabet.symbolFor(symbol));
            symbol = 0;
            head += LoadoutAlphabet.BITS_PER_SYMBOL - partial;
        }
        return out.toString();
    }
}
