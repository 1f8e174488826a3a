package com.questrail.loadout.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class BitStreamReaderTest
{
    @Test
    void readsFieldsLeastSignificantBitFirst()
    {
        BitStreamReader r = new BitStreamReader("1");
        assertEquals(5, r.read(3));
        assertEquals(6, r.read(3));
    }

    @Test
    void fieldMaySpanSymbols()
    {
        BitStreamReader r = new BitStreamReader("CA");
        assertEquals(2, r.read(8));
        assertEquals(4, r.bitsRemaining());
    }

    @Test
    void readingPastEndYieldsZeros()
    {
        BitStreamReader r = new BitStreamReader("B");
        assertEquals(1, r.read(6));
        assertEquals(0, r.bitsRemaining());
        assertEquals(0, r.read(8));
        assertEquals(0, r.bitsRemaining());
    }

    @Test
    void readsBackThirtyTwoBitValue()
    {
        BitStreamWriter w = new BitStreamWriter();
        w.write(32, 0xCAFEBABE);
        w.write(5, 17);
        BitStreamReader r = new BitStreamReader(w.flush());
        assertEquals(0xCAFEBABE, r.read(32));
        assertEquals(17, r.read(5));
    }

    @Test
    void rejectsCharacterOutsideAlphabet()
    {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new BitStreamReader("AB=C"));
        assertTrue(e.getMessage().contains("index 2"));
    }
}
