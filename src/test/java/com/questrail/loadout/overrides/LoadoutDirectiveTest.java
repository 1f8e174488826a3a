package com.questrail.loadout.overrides;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class LoadoutDirectiveTest
{
    @Test
    void parsesAddWithoutRank()
    {
        LoadoutDirective d = LoadoutDirective.parse("+Fiery_Demise");

        assertEquals(LoadoutDirective.Action.ADD, d.action());
        assertEquals("Fiery Demise", d.name());
        assertTrue(d.rank().isEmpty());
        assertEquals("+Fiery_Demise", d.text());
    }

    @Test
    void parsesAddWithRank()
    {
        LoadoutDirective d = LoadoutDirective.parse("+Vigor:1");
        assertEquals("Vigor", d.name());
        assertEquals(1, d.rank().getAsInt());
    }

    @Test
    void parsesRemove()
    {
        LoadoutDirective d = LoadoutDirective.parse("-Keen_Edge");
        assertEquals(LoadoutDirective.Action.REMOVE, d.action());
        assertEquals("Keen Edge", d.name());
    }

    @Test
    void rejectsMalformedDirectives()
    {
        for (String bad : new String[] { "Vigor", "+", "", "+Vigor:x", "+Vigor:0", "-Vigor:1", "+:2", "*Vigor" }) {
            assertThrows(IllegalArgumentException.class, () -> LoadoutDirective.parse(bad), bad);
        }
    }
}
