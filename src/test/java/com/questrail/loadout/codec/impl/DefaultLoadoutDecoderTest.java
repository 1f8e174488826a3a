package com.questrail.loadout.codec.impl;

import com.questrail.loadout.TestCatalogs;
import com.questrail.loadout.api.DecodedLoadout;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.catalog.NodeCatalog;
import com.questrail.loadout.codec.LoadoutDecodeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultLoadoutDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultLoadoutDecoder}.
 *
 * <ul>
 *   <li>pre-decode checks (alphabet, header length)</li>
 *   <li>version dispatch</li>
 *   <li>record reconstruction, including granted baselines</li>
 *   <li>early termination on short strings</li>
 * </ul>
 */
final class DefaultLoadoutDecoderTest
{
    private final DefaultLoadoutDecoder decoder = new DefaultLoadoutDecoder();
    private final NodeCatalog scenario = TestCatalogs.scenario();

    @Test
    void decodesScenarioString()
    {
        DecodedLoadout d = decoder.decode("CUkAAAAAAAAAAAAAAAAAAAAAAcBbA", scenario);

        assertEquals(581, d.treeIdentity());
        assertEquals(Selections.builder().select(1, 2).select(2, 1, 1).build(), d.selections());
        // C is granted but was written as unselected
        assertEquals(0, d.selections().rankOf(5));
    }

    @Test
    void grantedNodeDecodesToBaselineRank()
    {
        DecodedLoadout d = decoder.decode("CAAAAAAAAAAAAAAAAAAAAAAAAQ", scenario);
        assertEquals(NodeSelection.of(1), d.selections().get(5).orElseThrow());
        assertEquals(1, d.selections().size());
    }

    @Test
    void headerOnlyStringDecodesToNoSelections()
    {
        DecodedLoadout d = decoder.decode("CUkAAAAAAAAAAAAAAAAAAAAAAA", scenario);
        assertEquals(581, d.treeIdentity());
        assertTrue(d.selections().isEmpty());
    }

    @Test
    void stringShorterThanCatalogLeavesTrailingNodesUnselected()
    {
        NodeCatalog sample = TestCatalogs.sample();
        String full = TestCatalogs.VALID_SAMPLE_LOADOUT;
        String cut = full.substring(0, full.length() - 1);

        assertEquals('A', full.charAt(full.length() - 1));
        assertEquals(decoder.decode(full, sample), decoder.decode(cut, sample));
    }

    @Test
    void rejectsCharacterOutsideAlphabet()
    {
        LoadoutDecodeException e = assertThrows(LoadoutDecodeException.class,
                () -> decoder.decode("CUkAAAAAAAAAAAAAAAAAAAAAAc-bA", scenario));
        assertEquals(LoadoutDecodeException.Reason.INVALID_CHARACTER, e.reason());
        assertTrue(e.getMessage().contains("'-'"));
        assertTrue(e.getMessage().contains("26"));
    }

    @Test
    void invalidCharacterIsReportedBeforeLength()
    {
        LoadoutDecodeException e = assertThrows(LoadoutDecodeException.class,
                () -> decoder.decode("C=", scenario));
        assertEquals(LoadoutDecodeException.Reason.INVALID_CHARACTER, e.reason());
    }

    @Test
    void rejectsStringShorterThanHeader()
    {
        // 25 symbols = 150 bits < 152
        LoadoutDecodeException e = assertThrows(LoadoutDecodeException.class,
                () -> decoder.decode("CUkAAAAAAAAAAAAAAAAAAAAAA", scenario));
        assertEquals(LoadoutDecodeException.Reason.TOO_SHORT, e.reason());

        assertThrows(LoadoutDecodeException.class, () -> decoder.decode("", scenario));
    }

    @Test
    void rejectsUnsupportedVersion()
    {
        LoadoutDecodeException e = assertThrows(LoadoutDecodeException.class,
                () -> decoder.decode("DAAAAAAAAAAAAAAAAAAAAAAAAA", scenario));
        assertEquals(LoadoutDecodeException.Reason.UNSUPPORTED_VERSION, e.reason());
        assertTrue(e.getMessage().contains("3"));
    }

    @Test
    void rejectsPartialRankOfZero()
    {
        LoadoutDecodeException e = assertThrows(LoadoutDecodeException.class,
                () -> decoder.decode("CAAAAAAAAAAAAAAAAAAAAAAAAcA", scenario));
        assertEquals(LoadoutDecodeException.Reason.MALFORMED_RECORD, e.reason());
    }

    @Test
    void treeHashBitsAreIgnored()
    {
        // hash region filled with ones
        DecodedLoadout d = decoder.decode("CUkA/////////////////////fBbA", scenario);
        assertEquals(581, d.treeIdentity());
    }
}
