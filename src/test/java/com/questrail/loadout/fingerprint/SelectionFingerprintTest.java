package com.questrail.loadout.fingerprint;

import com.questrail.loadout.TestCatalogs;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.catalog.NodeCatalog;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SelectionFingerprintTest
{
    private final NodeCatalog catalog = TestCatalogs.sample();

    @Test
    void coversSpecializationAndSubTreeNodes()
    {
        assertEquals("spec[30:3,31:1,40:2]sub[60:1,61:2]",
                SelectionFingerprint.of(TestCatalogs.validSampleBuild(), catalog));
    }

    @Test
    void ignoresPrimarySection()
    {
        Selections other = TestCatalogs.validSampleBuild()
                .with(20, NodeSelection.of(1, 0))
                .without(25);

        assertEquals(SelectionFingerprint.of(TestCatalogs.validSampleBuild(), catalog),
                SelectionFingerprint.of(other, catalog));
    }

    @Test
    void includesChoiceIndex()
    {
        Selections felScarred = Selections.builder()
                .select(30, 1)
                .select(50, 1, 1)
                .select(70, 1)
                .select(71, 1, 1)
                .build();

        assertEquals("spec[30:1]sub[70:1,71:1:c1]", SelectionFingerprint.of(felScarred, catalog));
    }

    @Test
    void emptyAndUnknownSelections()
    {
        assertEquals("spec[]sub[]", SelectionFingerprint.of(Selections.empty(), catalog));
        assertEquals("spec[]sub[]",
                SelectionFingerprint.of(Selections.builder().select(999, 1).build(), catalog));
    }
}
