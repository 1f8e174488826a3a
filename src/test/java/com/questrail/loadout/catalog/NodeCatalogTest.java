package com.questrail.loadout.catalog;

import com.questrail.loadout.TestCatalogs;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.SubtreeSelectorNode;
import com.questrail.loadout.api.TreeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class NodeCatalogTest
{
    private NodeCatalog catalog;

    @BeforeEach
    void setUp()
    {
        catalog = TestCatalogs.sample();
    }

    @Test
    void nodesAreOrderedById()
    {
        NodeCatalog c = NodeCatalog.of(
                TreeNode.normal(9).build(),
                TreeNode.normal(2).build(),
                TreeNode.normal(5).build());

        assertEquals(List.of(2, 5, 9), c.nodes().stream().map(TreeNode::id).toList());
    }

    @Test
    void rejectsDuplicateIds()
    {
        assertThrows(IllegalArgumentException.class, () -> NodeCatalog.of(
                TreeNode.normal(1).build(),
                TreeNode.normal(1).maxRank(2).build()));
    }

    @Test
    void groupsNodesBySectionAndSubTree()
    {
        assertEquals(List.of(10, 11, 20, 25), ids(catalog.nodesIn(Section.PRIMARY)));
        assertEquals(List.of(30, 31, 40), ids(catalog.nodesIn(Section.SPECIALIZATION)));
        assertEquals(List.of(50, 60, 61, 70, 71), ids(catalog.nodesIn(Section.SUB_TREE)));

        assertEquals(List.of("Aldrachi Reaver", "Fel-Scarred"), List.copyOf(catalog.subTreeGroups()));
        assertEquals(List.of(70, 71), ids(catalog.nodesInSubTree("Fel-Scarred")));
        assertTrue(catalog.nodesInSubTree("Nobody").isEmpty());
    }

    @Test
    void gatesAreDistinctAndAscending()
    {
        assertEquals(Set.of(2), catalog.gates(Section.PRIMARY));
        assertEquals(Set.of(3), catalog.gates(Section.SPECIALIZATION));
        assertTrue(catalog.gates(Section.SUB_TREE).isEmpty());
    }

    @Test
    void findsSubtreeSelectorStructurally()
    {
        SubtreeSelectorNode selector = catalog.findSubtreeSelector().orElseThrow();
        assertEquals(50, selector.id());
        assertEquals(1, selector.indexOfGroup("Fel-Scarred").orElseThrow());
    }

    @Test
    void selectorMustNameOnlyGivenGroups()
    {
        assertTrue(catalog.findSubtreeSelector(Set.of("Aldrachi Reaver")).isEmpty());
        assertTrue(catalog.findSubtreeSelector(Set.of("Aldrachi Reaver", "Fel-Scarred", "Annihilator")).isPresent());
    }

    @Test
    void selectorIsFoundByTheGroupItOffers()
    {
        NodeCatalog c = TestCatalogs.twoSelectors();

        assertEquals(List.of(100, 101), c.subtreeSelectors().stream().map(TreeNode::id).toList());
        assertEquals(101, c.findSubtreeSelectorFor("Fel-Scarred").orElseThrow().id());
        assertEquals(100, c.findSubtreeSelectorFor("Annihilator").orElseThrow().id());
        assertEquals(100, c.findSubtreeSelectorFor("Aldrachi Reaver").orElseThrow().id());
        assertTrue(c.findSubtreeSelectorFor("Lone").isEmpty());
    }

    @Test
    void selectorWithoutEntriesIsNotDiscovered()
    {
        NodeCatalog c = NodeCatalog.of(
                TreeNode.subtreeSelector(1).section(Section.SUB_TREE).build(),
                TreeNode.normal(2).subTree("G").build());
        assertTrue(c.findSubtreeSelector().isEmpty());
    }

    @Test
    void partitionSplitsBySectionAndDetectsSubTree()
    {
        Selections s = TestCatalogs.validSampleBuild().with(999, NodeSelection.of(1));

        SelectionPartition p = catalog.partition(s);

        assertEquals(Set.of(10, 11, 20, 25), p.section(Section.PRIMARY).nodeIds());
        assertEquals(Set.of(30, 31, 40), p.section(Section.SPECIALIZATION).nodeIds());
        assertEquals(Set.of(50, 60, 61), p.section(Section.SUB_TREE).nodeIds());
        assertEquals(Set.of(999), p.unknown().nodeIds());
        assertEquals("Aldrachi Reaver", p.subTree().orElseThrow());
    }

    @Test
    void partitionTieGoesToFirstGroup()
    {
        Selections s = Selections.builder().select(60, 1).select(70, 1).build();
        assertEquals("Aldrachi Reaver", catalog.partition(s).subTree().orElseThrow());

        Selections fs = Selections.builder().select(60, 1).select(70, 1).select(71, 1, 0).build();
        assertEquals("Fel-Scarred", catalog.partition(fs).subTree().orElseThrow());
    }

    @Test
    void noSubTreeDetectedWithoutSubTreeNodes()
    {
        assertTrue(catalog.partition(Selections.builder().select(10, 1).build()).subTree().isEmpty());
    }

    @Test
    void findsNodesByNormalizedName()
    {
        assertEquals(40, catalog.findByName("fiery_demise").orElseThrow().node().id());
        assertEquals(40, catalog.findByName("Fiery Demise").orElseThrow().node().id());
        assertTrue(catalog.findByName("Fiery Demise").orElseThrow().entryIndex().isEmpty());
        assertTrue(catalog.findByName("Nonexistent").isEmpty());
    }

    @Test
    void tieredNodeMatchesOnFirstTier()
    {
        assertEquals(25, catalog.findByName("Keen Edge").orElseThrow().node().id());
        assertTrue(catalog.findByName("Keener Edge").isEmpty());
    }

    @Test
    void entryNamesReportTheirIndex()
    {
        NameMatch chaos = catalog.findByName("Chaos Lance").orElseThrow();
        assertEquals(20, chaos.node().id());
        assertEquals(1, chaos.entryIndex().getAsInt());

        NameMatch fel = catalog.findByName("Fel Lance").orElseThrow();
        assertEquals(20, fel.node().id());
        assertEquals(0, fel.entryIndex().getAsInt());
    }

    @Test
    void nameLookupCanBeRestrictedToSection()
    {
        assertTrue(catalog.findByName("Vigor", Section.PRIMARY).isPresent());
        assertTrue(catalog.findByName("Vigor", Section.SPECIALIZATION).isEmpty());
    }

    @Test
    void resolvesSubTreeGroupLoosely()
    {
        assertEquals("Fel-Scarred", catalog.resolveSubTreeGroup("felscarred").orElseThrow());
        assertEquals("Aldrachi Reaver", catalog.resolveSubTreeGroup("aldrachi_reaver").orElseThrow());
        assertTrue(catalog.resolveSubTreeGroup("annihilator").isEmpty());
    }

    private static List<Integer> ids(List<TreeNode> nodes)
    {
        return nodes.stream().map(TreeNode::id).toList();
    }
}
