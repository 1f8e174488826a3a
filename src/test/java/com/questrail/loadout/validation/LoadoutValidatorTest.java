package com.questrail.loadout.validation;

import com.questrail.loadout.TestCatalogs;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.catalog.NodeCatalog;
import com.questrail.loadout.codec.impl.DefaultLoadoutDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LoadoutValidatorTest
 * -----------------------------------------------------------------------------
 * Budget, gate, structure and sub-tree checks. Most cases start from the
 * valid sample build and break one thing.
 */
final class LoadoutValidatorTest
{
    private static final int TREE = TestCatalogs.SAMPLE_TREE;

    private NodeCatalog catalog;
    private LoadoutValidator validator;
    private Selections valid;

    @BeforeEach
    void setUp()
    {
        catalog = TestCatalogs.sample();
        validator = new LoadoutValidator(new SectionBudgets(
                TestCatalogs.SAMPLE_PRIMARY_BUDGET,
                TestCatalogs.SAMPLE_SPECIALIZATION_BUDGET,
                TestCatalogs.SAMPLE_SUB_TREE_BUDGET));
        valid = TestCatalogs.validSampleBuild();
    }

    @Test
    void validBuildPasses()
    {
        ValidationReport r = validator.validate(TREE, valid, catalog);

        assertTrue(r.valid(), r.errors().toString());
        assertEquals(4, r.pointsSpent(Section.PRIMARY));
        assertEquals(5, r.pointsSpent(Section.SPECIALIZATION));
        assertEquals(3, r.pointsSpent(Section.SUB_TREE));
        assertEquals("Aldrachi Reaver", r.subTree().orElseThrow());
    }

    @Test
    void validatesDecodedLoadoutWithItsTreeIdentity()
    {
        var decoded = new DefaultLoadoutDecoder().decode(TestCatalogs.VALID_SAMPLE_LOADOUT, catalog);
        assertTrue(validator.validate(decoded, catalog).valid());
    }

    @Test
    void treeSpecificGrantCountsOnlyForThatTree()
    {
        // node 31 is granted for tree 581 only
        ValidationReport unknownTree = validator.validate(valid, catalog);
        assertEquals(6, unknownTree.pointsSpent(Section.SPECIALIZATION));
        assertEquals(List.of("Specialization section: 6 points spent, expected 5"), unknownTree.errors());

        assertFalse(validator.validate(577, valid, catalog).valid());
    }

    @Test
    void budgetMismatchIsReportedPerSection()
    {
        ValidationReport r = validator.validate(TREE, valid.without(40), catalog);

        assertEquals(List.of("Specialization section: 3 points spent, expected 5"), r.errors());
    }

    @Test
    void gateShortfallFailsEvenOnBudget()
    {
        NodeCatalog gated = NodeCatalog.of(
                TreeNode.normal(1).name("Opening").maxRank(7).build(),
                TreeNode.normal(2).name("Middle").maxRank(20).reqPoints(8).build(),
                TreeNode.normal(3).name("Capstone").maxRank(20).reqPoints(20).build());
        Selections s = Selections.builder().select(1, 7).select(2, 13).select(3, 14).build();

        ValidationReport r = new LoadoutValidator(new SectionBudgets(34, 0, 0)).validate(s, gated);

        assertEquals(34, r.pointsSpent(Section.PRIMARY));
        assertEquals(List.of("Primary gate 8: only 7 points spent before it (short by 1)"), r.errors());
    }

    @Test
    void everyGateIsCheckedIndependently()
    {
        NodeCatalog gated = NodeCatalog.of(
                TreeNode.normal(1).maxRank(10).build(),
                TreeNode.normal(2).maxRank(20).reqPoints(8).build(),
                TreeNode.normal(3).maxRank(20).reqPoints(20).build());
        Selections s = Selections.builder().select(1, 8).select(2, 4).select(3, 20).build();

        ValidationReport r = new LoadoutValidator(new SectionBudgets(32, 0, 0)).validate(s, gated);

        assertEquals(List.of("Primary gate 20: only 12 points spent before it (short by 8)"), r.errors());
    }

    @Test
    void freeNodesDoNotCountTowardsGates()
    {
        // 11 is free, so only the two points on 25 precede gate 2
        Selections s = valid.without(10).with(25, NodeSelection.of(2)).with(11, NodeSelection.of(1));
        ValidationReport r = validator.validate(TREE, s, catalog);

        assertTrue(r.errors().contains("Primary section: 3 points spent, expected 4"), r.errors().toString());
        assertFalse(r.errors().stream().anyMatch(e -> e.startsWith("Primary gate")), r.errors().toString());

        Selections starved = valid.without(10).without(25);
        assertTrue(validator.validate(TREE, starved, catalog).errors()
                .contains("Primary gate 2: only 0 points spent before it (short by 2)"));
    }

    @Test
    void allViolationsAreCollected()
    {
        ValidationReport r = validator.validate(TREE, Selections.empty(), catalog);

        assertEquals(5, r.errors().size(), r.errors().toString());
        assertTrue(r.subTree().isEmpty());
    }

    @Test
    void reportsNodeMissingFromCatalog()
    {
        ValidationReport r = validator.validate(TREE, valid.with(999, NodeSelection.of(1)), catalog);
        assertEquals(List.of("Node 999 is not in the catalog"), r.errors());
    }

    @Test
    void reportsRankAboveMax()
    {
        ValidationReport r = validator.validate(TREE, valid.with(10, NodeSelection.of(3)), catalog);
        assertTrue(r.errors().contains("Node 10 (Vigor) selected at rank 3, max rank is 2"), r.errors().toString());
    }

    @Test
    void reportsChoiceIndexOutOfRange()
    {
        ValidationReport r = validator.validate(TREE, valid.with(20, NodeSelection.of(1, 3)), catalog);
        assertEquals(List.of("Node 20 (Fel Lance) choice index 3 is out of range (2 entries)"), r.errors());
    }

    @Test
    void reportsChoiceIndexOnNormalNode()
    {
        ValidationReport r = validator.validate(TREE, valid.with(30, NodeSelection.of(3, 0)), catalog);
        assertEquals(List.of("Node 30 (Soul Rend) carries choice index 0 but is not a choice node"), r.errors());
    }

    @Test
    void reportsSelectionsInTwoSubTrees()
    {
        ValidationReport r = validator.validate(TREE, valid.with(70, NodeSelection.of(1)), catalog);

        assertTrue(r.errors().contains("Selections span more than one sub-tree group: Aldrachi Reaver, Fel-Scarred"),
                r.errors().toString());
    }

    @Test
    void reportsSelectorChoosingOtherSubTree()
    {
        ValidationReport r = validator.validate(TREE, valid.with(50, NodeSelection.of(1, 1)), catalog);

        assertEquals(List.of("Sub-tree selector 50 chooses \"Fel-Scarred\" but no nodes of that sub-tree are selected"),
                r.errors());
    }

    @Test
    void reportsSelectorWithoutChoice()
    {
        ValidationReport r = validator.validate(TREE, valid.with(50, NodeSelection.of(1)), catalog);
        assertEquals(List.of("Sub-tree selector 50 is selected without a choice"), r.errors());
    }

    @Test
    void reportsSubTreeNodesWithoutSelector()
    {
        ValidationReport r = validator.validate(TREE, valid.without(50), catalog);

        assertEquals(List.of("Sub-tree nodes of Aldrachi Reaver are selected but sub-tree selector 50 is not"),
                r.errors());
    }

    @Test
    void missingSelectorIsNamedByTheGroupItOffers()
    {
        LoadoutValidator subTreeOnly = new LoadoutValidator(new SectionBudgets(0, 0, 1));

        ValidationReport r = subTreeOnly.validate(0, Selections.builder().select(400, 1).build(),
                TestCatalogs.twoSelectors());

        assertEquals(List.of("Sub-tree nodes of Fel-Scarred are selected but sub-tree selector 101 is not"),
                r.errors());
    }

    @Test
    void choiceNodeWithoutChoiceIndexIsReported()
    {
        ValidationReport r = validator.validate(TREE, valid.with(20, NodeSelection.of(1)), catalog);

        assertEquals(List.of("Node 20 (Fel Lance) is selected without a choice index"), r.errors());
    }

    @Test
    void grantedChoiceNodeAtBaselineNeedsNoChoiceIndex()
    {
        NodeCatalog c = NodeCatalog.of(TreeNode.choice(2).granted(true).entry(11, "x").entry(12, "y").build());
        LoadoutValidator none = new LoadoutValidator(new SectionBudgets(0, 0, 0));

        assertTrue(none.validate(0, Selections.builder().select(2, 1).build(), c).valid());
    }

    @Test
    void selectorCostsNoPoints()
    {
        assertEquals(3, validator.validate(TREE, valid, catalog).pointsSpent(Section.SUB_TREE));
    }

    @Test
    void defaultValidatorUsesDefaultBudgets()
    {
        assertEquals(SectionBudgets.defaults(), new LoadoutValidator().budgets());
    }
}
