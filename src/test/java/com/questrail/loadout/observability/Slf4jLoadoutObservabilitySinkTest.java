package com.questrail.loadout.observability;

import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.validation.ValidationReport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jLoadoutObservabilitySinkTest
{
    private final Slf4jLoadoutObservabilitySink sink = new Slf4jLoadoutObservabilitySink();

    @Test
    void acceptsEveryEventKind()
    {
        ValidationReport passed = new ValidationReport(List.of(), Map.of(Section.PRIMARY, 4), Optional.of("Aldrachi Reaver"));
        ValidationReport failed = new ValidationReport(List.of("Primary section: 3 points spent, expected 4"),
                Map.of(), Optional.empty());

        assertDoesNotThrow(() -> {
            sink.onDirectiveApplied(new DirectiveAppliedEvent(Instant.now(), "+Vigor", 10, "Vigor",
                    Optional.empty(), Optional.of(NodeSelection.of(2))));
            sink.onDirectiveApplied(new DirectiveAppliedEvent(Instant.now(), "-Vigor", 10, "Vigor",
                    Optional.of(NodeSelection.of(2)), Optional.empty()));
            sink.onValidation(new ValidationEvent(Instant.now(), 581, passed));
            sink.onValidation(new ValidationEvent(Instant.now(), 581, failed));
            sink.onError(new LoadoutErrorEvent(Instant.now(), "boom", new IllegalStateException("boom")));
        });
    }

    @Test
    void removalIsAnEventWithoutResultingSelection()
    {
        DirectiveAppliedEvent e = new DirectiveAppliedEvent(Instant.now(), "-Vigor", 10, "Vigor",
                Optional.of(NodeSelection.of(2)), Optional.empty());
        assertTrue(e.removal());
    }

    @Test
    void reportFillsMissingSectionsWithZero()
    {
        ValidationReport r = new ValidationReport(List.of(), Map.of(Section.PRIMARY, 4), Optional.empty());
        assertEquals(0, r.pointsSpent(Section.SUB_TREE));
        assertTrue(r.valid());
    }
}
