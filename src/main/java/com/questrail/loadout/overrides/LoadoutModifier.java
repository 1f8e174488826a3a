package com.questrail.loadout.overrides;

import com.questrail.loadout.api.DecodedLoadout;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.catalog.NameMatch;
import com.questrail.loadout.catalog.NodeCatalog;
import com.questrail.loadout.codec.LoadoutDecodeException;
import com.questrail.loadout.codec.LoadoutDecoder;
import com.questrail.loadout.codec.LoadoutEncoder;
import com.questrail.loadout.observability.DirectiveAppliedEvent;
import com.questrail.loadout.observability.LoadoutErrorEvent;
import com.questrail.loadout.observability.LoadoutObservabilitySink;
import com.questrail.loadout.observability.ValidationEvent;
import com.questrail.loadout.validation.LoadoutValidator;
import com.questrail.loadout.validation.ValidationReport;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LoadoutModifier
 * -----------------------------------------------------------------------------
 * Edits an existing loadout string by display name.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   loadout string
 *     → decode
 *     → apply directives in order
 *     → validate (with the decoded tree identity)
 *     → encode, only when valid
 * </pre>
 *
 * <h2>Directive semantics</h2>
 * <ul>
 *   <li>{@code +Name[:rank]} sets the node to the given rank, or its max rank.
 *       A choice or selector node takes the entry the name matched; otherwise
 *       it keeps its current choice, or 0 when it had none.</li>
 *   <li>{@code -Name} removes the node. Removing an unselected node is a
 *       no-op.</li>
 * </ul>
 *
 * <p>An invalid result is not an error: it comes back as
 * {@link ModifyResult.Rejected} carrying the full report. Malformed input
 * (undecodable strings, unknown names) throws.</p>
 */
public final class LoadoutModifier
{
    private final NodeCatalog catalog;
    private final LoadoutDecoder decoder;
    private final LoadoutEncoder encoder;
    private final LoadoutValidator validator;
    private final LoadoutObservabilitySink sink;

    public LoadoutModifier(NodeCatalog catalog,
                           LoadoutDecoder decoder,
                           LoadoutEncoder encoder,
                           LoadoutValidator validator,
                           LoadoutObservabilitySink sink) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @throws LoadoutDecodeException if the base string does not decode
     * @throws UnknownNodeException   if a directive names no catalog node
     */
    public ModifyResult modify(String loadout, List<LoadoutDirective> directives) {
        Objects.requireNonNull(loadout, "loadout");
        Objects.requireNonNull(directives, "directives");

        final DecodedLoadout base;
        try {
            base = decoder.decode(loadout, catalog);
        } catch (LoadoutDecodeException e) {
            sink.onError(new LoadoutErrorEvent(Instant.now(), "Base loadout does not decode: " + e.getMessage(), e));
            throw e;
        }

        Selections selections = base.selections();
        for (LoadoutDirective directive : directives) {
            selections = apply(selections, Objects.requireNonNull(directive, "directive"));
        }

        final ValidationReport report = validator.validate(base.treeIdentity(), selections, catalog);
        sink.onValidation(new ValidationEvent(Instant.now(), base.treeIdentity(), report));

        if (!report.valid()) {
            return new ModifyResult.Rejected(report);
        }
        return new ModifyResult.Accepted(encoder.encode(base.treeIdentity(), catalog, selections), report);
    }

    private Selections apply(Selections selections, LoadoutDirective directive) {
        Optional<NameMatch> found = catalog.findByName(directive.name());
        if (found.isEmpty()) {
            UnknownNodeException e = new UnknownNodeException(directive.name(), "directive " + directive.text());
            sink.onError(new LoadoutErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
        final NameMatch match = found.get();
        final TreeNode node = match.node();
        final Optional<NodeSelection> before = selections.get(node.id());

        final Selections after;
        if (directive.action() == LoadoutDirective.Action.REMOVE) {
            after = selections.without(node.id());
        } else {
            int rank = directive.rank().orElse(node.maxRank());
            NodeSelection sel;
            if (node.kind().carriesChoice()) {
                int choice = 0;
                if (match.entryIndex().isPresent()) {
                    choice = match.entryIndex().getAsInt();
                } else if (before.isPresent() && before.get().choiceIndex().isPresent()) {
                    choice = before.get().choiceIndex().getAsInt();
                }
                sel = NodeSelection.of(rank, choice);
            } else {
                sel = NodeSelection.of(rank);
            }
            after = selections.with(node.id(), sel);
        }

        sink.onDirectiveApplied(new DirectiveAppliedEvent(
                Instant.now(), directive.text(), node.id(), node.displayName(), before, after.get(node.id())));
        return after;
    }
}
