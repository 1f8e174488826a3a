package com.questrail.loadout.codec.impl;

import com.questrail.loadout.api.DecodedLoadout;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Selections;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.catalog.NodeCatalog;
import com.questrail.loadout.codec.LoadoutDecodeException;
import com.questrail.loadout.codec.LoadoutDecoder;

import java.util.Objects;

import static com.questrail.loadout.codec.LoadoutDecodeException.Reason.INVALID_CHARACTER;
import static com.questrail.loadout.codec.LoadoutDecodeException.Reason.TOO_SHORT;
import static com.questrail.loadout.codec.LoadoutDecodeException.Reason.UNSUPPORTED_VERSION;

/**
 * DefaultLoadoutDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link LoadoutDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Alphabet check over the whole string</li>
 *   <li>Length check against the fixed header</li>
 *   <li>Version read and dispatch; only version 2 is implemented</li>
 *   <li>Tree identity read, tree hash skipped</li>
 *   <li>One record per catalog node until the string runs out</li>
 * </ol>
 *
 * <p>Strings may end before the last catalog node: encoders are free to drop
 * trailing all-zero symbols, and every node past the end decodes as
 * unselected.</p>
 *
 * <p>Stateless and safe to share.</p>
 */
public final class DefaultLoadoutDecoder implements LoadoutDecoder
{
    @Override
    public DecodedLoadout decode(String loadout, NodeCatalog catalog)
    {
        Objects.requireNonNull(loadout, "loadout");
        Objects.requireNonNull(catalog, "catalog");

        // 1) Alphabet
        final int bad = LoadoutAlphabet.indexOfInvalid(loadout);
        if (bad >= 0) {
            throw new LoadoutDecodeException(INVALID_CHARACTER,
                    "Invalid character '" + loadout.charAt(bad) + "' at index " + bad + " in loadout string");
        }

        // 2) Header length
        final long bits = (long) loadout.length() * LoadoutAlphabet.BITS_PER_SYMBOL;
        if (bits < LoadoutFormat.HEADER_BITS) {
            throw new LoadoutDecodeException(TOO_SHORT,
                    "Loadout string too short: " + bits + " bits, header needs " + LoadoutFormat.HEADER_BITS);
        }

        final BitStreamReader reader = new BitStreamReader(loadout);
        final BitChannel ch = BitChannel.readingFrom(reader);

        // 3) Version dispatch
        final int version = LoadoutFormat.version(ch);
        return switch (version) {
            case LoadoutFormat.VERSION -> decodeVersion2(reader, ch, catalog);
            default -> throw new LoadoutDecodeException(UNSUPPORTED_VERSION,
                    "Unsupported loadout serialization version: " + version);
        };
    }

    private static DecodedLoadout decodeVersion2(BitStreamReader reader, BitChannel ch, NodeCatalog catalog)
    {
        final int treeIdentity = LoadoutFormat.treeIdentityAndHash(ch, 0);
        final Selections.Builder selections = Selections.builder();

        for (TreeNode node : catalog.nodes()) {
            if (reader.bitsRemaining() < 1) {
                break;
            }
            NodeSelection sel = LoadoutFormat.nodeRecord(ch, node, node.isGrantedFor(treeIdentity), null);
            if (sel != null) {
                selections.put(node.id(), sel);
            }
        }

        return new DecodedLoadout(treeIdentity, selections.build());
    }
}
