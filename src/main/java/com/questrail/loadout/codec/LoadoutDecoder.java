package com.questrail.loadout.codec;

import com.questrail.loadout.api.DecodedLoadout;
import com.questrail.loadout.catalog.NodeCatalog;

/**
 * LoadoutDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary: loadout string to selections.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Rejecting malformed input (alphabet, length, version)</li>
 *   <li>Reconstructing the tree identity and selections</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for budget, gate or
 * sub-tree legality. A string produced by another tool may decode cleanly
 * and still be an illegal build.</p>
 */
public interface LoadoutDecoder
{
    /**
     * Decode a loadout string against the catalog it was encoded with.
     *
     * @param loadout printable loadout string
     * @param catalog node list, walked in ascending id order
     * @return tree identity and selections
     * @throws LoadoutDecodeException if the
     *         string is malformed; no partial result is produced
     */
    DecodedLoadout decode(String loadout, NodeCatalog catalog);
}
