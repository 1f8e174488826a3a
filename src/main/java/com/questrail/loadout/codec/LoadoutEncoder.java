package com.questrail.loadout.codec;

import com.questrail.loadout.api.Selections;
import com.questrail.loadout.catalog.NodeCatalog;

/**
 * LoadoutEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary: selections to loadout string.
 *
 * <p>The encoder is responsible only for the wire layout. It does not decide
 * what to select and does not check budgets or gates; pair it with
 * {@code LoadoutValidator} where legality matters.</p>
 *
 * <p>Encoding is deterministic: the same tree identity, catalog and selections
 * always produce the same string.</p>
 */
public interface LoadoutEncoder
{
    /**
     * Encode selections against a catalog.
     *
     * @param treeIdentity 16-bit identifier written to the header
     * @param catalog      node list, walked in ascending id order
     * @param selections   sparse selections; every id must exist in the catalog
     * @return the printable loadout string
     * @throws IllegalArgumentException if a selection cannot be represented
     *         against the catalog
     */
    String encode(int treeIdentity, NodeCatalog catalog, Selections selections);
}
