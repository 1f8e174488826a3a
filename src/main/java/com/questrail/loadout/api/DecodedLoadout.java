package com.questrail.loadout.api;

import java.util.Objects;

/**
 * Result of decoding a loadout string: the tree identity from the header and
 * the reconstructed selections.
 */
public record DecodedLoadout(int treeIdentity, Selections selections)
{
    public DecodedLoadout {
        Objects.requireNonNull(selections, "selections");
    }
}
