/**
 * Loadout Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> for loadout
 * strings: the printable, bit-packed form of a selection mapping that game
 * clients and third-party planners exchange.</p>
 *
 * <h2>Normative Authority</h2>
 * <p>The external client's import/export format is the authoritative
 * definition of the layout. The layout must be reproduced exactly; there is
 * no tolerance for output that merely decodes to the same selections.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Selections + NodeCatalog
 *        → LoadoutEncoder      (header + one record per catalog node)
 *            → String
 *
 *   String + NodeCatalog
 *        → LoadoutDecoder      (alphabet, length and version checks first)
 *            → DecodedLoadout
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec never checks budgets, gates or sub-tree consistency; that is
 *       {@code com.questrail.loadout.validation}.</li>
 *   <li>The codec never loads catalogs. Callers supply the same catalog to
 *       both directions.</li>
 *   <li>All bit-level mechanics live in {@code codec.impl}.</li>
 * </ul>
 */
package com.questrail.loadout.codec;
