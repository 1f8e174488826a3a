/**
 * Loadout Codec (Bit-Level Implementation)
 * =============================================================================
 *
 * <p>Concrete codec that bridges selections and loadout strings.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   encode:  Selections
 *              → LoadoutFormat (via BitChannel.writingTo)
 *              → BitStreamWriter
 *              → String
 *
 *   decode:  String
 *              → LoadoutAlphabet check, header length check
 *              → BitStreamReader
 *              → LoadoutFormat (via BitChannel.readingFrom)
 *              → DecodedLoadout
 * </pre>
 *
 * <p>{@link com.questrail.loadout.codec.impl.LoadoutFormat} is the single
 * description of the field sequence; neither direction walks the layout on
 * its own.</p>
 *
 * <p>This layer is strictly:</p>
 * <ul>
 *   <li>format-faithful</li>
 *   <li>catalog-driven (node order comes from the catalog alone)</li>
 *   <li>legality-free (no budgets, no gates)</li>
 * </ul>
 */
package com.questrail.loadout.codec.impl;
