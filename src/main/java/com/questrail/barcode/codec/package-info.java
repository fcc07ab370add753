/**
 * Raster Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> between raw image
 * container bytes and the typed {@link com.questrail.barcode.model.Pixmap}
 * consumed by the recognition pipeline.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec layer sits <strong>below</strong> signal extraction and
 * <strong>above</strong> whatever I/O produced the bytes:</p>
 *
 * <pre>
 *   byte[] container
 *        → RasterDecoder         (header + payload rules applied here)
 *            → Pixmap            (validated, immutable)
 *                → SignalExtractor
 *                    → run lengths
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Decoders are built from the combinators in
 *       {@link com.questrail.barcode.codec.parse}; they never throw on bad
 *       input but return {@link com.questrail.barcode.codec.parse.ParseResult.Err}.</li>
 *   <li>All byte-level mechanics live exclusively in this layer.</li>
 * </ul>
 */
package com.questrail.barcode.codec;
