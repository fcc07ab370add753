/**
 * Raster Codec: netpbm {@code P6} implementation
 * =============================================================================
 *
 * <h2>Container layout</h2>
 * <pre>
 *   "P6"  ws  width  ws  height  ws  maxval(=255)  one-ws-byte  payload
 * </pre>
 * <p>where {@code ws} is one or more whitespace bytes, optionally interleaved
 * with {@code #} comments running to end of line, and {@code payload} is
 * {@code width * height * 3} bytes, R then G then B, row-major, no padding.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] container
 *        → Parsers.literal / separator / naturalNumber
 *        → Parsers.delimiter
 *        → Parsers.fixedBytes
 *        → Pixmap
 * </pre>
 *
 * <p>Any failure at this layer results in a
 * {@link com.questrail.barcode.codec.parse.ParseResult.Err} carrying the
 * offset where the container stopped conforming.</p>
 */
package com.questrail.barcode.codec.impl;
