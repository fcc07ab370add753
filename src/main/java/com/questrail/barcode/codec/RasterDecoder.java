package com.questrail.barcode.codec;

import com.questrail.barcode.codec.parse.ParseResult;
import com.questrail.barcode.model.Pixmap;

/**
 * RasterDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for raster image containers.
 *
 * <p>This interface defines the inbound boundary between raw container bytes
 * (typically a whole image file read by the caller) and a structured
 * {@link Pixmap}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating the container header</li>
 *   <li>Detecting truncation of the pixel payload</li>
 *   <li>Constructing a {@link Pixmap} on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting image content</li>
 *   <li>Reading files or streams</li>
 *   <li>Retrying or buffering partial data</li>
 * </ul>
 */
public interface RasterDecoder
{
    /**
     * Decodes a complete container.
     *
     * <p>The input is treated as a complete unit; streaming or accumulation
     * across calls is not supported.</p>
     *
     * @param buffer raw container bytes
     * @return {@link ParseResult.Ok} holding the raster, or
     *         {@link ParseResult.Err} naming the offset at which decoding failed
     */
    ParseResult<Pixmap> decode(byte[] buffer);
}
