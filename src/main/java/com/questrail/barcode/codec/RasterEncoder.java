package com.questrail.barcode.codec;

import com.questrail.barcode.model.Pixmap;

/**
 * Byte-level encoder producing a raster image container.
 *
 * <p>The outbound counterpart of {@link RasterDecoder}: whatever an encoder
 * writes, the matching decoder reads back to an equal raster.</p>
 */
public interface RasterEncoder
{
    byte[] encode(Pixmap pixmap);
}
