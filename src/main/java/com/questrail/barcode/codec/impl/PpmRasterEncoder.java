package com.questrail.barcode.codec.impl;

import com.questrail.barcode.codec.RasterEncoder;
import com.questrail.barcode.model.Pixmap;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * PpmRasterEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RasterEncoder}.
 *
 * <p>This is the mechanical inverse of {@link PpmRasterDecoder}. It writes the
 * canonical header {@code P6\n<width> <height>\n255\n} followed by the raw
 * samples; it never emits comments.</p>
 */
public final class PpmRasterEncoder implements RasterEncoder
{
    @Override
    public byte[] encode(Pixmap pixmap)
    {
        Objects.requireNonNull(pixmap, "pixmap");

        final byte[] header = (PpmRasterDecoder.MAGIC + "\n"
                + pixmap.width() + " " + pixmap.height() + "\n"
                + PpmRasterDecoder.MAX_CHANNEL_VALUE + "\n")
                .getBytes(StandardCharsets.US_ASCII);
        final byte[] samples = pixmap.samples();

        final byte[] out = Arrays.copyOf(header, header.length + samples.length);
        System.arraycopy(samples, 0, out, header.length, samples.length);
        return out;
    }
}
