package com.questrail.barcode.codec.impl;

import com.questrail.barcode.codec.RasterDecoder;
import com.questrail.barcode.codec.parse.ByteCursor;
import com.questrail.barcode.codec.parse.ParseResult;
import com.questrail.barcode.codec.parse.Parser;
import com.questrail.barcode.codec.parse.Parsers;
import com.questrail.barcode.model.Pixmap;

import java.util.Objects;

/**
 * PpmRasterDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RasterDecoder} for the binary colour
 * netpbm container ({@code P6}).
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Match the two-character tag {@code P6}</li>
 *   <li>Skip whitespace and {@code #} comment lines</li>
 *   <li>Read width, height and maximum channel value as decimal numbers</li>
 *   <li>Require a maximum channel value of exactly 255</li>
 *   <li>Consume exactly one delimiter byte</li>
 *   <li>Consume {@code width * height * 3} payload bytes, row-major RGB</li>
 * </ol>
 *
 * <p>Sixteen-bit rasters (maximum value above 255) are rejected rather than
 * down-sampled. Bytes after the payload are ignored.</p>
 */
public final class PpmRasterDecoder implements RasterDecoder
{
    static final String MAGIC = "P6";
    static final int MAX_CHANNEL_VALUE = 255;

    private static final Parser<Pixmap> CONTAINER =
            Parsers.literal(MAGIC)
                    .then(Parsers.separator())
                    .then(dimension("width"))
                    .bind(width -> Parsers.separator()
                            .then(dimension("height"))
                            .bind(height -> Parsers.separator()
                                    .then(maxChannelValue())
                                    .then(Parsers.delimiter())
                                    .then(payload(width, height))));

    @Override
    public ParseResult<Pixmap> decode(byte[] buffer)
    {
        Objects.requireNonNull(buffer, "buffer");
        return CONTAINER.parse(ByteCursor.of(buffer));
    }

    private static Parser<Integer> dimension(String name)
    {
        return Parsers.position().bind(start -> Parsers.naturalNumber().bind(value ->
                value > 0
                        ? Parsers.<Integer>pure(value)
                        : Parsers.<Integer>failAt("Raster " + name + " must be positive but was " + value, start)));
    }

    private static Parser<Integer> maxChannelValue()
    {
        return Parsers.position().bind(start -> Parsers.naturalNumber().bind(value ->
                value == MAX_CHANNEL_VALUE
                        ? Parsers.<Integer>pure(value)
                        : Parsers.<Integer>failAt("Unsupported maximum channel value " + value
                                + " (only " + MAX_CHANNEL_VALUE + " is supported)", start)));
    }

    private static Parser<Pixmap> payload(int width, int height)
    {
        final long sampleCount = (long) width * height * 3;
        if (sampleCount > Integer.MAX_VALUE) {
            return Parsers.fail("Raster too large: " + width + "x" + height);
        }
        return Parsers.fixedBytes((int) sampleCount)
                .map(samples -> Pixmap.fromSamples(width, height, samples));
    }
}
