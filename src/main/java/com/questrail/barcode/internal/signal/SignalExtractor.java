package com.questrail.barcode.internal.signal;

import com.questrail.barcode.model.Pixmap;

import java.util.Objects;

/**
 * SignalExtractor
 * -----------------------------------------------------------------------------
 * Turns one row of a {@link Pixmap} into alternating bar/space widths.
 *
 * <pre>
 *   Pixmap row
 *        → luminance per pixel
 *            → adaptive threshold (bits)
 *                → run-length encoding
 * </pre>
 *
 * <p>Only the requested row is read; the raster itself is never copied.</p>
 */
public final class SignalExtractor
{
    private final AdaptiveThreshold threshold;

    public SignalExtractor(AdaptiveThreshold threshold)
    {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
    }

    /**
     * Luminance of every pixel in {@code row}.
     *
     * @throws IndexOutOfBoundsException if {@code row} is outside the raster
     */
    public int[] luminanceRow(Pixmap pixmap, int row)
    {
        Objects.requireNonNull(pixmap, "pixmap");
        Objects.checkIndex(row, pixmap.height());

        final int[] values = new int[pixmap.width()];
        for (int column = 0; column < values.length; column++) {
            values[column] = Luminance.of(pixmap.pixel(row, column));
        }
        return values;
    }

    /**
     * Run lengths of the thresholded row.
     *
     * @throws IndexOutOfBoundsException if {@code row} is outside the raster
     */
    public RunLength extractRow(Pixmap pixmap, int row)
    {
        return RunLength.encode(threshold.apply(luminanceRow(pixmap, row)));
    }
}
