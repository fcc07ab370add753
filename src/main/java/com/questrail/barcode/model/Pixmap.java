package com.questrail.barcode.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Pixmap
 * -----------------------------------------------------------------------------
 * Immutable colour raster, addressed {@code [row][column]}.
 *
 * <h2>Why a flat {@code byte[]}</h2>
 * Samples are kept exactly as they appear in the container payload:
 * three bytes per pixel (R, G, B), row-major, no padding. Consumers read
 * individual pixels through {@link #pixel(int, int)}; nothing hands out a
 * copy of the whole grid.
 *
 * Samples are copied on the way in and on the way out.
 */
public final class Pixmap
{
    private final int width;
    private final int height;
    private final byte[] samples;

    private Pixmap(int width, int height, byte[] samples)
    {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /**
     * Wraps row-major RGB samples.
     *
     * @throws IllegalArgumentException if a dimension is not positive or the
     *         sample count is not {@code width * height * 3}
     */
    public static Pixmap fromSamples(int width, int height, byte[] samples)
    {
        Objects.requireNonNull(samples, "samples");
        checkDimensions(width, height);
        final long expected = (long) width * height * 3;
        if (samples.length != expected) {
            throw new IllegalArgumentException(
                    "Expected " + expected + " samples for " + width + "x" + height + " but got " + samples.length);
        }
        return new Pixmap(width, height, samples.clone());
    }

    public static Builder builder(int width, int height)
    {
        return new Builder(width, height);
    }

    public int width()
    {
        return width;
    }

    public int height()
    {
        return height;
    }

    /**
     * Returns the pixel at {@code row}, {@code column}.
     *
     * @throws IndexOutOfBoundsException if either coordinate is outside the raster
     */
    public Rgb pixel(int row, int column)
    {
        Objects.checkIndex(row, height);
        Objects.checkIndex(column, width);
        final int base = (row * width + column) * 3;
        return new Rgb(samples[base] & 0xFF, samples[base + 1] & 0xFF, samples[base + 2] & 0xFF);
    }

    /**
     * Returns a copy of the raw row-major RGB samples.
     */
    public byte[] samples()
    {
        return samples.clone();
    }

    @Override
    public String toString()
    {
        return "Pixmap[" + width + "x" + height + ']';
    }

    private static void checkDimensions(int width, int height)
    {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + width + "x" + height);
        }
        if ((long) width * height * 3 > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Raster too large: " + width + "x" + height);
        }
    }

    /**
     * Mutable staging area for building a {@link Pixmap} pixel by pixel.
     * Starts out white.
     */
    public static final class Builder
    {
        private final int width;
        private final int height;
        private final byte[] samples;

        private Builder(int width, int height)
        {
            checkDimensions(width, height);
            this.width = width;
            this.height = height;
            this.samples = new byte[width * height * 3];
            Arrays.fill(samples, (byte) 0xFF);
        }

        public Builder set(int row, int column, Rgb rgb)
        {
            Objects.requireNonNull(rgb, "rgb");
            Objects.checkIndex(row, height);
            Objects.checkIndex(column, width);
            final int base = (row * width + column) * 3;
            samples[base] = (byte) rgb.red();
            samples[base + 1] = (byte) rgb.green();
            samples[base + 2] = (byte) rgb.blue();
            return this;
        }

        public Pixmap build()
        {
            return new Pixmap(width, height, samples.clone());
        }
    }
}
