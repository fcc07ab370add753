package com.questrail.barcode.internal.signal;

import com.questrail.barcode.model.Rgb;

/**
 * Reduces colour to a single brightness value.
 */
public final class Luminance
{
    static final double RED_WEIGHT = 0.30;
    static final double GREEN_WEIGHT = 0.59;
    static final double BLUE_WEIGHT = 0.11;

    private Luminance() {}

    /**
     * Weighted sum {@code 0.30R + 0.59G + 0.11B}, rounded to the nearest integer.
     *
     * @return a value in {@code 0..255}
     */
    public static int of(Rgb rgb)
    {
        final double y = rgb.red() * RED_WEIGHT + rgb.green() * GREEN_WEIGHT + rgb.blue() * BLUE_WEIGHT;
        return (int) Math.min(255, Math.round(y));
    }
}
