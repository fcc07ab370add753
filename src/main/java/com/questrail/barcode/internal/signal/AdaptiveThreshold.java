package com.questrail.barcode.internal.signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AdaptiveThreshold
 * -----------------------------------------------------------------------------
 * Maps brightness values to bits relative to the range actually present in
 * the input.
 *
 * <p>The pivot is {@code round(min + (max - min) * fraction)}. Values strictly
 * below the pivot become {@link Bit#ZERO}; all others become {@link Bit#ONE}.
 * A flat input (min equals max) therefore maps entirely to {@code ONE}.</p>
 */
public final class AdaptiveThreshold
{
    private final double fraction;

    /**
     * @param fraction position of the pivot between the darkest and lightest
     *                 value, strictly between 0 and 1
     */
    public AdaptiveThreshold(double fraction)
    {
        if (!(fraction > 0.0 && fraction < 1.0)) {
            throw new IllegalArgumentException("fraction must be in (0, 1): " + fraction);
        }
        this.fraction = fraction;
    }

    public double fraction()
    {
        return fraction;
    }

    public int pivot(int[] values)
    {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        int least = values[0];
        int greatest = values[0];
        for (int v : values) {
            least = Math.min(least, v);
            greatest = Math.max(greatest, v);
        }
        return (int) Math.round(least + (greatest - least) * fraction);
    }

    public List<Bit> apply(int[] values)
    {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            return List.of();
        }
        final int pivot = pivot(values);
        final List<Bit> bits = new ArrayList<>(values.length);
        for (int v : values) {
            bits.add(v < pivot ? Bit.ZERO : Bit.ONE);
        }
        return bits;
    }
}
