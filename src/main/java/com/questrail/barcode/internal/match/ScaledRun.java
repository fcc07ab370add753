package com.questrail.barcode.internal.match;

import java.util.Arrays;
import java.util.Objects;

/**
 * ScaledRun
 * -----------------------------------------------------------------------------
 * Run lengths divided by their sum, so the entries add up to one.
 *
 * <p>Scaling removes the absolute bar width, which depends on how far the
 * camera was from the symbol, and leaves only the proportions that identify a
 * digit.</p>
 */
public final class ScaledRun
{
    private final double[] values;

    private ScaledRun(double[] values)
    {
        this.values = values;
    }

    /**
     * Scales {@code runs}; individual runs may be zero but the sum may not.
     */
    public static ScaledRun of(int... runs)
    {
        Objects.requireNonNull(runs, "runs");
        long sum = 0;
        for (int r : runs) {
            if (r < 0) {
                throw new IllegalArgumentException("Negative run length: " + r);
            }
            sum += r;
        }
        if (sum == 0) {
            throw new IllegalArgumentException("Runs must not sum to zero: " + Arrays.toString(runs));
        }
        final double[] values = new double[runs.length];
        for (int i = 0; i < runs.length; i++) {
            values[i] = runs[i] / (double) sum;
        }
        return new ScaledRun(values);
    }

    /**
     * Scales the run lengths of a {@code '0'}/{@code '1'} pattern.
     */
    public static ScaledRun ofPattern(String pattern)
    {
        return of(runLengths(pattern));
    }

    /**
     * Run lengths of a pattern string, e.g. {@code "0001101"} gives
     * {@code [3, 2, 1, 1]}.
     */
    public static int[] runLengths(String pattern)
    {
        Objects.requireNonNull(pattern, "pattern");
        final int[] runs = new int[pattern.length()];
        int count = 0;
        int i = 0;
        while (i < pattern.length()) {
            int j = i + 1;
            while (j < pattern.length() && pattern.charAt(j) == pattern.charAt(i)) {
                j++;
            }
            runs[count++] = j - i;
            i = j;
        }
        return Arrays.copyOf(runs, count);
    }

    public int size()
    {
        return values.length;
    }

    public double get(int index)
    {
        return values[index];
    }

    /**
     * Sum of absolute differences between corresponding entries. A missing
     * entry in the shorter vector counts as zero.
     */
    public double distance(ScaledRun other)
    {
        Objects.requireNonNull(other, "other");
        final int n = Math.max(values.length, other.values.length);
        double sum = 0;
        for (int i = 0; i < n; i++) {
            final double a = i < values.length ? values[i] : 0.0;
            final double b = i < other.values.length ? other.values[i] : 0.0;
            sum += Math.abs(a - b);
        }
        return sum;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof ScaledRun other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString()
    {
        return "ScaledRun" + Arrays.toString(values);
    }
}
