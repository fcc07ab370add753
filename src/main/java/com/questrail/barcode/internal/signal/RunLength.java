package com.questrail.barcode.internal.signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * RunLength
 * -----------------------------------------------------------------------------
 * Ordered sequence of {@link Run}s describing one thresholded scanline.
 *
 * <p>Invariant: adjacent runs never share a bit value. Every run is maximal,
 * so runs alternate between bars and spaces.</p>
 */
public final class RunLength
{
    private final List<Run> runs;

    private RunLength(List<Run> runs)
    {
        this.runs = runs;
    }

    /**
     * Builds from runs that already alternate.
     *
     * @throws IllegalArgumentException if two adjacent runs share a bit
     */
    public static RunLength of(List<Run> runs)
    {
        Objects.requireNonNull(runs, "runs");
        for (int i = 1; i < runs.size(); i++) {
            if (runs.get(i).bit() == runs.get(i - 1).bit()) {
                throw new IllegalArgumentException("Adjacent runs share bit " + runs.get(i).bit() + " at index " + i);
            }
        }
        return new RunLength(List.copyOf(runs));
    }

    /**
     * Run-length encodes a bit sequence.
     */
    public static RunLength encode(List<Bit> bits)
    {
        Objects.requireNonNull(bits, "bits");
        final List<Run> runs = new ArrayList<>();
        int i = 0;
        while (i < bits.size()) {
            final Bit bit = bits.get(i);
            int j = i + 1;
            while (j < bits.size() && bits.get(j) == bit) {
                j++;
            }
            runs.add(new Run(j - i, bit));
            i = j;
        }
        return new RunLength(Collections.unmodifiableList(runs));
    }

    public List<Run> runs()
    {
        return runs;
    }

    public int size()
    {
        return runs.size();
    }

    public Run get(int index)
    {
        return runs.get(index);
    }

    /**
     * Copies the lengths of {@code count} runs starting at {@code from}.
     *
     * @throws IndexOutOfBoundsException if the range exceeds the sequence
     */
    public int[] lengths(int from, int count)
    {
        Objects.checkFromIndexSize(from, count, runs.size());
        final int[] out = new int[count];
        for (int i = 0; i < count; i++) {
            out[i] = runs.get(from + i).length();
        }
        return out;
    }

    /**
     * Expands back into one bit per sample.
     */
    public List<Bit> decode()
    {
        final List<Bit> bits = new ArrayList<>();
        for (Run run : runs) {
            for (int i = 0; i < run.length(); i++) {
                bits.add(run.bit());
            }
        }
        return bits;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof RunLength other && runs.equals(other.runs);
    }

    @Override
    public int hashCode()
    {
        return runs.hashCode();
    }

    @Override
    public String toString()
    {
        return "RunLength" + runs;
    }
}
