package com.questrail.barcode.model;

import java.util.List;
import java.util.Objects;

/**
 * EAN-13 weighted checksum.
 *
 * <p>Digits at even (0-based) positions weigh 1, digits at odd positions weigh
 * 3; the check digit brings the weighted sum of all thirteen to a multiple of
 * ten.</p>
 */
public final class Ean13Checksum
{
    private Ean13Checksum() {}

    /**
     * Weight of the digit at {@code position} (0-based) within the thirteen.
     */
    public static int weight(int position)
    {
        return (position % 2 == 0) ? 1 : 3;
    }

    /**
     * Computes the check digit for the first twelve digits.
     *
     * @throws IllegalArgumentException if {@code body} does not hold twelve digits
     */
    public static int checkDigit(List<Integer> body)
    {
        Objects.requireNonNull(body, "body");
        if (body.size() != Ean13Code.LENGTH - 1) {
            throw new IllegalArgumentException("Expected 12 digits but got " + body.size());
        }
        return (10 - weightedSum(body) % 10) % 10;
    }

    /**
     * True if the thirteen digits satisfy the checksum.
     */
    public static boolean isValid(List<Integer> digits)
    {
        Objects.requireNonNull(digits, "digits");
        return digits.size() == Ean13Code.LENGTH && weightedSum(digits) % 10 == 0;
    }

    private static int weightedSum(List<Integer> digits)
    {
        int sum = 0;
        for (int i = 0; i < digits.size(); i++) {
            final int d = digits.get(i);
            if (d < 0 || d > 9) {
                throw new IllegalArgumentException("Not a decimal digit at position " + i + ": " + d);
            }
            sum += d * weight(i);
        }
        return sum;
    }
}
