package com.questrail.barcode.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A checksum-consistent EAN-13 product code.
 *
 * <p>UPC-A is the subset of EAN-13 whose first digit is {@code 0}; see
 * {@link #isUpcA()}.</p>
 */
public record Ean13Code(List<Integer> digits)
{
    public static final int LENGTH = 13;

    public Ean13Code {
        Objects.requireNonNull(digits, "digits");
        digits = List.copyOf(digits);
        if (digits.size() != LENGTH) {
            throw new IllegalArgumentException("EAN-13 requires 13 digits but got " + digits.size());
        }
        if (!Ean13Checksum.isValid(digits)) {
            throw new IllegalArgumentException("Checksum mismatch: " + join(digits));
        }
    }

    /**
     * Parses thirteen decimal characters.
     */
    public static Ean13Code of(String text)
    {
        return new Ean13Code(parseDigits(text, LENGTH));
    }

    /**
     * Builds a code from its first twelve digits, appending the check digit.
     */
    public static Ean13Code fromBody(String body)
    {
        final List<Integer> digits = new ArrayList<>(parseDigits(body, LENGTH - 1));
        digits.add(Ean13Checksum.checkDigit(digits));
        return new Ean13Code(digits);
    }

    public int digit(int position)
    {
        return digits.get(position);
    }

    public int checkDigit()
    {
        return digits.get(LENGTH - 1);
    }

    public boolean isUpcA()
    {
        return digits.get(0) == 0;
    }

    /**
     * Returns the twelve-digit UPC-A rendering of this code.
     *
     * @throws IllegalStateException if the code lies outside the UPC-A range
     */
    public String toUpcA()
    {
        if (!isUpcA()) {
            throw new IllegalStateException("Not a UPC-A code: " + this);
        }
        return toString().substring(1);
    }

    @Override
    public String toString()
    {
        return join(digits);
    }

    private static List<Integer> parseDigits(String text, int expectedLength)
    {
        Objects.requireNonNull(text, "text");
        if (text.length() != expectedLength) {
            throw new IllegalArgumentException(
                    "Expected " + expectedLength + " digits but got '" + text + "'");
        }
        final List<Integer> digits = new ArrayList<>(expectedLength);
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Not a decimal digit at position " + i + ": '" + c + "'");
            }
            digits.add(c - '0');
        }
        return digits;
    }

    private static String join(List<Integer> digits)
    {
        final StringBuilder sb = new StringBuilder(digits.size());
        digits.forEach(sb::append);
        return sb.toString();
    }
}
