package com.questrail.barcode.internal.symbology;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ean13Patterns
 * -----------------------------------------------------------------------------
 * Module patterns of the EAN-13 symbology.
 *
 * <p>Each digit occupies seven modules written here as {@code '1'} (bar) and
 * {@code '0'} (space):</p>
 * <ul>
 *   <li><b>left odd</b> (set A, "L"): odd number of bar modules</li>
 *   <li><b>right</b> (set C, "R"): bitwise complement of left odd</li>
 *   <li><b>left even</b> (set B, "G"): right pattern reversed</li>
 * </ul>
 *
 * <p>The first digit is never drawn. It selects which of the six left digits
 * use left odd ({@code '1'}) versus left even ({@code '0'}), per
 * {@link #parity(int)}.</p>
 */
public final class Ean13Patterns
{
    public static final int MODULES_PER_DIGIT = 7;
    public static final int TOTAL_MODULES = 95;

    public static final String OUTER_GUARD = "101";
    public static final String CENTER_GUARD = "01010";

    private static final List<String> LEFT_ODD = List.of(
            "0001101", "0011001", "0010011", "0111101", "0100011",
            "0110001", "0101111", "0111011", "0110111", "0001011");

    private static final List<String> PARITY = List.of(
            "111111", "110100", "110010", "110001", "101100",
            "100110", "100011", "101010", "101001", "100101");

    private static final List<String> RIGHT = LEFT_ODD.stream()
            .map(Ean13Patterns::complement)
            .collect(Collectors.toUnmodifiableList());

    private static final List<String> LEFT_EVEN = RIGHT.stream()
            .map(p -> new StringBuilder(p).reverse().toString())
            .collect(Collectors.toUnmodifiableList());

    private Ean13Patterns() {}

    public static String leftOdd(int digit)
    {
        return LEFT_ODD.get(digit);
    }

    public static String leftEven(int digit)
    {
        return LEFT_EVEN.get(digit);
    }

    public static String right(int digit)
    {
        return RIGHT.get(digit);
    }

    /**
     * Six-character odd/even selection for the left half, {@code '1'} meaning
     * left odd.
     */
    public static String parity(int firstDigit)
    {
        return PARITY.get(firstDigit);
    }

    private static String complement(String pattern)
    {
        final StringBuilder sb = new StringBuilder(pattern.length());
        for (int i = 0; i < pattern.length(); i++) {
            sb.append(pattern.charAt(i) == '1' ? '0' : '1');
        }
        return sb.toString();
    }
}
