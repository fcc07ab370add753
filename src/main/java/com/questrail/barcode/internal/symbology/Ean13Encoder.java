package com.questrail.barcode.internal.symbology;

import com.questrail.barcode.internal.signal.Bit;
import com.questrail.barcode.model.Ean13Code;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ean13Encoder
 * -----------------------------------------------------------------------------
 * Lays out the 95 modules of an EAN-13 symbol.
 *
 * <pre>
 *   [outer guard 3][6 left digits × 7][center guard 5][6 right digits × 7][outer guard 3]
 * </pre>
 *
 * <p>This is the inverse of recognition: the left digits take the odd/even
 * pattern chosen by the first digit, the right digits (check digit last)
 * always take the right pattern. Bars are {@link Bit#ZERO}.</p>
 */
public final class Ean13Encoder
{
    private Ean13Encoder() {}

    public static List<Bit> encodeModules(Ean13Code code)
    {
        Objects.requireNonNull(code, "code");

        final StringBuilder modules = new StringBuilder(Ean13Patterns.TOTAL_MODULES);
        final String parity = Ean13Patterns.parity(code.digit(0));

        modules.append(Ean13Patterns.OUTER_GUARD);
        for (int i = 0; i < 6; i++) {
            final int digit = code.digit(1 + i);
            modules.append(parity.charAt(i) == '1'
                    ? Ean13Patterns.leftOdd(digit)
                    : Ean13Patterns.leftEven(digit));
        }
        modules.append(Ean13Patterns.CENTER_GUARD);
        for (int i = 0; i < 6; i++) {
            modules.append(Ean13Patterns.right(code.digit(7 + i)));
        }
        modules.append(Ean13Patterns.OUTER_GUARD);

        final List<Bit> bits = new ArrayList<>(modules.length());
        for (int i = 0; i < modules.length(); i++) {
            bits.add(modules.charAt(i) == '1' ? Bit.ZERO : Bit.ONE);
        }
        return bits;
    }
}
