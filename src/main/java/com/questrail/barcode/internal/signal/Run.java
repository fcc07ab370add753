package com.questrail.barcode.internal.signal;

import java.util.Objects;

/**
 * A maximal stretch of identical bits.
 */
public record Run(int length, Bit bit)
{
    public Run {
        Objects.requireNonNull(bit, "bit");
        if (length <= 0) {
            throw new IllegalArgumentException("Run length must be positive: " + length);
        }
    }
}
