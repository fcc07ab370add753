package com.questrail.barcode.internal.match;

/**
 * Which reference table variant produced a match.
 */
public enum Parity
{
    /** Left half, odd-parity (set A) encoding. */
    ODD,

    /** Left half, even-parity (set B) encoding. */
    EVEN,

    /** Right half; carries no parity information. */
    NONE
}
