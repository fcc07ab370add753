package com.questrail.barcode.internal.signal;

/**
 * Monochrome sample of a scanline.
 */
public enum Bit
{
    /** Dark: part of a bar. */
    ZERO,

    /** Light: part of a space. */
    ONE
}
