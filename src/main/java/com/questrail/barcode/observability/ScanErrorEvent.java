package com.questrail.barcode.observability;

import java.time.Instant;

/**
 * Record representing input that could not be decoded as a raster.
 */
public record ScanErrorEvent(
    Instant timestamp,
    String message,
    int offset
) {
}
