package com.questrail.barcode.observability;

import com.questrail.barcode.ScanResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing the end of one scan, successful or not.
 */
public record ScanCompletedEvent(
    Instant timestamp,
    ScanResult result,
    Duration elapsed
) {
}
