package com.questrail.barcode;

import java.util.Objects;

/**
 * Thrown by {@link ScanResult#orElseThrow()} when a scan produced no code.
 *
 * The failed {@link ScanResult} is kept so callers can still tell an
 * unreadable file from an image without a barcode.
 */
public final class BarcodeScanException extends RuntimeException {
    private final ScanResult result;

    public BarcodeScanException(ScanResult result) {
        super(describe(result));
        this.result = result;
    }

    public ScanResult result() {
        return result;
    }

    private static String describe(ScanResult result) {
        Objects.requireNonNull(result, "result");
        if (result instanceof ScanResult.Unreadable u) {
            return "Unreadable image at offset " + u.offset() + ": " + u.message();
        }
        if (result instanceof ScanResult.NotFound n) {
            return "No barcode found in row " + n.row() + " after " + n.attempts() + " attempts";
        }
        return "Scan did not fail: " + result;
    }
}
