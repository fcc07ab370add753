package com.questrail.barcode.observability;

import com.questrail.barcode.internal.match.SignalRejection;

import java.util.Objects;

/**
 * Record of one run offset tried while scanning a row.
 *
 * @param rejection why the offset was screened out; {@code null} unless
 *                  {@code outcome} is {@link Outcome#REJECTED}
 */
public record ScanAttemptEvent(
    int row,
    int runOffset,
    Outcome outcome,
    SignalRejection rejection
) {
    public enum Outcome {
        /** The runs at this offset cannot start a symbol. */
        REJECTED,
        /** Digits were scored but no checksum-consistent assignment exists. */
        UNSOLVED,
        /** A code was decoded at this offset. */
        DECODED
    }

    public ScanAttemptEvent {
        Objects.requireNonNull(outcome, "outcome");
        if ((outcome == Outcome.REJECTED) != (rejection != null)) {
            throw new IllegalArgumentException("rejection must be set exactly when outcome is REJECTED");
        }
    }

    public static ScanAttemptEvent rejected(int row, int runOffset, SignalRejection rejection) {
        return new ScanAttemptEvent(row, runOffset, Outcome.REJECTED, Objects.requireNonNull(rejection, "rejection"));
    }

    public static ScanAttemptEvent unsolved(int row, int runOffset) {
        return new ScanAttemptEvent(row, runOffset, Outcome.UNSOLVED, null);
    }

    public static ScanAttemptEvent decoded(int row, int runOffset) {
        return new ScanAttemptEvent(row, runOffset, Outcome.DECODED, null);
    }
}
