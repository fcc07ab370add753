package com.questrail.barcode.observability;

/**
 * Main interface for receiving scanner observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ScanObservabilitySink {
    /**
     * Called once for every run offset the scanner tries.
     * @param event the attempt details
     */
    void onAttempt(ScanAttemptEvent event);

    /**
     * Called when a scan finishes, whatever its result.
     * @param event the completion details
     */
    void onCompleted(ScanCompletedEvent event);

    /**
     * Called when the input container cannot be decoded.
     * @param event the error event
     */
    void onError(ScanErrorEvent event);
}
