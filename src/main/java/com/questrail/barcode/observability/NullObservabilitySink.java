package com.questrail.barcode.observability;

/**
 * No-op implementation of ScanObservabilitySink.
 */
public final class NullObservabilitySink implements ScanObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onAttempt(ScanAttemptEvent event) {}

    @Override
    public void onCompleted(ScanCompletedEvent event) {}

    @Override
    public void onError(ScanErrorEvent event) {}
}
