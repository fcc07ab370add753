package com.questrail.barcode.observability;

import com.questrail.barcode.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ScanObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jScanObservabilitySink implements ScanObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jScanObservabilitySink.class);

    @Override
    public void onAttempt(ScanAttemptEvent event) {
        switch (event.outcome()) {
            case REJECTED -> log.trace("Row {} offset {}: rejected ({})",
                event.row(), event.runOffset(), event.rejection());
            case UNSOLVED -> log.debug("Row {} offset {}: no checksum-consistent digits",
                event.row(), event.runOffset());
            case DECODED -> log.debug("Row {} offset {}: decoded",
                event.row(), event.runOffset());
        }
    }

    @Override
    public void onCompleted(ScanCompletedEvent event) {
        ScanResult result = event.result();
        if (result instanceof ScanResult.Decoded decoded) {
            log.info("Barcode {} found in row {} at run offset {} ({} ms)",
                decoded.value(), decoded.row(), decoded.runOffset(), event.elapsed().toMillis());
        } else if (result instanceof ScanResult.NotFound notFound) {
            log.info("No barcode found in row {} after {} attempts ({} ms)",
                notFound.row(), notFound.attempts(), event.elapsed().toMillis());
        }
    }

    @Override
    public void onError(ScanErrorEvent event) {
        log.warn("Unreadable image at offset {}: {}", event.offset(), event.message());
    }
}
