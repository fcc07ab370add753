package com.questrail.barcode;

import com.questrail.barcode.model.Ean13Code;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of scanning one image.
 *
 * <ul>
 *   <li>{@link Decoded}: a checksum-consistent code was found</li>
 *   <li>{@link NotFound}: the image was readable but no offset of the
 *       scanned row yielded a code</li>
 *   <li>{@link Unreadable}: the container could not be decoded; nothing was
 *       scanned</li>
 * </ul>
 */
public sealed interface ScanResult
        permits ScanResult.Decoded, ScanResult.NotFound, ScanResult.Unreadable {

    default Optional<Ean13Code> code() {
        return Optional.empty();
    }

    default boolean isDecoded() {
        return code().isPresent();
    }

    /**
     * Returns the decoded code.
     *
     * @throws BarcodeScanException if this result is not {@link Decoded}
     */
    default Ean13Code orElseThrow() {
        return code().orElseThrow(() -> new BarcodeScanException(this));
    }

    /**
     * @param row pixel row that was scanned
     * @param runOffset index of the run where the symbol's start guard begins
     */
    record Decoded(Ean13Code value, int row, int runOffset) implements ScanResult {
        public Decoded {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Optional<Ean13Code> code() {
            return Optional.of(value);
        }
    }

    /**
     * @param row pixel row that was scanned
     * @param attempts number of run offsets tried
     */
    record NotFound(int row, int attempts) implements ScanResult {
    }

    /**
     * @param message why the container was rejected
     * @param offset byte offset at which decoding failed
     */
    record Unreadable(String message, int offset) implements ScanResult {
        public Unreadable {
            Objects.requireNonNull(message, "message");
        }
    }
}
