package com.questrail.barcode;

import com.questrail.barcode.model.Pixmap;

/**
 * Recognises a one-dimensional product code in a raster image.
 */
public interface BarcodeScanner {
    /**
     * Decodes an image container and scans it.
     *
     * @param rawBytes the complete container, e.g. the contents of a {@code .ppm} file
     * @return {@link ScanResult.Unreadable} if the container is malformed,
     *         otherwise the result of {@link #scan(Pixmap)}
     */
    ScanResult decodeBarcode(byte[] rawBytes);

    /**
     * Scans an already decoded raster.
     */
    ScanResult scan(Pixmap pixmap);
}
