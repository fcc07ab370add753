package com.questrail.barcode.test;

import com.questrail.barcode.internal.signal.Bit;
import com.questrail.barcode.internal.symbology.Ean13Encoder;
import com.questrail.barcode.model.Ean13Code;
import com.questrail.barcode.model.Pixmap;
import com.questrail.barcode.model.Rgb;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * SyntheticBarcodeImage
 * -----------------------------------------------------------------------------
 * Renders an {@link Ean13Code} as a photograph-like raster for tests.
 *
 * <p>Bars are drawn dark grey and spaces off-white rather than pure black and
 * white. Two kinds of seeded noise can be added:</p>
 * <ul>
 *   <li><b>luminance jitter</b>: every pixel is brightened or darkened by up
 *       to the given fraction of full scale, all three channels alike</li>
 *   <li><b>boundary jitter</b>: every bar/space edge is moved left or right by
 *       up to the given number of pixels; all rows share the same edges</li>
 * </ul>
 */
public final class SyntheticBarcodeImage {
    /**
     * Smallest module width at which noisy renderings (15% luminance jitter,
     * one pixel of boundary jitter) are expected to decode reliably. Noise-free
     * renderings decode from a width of 1.
     */
    public static final int MIN_NOISY_MODULE_WIDTH = 6;

    static final Rgb BAR = new Rgb(15, 15, 20);
    static final Rgb SPACE = new Rgb(235, 232, 225);

    private final int moduleWidth;
    private final int quietModules;
    private final int height;
    private final double luminanceJitter;
    private final int boundaryJitter;
    private final long seed;

    private SyntheticBarcodeImage(Builder builder) {
        this.moduleWidth = builder.moduleWidth;
        this.quietModules = builder.quietModules;
        this.height = builder.height;
        this.luminanceJitter = builder.luminanceJitter;
        this.boundaryJitter = builder.boundaryJitter;
        this.seed = builder.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Noise-free rendering with default geometry.
     */
    public static Pixmap perfect(Ean13Code code) {
        return builder().build().render(code);
    }

    public Pixmap render(Ean13Code code) {
        final Random random = new Random(seed);

        final List<Bit> line = new ArrayList<>();
        for (int i = 0; i < quietModules; i++) {
            line.add(Bit.ONE);
        }
        line.addAll(Ean13Encoder.encodeModules(code));
        for (int i = 0; i < quietModules; i++) {
            line.add(Bit.ONE);
        }

        final int width = line.size() * moduleWidth;
        final Bit[] columns = new Bit[width];
        int segmentStart = 0;
        for (int module = 1; module <= line.size(); module++) {
            if (module < line.size() && line.get(module) == line.get(module - 1)) {
                continue;
            }
            int edge = module * moduleWidth;
            if (module < line.size() && boundaryJitter > 0) {
                edge += random.nextInt(2 * boundaryJitter + 1) - boundaryJitter;
            }
            for (int column = segmentStart; column < edge; column++) {
                columns[column] = line.get(module - 1);
            }
            segmentStart = edge;
        }

        final int maxDelta = (int) Math.round(luminanceJitter * 255);
        final Pixmap.Builder pixmap = Pixmap.builder(width, height);
        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                final Rgb base = columns[column] == Bit.ZERO ? BAR : SPACE;
                final int delta = maxDelta == 0 ? 0 : random.nextInt(2 * maxDelta + 1) - maxDelta;
                pixmap.set(row, column, new Rgb(
                        clamp(base.red() + delta),
                        clamp(base.green() + delta),
                        clamp(base.blue() + delta)));
            }
        }
        return pixmap.build();
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }

    public static final class Builder {
        private int moduleWidth = 3;
        private int quietModules = 10;
        private int height = 9;
        private double luminanceJitter = 0.0;
        private int boundaryJitter = 0;
        private long seed = 1L;

        private Builder() {}

        /**
         * Pixels per module, default 3. With noise enabled, widths below
         * {@link SyntheticBarcodeImage#MIN_NOISY_MODULE_WIDTH} still render
         * but no longer decode reliably.
         */
        public Builder withModuleWidth(int moduleWidth) {
            this.moduleWidth = moduleWidth;
            return this;
        }

        public Builder withQuietModules(int quietModules) {
            this.quietModules = quietModules;
            return this;
        }

        public Builder withHeight(int height) {
            this.height = height;
            return this;
        }

        public Builder withLuminanceJitter(double luminanceJitter) {
            this.luminanceJitter = luminanceJitter;
            return this;
        }

        public Builder withBoundaryJitter(int boundaryJitter) {
            this.boundaryJitter = boundaryJitter;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public SyntheticBarcodeImage build() {
            if (moduleWidth <= 2 * boundaryJitter) {
                throw new IllegalArgumentException("moduleWidth must exceed twice the boundary jitter");
            }
            if (quietModules < 1 || height < 1) {
                throw new IllegalArgumentException("quietModules and height must be positive");
            }
            return new SyntheticBarcodeImage(this);
        }
    }
}
