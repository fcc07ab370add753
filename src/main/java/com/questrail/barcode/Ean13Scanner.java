package com.questrail.barcode;

import com.questrail.barcode.codec.RasterDecoder;
import com.questrail.barcode.codec.impl.PpmRasterDecoder;
import com.questrail.barcode.codec.parse.ParseResult;
import com.questrail.barcode.config.ScannerConfig;
import com.questrail.barcode.internal.match.CandidateMatcher;
import com.questrail.barcode.internal.match.SignalRejection;
import com.questrail.barcode.internal.signal.AdaptiveThreshold;
import com.questrail.barcode.internal.signal.RunLength;
import com.questrail.barcode.internal.signal.SignalExtractor;
import com.questrail.barcode.internal.solve.CheckDigitSolver;
import com.questrail.barcode.model.Ean13Code;
import com.questrail.barcode.model.Pixmap;
import com.questrail.barcode.observability.NullObservabilitySink;
import com.questrail.barcode.observability.ScanAttemptEvent;
import com.questrail.barcode.observability.ScanCompletedEvent;
import com.questrail.barcode.observability.ScanErrorEvent;
import com.questrail.barcode.observability.ScanObservabilitySink;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Ean13Scanner
 * =============================================================================
 * Composition root of the EAN-13 / UPC-A recognition pipeline.
 *
 * <pre>
 *   byte[] container
 *        → RasterDecoder       (Pixmap, or Unreadable)
 *        → SignalExtractor     (centre row → run lengths)
 *        → CandidateMatcher    (per run offset: ranked digit guesses)
 *        → CheckDigitSolver    (checksum-consistent code)
 * </pre>
 *
 * <p>Run offsets are tried lazily from the left edge of the row; the scan
 * stops at the first offset that yields a code.</p>
 *
 * <p>Instances hold only immutable collaborators and may be shared between
 * threads, provided the observability sink tolerates concurrent calls.</p>
 */
public final class Ean13Scanner implements BarcodeScanner {
    private final RasterDecoder rasterDecoder;
    private final SignalExtractor signalExtractor;
    private final CandidateMatcher matcher;
    private final CheckDigitSolver solver;
    private final ScanObservabilitySink observabilitySink;
    private final Clock clock;

    private Ean13Scanner(Builder builder) {
        this.rasterDecoder = builder.rasterDecoder;
        this.signalExtractor = new SignalExtractor(new AdaptiveThreshold(builder.config.threshold()));
        this.matcher = new CandidateMatcher(builder.config.candidatesPerGroup());
        this.solver = new CheckDigitSolver();
        this.observabilitySink = builder.observabilitySink;
        this.clock = builder.clock;
    }

    /**
     * Scanner with default configuration and no observability.
     */
    public static Ean13Scanner create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ScanResult decodeBarcode(byte[] rawBytes) {
        Objects.requireNonNull(rawBytes, "rawBytes");
        final Instant start = clock.instant();

        final ParseResult<Pixmap> decoded = rasterDecoder.decode(rawBytes);
        if (decoded instanceof ParseResult.Err<Pixmap> err) {
            observabilitySink.onError(new ScanErrorEvent(clock.instant(), err.message(), err.offset()));
            return complete(new ScanResult.Unreadable(err.message(), err.offset()), start);
        }
        return scan(((ParseResult.Ok<Pixmap>) decoded).value(), start);
    }

    @Override
    public ScanResult scan(Pixmap pixmap) {
        Objects.requireNonNull(pixmap, "pixmap");
        return scan(pixmap, clock.instant());
    }

    /**
     * The row scanned for a raster of the given height: the vertical centre.
     */
    public static int centreRow(int height) {
        return (height - 1) / 2;
    }

    private ScanResult scan(Pixmap pixmap, Instant start) {
        final int row = centreRow(pixmap.height());
        final RunLength runs = signalExtractor.extractRow(pixmap, row);

        // beyond the last full-symbol offset every attempt is TOO_FEW_RUNS; try offset 0 to report it
        final int offsets = Math.max(1, runs.size() - CandidateMatcher.SYMBOL_RUNS + 1);

        final ScanResult result = IntStream.range(0, offsets)
                .mapToObj(offset -> attempt(runs, row, offset))
                .flatMap(Optional::stream)
                .findFirst()
                .<ScanResult>map(found -> found)
                .orElseGet(() -> new ScanResult.NotFound(row, offsets));
        return complete(result, start);
    }

    private Optional<ScanResult.Decoded> attempt(RunLength runs, int row, int offset) {
        final Optional<SignalRejection> rejection = matcher.screen(runs, offset);
        if (rejection.isPresent()) {
            observabilitySink.onAttempt(ScanAttemptEvent.rejected(row, offset, rejection.get()));
            return Optional.empty();
        }

        final Optional<Ean13Code> code = matcher.candidateDigits(runs, offset).flatMap(solver::solve);
        observabilitySink.onAttempt(code.isPresent()
                ? ScanAttemptEvent.decoded(row, offset)
                : ScanAttemptEvent.unsolved(row, offset));
        return code.map(c -> new ScanResult.Decoded(c, row, offset));
    }

    private ScanResult complete(ScanResult result, Instant start) {
        final Instant end = clock.instant();
        observabilitySink.onCompleted(new ScanCompletedEvent(end, result, Duration.between(start, end)));
        return result;
    }

    public static final class Builder {
        private ScannerConfig config = ScannerConfig.defaults();
        private RasterDecoder rasterDecoder = new PpmRasterDecoder();
        private ScanObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder withConfig(ScannerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withRasterDecoder(RasterDecoder rasterDecoder) {
            this.rasterDecoder = Objects.requireNonNull(rasterDecoder, "rasterDecoder");
            return this;
        }

        public Builder withObservabilitySink(ScanObservabilitySink observabilitySink) {
            this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Ean13Scanner build() {
            return new Ean13Scanner(this);
        }
    }
}
