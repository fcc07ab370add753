package com.questrail.barcode;

import com.questrail.barcode.codec.impl.PpmRasterEncoder;
import com.questrail.barcode.codec.parse.ParseResult;
import com.questrail.barcode.internal.match.SignalRejection;
import com.questrail.barcode.model.Ean13Code;
import com.questrail.barcode.model.Pixmap;
import com.questrail.barcode.observability.RecordingScanSink;
import com.questrail.barcode.observability.ScanAttemptEvent;
import com.questrail.barcode.observability.ScanCompletedEvent;
import com.questrail.barcode.observability.ScanErrorEvent;
import com.questrail.barcode.test.SyntheticBarcodeImage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ean13ScannerTest
 * -----------------------------------------------------------------------------
 * End-to-end tests from container bytes to {@link ScanResult}.
 *
 * <p>Images are rendered by {@link SyntheticBarcodeImage} and written with
 * {@link PpmRasterEncoder}, so every test passes through the full decode
 * pipeline.</p>
 */
class Ean13ScannerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final PpmRasterEncoder encoder = new PpmRasterEncoder();
    private final RecordingScanSink sink = new RecordingScanSink();
    private final Ean13Scanner scanner = Ean13Scanner.builder()
            .withObservabilitySink(sink)
            .withClock(Clock.fixed(NOW, ZoneOffset.UTC))
            .build();

    @Test
    void perfectRastersRoundTrip() {
        for (String text : List.of(
                "9780132114677", "4006381333931", "5901234123457",
                "0036000291452", "0000000000000", "8711253001202")) {
            Ean13Code code = Ean13Code.of(text);
            byte[] container = encoder.encode(SyntheticBarcodeImage.perfect(code));

            assertEquals(code, scanner.decodeBarcode(container).orElseThrow(), text);
        }
    }

    @Test
    void everyLeadingDigitRoundTrips() {
        for (int first = 0; first <= 9; first++) {
            Ean13Code code = Ean13Code.fromBody(first + "12345678901");
            assertEquals(code, scanner.scan(SyntheticBarcodeImage.perfect(code)).orElseThrow());
        }
    }

    @Test
    void noisyPhotographsDecodeAtMinimumModuleWidth() {
        Ean13Code code = Ean13Code.fromBody("978013211467");
        int correct = 0;
        for (long seed = 1; seed <= 100; seed++) {
            Pixmap photo = SyntheticBarcodeImage.builder()
                    .withModuleWidth(SyntheticBarcodeImage.MIN_NOISY_MODULE_WIDTH)
                    .withHeight(15)
                    .withLuminanceJitter(0.15)
                    .withBoundaryJitter(1)
                    .withSeed(seed)
                    .build()
                    .render(code);

            ScanResult result = scanner.decodeBarcode(encoder.encode(photo));
            if (result instanceof ScanResult.Decoded decoded && decoded.value().equals(code)) {
                correct++;
            }
        }

        assertTrue(correct >= 95, "decoded " + correct + " of 100 seeds");
    }

    @Test
    void decodedResultReportsRowAndRunOffset() {
        Pixmap image = SyntheticBarcodeImage.builder().withHeight(9).build()
                .render(Ean13Code.of("4006381333931"));

        ScanResult.Decoded decoded = assertInstanceOf(ScanResult.Decoded.class, scanner.scan(image));

        assertEquals(4, decoded.row());
        // run 0 is the quiet zone
        assertEquals(1, decoded.runOffset());
    }

    @Test
    void attemptsAreReportedUntilFirstSuccess() {
        scanner.scan(SyntheticBarcodeImage.perfect(Ean13Code.of("4006381333931")));

        List<ScanAttemptEvent> attempts = sink.getAttempts();
        assertEquals(2, attempts.size());
        assertEquals(SignalRejection.LEADING_RUN_LIGHT, attempts.get(0).rejection());
        assertEquals(ScanAttemptEvent.Outcome.DECODED, attempts.get(1).outcome());

        ScanCompletedEvent completed = sink.getCompletions().get(0);
        assertTrue(completed.result().isDecoded());
        assertEquals(Duration.ZERO, completed.elapsed());
        assertFalse(sink.hasEventOfType(ScanErrorEvent.class));
    }

    @Test
    void otherContainerTagIsUnreadableAtOffsetZero() {
        byte[] container = "P5\n1 1\n255\n\0".getBytes(StandardCharsets.US_ASCII);

        ScanResult result = scanner.decodeBarcode(container);

        ScanResult.Unreadable unreadable = assertInstanceOf(ScanResult.Unreadable.class, result);
        assertEquals(0, unreadable.offset());
        assertEquals(0, sink.getErrors().get(0).offset());
        assertEquals(result, sink.getCompletions().get(0).result());
        assertTrue(sink.getAttempts().isEmpty());
    }

    @Test
    void blankImageIsNotFound() {
        Pixmap blank = Pixmap.builder(120, 9).build();

        ScanResult result = scanner.decodeBarcode(encoder.encode(blank));

        assertEquals(new ScanResult.NotFound(4, 1), result);
        assertEquals(SignalRejection.TOO_FEW_RUNS, sink.getAttempts().get(0).rejection());
    }

    @Test
    void orElseThrowCarriesFailedResult() {
        ScanResult result = scanner.scan(Pixmap.builder(10, 3).build());

        BarcodeScanException e = assertThrows(BarcodeScanException.class, result::orElseThrow);
        assertSame(result, e.result());
        assertTrue(e.getMessage().contains("No barcode found"));
    }

    @Test
    void customRasterDecoderErrorsSurfaceAsUnreadable() {
        Ean13Scanner custom = Ean13Scanner.builder()
                .withRasterDecoder(bytes -> ParseResult.err("unsupported container", 3))
                .build();

        assertEquals(new ScanResult.Unreadable("unsupported container", 3), custom.decodeBarcode(new byte[4]));
    }

    @Test
    void centreRowRoundsDown() {
        assertEquals(0, Ean13Scanner.centreRow(1));
        assertEquals(4, Ean13Scanner.centreRow(9));
        assertEquals(4, Ean13Scanner.centreRow(10));
    }

    @Test
    void upcACodeIsRecognisedAsSuch() {
        Ean13Code code = Ean13Scanner.create()
                .scan(SyntheticBarcodeImage.perfect(Ean13Code.of("0036000291452")))
                .orElseThrow();

        assertEquals("036000291452", code.toUpcA());
    }
}
