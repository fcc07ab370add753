package com.questrail.barcode.internal.symbology;

import com.questrail.barcode.internal.signal.Bit;
import com.questrail.barcode.model.Ean13Code;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class Ean13EncoderTest {

    private static final Bit BAR = Bit.ZERO;
    private static final Bit SPACE = Bit.ONE;

    @Test
    void symbolHasNinetyFiveModules() {
        assertEquals(Ean13Patterns.TOTAL_MODULES, Ean13Encoder.encodeModules(Ean13Code.of("5901234123457")).size());
    }

    @Test
    void guardsSitAtFixedModules() {
        List<Bit> modules = Ean13Encoder.encodeModules(Ean13Code.of("9780132114677"));

        assertEquals(List.of(BAR, SPACE, BAR), modules.subList(0, 3));
        assertEquals(List.of(SPACE, BAR, SPACE, BAR, SPACE), modules.subList(45, 50));
        assertEquals(List.of(BAR, SPACE, BAR), modules.subList(92, 95));
    }

    @Test
    void firstDigitSelectsLeftParities() {
        // first digit 0 encodes every left digit with left-odd patterns
        List<Bit> modules = Ean13Encoder.encodeModules(Ean13Code.of("0036000291452"));

        assertEquals(bits(Ean13Patterns.leftOdd(0)), modules.subList(3, 10));
        assertEquals(bits(Ean13Patterns.leftOdd(3)), modules.subList(10, 17));
    }

    @Test
    void evenParityDigitUsesLeftEvenPattern() {
        // first digit 9 selects 100101: the second left digit is even
        List<Bit> modules = Ean13Encoder.encodeModules(Ean13Code.of("9780132114677"));

        assertEquals(bits(Ean13Patterns.leftOdd(7)), modules.subList(3, 10));
        assertEquals(bits(Ean13Patterns.leftEven(8)), modules.subList(10, 17));
    }

    @Test
    void rightHalfEndsWithCheckDigit() {
        List<Bit> modules = Ean13Encoder.encodeModules(Ean13Code.of("9780132114677"));
        assertEquals(bits(Ean13Patterns.right(7)), modules.subList(85, 92));
    }

    @Test
    void patternTablesAreConsistent() {
        for (int digit = 0; digit <= 9; digit++) {
            String odd = Ean13Patterns.leftOdd(digit);
            assertEquals(Ean13Patterns.MODULES_PER_DIGIT, odd.length());
            assertEquals('0', odd.charAt(0));
            assertEquals('1', Ean13Patterns.right(digit).charAt(0));
            assertEquals('1', Ean13Patterns.parity(digit).charAt(0));
            assertEquals(new StringBuilder(Ean13Patterns.right(digit)).reverse().toString(),
                    Ean13Patterns.leftEven(digit));
        }
    }

    private static List<Bit> bits(String pattern) {
        return pattern.chars().mapToObj(c -> c == '1' ? BAR : SPACE).collect(Collectors.toList());
    }
}
