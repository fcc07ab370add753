package com.questrail.barcode.codec.parse;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Parsers
 * -----------------------------------------------------------------------------
 * Primitive parsers over a {@link ByteCursor}.
 *
 * <p>Every primitive either succeeds with a cursor advanced past what it
 * consumed, or fails with an {@link ParseResult.Err} positioned at the offset
 * where the input stopped matching. Multi-step decoders are assembled from
 * these with {@link Parser#bind} and {@link Parser#map}.</p>
 */
public final class Parsers
{
    private static final int COMMENT = '#';

    private Parsers() {}

    /**
     * Succeeds with {@code value} without consuming input.
     */
    public static <T> Parser<T> pure(T value)
    {
        return input -> ParseResult.ok(value, input);
    }

    /**
     * Fails at the current offset without consuming input.
     */
    public static <T> Parser<T> fail(String message)
    {
        Objects.requireNonNull(message, "message");
        return input -> ParseResult.err(message, input.offset());
    }

    /**
     * Fails reporting {@code offset} rather than the current offset.
     *
     * <p>Used when a value is only known to be invalid after it has been
     * consumed, so the error can point at where the value began.</p>
     */
    public static <T> Parser<T> failAt(String message, int offset)
    {
        Objects.requireNonNull(message, "message");
        return input -> ParseResult.err(message, offset);
    }

    /**
     * Yields the current offset without consuming input.
     */
    public static Parser<Integer> position()
    {
        return input -> ParseResult.ok(input.offset(), input);
    }

    /**
     * Consumes one byte, yielding it as an unsigned value {@code 0..255}.
     */
    public static Parser<Integer> anyByte()
    {
        return input -> {
            if (input.isExhausted()) {
                return ParseResult.err("Unexpected end of input", input.offset());
            }
            return ParseResult.ok(input.peek(), input.advance(1));
        };
    }

    /**
     * Consumes one byte accepted by {@code predicate}.
     *
     * @param expected description used in the failure message
     */
    public static Parser<Integer> satisfy(IntPredicate predicate, String expected)
    {
        Objects.requireNonNull(predicate, "predicate");
        return input -> {
            if (input.isExhausted()) {
                return ParseResult.err("Expected " + expected + " but input ended", input.offset());
            }
            final int b = input.peek();
            if (!predicate.test(b)) {
                return ParseResult.err(
                        String.format("Expected %s but found 0x%02X", expected, b), input.offset());
            }
            return ParseResult.ok(b, input.advance(1));
        };
    }

    /**
     * Consumes exactly {@code count} bytes.
     *
     * <p>Fails without consuming anything if fewer bytes remain.</p>
     */
    public static Parser<byte[]> fixedBytes(int count)
    {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        return input -> {
            if (input.remaining() < count) {
                return ParseResult.err(
                        "Truncated input: expected " + count + " bytes but only "
                                + input.remaining() + " remain",
                        input.offset());
            }
            return ParseResult.ok(input.peek(count), input.advance(count));
        };
    }

    /**
     * Matches the ASCII bytes of {@code tag} exactly.
     *
     * <p>A mismatch is reported at the offset where the tag was expected to
     * begin, not where the first differing byte sits.</p>
     */
    public static Parser<String> literal(String tag)
    {
        Objects.requireNonNull(tag, "tag");
        final byte[] expected = tag.getBytes(StandardCharsets.US_ASCII);
        return input -> {
            if (input.remaining() < expected.length) {
                return ParseResult.err("Expected literal '" + tag + "' but input ended", input.offset());
            }
            final byte[] actual = input.peek(expected.length);
            for (int i = 0; i < expected.length; i++) {
                if (actual[i] != expected[i]) {
                    return ParseResult.err(
                            "Expected literal '" + tag + "' but found '" + printable(actual) + "'",
                            input.offset());
                }
            }
            return ParseResult.ok(tag, input.advance(expected.length));
        };
    }

    /**
     * Consumes one or more ASCII decimal digits as a non-negative {@code int}.
     */
    public static Parser<Integer> naturalNumber()
    {
        return input -> {
            ByteCursor cursor = input;
            long value = 0;
            while (!cursor.isExhausted() && isDigit(cursor.peek())) {
                value = value * 10 + (cursor.peek() - '0');
                if (value > Integer.MAX_VALUE) {
                    return ParseResult.err("Number too large", input.offset());
                }
                cursor = cursor.advance(1);
            }
            if (cursor == input) {
                return cursor.isExhausted()
                        ? ParseResult.err("Expected a decimal number but input ended", input.offset())
                        : ParseResult.err(
                                String.format("Expected a decimal number but found 0x%02X", input.peek()),
                                input.offset());
            }
            return ParseResult.ok((int) value, cursor);
        };
    }

    /**
     * Consumes zero or more ASCII whitespace bytes, yielding how many.
     */
    public static Parser<Integer> skipWhitespace()
    {
        return input -> {
            ByteCursor cursor = input;
            while (!cursor.isExhausted() && isWhitespace(cursor.peek())) {
                cursor = cursor.advance(1);
            }
            return ParseResult.ok(cursor.offset() - input.offset(), cursor);
        };
    }

    /**
     * Consumes whitespace and {@code #} comments running to end of line,
     * yielding how many bytes were skipped.
     */
    public static Parser<Integer> skipInsignificant()
    {
        return input -> {
            ByteCursor cursor = input;
            while (!cursor.isExhausted()) {
                final int b = cursor.peek();
                if (isWhitespace(b)) {
                    cursor = cursor.advance(1);
                }
                else if (b == COMMENT) {
                    while (!cursor.isExhausted() && !isLineEnd(cursor.peek())) {
                        cursor = cursor.advance(1);
                    }
                }
                else {
                    break;
                }
            }
            return ParseResult.ok(cursor.offset() - input.offset(), cursor);
        };
    }

    /**
     * Like {@link #skipInsignificant()} but requires at least one byte.
     */
    public static Parser<Integer> separator()
    {
        return skipInsignificant()
                .bind(count -> count > 0
                        ? Parsers.<Integer>pure(count)
                        : Parsers.<Integer>fail("Expected whitespace separator"));
    }

    /**
     * Consumes exactly one whitespace byte.
     */
    public static Parser<Integer> delimiter()
    {
        return satisfy(Parsers::isWhitespace, "a single whitespace delimiter");
    }

    static boolean isWhitespace(int b)
    {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0x0B || b == 0x0C;
    }

    private static boolean isLineEnd(int b)
    {
        return b == '\n' || b == '\r';
    }

    private static boolean isDigit(int b)
    {
        return b >= '0' && b <= '9';
    }

    private static String printable(byte[] bytes)
    {
        final StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            final int v = b & 0xFF;
            sb.append(v >= 0x20 && v < 0x7F ? (char) v : '?');
        }
        return sb.toString();
    }
}
