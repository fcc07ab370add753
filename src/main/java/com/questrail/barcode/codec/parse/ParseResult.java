package com.questrail.barcode.codec.parse;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one parsing step.
 *
 * <p>Either {@link Ok}, carrying the parsed value and the cursor positioned
 * after it, or {@link Err}, carrying a message and the byte offset at which
 * parsing failed. An {@code Err} is never unwrapped by later steps:
 * {@link #bind} and {@link #map} pass it through without invoking their
 * function.</p>
 *
 * @param <T> type of the parsed value
 */
public sealed interface ParseResult<T> permits ParseResult.Ok, ParseResult.Err
{
    static <T> ParseResult<T> ok(T value, ByteCursor remainder)
    {
        return new Ok<>(value, remainder);
    }

    static <T> ParseResult<T> err(String message, int offset)
    {
        return new Err<>(message, offset);
    }

    /**
     * Chains the next parsing step onto a successful result.
     *
     * <p>On {@code Ok} the parser produced by {@code next} is run from the
     * remainder. On {@code Err} this result is returned as-is and
     * {@code next} is not called.</p>
     */
    <U> ParseResult<U> bind(Function<? super T, Parser<U>> next);

    /**
     * Transforms a successful value without touching the remainder.
     */
    <U> ParseResult<U> map(Function<? super T, ? extends U> mapper);

    boolean isOk();

    /**
     * Returns the value of a successful result, or empty for an error.
     */
    Optional<T> toOptional();

    record Ok<T>(T value, ByteCursor remainder) implements ParseResult<T>
    {
        public Ok {
            Objects.requireNonNull(remainder, "remainder");
        }

        @Override
        public <U> ParseResult<U> bind(Function<? super T, Parser<U>> next)
        {
            return next.apply(value).parse(remainder);
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper)
        {
            return new Ok<>(mapper.apply(value), remainder);
        }

        @Override
        public boolean isOk()
        {
            return true;
        }

        @Override
        public Optional<T> toOptional()
        {
            return Optional.ofNullable(value);
        }
    }

    record Err<T>(String message, int offset) implements ParseResult<T>
    {
        public Err {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public <U> ParseResult<U> bind(Function<? super T, Parser<U>> next)
        {
            return new Err<>(message, offset);
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper)
        {
            return new Err<>(message, offset);
        }

        @Override
        public boolean isOk()
        {
            return false;
        }

        @Override
        public Optional<T> toOptional()
        {
            return Optional.empty();
        }

        /**
         * Message prefixed with the failing offset.
         */
        public String describe()
        {
            return "offset " + offset + ": " + message;
        }
    }
}
