package com.questrail.barcode.codec.parse;

import java.util.function.Function;

/**
 * A fallible decoding step over an explicit {@link ByteCursor}.
 *
 * <p>A parser takes the cursor as input and returns it, advanced, inside its
 * {@link ParseResult}. There is no ambient parse position: progress is only
 * ever carried by the cursor values parsers hand to one another.</p>
 *
 * @param <T> type of the parsed value
 */
@FunctionalInterface
public interface Parser<T>
{
    ParseResult<T> parse(ByteCursor input);

    /**
     * Runs this parser, then the parser selected by its value.
     */
    default <U> Parser<U> bind(Function<? super T, Parser<U>> next)
    {
        return input -> parse(input).bind(next);
    }

    default <U> Parser<U> map(Function<? super T, ? extends U> mapper)
    {
        return input -> parse(input).map(mapper);
    }

    /**
     * Runs this parser, discards its value, then runs {@code next}.
     */
    default <U> Parser<U> then(Parser<U> next)
    {
        return bind(ignored -> next);
    }

    /**
     * Runs this parser, then {@code next}, keeping this parser's value.
     */
    default <U> Parser<T> skip(Parser<U> next)
    {
        return bind(value -> next.map(ignored -> value));
    }
}
