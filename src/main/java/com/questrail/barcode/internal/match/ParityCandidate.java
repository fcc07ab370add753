package com.questrail.barcode.internal.match;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.Function;

/**
 * A value tagged with the {@link Parity} of the table that produced it.
 *
 * <p>Ordering via {@link #byValue(Comparator)} looks only at the value; the tag
 * is carried along and can be projected out with {@link #parity()}.</p>
 */
public record ParityCandidate<T>(Parity parity, T value)
{
    public ParityCandidate {
        Objects.requireNonNull(parity, "parity");
        Objects.requireNonNull(value, "value");
    }

    public static <T> ParityCandidate<T> odd(T value)
    {
        return new ParityCandidate<>(Parity.ODD, value);
    }

    public static <T> ParityCandidate<T> even(T value)
    {
        return new ParityCandidate<>(Parity.EVEN, value);
    }

    public static <T> ParityCandidate<T> none(T value)
    {
        return new ParityCandidate<>(Parity.NONE, value);
    }

    /**
     * Replaces the value, keeping the tag.
     */
    public <U> ParityCandidate<U> map(Function<? super T, ? extends U> mapper)
    {
        return new ParityCandidate<>(parity, mapper.apply(value));
    }

    public static <T> Comparator<ParityCandidate<T>> byValue(Comparator<? super T> valueOrder)
    {
        Objects.requireNonNull(valueOrder, "valueOrder");
        return (a, b) -> valueOrder.compare(a.value, b.value);
    }
}
