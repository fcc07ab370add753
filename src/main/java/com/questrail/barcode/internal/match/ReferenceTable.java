package com.questrail.barcode.internal.match;

import com.questrail.barcode.internal.symbology.Ean13Patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * ReferenceTable
 * -----------------------------------------------------------------------------
 * The ten scaled reference vectors (digits 0-9) of one EAN-13 encoding
 * variant, built once from {@link Ean13Patterns}.
 *
 * <p>{@link #LEFT_ODD}, {@link #LEFT_EVEN} and {@link #RIGHT} describe the
 * seven-module digit patterns; {@link #PARITY} describes the six-position
 * odd/even selection that encodes the first digit.</p>
 */
public enum ReferenceTable
{
    LEFT_ODD(Parity.ODD, Ean13Patterns::leftOdd),
    LEFT_EVEN(Parity.EVEN, Ean13Patterns::leftEven),
    RIGHT(Parity.NONE, Ean13Patterns::right),
    PARITY(Parity.NONE, Ean13Patterns::parity);

    private final Parity parity;
    private final List<ScaledRun> entries;

    ReferenceTable(Parity parity, IntFunction<String> patternForDigit)
    {
        this.parity = parity;
        final List<ScaledRun> scaled = new ArrayList<>(10);
        for (int digit = 0; digit <= 9; digit++) {
            scaled.add(ScaledRun.ofPattern(patternForDigit.apply(digit)));
        }
        this.entries = Collections.unmodifiableList(scaled);
    }

    /**
     * Tag attached to candidates matched against this table.
     */
    public Parity parity()
    {
        return parity;
    }

    public ScaledRun entry(int digit)
    {
        return entries.get(digit);
    }

    /**
     * Scores {@code observed} against all ten entries, best first.
     */
    public List<CandidateDigit> rank(ScaledRun observed)
    {
        Objects.requireNonNull(observed, "observed");
        final List<CandidateDigit> scores = new ArrayList<>(entries.size());
        for (int digit = 0; digit < entries.size(); digit++) {
            scores.add(new CandidateDigit(entries.get(digit).distance(observed), digit));
        }
        Collections.sort(scores);
        return scores;
    }
}
