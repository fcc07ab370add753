package com.questrail.barcode.internal.match;

import java.util.Comparator;

/**
 * A digit guess and its distance from the observed runs. Lower is better;
 * equal scores order by digit.
 */
public record CandidateDigit(double score, int digit) implements Comparable<CandidateDigit>
{
    private static final Comparator<CandidateDigit> ORDER =
            Comparator.comparingDouble(CandidateDigit::score).thenComparingInt(CandidateDigit::digit);

    public CandidateDigit {
        if (digit < 0 || digit > 9) {
            throw new IllegalArgumentException("digit must be 0-9: " + digit);
        }
        if (Double.isNaN(score) || score < 0) {
            throw new IllegalArgumentException("score must be a non-negative number: " + score);
        }
    }

    @Override
    public int compareTo(CandidateDigit other)
    {
        return ORDER.compare(this, other);
    }
}
