package com.questrail.barcode.internal.match;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ranked digit guesses for the twelve encoded positions of one symbol.
 *
 * <p>Positions 0-5 are the left half (tagged {@link Parity#ODD} or
 * {@link Parity#EVEN}), positions 6-11 the right half (tagged
 * {@link Parity#NONE}); position 11 is the check digit. The first digit of
 * the code is not among them: it is implied by the left-half parities.</p>
 */
public record DigitCandidates(List<List<ParityCandidate<CandidateDigit>>> positions)
{
    public static final int POSITIONS = 12;

    public DigitCandidates {
        Objects.requireNonNull(positions, "positions");
        if (positions.size() != POSITIONS) {
            throw new IllegalArgumentException("Expected 12 positions but got " + positions.size());
        }
        positions = positions.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    /**
     * The eleven positions preceding the check digit.
     */
    public List<List<ParityCandidate<CandidateDigit>>> body()
    {
        return positions.subList(0, POSITIONS - 1);
    }

    public List<ParityCandidate<CandidateDigit>> checkGroup()
    {
        return positions.get(POSITIONS - 1);
    }

    public boolean anyEmpty()
    {
        return positions.stream().anyMatch(List::isEmpty);
    }
}
