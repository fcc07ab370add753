package com.questrail.barcode.internal.solve;

import com.questrail.barcode.internal.match.CandidateDigit;
import com.questrail.barcode.internal.match.ParityCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A digit sequence chosen so far, one entry per folded position, and the
 * summed match score of its choices.
 */
public record PartialSolution(List<ParityCandidate<Integer>> digits, double score)
{
    static final PartialSolution EMPTY = new PartialSolution(List.of(), 0.0);

    public PartialSolution {
        Objects.requireNonNull(digits, "digits");
        digits = List.copyOf(digits);
    }

    PartialSolution extend(ParityCandidate<CandidateDigit> candidate)
    {
        final List<ParityCandidate<Integer>> next = new ArrayList<>(digits.size() + 1);
        next.addAll(digits);
        next.add(candidate.map(CandidateDigit::digit));
        return new PartialSolution(next, score + candidate.value().score());
    }

    /**
     * True if this solution should replace {@code incumbent} for the same key.
     * Only a strictly lower score wins, so earlier entries keep ties.
     */
    boolean beats(PartialSolution incumbent)
    {
        return incumbent == null || score < incumbent.score;
    }
}
