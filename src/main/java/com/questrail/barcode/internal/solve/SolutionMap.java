package com.questrail.barcode.internal.solve;

import com.questrail.barcode.internal.match.CandidateDigit;
import com.questrail.barcode.internal.match.ParityCandidate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SolutionMap
 * -----------------------------------------------------------------------------
 * Best partial digit sequence for each weighted-sum residue {@code 0..9}.
 *
 * <p>Instances are immutable; {@link #incorporate} returns a new map. However
 * many candidates each position has, a map never holds more than ten
 * entries, which is what keeps the search linear in the number of
 * positions.</p>
 */
public final class SolutionMap
{
    static final int RESIDUES = 10;

    private final PartialSolution[] slots;

    private SolutionMap(PartialSolution[] slots)
    {
        this.slots = slots;
    }

    /**
     * {@code 0 ↦ []}: residue zero, reached by the empty sequence.
     */
    public static SolutionMap initial()
    {
        final PartialSolution[] slots = new PartialSolution[RESIDUES];
        slots[0] = PartialSolution.EMPTY;
        return new SolutionMap(slots);
    }

    /**
     * Folds in one more position.
     *
     * <p>Every existing {@code (residue, sequence)} is extended by every
     * candidate, landing at {@code (residue + weight * digit) mod 10}. Entries
     * built from one candidate cannot collide with each other. When entries
     * built from different candidates land on the same residue, neither
     * insertion order decides: a later entry replaces an earlier one only if
     * its cumulative score is strictly lower. So a cheaper sequence reached
     * through a worse-ranked candidate still displaces a costlier one, and on
     * equal scores the entry from the earlier (better-ranked) candidate
     * stays.</p>
     *
     * @param candidates guesses for the position, best first
     * @param weight checksum weight of the position (1 or 3)
     */
    public SolutionMap incorporate(List<ParityCandidate<CandidateDigit>> candidates, int weight)
    {
        Objects.requireNonNull(candidates, "candidates");

        final PartialSolution[] next = new PartialSolution[RESIDUES];
        for (ParityCandidate<CandidateDigit> candidate : candidates) {
            final int contribution = weight * candidate.value().digit();
            for (int residue = 0; residue < RESIDUES; residue++) {
                final PartialSolution existing = slots[residue];
                if (existing == null) {
                    continue;
                }
                final int key = (residue + contribution) % RESIDUES;
                final PartialSolution extended = existing.extend(candidate);
                if (extended.beats(next[key])) {
                    next[key] = extended;
                }
            }
        }
        return new SolutionMap(next);
    }

    public Optional<PartialSolution> get(int residue)
    {
        Objects.checkIndex(residue, RESIDUES);
        return Optional.ofNullable(slots[residue]);
    }

    public int size()
    {
        int n = 0;
        for (PartialSolution s : slots) {
            if (s != null) {
                n++;
            }
        }
        return n;
    }

    public boolean isEmpty()
    {
        return size() == 0;
    }
}
