package com.questrail.barcode.internal.solve;

import com.questrail.barcode.internal.match.CandidateDigit;
import com.questrail.barcode.internal.match.DigitCandidates;
import com.questrail.barcode.internal.match.Parity;
import com.questrail.barcode.internal.match.ParityCandidate;
import com.questrail.barcode.internal.match.ReferenceTable;
import com.questrail.barcode.internal.match.ScaledRun;
import com.questrail.barcode.model.Ean13Checksum;
import com.questrail.barcode.model.Ean13Code;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CheckDigitSolver
 * -----------------------------------------------------------------------------
 * Picks one digit per position such that the thirteen digits satisfy the
 * EAN-13 checksum.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Start from {@link SolutionMap#initial()}.</li>
 *   <li>Fold in the eleven positions before the check digit, each with its
 *       checksum weight; the map keeps at most one sequence per residue.</li>
 *   <li>For each surviving sequence, read the first digit off the parities of
 *       its six left-half entries and re-key the sequence by the check digit
 *       it would need.</li>
 *   <li>Walk the check-group candidates best first; the first one present as
 *       a key completes the code. Among check candidates with the same score
 *       as that first hit, the one whose sequence scored lower is taken.</li>
 * </ol>
 *
 * <p>With three guesses per right position and six per left position the
 * full cross product runs to tens of millions of sequences. The residue map
 * replaces that with at most ten live sequences per position.</p>
 */
public final class CheckDigitSolver
{
    static final int LEFT_DIGITS = 6;

    /**
     * @return the completed code, or empty if any position has no candidates
     *         or no check-group candidate is consistent with the rest
     */
    public Optional<Ean13Code> solve(DigitCandidates candidates)
    {
        Objects.requireNonNull(candidates, "candidates");
        if (candidates.anyEmpty()) {
            return Optional.empty();
        }

        final Resolved[] byCheckDigit = keyByCheckDigit(foldBody(candidates));

        Resolved best = null;
        CandidateDigit bestCheck = null;
        for (ParityCandidate<CandidateDigit> check : candidates.checkGroup()) {
            if (bestCheck != null && check.value().score() > bestCheck.score()) {
                break;
            }
            final Resolved hit = byCheckDigit[check.value().digit()];
            if (hit == null) {
                continue;
            }
            // equally scored check candidates: the better-scored body wins
            if (best == null || hit.score() < best.score()) {
                best = hit;
                bestCheck = check.value();
            }
        }
        return best == null
                ? Optional.empty()
                : Optional.of(best.complete(bestCheck.digit()));
    }

    SolutionMap foldBody(DigitCandidates candidates)
    {
        SolutionMap map = SolutionMap.initial();
        final List<List<ParityCandidate<CandidateDigit>>> body = candidates.body();
        for (int i = 0; i < body.size(); i++) {
            // body position i is digit i + 1 of the code
            map = map.incorporate(body.get(i), Ean13Checksum.weight(i + 1));
        }
        return map;
    }

    /**
     * Re-keys every folded sequence from its residue to the check digit that
     * would complete it, once its first digit has been added.
     */
    Resolved[] keyByCheckDigit(SolutionMap map)
    {
        final Resolved[] byCheckDigit = new Resolved[SolutionMap.RESIDUES];
        for (int residue = 0; residue < SolutionMap.RESIDUES; residue++) {
            final Optional<PartialSolution> entry = map.get(residue);
            if (entry.isEmpty()) {
                continue;
            }
            final PartialSolution body = entry.get();
            final CandidateDigit first = firstDigit(leftParities(body));

            final int total = (residue + first.digit() * Ean13Checksum.weight(0)) % 10;
            final int checkDigit = (10 - total) % 10;
            final Resolved resolved = new Resolved(first.digit(), body, body.score() + first.score());

            final Resolved incumbent = byCheckDigit[checkDigit];
            if (incumbent == null || resolved.score() < incumbent.score()) {
                byCheckDigit[checkDigit] = resolved;
            }
        }
        return byCheckDigit;
    }

    /**
     * Nearest first digit for a left-half parity sequence.
     *
     * @throws IllegalArgumentException if a parity is not {@link Parity#ODD}
     *         or {@link Parity#EVEN}, or there are not six of them
     */
    static CandidateDigit firstDigit(List<Parity> leftParities)
    {
        if (leftParities.size() != LEFT_DIGITS) {
            throw new IllegalArgumentException("Expected 6 left parities but got " + leftParities.size());
        }
        final StringBuilder pattern = new StringBuilder(LEFT_DIGITS);
        for (Parity p : leftParities) {
            switch (p) {
                case ODD -> pattern.append('1');
                case EVEN -> pattern.append('0');
                default -> throw new IllegalArgumentException("Left-half digit without parity: " + p);
            }
        }

        // reference patterns all open with an odd digit; keep runs aligned when this one does not
        int[] runs = ScaledRun.runLengths(pattern.toString());
        if (pattern.charAt(0) == '0') {
            final int[] aligned = new int[runs.length + 1];
            System.arraycopy(runs, 0, aligned, 1, runs.length);
            runs = aligned;
        }
        return ReferenceTable.PARITY.rank(ScaledRun.of(runs)).get(0);
    }

    private static List<Parity> leftParities(PartialSolution body)
    {
        final List<Parity> parities = new ArrayList<>(LEFT_DIGITS);
        for (ParityCandidate<Integer> d : body.digits().subList(0, LEFT_DIGITS)) {
            parities.add(d.parity());
        }
        return parities;
    }

    record Resolved(int firstDigit, PartialSolution body, double score)
    {
        Ean13Code complete(int checkDigit)
        {
            final List<Integer> digits = new ArrayList<>(Ean13Code.LENGTH);
            digits.add(firstDigit);
            for (ParityCandidate<Integer> d : body.digits()) {
                digits.add(d.value());
            }
            digits.add(checkDigit);
            return new Ean13Code(digits);
        }
    }
}
