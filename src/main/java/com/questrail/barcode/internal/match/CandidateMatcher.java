package com.questrail.barcode.internal.match;

import com.questrail.barcode.internal.signal.Bit;
import com.questrail.barcode.internal.signal.RunLength;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CandidateMatcher
 * -----------------------------------------------------------------------------
 * Scores aligned four-run groups of a scanline against the reference tables.
 *
 * <h2>Symbol layout in runs</h2>
 * <pre>
 *   offset +0   outer guard      3 runs  (bar, space, bar)
 *   offset +3   left digits      6 × 4 runs
 *   offset +27  center guard     5 runs
 *   offset +32  right digits     6 × 4 runs
 *   offset +56  outer guard      3 runs
 * </pre>
 *
 * <h2>Why several candidates per group</h2>
 * The nearest reference vector is not always the printed digit, but the
 * printed digit is almost always among the nearest few. Keeping
 * {@code candidatesPerGroup} guesses lets {@code CheckDigitSolver} settle the
 * remaining ambiguity with the checksum.
 *
 * <p>Left groups are matched against both left tables because each left digit
 * may be printed in either parity; the mix of parities encodes the first
 * digit.</p>
 */
public final class CandidateMatcher
{
    public static final int GUARD_RUNS = 3;
    public static final int CENTER_RUNS = 5;
    public static final int RUNS_PER_DIGIT = 4;
    public static final int DIGITS_PER_HALF = 6;

    static final int LEFT_START = GUARD_RUNS;
    static final int RIGHT_START = LEFT_START + DIGITS_PER_HALF * RUNS_PER_DIGIT + CENTER_RUNS;

    /** Runs spanned by a complete symbol, both guards included. */
    public static final int SYMBOL_RUNS = RIGHT_START + DIGITS_PER_HALF * RUNS_PER_DIGIT + GUARD_RUNS;

    private final int candidatesPerGroup;

    public CandidateMatcher(int candidatesPerGroup)
    {
        if (candidatesPerGroup < 1 || candidatesPerGroup > 10) {
            throw new IllegalArgumentException("candidatesPerGroup must be 1-10: " + candidatesPerGroup);
        }
        this.candidatesPerGroup = candidatesPerGroup;
    }

    public int candidatesPerGroup()
    {
        return candidatesPerGroup;
    }

    /**
     * The best {@code candidatesPerGroup} digits for four observed runs.
     */
    public List<CandidateDigit> matchGroup(ReferenceTable table, int[] fourRuns)
    {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(fourRuns, "fourRuns");
        if (fourRuns.length != RUNS_PER_DIGIT) {
            throw new IllegalArgumentException("Expected 4 runs but got " + fourRuns.length);
        }
        return List.copyOf(table.rank(ScaledRun.of(fourRuns)).subList(0, candidatesPerGroup));
    }

    /**
     * Odd- and even-parity guesses for a left-half group, merged and ordered by
     * score regardless of parity.
     */
    public List<ParityCandidate<CandidateDigit>> bestLeft(int[] fourRuns)
    {
        final List<ParityCandidate<CandidateDigit>> merged = new ArrayList<>(2 * candidatesPerGroup);
        for (CandidateDigit c : matchGroup(ReferenceTable.LEFT_ODD, fourRuns)) {
            merged.add(ParityCandidate.odd(c));
        }
        for (CandidateDigit c : matchGroup(ReferenceTable.LEFT_EVEN, fourRuns)) {
            merged.add(ParityCandidate.even(c));
        }
        merged.sort(ParityCandidate.byValue(CandidateDigit::compareTo));
        return List.copyOf(merged);
    }

    public List<ParityCandidate<CandidateDigit>> bestRight(int[] fourRuns)
    {
        final List<ParityCandidate<CandidateDigit>> out = new ArrayList<>(candidatesPerGroup);
        for (CandidateDigit c : matchGroup(ReferenceTable.RIGHT, fourRuns)) {
            out.add(ParityCandidate.none(c));
        }
        return List.copyOf(out);
    }

    /**
     * Checks whether a symbol could start at {@code offset}.
     *
     * @return the reason it cannot, or empty if scoring may proceed
     */
    public Optional<SignalRejection> screen(RunLength runs, int offset)
    {
        Objects.requireNonNull(runs, "runs");
        if (offset < 0 || runs.size() - offset < SYMBOL_RUNS) {
            return Optional.of(SignalRejection.TOO_FEW_RUNS);
        }
        if (runs.get(offset).bit() == Bit.ONE) {
            return Optional.of(SignalRejection.LEADING_RUN_LIGHT);
        }
        return Optional.empty();
    }

    /**
     * Ranked guesses for all twelve encoded digits of a symbol starting at
     * {@code offset}.
     *
     * @return empty if {@link #screen} rejects the offset
     */
    public Optional<DigitCandidates> candidateDigits(RunLength runs, int offset)
    {
        if (screen(runs, offset).isPresent()) {
            return Optional.empty();
        }

        final List<List<ParityCandidate<CandidateDigit>>> positions = new ArrayList<>(DigitCandidates.POSITIONS);
        for (int i = 0; i < DIGITS_PER_HALF; i++) {
            positions.add(bestLeft(runs.lengths(offset + LEFT_START + i * RUNS_PER_DIGIT, RUNS_PER_DIGIT)));
        }
        for (int i = 0; i < DIGITS_PER_HALF; i++) {
            positions.add(bestRight(runs.lengths(offset + RIGHT_START + i * RUNS_PER_DIGIT, RUNS_PER_DIGIT)));
        }
        return Optional.of(new DigitCandidates(positions));
    }
}
