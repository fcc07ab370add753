package com.questrail.barcode.internal.solve;

import com.questrail.barcode.internal.match.CandidateDigit;
import com.questrail.barcode.internal.match.CandidateMatcher;
import com.questrail.barcode.internal.match.DigitCandidates;
import com.questrail.barcode.internal.match.Parity;
import com.questrail.barcode.internal.match.ParityCandidate;
import com.questrail.barcode.internal.signal.RunLength;
import com.questrail.barcode.internal.symbology.Ean13Encoder;
import com.questrail.barcode.internal.symbology.Ean13Patterns;
import com.questrail.barcode.model.Ean13Checksum;
import com.questrail.barcode.model.Ean13Code;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CheckDigitSolverTest
 * -----------------------------------------------------------------------------
 * Validates the residue-keyed search: clean input, repair of a misranked
 * digit, and the checksum guarantee on arbitrary candidate lists.
 */
class CheckDigitSolverTest {

    private final CheckDigitSolver solver = new CheckDigitSolver();

    @Test
    void solvesCleanSymbols() {
        CandidateMatcher matcher = new CandidateMatcher(3);
        for (String text : List.of("9780132114677", "4006381333931", "5901234123457", "0036000291452")) {
            Ean13Code code = Ean13Code.of(text);
            RunLength runs = RunLength.encode(Ean13Encoder.encodeModules(code));

            DigitCandidates candidates = matcher.candidateDigits(runs, 0).orElseThrow();

            assertEquals(Optional.of(code), solver.solve(candidates), text);
        }
    }

    @Test
    void checksumRepairsMisrankedDigit() {
        Ean13Code code = Ean13Code.of("9780132114677");
        List<List<ParityCandidate<CandidateDigit>>> positions = new ArrayList<>();
        for (int p = 0; p < DigitCandidates.POSITIONS; p++) {
            int truth = code.digit(p + 1);
            int decoy = (truth + 1) % 10;
            Parity parity = parityAt(code, p);
            if (p == 4) {
                positions.add(List.of(
                        new ParityCandidate<>(parity, new CandidateDigit(0.02, decoy)),
                        new ParityCandidate<>(parity, new CandidateDigit(0.05, truth))));
            } else {
                positions.add(List.of(
                        new ParityCandidate<>(parity, new CandidateDigit(0.05, truth)),
                        new ParityCandidate<>(parity, new CandidateDigit(0.30, decoy))));
            }
        }

        assertEquals(Optional.of(code), solver.solve(new DigitCandidates(positions)));
    }

    @Test
    void firstResolvingCheckCandidateWins() {
        // zeros everywhere need check digit 0; a 1 at position 1 needs check digit 9
        List<List<ParityCandidate<CandidateDigit>>> positions = zeroPositions();
        positions.set(1, List.of(
                ParityCandidate.odd(new CandidateDigit(0.1, 0)),
                ParityCandidate.odd(new CandidateDigit(0.2, 1))));
        positions.set(11, List.of(
                ParityCandidate.none(new CandidateDigit(0.0, 9)),
                ParityCandidate.none(new CandidateDigit(0.05, 0))));

        assertEquals(Optional.of(Ean13Code.of("0010000000009")), solver.solve(new DigitCandidates(positions)));
    }

    @Test
    void unresolvedCheckCandidatesAreSkipped() {
        List<List<ParityCandidate<CandidateDigit>>> positions = zeroPositions();
        positions.set(11, List.of(
                ParityCandidate.none(new CandidateDigit(0.0, 4)),
                ParityCandidate.none(new CandidateDigit(0.3, 0))));

        assertEquals(Optional.of(Ean13Code.of("0000000000000")), solver.solve(new DigitCandidates(positions)));
    }

    @Test
    void equallyScoredCheckCandidatesPreferBetterSequence() {
        List<List<ParityCandidate<CandidateDigit>>> positions = zeroPositions();
        positions.set(1, List.of(
                ParityCandidate.odd(new CandidateDigit(0.1, 0)),
                ParityCandidate.odd(new CandidateDigit(0.2, 1))));
        positions.set(11, List.of(
                ParityCandidate.none(new CandidateDigit(0.05, 9)),
                ParityCandidate.none(new CandidateDigit(0.05, 0))));

        assertEquals(Optional.of(Ean13Code.of("0000000000000")), solver.solve(new DigitCandidates(positions)));
    }

    @Test
    void everySolutionSatisfiesChecksum() {
        Random random = new Random(7);
        int solved = 0;
        for (int trial = 0; trial < 200; trial++) {
            Optional<Ean13Code> result = solver.solve(randomCandidates(random));
            if (result.isPresent()) {
                solved++;
                assertTrue(Ean13Checksum.isValid(result.get().digits()));
            }
        }
        assertTrue(solved > 0);
    }

    @Test
    void emptyPositionYieldsNothing() {
        List<List<ParityCandidate<CandidateDigit>>> positions = new ArrayList<>(randomCandidates(new Random(1)).positions());
        positions.set(8, List.of());

        assertTrue(solver.solve(new DigitCandidates(positions)).isEmpty());
    }

    @Test
    void noMatchingCheckDigitYieldsNothing() {
        // every position offers only zero; the first digit comes out 0 and the check digit must be 0
        List<List<ParityCandidate<CandidateDigit>>> positions = new ArrayList<>();
        for (int p = 0; p < DigitCandidates.POSITIONS; p++) {
            CandidateDigit digit = new CandidateDigit(0.0, p == 11 ? 5 : 0);
            positions.add(List.of(new ParityCandidate<>(p < 6 ? Parity.ODD : Parity.NONE, digit)));
        }

        assertTrue(solver.solve(new DigitCandidates(positions)).isEmpty());
    }

    @Test
    void firstDigitFromParityPattern() {
        assertEquals(0, CheckDigitSolver.firstDigit(parities("111111")).digit());
        assertEquals(1, CheckDigitSolver.firstDigit(parities("110100")).digit());
        assertEquals(8, CheckDigitSolver.firstDigit(parities("101001")).digit());
        assertEquals(9, CheckDigitSolver.firstDigit(parities("100101")).digit());
        assertEquals(0.0, CheckDigitSolver.firstDigit(parities("100110")).score(), 1e-12);
    }

    @Test
    void firstDigitRejectsUntaggedOrShortInput() {
        assertThrows(IllegalArgumentException.class,
                () -> CheckDigitSolver.firstDigit(List.of(Parity.ODD, Parity.NONE, Parity.ODD,
                        Parity.ODD, Parity.ODD, Parity.ODD)));
        assertThrows(IllegalArgumentException.class,
                () -> CheckDigitSolver.firstDigit(List.of(Parity.ODD)));
    }

    private static Parity parityAt(Ean13Code code, int position) {
        if (position >= 6) {
            return Parity.NONE;
        }
        return Ean13Patterns.parity(code.digit(0)).charAt(position) == '1' ? Parity.ODD : Parity.EVEN;
    }

    /**
     * A single zero candidate per position: odd parity on the left, none on the right.
     */
    private static List<List<ParityCandidate<CandidateDigit>>> zeroPositions() {
        List<List<ParityCandidate<CandidateDigit>>> positions = new ArrayList<>();
        for (int p = 0; p < DigitCandidates.POSITIONS; p++) {
            CandidateDigit zero = new CandidateDigit(0.0, 0);
            ParityCandidate<CandidateDigit> entry = p < 6 ? ParityCandidate.odd(zero) : ParityCandidate.none(zero);
            positions.add(List.of(entry));
        }
        return positions;
    }

    private static List<Parity> parities(String pattern) {
        List<Parity> out = new ArrayList<>();
        for (char c : pattern.toCharArray()) {
            out.add(c == '1' ? Parity.ODD : Parity.EVEN);
        }
        return out;
    }

    private static DigitCandidates randomCandidates(Random random) {
        List<List<ParityCandidate<CandidateDigit>>> positions = new ArrayList<>();
        for (int p = 0; p < DigitCandidates.POSITIONS; p++) {
            List<ParityCandidate<CandidateDigit>> group = new ArrayList<>();
            for (int k = 0; k < 3; k++) {
                CandidateDigit digit = new CandidateDigit(random.nextDouble(), random.nextInt(10));
                Parity parity = p >= 6 ? Parity.NONE : random.nextBoolean() ? Parity.ODD : Parity.EVEN;
                group.add(new ParityCandidate<>(parity, digit));
            }
            group.sort(ParityCandidate.byValue(CandidateDigit::compareTo));
            positions.add(group);
        }
        return new DigitCandidates(positions);
    }
}
