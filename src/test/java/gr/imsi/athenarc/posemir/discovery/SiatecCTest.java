package gr.imsi.athenarc.posemir.discovery;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Tec;
import gr.imsi.athenarc.posemir.domain.Vector;
import gr.imsi.athenarc.posemir.generator.PointSetGenerator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SiatecCTest {

    private final PointSet example = PointSet.of(
        Point.of(0, 60), Point.of(1, 62), Point.of(4, 60), Point.of(5, 62));

    private final PointSet chords = PointSet.of(
        Point.of(0, 60), Point.of(0, 64), Point.of(1, 60), Point.of(1, 64));

    @Test
    public void testRepeatedMotif() {
        List<Tec> tecs = new SiatecC(new BigFraction(2)).computeTecs(example);
        assertEquals(1, tecs.size());
        assertEquals(Pattern.of(Point.of(0, 60), Point.of(1, 62)), tecs.get(0).getPattern());
        assertEquals(Arrays.asList(Vector.ZERO, Vector.of(4, 0)), tecs.get(0).getTranslators());
    }

    @Test
    public void testLargerMaxIoiFindsMoreTecs() {
        List<Tec> tecs = new SiatecC(new BigFraction(5)).computeTecs(example);
        assertEquals(2, tecs.size());
        assertEquals(Pattern.of(Point.of(0, 60), Point.of(4, 60)), tecs.get(0).getPattern());
        assertEquals(Arrays.asList(Vector.ZERO, Vector.of(1, 2)), tecs.get(0).getTranslators());
        assertEquals(Pattern.of(Point.of(0, 60), Point.of(1, 62)), tecs.get(1).getPattern());
        assertEquals(Arrays.asList(Vector.ZERO, Vector.of(4, 0)), tecs.get(1).getTranslators());
    }

    @Test
    public void testZeroMaxIoiOnChords() {
        List<Tec> tecs = new SiatecC(BigFraction.ZERO).computeTecs(chords);
        assertEquals(1, tecs.size());
        assertEquals(Pattern.of(Point.of(0, 60), Point.of(0, 64)), tecs.get(0).getPattern());
        assertEquals(Arrays.asList(Vector.ZERO, Vector.of(1, 0)), tecs.get(0).getTranslators());

        assertEquals(2, new SiatecC(BigFraction.ONE).computeTecs(chords).size());
    }

    @Test
    public void testFractionalOnsetsAreExact() {
        PointSet triplets = PointSet.of(
            Point.of(BigFraction.ZERO, 60), Point.of(new BigFraction(1, 3), 62),
            Point.of(BigFraction.ONE, 60), Point.of(new BigFraction(4, 3), 62));
        List<Tec> tecs = new SiatecC(new BigFraction(1, 3)).computeTecs(triplets);
        assertEquals(1, tecs.size());
        assertEquals(Pattern.of(Point.of(BigFraction.ZERO, 60), Point.of(new BigFraction(1, 3), 62)), tecs.get(0).getPattern());
        assertEquals(Arrays.asList(Vector.ZERO, Vector.of(1, 0)), tecs.get(0).getTranslators());
    }

    @Test
    public void testNoRepetitionNoTecs() {
        PointSet pointSet = PointSetGenerator.withoutRepeatedPatterns(12);
        assertTrue(new SiatecC(new BigFraction(20)).computeTecs(pointSet).isEmpty());
        assertTrue(new SiatecC(BigFraction.ONE).computeTecs(PointSet.of(Point.of(0, 60))).isEmpty());
    }

    @Test
    public void testPointsOnALine() {
        List<Tec> tecs = new SiatecC(BigFraction.ONE).computeTecs(PointSetGenerator.onLine(5));
        assertEquals(3, tecs.size());
        for (int k = 1; k <= 3; k++) {
            Tec tec = tecs.get(k - 1);
            assertEquals(5 - k, tec.getPattern().size());
            assertEquals(k + 1, tec.getTranslators().size());
        }
    }

    @Test
    public void testEmptyPointSetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SiatecC(BigFraction.ONE).computeTecs(new PointSet(new ArrayList<>())));
    }

    @Test
    public void testStreamingAndBulkAgree() {
        PointSet pointSet = randomPointSet(7);
        SiatecC siatecC = new SiatecC(new BigFraction(3));
        List<Tec> streamed = new ArrayList<>();
        siatecC.computeTecsToOutput(pointSet, streamed::add);
        assertEquals(siatecC.computeTecs(pointSet), streamed);
        assertEquals(streamed, new SiatecC(new BigFraction(3)).computeTecs(pointSet));
    }

    @Test
    public void testTecProperties() {
        int checked = 0;
        for (long seed = 1; seed <= 5; seed++) {
            PointSet pointSet = randomPointSet(seed);
            List<Tec> tecs = new SiatecC(new BigFraction(3)).computeTecs(pointSet);
            assertTecProperties(pointSet, tecs);
            checked += tecs.size();
        }
        assertTrue(checked > 0);
    }

    @Test
    public void testNonIntegralPitchShift() {
        PointSet pointSet = PointSet.of(Point.of(0, 0.2), Point.of(1, 0.2), Point.of(4, 0.9), Point.of(5, 0.9));
        List<Tec> tecs = new SiatecC(new BigFraction(2)).computeTecs(pointSet);
        assertEquals(1, tecs.size());
        assertEquals(Pattern.of(Point.of(0, 0.2), Point.of(1, 0.2)), tecs.get(0).getPattern());
        assertEquals(Pattern.of(Point.of(4, 0.9), Point.of(5, 0.9)), tecs.get(0).getOccurrences().get(1));
        assertEquals(0.9, tecs.get(0).getOccurrences().get(1).getFirst().getPitch());
        assertTecProperties(pointSet, tecs);
    }

    @Test
    public void testMicrotonalMotifShiftedByATenth() {
        Pattern motif = Pattern.of(Point.of(0, 60.3), Point.of(1, 60.7), Point.of(1.5, 61.1));
        Vector shift = Vector.of(4, 0.1);
        List<Point> points = new ArrayList<>(motif.getPoints());
        points.addAll(motif.translate(shift).getPoints());
        PointSet pointSet = new PointSet(points);

        List<Tec> tecs = new SiatecC(new BigFraction(2)).computeTecs(pointSet);
        assertTecProperties(pointSet, tecs);
        Set<Tec> found = new HashSet<>(tecs);
        assertTrue(found.contains(new Tec(motif, Arrays.asList(Vector.ZERO, shift))), "Missing motif TEC in " + tecs);
    }

    @Test
    public void testNonIntegralPitchProperties() {
        for (long seed = 1; seed <= 5; seed++) {
            PointSet pointSet = microtonal(randomPointSet(seed));
            assertTecProperties(pointSet, new SiatecC(new BigFraction(3)).computeTecs(pointSet));
        }
    }

    @Test
    public void testLargerMaxIoiKeepsEveryTec() {
        for (long seed = 1; seed <= 5; seed++) {
            PointSet pointSet = randomPointSet(seed);
            Set<Tec> narrow = new HashSet<>(new SiatecC(BigFraction.ONE).computeTecs(pointSet));
            Set<Tec> wide = new HashSet<>(new SiatecC(new BigFraction(4)).computeTecs(pointSet));
            assertTrue(wide.containsAll(narrow));
        }
    }

    /**
     * Checks soundness, translator and pattern maximality, shape uniqueness and non-triviality
     * against brute force.
     */
    private static void assertTecProperties(PointSet pointSet, List<Tec> tecs) {
        Set<List<Vector>> shapes = new HashSet<>();
        for (Tec tec : tecs) {
            assertFalse(tec.isTrivial(), "Trivial TEC " + tec);
            assertEquals(Vector.ZERO, tec.getTranslators().get(0));
            assertTrue(shapes.add(tec.getPattern().normalized()), "Shape emitted twice: " + tec);
            for (Pattern occurrence : tec.getOccurrences()) {
                assertTrue(pointSet.containsAll(occurrence), "Occurrence outside the point set: " + occurrence);
            }
            assertEquals(allTranslators(tec.getPattern(), pointSet), tec.getTranslators());
            assertEquals(new HashSet<>(maximalPattern(tec.getTranslators(), pointSet)),
                new HashSet<>(tec.getPattern().getPoints()));
        }
    }

    /**
     * Maps integral pitches onto tenths of a semitone above 60.3, none of which is exact in binary.
     */
    private static PointSet microtonal(PointSet pointSet) {
        List<Point> points = new ArrayList<>(pointSet.size());
        for (Point point : pointSet) {
            points.add(Point.of(point.getOnset(), 60.3 + point.getPitch() / 10));
        }
        return new PointSet(points);
    }

    private static PointSet randomPointSet(long seed) {
        return new PointSetGenerator(seed).randomRepeatedPatterns(60, 2, 5, 3, 0, 20);
    }

    /**
     * Brute force: every vector mapping the whole pattern into the point set.
     */
    private static List<Vector> allTranslators(Pattern pattern, PointSet pointSet) {
        Set<Point> points = new HashSet<>(pointSet.getPoints());
        List<Vector> translators = new ArrayList<>();
        for (Point target : pointSet) {
            Vector translator = target.subtract(pattern.getFirst());
            boolean all = true;
            for (Point point : pattern) {
                all &= points.contains(point.translate(translator));
            }
            if (all) {
                translators.add(translator);
            }
        }
        return translators;
    }

    /**
     * Brute force: every point of the set that all translators map into the set.
     */
    private static List<Point> maximalPattern(List<Vector> translators, PointSet pointSet) {
        Set<Point> points = new HashSet<>(pointSet.getPoints());
        List<Point> pattern = new ArrayList<>();
        for (Point point : pointSet) {
            boolean all = true;
            for (Vector translator : translators) {
                all &= points.contains(point.translate(translator));
            }
            if (all) {
                pattern.add(point);
            }
        }
        return pattern;
    }
}
