package gr.imsi.athenarc.posemir.matching;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Vector;
import gr.imsi.athenarc.posemir.generator.PointSetGenerator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExactMatcherTest {

    private final ExactMatcher matcher = new ExactMatcher();

    private final PointSet pointSet = PointSet.of(
        Point.of(0, 60), Point.of(1, 62), Point.of(4, 60), Point.of(5, 62));

    @Test
    public void testFindsEveryOccurrenceInOrder() {
        Pattern query = Pattern.of(Point.of(0, 60), Point.of(1, 62));
        List<Pattern> occurrences = matcher.findOccurrences(query, pointSet);
        assertEquals(Arrays.asList(query, Pattern.of(Point.of(4, 60), Point.of(5, 62))), occurrences);
        assertEquals(Arrays.asList(Vector.ZERO, Vector.of(4, 0)), matcher.findTranslators(query, pointSet));
    }

    @Test
    public void testQueryDoesNotNeedToBelongToThePointSet() {
        Pattern query = Pattern.of(Point.of(10, 70), Point.of(11, 72));
        List<Pattern> occurrences = matcher.findOccurrences(query, pointSet);
        assertEquals(2, occurrences.size());
        assertEquals(Pattern.of(Point.of(0, 60), Point.of(1, 62)), occurrences.get(0));
        assertEquals(Pattern.of(Point.of(4, 60), Point.of(5, 62)), occurrences.get(1));
    }

    @Test
    public void testOnlyTranslationsMatch() {
        // stretched in time
        assertTrue(matcher.findOccurrences(Pattern.of(Point.of(0, 60), Point.of(2, 62)), pointSet).isEmpty());
        // inverted
        assertTrue(matcher.findOccurrences(Pattern.of(Point.of(0, 62), Point.of(1, 60)), pointSet).isEmpty());
    }

    @Test
    public void testQueryLargerThanPointSet() {
        Pattern query = Pattern.of(Point.of(0, 60), Point.of(1, 62), Point.of(4, 60), Point.of(5, 62), Point.of(6, 60));
        assertTrue(matcher.findOccurrences(query, pointSet).isEmpty());
    }

    @Test
    public void testSinglePointQueryMatchesEveryPoint() {
        List<Pattern> occurrences = matcher.findOccurrences(Pattern.of(Point.of(100, 0)), pointSet);
        assertEquals(pointSet.size(), occurrences.size());
        for (int i = 0; i < pointSet.size(); i++) {
            assertEquals(pointSet.get(i), occurrences.get(i).getFirst());
        }
    }

    @Test
    public void testOccurrencesKeepTheQueryOrder() {
        Pattern query = Pattern.of(Point.of(1, 62), Point.of(0, 60));
        List<Pattern> occurrences = matcher.findOccurrences(query, pointSet);
        assertEquals(Arrays.asList(query, Pattern.of(Point.of(5, 62), Point.of(4, 60))), occurrences);
    }

    @Test
    public void testStreamingMatchesCollecting() {
        Pattern query = Pattern.of(Point.of(0, 60));
        List<Pattern> streamed = new ArrayList<>();
        matcher.findOccurrences(query, pointSet, streamed::add);
        assertEquals(matcher.findOccurrences(query, pointSet), streamed);
    }

    @Test
    public void testNonIntegralPitchOccurrencesArePointsOfTheSet() {
        PointSet microtonal = PointSet.of(Point.of(0, 0.2), Point.of(4, 0.9));
        List<Pattern> occurrences = matcher.findOccurrences(Pattern.of(Point.of(0, 0.2)), microtonal);
        assertEquals(2, occurrences.size());
        for (Pattern occurrence : occurrences) {
            assertTrue(microtonal.containsAll(occurrence), "Occurrence outside the point set: " + occurrence);
        }
        assertEquals(0.9, occurrences.get(1).getFirst().getPitch());
    }

    @Test
    public void testNonIntegralPitchShiftedMotif() {
        Pattern motif = Pattern.of(Point.of(0, 60.3), Point.of(1, 60.7), Point.of(1.5, 61.1));
        Pattern shifted = motif.translate(Vector.of(4, 0.1));
        List<Point> points = new ArrayList<>(motif.getPoints());
        points.addAll(shifted.getPoints());
        PointSet microtonal = new PointSet(points);

        assertEquals(Arrays.asList(motif, shifted), matcher.findOccurrences(motif, microtonal));
        assertEquals(Arrays.asList(Vector.ZERO, Vector.of(4, 0.1)), matcher.findTranslators(motif, microtonal));
    }

    @Test
    public void testNonIntegralPitchesSoundAndComplete() {
        for (long seed = 1; seed <= 5; seed++) {
            PointSet microtonal = microtonal(new PointSetGenerator(seed).randomRepeatedPatterns(40, 2, 4, 3, 0, 15));
            for (int start = 0; start + 3 <= microtonal.size(); start += 7) {
                Pattern query = new Pattern(microtonal.getPoints().subList(start, start + 3));
                List<Pattern> occurrences = matcher.findOccurrences(query, microtonal);
                assertTrue(occurrences.contains(query));
                for (Pattern occurrence : occurrences) {
                    assertTrue(microtonal.containsAll(occurrence), "Occurrence outside the point set: " + occurrence);
                    assertTrue(query.isTranslationOf(occurrence));
                }
                assertEquals(allTranslators(query, microtonal), matcher.findTranslators(query, microtonal));
            }
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

    private static List<Vector> allTranslators(Pattern query, PointSet pointSet) {
        Set<Point> points = new HashSet<>(pointSet.getPoints());
        List<Vector> translators = new ArrayList<>();
        for (Point target : pointSet) {
            Vector translator = target.subtract(query.getFirst());
            boolean all = true;
            for (Point point : query) {
                all &= points.contains(point.translate(translator));
            }
            if (all) {
                translators.add(translator);
            }
        }
        return translators;
    }
}
