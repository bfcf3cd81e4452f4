package gr.imsi.athenarc.posemir.generator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;

/**
 * Builds synthetic point sets with known repetition structure, for tests and benchmarks.
 * All coordinates are integral.
 */
public class PointSetGenerator {

    private final Random random;

    public PointSetGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * Returns a point set of exactly {@code n} distinct points made of random patterns, each followed
     * by up to {@code maxRepetitions} translated copies of itself. Coordinates are drawn from
     * {@code [minValue, maxValue)}.
     */
    public PointSet randomRepeatedPatterns(int n, int minPatternSize, int maxPatternSize, int maxRepetitions,
                                           int minValue, int maxValue) {
        Preconditions.checkArgument(n > 0, "Point set size must be positive");
        Preconditions.checkArgument(0 < minPatternSize && minPatternSize <= maxPatternSize, "Invalid pattern size range");
        Preconditions.checkArgument(maxRepetitions >= 1, "There must be at least one repetition");
        Preconditions.checkArgument(minValue < maxValue, "Invalid value range");
        long range = (long) maxValue - minValue;
        Preconditions.checkArgument(range * range >= 2L * n, "Value range is too small for %s distinct points", n);

        Set<Point> points = new LinkedHashSet<>();
        while (points.size() < n) {
            int patternSize = minPatternSize + random.nextInt(maxPatternSize - minPatternSize + 1);
            List<int[]> pattern = new ArrayList<>(patternSize);
            for (int i = 0; i < patternSize; i++) {
                pattern.add(new int[] {randomValue(minValue, maxValue), randomValue(minValue, maxValue)});
            }
            addTranslated(points, pattern, 0, 0, n);

            int repetitions = 1 + random.nextInt(maxRepetitions);
            for (int r = 0; r < repetitions && points.size() < n; r++) {
                addTranslated(points, pattern, randomValue(minValue, maxValue), randomValue(minValue, maxValue), n);
            }
        }
        return new PointSet(points);
    }

    /**
     * Returns {@code n} points with onsets 0, 1, ..., n - 1 and a constant pitch.
     */
    public static PointSet onLine(int n) {
        Preconditions.checkArgument(n > 0, "Point set size must be positive");
        List<Point> points = new ArrayList<>(n);
        for (int x = 0; x < n; x++) {
            points.add(Point.of(x, 0.0));
        }
        return new PointSet(points);
    }

    /**
     * Returns {@code n} points whose pairwise difference vectors are all distinct, so no pattern of
     * more than one point repeats.
     */
    public static PointSet withoutRepeatedPatterns(int n) {
        Preconditions.checkArgument(n > 0 && n <= 30, "Point set size must be between 1 and 30");
        List<Point> points = new ArrayList<>(n);
        // pitches 2^x keep every difference 2^j - 2^i unique
        for (int x = 0; x < n; x++) {
            points.add(Point.of(x, (double) (1L << x)));
        }
        return new PointSet(points);
    }

    private void addTranslated(Set<Point> points, List<int[]> pattern, int dx, int dy, int limit) {
        for (int[] point : pattern) {
            if (points.size() >= limit) {
                return;
            }
            points.add(Point.of((double) point[0] + dx, (double) point[1] + dy));
        }
    }

    private int randomValue(int minValue, int maxValue) {
        return minValue + random.nextInt(maxValue - minValue);
    }
}
