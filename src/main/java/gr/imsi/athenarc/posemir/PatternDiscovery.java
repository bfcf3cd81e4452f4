package gr.imsi.athenarc.posemir;

import java.util.List;
import java.util.function.Consumer;

import org.apache.commons.math3.fraction.BigFraction;
import org.jetbrains.annotations.NotNull;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.posemir.discovery.SiatecC;
import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Tec;
import gr.imsi.athenarc.posemir.matching.ExactMatcher;

/**
 * Entry points for callers holding plain lists of points. Every call builds its own point set
 * and validates its parameters before any result is produced.
 */
public final class PatternDiscovery {

    private PatternDiscovery() {
    }

    /**
     * Discovers all TECs of the points and returns them once the computation is complete.
     *
     * @param points the points, in any order, duplicates are dropped
     * @param maxIoi the largest onset difference between two points that seeds a translator
     */
    public static List<Tec> discoverTecs(@NotNull List<Point> points, @NotNull BigFraction maxIoi) {
        return new SiatecC(maxIoi).computeTecs(toPointSet(points));
    }

    public static List<Tec> discoverTecs(@NotNull List<Point> points, double maxIoi) {
        return discoverTecs(points, toMaxIoi(maxIoi));
    }

    /**
     * Discovers all TECs of the points, passing each to the sink as soon as it is final.
     */
    public static void discoverTecsStreaming(@NotNull List<Point> points, @NotNull BigFraction maxIoi,
                                             @NotNull Consumer<Tec> sink) {
        new SiatecC(maxIoi).computeTecsToOutput(toPointSet(points), sink);
    }

    public static void discoverTecsStreaming(@NotNull List<Point> points, double maxIoi, @NotNull Consumer<Tec> sink) {
        discoverTecsStreaming(points, toMaxIoi(maxIoi), sink);
    }

    /**
     * Passes every exact translated occurrence of the query among the points to the sink, in
     * ascending order of the point its first point lands on.
     */
    public static void findOccurrences(@NotNull Pattern query, @NotNull List<Point> points,
                                       @NotNull Consumer<Pattern> sink) {
        Preconditions.checkNotNull(query, "Query pattern must not be null");
        Preconditions.checkNotNull(sink, "Sink must not be null");
        new ExactMatcher().findOccurrences(query, toPointSet(points), sink);
    }

    private static PointSet toPointSet(List<Point> points) {
        Preconditions.checkNotNull(points, "Points must not be null");
        Preconditions.checkArgument(!points.isEmpty(), "Points must not be empty");
        return new PointSet(points);
    }

    private static BigFraction toMaxIoi(double maxIoi) {
        Preconditions.checkArgument(Double.isFinite(maxIoi) && maxIoi >= 0, "Max IOI must be a non-negative number, got %s", maxIoi);
        return new BigFraction(maxIoi);
    }
}
