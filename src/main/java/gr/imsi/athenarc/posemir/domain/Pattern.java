package gr.imsi.athenarc.posemir.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An ordered, non-empty sequence of distinct points. A pattern does not have to be drawn
 * from a point set: translated copies are synthesized by {@link #translate(Vector)}.
 * The order of the points is kept as given.
 */
public class Pattern implements Iterable<Point> {

    private final ImmutableList<Point> points;

    public Pattern(List<Point> points) {
        Preconditions.checkNotNull(points, "Pattern points must not be null");
        Preconditions.checkArgument(!points.isEmpty(), "Pattern must contain at least one point");
        Set<Point> seen = new HashSet<>();
        for (Point point : points) {
            Preconditions.checkNotNull(point, "Pattern cannot contain null points");
            Preconditions.checkArgument(seen.add(point), "Pattern contains duplicate point %s", point);
        }
        this.points = ImmutableList.copyOf(points);
    }

    public static Pattern of(Point... points) {
        return new Pattern(Arrays.asList(points));
    }

    public int size() {
        return points.size();
    }

    public Point get(int index) {
        return points.get(index);
    }

    public Point getFirst() {
        return points.get(0);
    }

    public List<Point> getPoints() {
        return points;
    }

    /**
     * Returns a new pattern with every point shifted by the given vector.
     */
    public Pattern translate(Vector vector) {
        if (vector.isZero()) {
            return this;
        }
        List<Point> translated = new ArrayList<>(points.size());
        for (Point point : points) {
            translated.add(point.translate(vector));
        }
        return new Pattern(translated);
    }

    /**
     * Returns the shape of this pattern: the vectors from the first point to every point,
     * in pattern order. Two patterns have equal shapes exactly when one is a translate of the other
     * with the points in corresponding order.
     */
    public List<Vector> normalized() {
        Point first = getFirst();
        List<Vector> shape = new ArrayList<>(points.size());
        for (Point point : points) {
            shape.add(point.subtract(first));
        }
        return shape;
    }

    public boolean isTranslationOf(Pattern other) {
        return size() == other.size() && normalized().equals(other.normalized());
    }

    /**
     * Returns the vector translating this pattern onto the other.
     *
     * @throws IllegalArgumentException if the other pattern is not a translate of this one
     */
    public Vector vectorTo(Pattern other) {
        Preconditions.checkArgument(isTranslationOf(other), "%s is not a translation of %s", other, this);
        return other.getFirst().subtract(getFirst());
    }

    @Override
    public Iterator<Point> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        return points.equals(((Pattern) o).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "Pattern" + points;
    }
}
