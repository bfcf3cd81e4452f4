package gr.imsi.athenarc.posemir.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Represents a de-duplicated set of points that can be traversed in ascending
 * (onset, pitch) order. A point set is immutable once built.
 */
public class PointSet implements Iterable<Point> {

    private final ImmutableList<Point> points;
    private final ImmutableSet<Point> lookup;

    public PointSet(Collection<Point> points) {
        Preconditions.checkNotNull(points, "Points must not be null");
        TreeSet<Point> sorted = new TreeSet<>();
        for (Point point : points) {
            sorted.add(Preconditions.checkNotNull(point, "Point set cannot contain null points"));
        }
        this.points = ImmutableList.copyOf(sorted);
        this.lookup = ImmutableSet.copyOf(sorted);
    }

    public static PointSet of(Point... points) {
        List<Point> list = new ArrayList<>(points.length);
        Collections.addAll(list, points);
        return new PointSet(list);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Point get(int index) {
        return points.get(index);
    }

    public boolean contains(Point point) {
        return lookup.contains(point);
    }

    /**
     * Returns true if every point of the pattern belongs to this point set.
     */
    public boolean containsAll(Pattern pattern) {
        for (Point point : pattern) {
            if (!lookup.contains(point)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the index of the point in this point set, or a negative value if it is missing.
     */
    public int indexOf(Point point) {
        return Collections.binarySearch(points, point);
    }

    public List<Point> getPoints() {
        return points;
    }

    /**
     * Returns the points shared by this point set and the other.
     */
    public PointSet intersection(PointSet other) {
        List<Point> common = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < size() && j < other.size()) {
            int c = points.get(i).compareTo(other.get(j));
            if (c == 0) {
                common.add(points.get(i));
                i++;
                j++;
            } else if (c < 0) {
                i++;
            } else {
                j++;
            }
        }
        return new PointSet(common);
    }

    /**
     * Returns the points with onsets in the inclusive range [from, to] in ascending order.
     */
    public List<Point> getRange(BigFraction from, BigFraction to) {
        Preconditions.checkArgument(from.compareTo(to) <= 0, "Range start %s is after range end %s", from, to);
        List<Point> range = new ArrayList<>();
        for (int i = firstIndexAtOrAfter(from); i < points.size(); i++) {
            Point point = points.get(i);
            if (point.getOnset().compareTo(to) > 0) {
                break;
            }
            range.add(point);
        }
        return range;
    }

    /**
     * Returns a copy of this point set with every onset multiplied by the given factor.
     */
    public PointSet timeScaled(BigFraction factor) {
        Preconditions.checkArgument(factor.compareTo(BigFraction.ZERO) > 0, "Scaling factor must be positive, got %s", factor);
        List<Point> scaled = new ArrayList<>(points.size());
        for (Point point : points) {
            scaled.add(new Point(point.getOnset().multiply(factor), point.getExactPitch()));
        }
        return new PointSet(scaled);
    }

    private int firstIndexAtOrAfter(BigFraction onset) {
        int low = 0;
        int high = points.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (points.get(mid).getOnset().compareTo(onset) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    @Override
    public Iterator<Point> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointSet)) return false;
        return points.equals(((PointSet) o).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "PointSet" + points;
    }
}
