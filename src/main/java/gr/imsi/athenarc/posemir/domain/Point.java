package gr.imsi.athenarc.posemir.domain;

import java.util.Objects;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.base.Preconditions;

/**
 * Represents a single note event as a point with an onset time and a pitch.
 * Both coordinates are kept as exact rational numbers, so that {@code p.translate(q.subtract(p))}
 * is always {@code q} and differences between points never accumulate rounding error.
 */
public final class Point implements Comparable<Point> {

    private final BigFraction onset;
    private final BigFraction pitch;

    public Point(BigFraction onset, BigFraction pitch) {
        Preconditions.checkNotNull(onset, "Onset must not be null");
        Preconditions.checkNotNull(pitch, "Pitch must not be null");
        // BigFraction hashes its raw terms, so keep them in lowest terms
        this.onset = onset.reduce();
        this.pitch = pitch.reduce();
    }

    /**
     * Creates a point from floating point coordinates. The conversion is exact: each fraction
     * is the value of the double itself, not a decimal approximation of it.
     */
    public static Point of(double onset, double pitch) {
        Preconditions.checkArgument(Double.isFinite(onset), "Onset must be finite, got %s", onset);
        return of(new BigFraction(onset), pitch);
    }

    public static Point of(BigFraction onset, double pitch) {
        Preconditions.checkArgument(Double.isFinite(pitch), "Pitch must be finite, got %s", pitch);
        return new Point(onset, new BigFraction(pitch));
    }

    public BigFraction getOnset() {
        return onset;
    }

    /**
     * Returns the onset as a double, as used when the point leaves the engine.
     */
    public double getRawOnset() {
        return onset.doubleValue();
    }

    /**
     * Returns the pitch as a double. For points read from doubles this is the value read.
     */
    public double getPitch() {
        return pitch.doubleValue();
    }

    public BigFraction getExactPitch() {
        return pitch;
    }

    /**
     * Returns the vector that translates {@code other} onto this point.
     */
    public Vector subtract(Point other) {
        return new Vector(onset.subtract(other.onset), pitch.subtract(other.pitch));
    }

    public Point translate(Vector vector) {
        return new Point(onset.add(vector.getX()), pitch.add(vector.getY()));
    }

    @Override
    public int compareTo(Point o) {
        int c = onset.compareTo(o.onset);
        if (c != 0) {
            return c;
        }
        return pitch.compareTo(o.pitch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point other = (Point) o;
        return onset.equals(other.onset) && pitch.equals(other.pitch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(onset, pitch);
    }

    @Override
    public String toString() {
        return "(" + getRawOnset() + ", " + getPitch() + ")";
    }
}
