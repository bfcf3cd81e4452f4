package gr.imsi.athenarc.posemir.domain;

import java.util.Objects;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.base.Preconditions;

/**
 * Difference between two points. Used both to translate patterns and as a map key when
 * grouping point pairs, hence the exact equality and the lexicographic total order.
 */
public final class Vector implements Comparable<Vector> {

    public static final Vector ZERO = new Vector(BigFraction.ZERO, BigFraction.ZERO);

    private final BigFraction x;
    private final BigFraction y;

    public Vector(BigFraction x, BigFraction y) {
        Preconditions.checkNotNull(x, "Vector x component must not be null");
        Preconditions.checkNotNull(y, "Vector y component must not be null");
        this.x = x.reduce();
        this.y = y.reduce();
    }

    public static Vector of(double x, double y) {
        Preconditions.checkArgument(Double.isFinite(x) && Double.isFinite(y), "Vector components must be finite, got (%s, %s)", x, y);
        return new Vector(new BigFraction(x), new BigFraction(y));
    }

    public BigFraction getX() {
        return x;
    }

    public double getRawX() {
        return x.doubleValue();
    }

    public BigFraction getY() {
        return y;
    }

    public double getRawY() {
        return y.doubleValue();
    }

    public Vector add(Vector other) {
        return new Vector(x.add(other.x), y.add(other.y));
    }

    public Vector subtract(Vector other) {
        return new Vector(x.subtract(other.x), y.subtract(other.y));
    }

    public boolean isZero() {
        return x.getNumerator().signum() == 0 && y.getNumerator().signum() == 0;
    }

    @Override
    public int compareTo(Vector o) {
        int c = x.compareTo(o.x);
        if (c != 0) {
            return c;
        }
        return y.compareTo(o.y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vector)) return false;
        Vector other = (Vector) o;
        return x.equals(other.x) && y.equals(other.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "<" + getRawX() + ", " + getRawY() + ">";
    }
}
