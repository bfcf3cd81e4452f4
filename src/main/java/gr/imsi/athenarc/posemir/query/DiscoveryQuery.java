package gr.imsi.athenarc.posemir.query;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.base.Preconditions;

/**
 * Asks for every translational equivalence class of the point set, following translators
 * seeded by point pairs at most {@code maxIoi} apart.
 */
public class DiscoveryQuery implements Query {

    private final BigFraction maxIoi;

    public DiscoveryQuery(BigFraction maxIoi) {
        Preconditions.checkNotNull(maxIoi, "Max IOI must not be null");
        Preconditions.checkArgument(maxIoi.compareTo(BigFraction.ZERO) >= 0, "Max IOI must be non-negative, got %s", maxIoi);
        this.maxIoi = maxIoi;
    }

    public DiscoveryQuery(double maxIoi) {
        this(toFraction(maxIoi));
    }

    private static BigFraction toFraction(double maxIoi) {
        Preconditions.checkArgument(Double.isFinite(maxIoi), "Max IOI must be finite, got %s", maxIoi);
        return new BigFraction(maxIoi);
    }

    public BigFraction getMaxIoi() {
        return maxIoi;
    }

    @Override
    public QueryType getType() {
        return QueryType.DISCOVERY;
    }

    @Override
    public String toString() {
        return "DiscoveryQuery{maxIoi=" + maxIoi.doubleValue() + '}';
    }
}
