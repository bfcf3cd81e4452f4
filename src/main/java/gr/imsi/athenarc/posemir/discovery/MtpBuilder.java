package gr.imsi.athenarc.posemir.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Vector;

/**
 * Computes maximal translatable patterns.
 * <p>
 * The restricted computation only looks at pairs of points whose onsets are at most
 * {@code maxIoi} apart. Since the point set is sorted by onset, the inner sweep for a point stops
 * at the first point beyond that window, so the work depends on the local density of the
 * point set rather than on its size.
 */
public class MtpBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(MtpBuilder.class);

    private final BigFraction maxIoi;

    public MtpBuilder(BigFraction maxIoi) {
        Preconditions.checkNotNull(maxIoi, "Max IOI must not be null");
        Preconditions.checkArgument(maxIoi.compareTo(BigFraction.ZERO) >= 0, "Max IOI must be non-negative, got %s", maxIoi);
        this.maxIoi = maxIoi;
    }

    public BigFraction getMaxIoi() {
        return maxIoi;
    }

    /**
     * Returns the MTPs of all vectors between a point and a later point at most {@code maxIoi}
     * later, in ascending vector order. The points of each MTP are in ascending order.
     */
    public List<Mtp> computeRestrictedMtps(PointSet pointSet) {
        Map<Vector, List<Point>> sourcesByVector = new TreeMap<>();
        int pairs = 0;

        for (int i = 0; i < pointSet.size(); i++) {
            Point from = pointSet.get(i);
            for (int j = i + 1; j < pointSet.size(); j++) {
                Point to = pointSet.get(j);
                if (to.getOnset().subtract(from.getOnset()).compareTo(maxIoi) > 0) {
                    break;
                }
                sourcesByVector.computeIfAbsent(to.subtract(from), v -> new ArrayList<>()).add(from);
                pairs++;
            }
        }

        List<Mtp> mtps = new ArrayList<>(sourcesByVector.size());
        for (Map.Entry<Vector, List<Point>> entry : sourcesByVector.entrySet()) {
            mtps.add(new Mtp(entry.getKey(), new Pattern(entry.getValue())));
        }
        LOG.debug("Swept {} point pairs within max IOI {} into {} MTPs", pairs, maxIoi, mtps.size());
        return mtps;
    }

    /**
     * Returns the MTP of an arbitrary vector over the whole point set, or empty if no point is
     * mapped into the set by it.
     */
    public static Optional<Mtp> computeMtp(PointSet pointSet, Vector vector) {
        List<Point> sources = new ArrayList<>();
        for (Point point : pointSet) {
            if (pointSet.contains(point.translate(vector))) {
                sources.add(point);
            }
        }
        if (sources.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Mtp(vector, new Pattern(sources)));
    }
}
