package gr.imsi.athenarc.posemir.discovery;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Tec;
import gr.imsi.athenarc.posemir.domain.Vector;
import gr.imsi.athenarc.posemir.matching.ExactMatcher;

/**
 * Turns MTPs into TECs for one point set. Each distinct pattern shape is emitted at most once,
 * represented by its earliest occurrence and carrying every vector under which it occurs.
 * <p>
 * Only the shapes already emitted are remembered, so a consolidator can feed a streaming sink
 * without holding on to the TECs themselves.
 */
public class TecConsolidator {

    private static final Logger LOG = LoggerFactory.getLogger(TecConsolidator.class);

    private final PointSet pointSet;
    private final ExactMatcher matcher;
    private final Set<List<Vector>> emittedShapes = new HashSet<>();

    public TecConsolidator(PointSet pointSet, ExactMatcher matcher) {
        this.pointSet = pointSet;
        this.matcher = matcher;
    }

    /**
     * Collects the translators worth expanding into full MTPs. Two sources of the same restricted
     * MTP start the same local pair of points, so the vector between them translates that pair
     * onto another part of the point set.
     */
    public SortedSet<Vector> candidateTranslators(List<Mtp> restrictedMtps) {
        SortedSet<Vector> candidates = new TreeSet<>();
        for (Mtp mtp : restrictedMtps) {
            Pattern sources = mtp.getPattern();
            for (int i = 0; i < sources.size(); i++) {
                for (int j = i + 1; j < sources.size(); j++) {
                    candidates.add(sources.get(j).subtract(sources.get(i)));
                }
            }
        }
        LOG.debug("Collected {} candidate translators from {} restricted MTPs", candidates.size(), restrictedMtps.size());
        return candidates;
    }

    /**
     * Builds the TEC of the MTP's pattern, or returns empty if a translate of the pattern has
     * already been consolidated.
     */
    public Optional<Tec> consolidate(Mtp mtp) {
        Pattern pattern = mtp.getPattern();
        if (emittedShapes.contains(pattern.normalized())) {
            return Optional.empty();
        }

        List<Pattern> occurrences = matcher.findOccurrences(pattern, pointSet);
        if (occurrences.isEmpty()) {
            LOG.debug("MTP {} has no occurrence in the point set, skipping it", mtp.getVector());
            return Optional.empty();
        }
        // the earliest occurrence represents the class, translators are rebased onto it
        Pattern representative = occurrences.get(0);
        List<Vector> rebased = new ArrayList<>(occurrences.size());
        for (Pattern occurrence : occurrences) {
            rebased.add(occurrence.getFirst().subtract(representative.getFirst()));
        }

        emittedShapes.add(pattern.normalized());
        Pattern maximal = extendToMaximal(representative, rebased);
        if (maximal != representative) {
            if (!emittedShapes.add(maximal.normalized())) {
                return Optional.empty();
            }
        }

        Tec tec = new Tec(maximal, rebased);
        LOG.debug("Consolidated {} from MTP {}", tec, mtp.getVector());
        return Optional.of(tec);
    }

    /**
     * Adds every point that all translators map into the point set. The result is the pattern
     * itself when it is already maximal for its translators, which is always the case for the
     * representative of an MTP since its translators include the MTP vector.
     */
    Pattern extendToMaximal(Pattern pattern, List<Vector> translators) {
        Set<Point> members = new HashSet<>(pattern.getPoints());
        List<Point> extension = new ArrayList<>();
        for (Point point : pointSet) {
            if (!members.contains(point) && translatedByAll(point, translators)) {
                extension.add(point);
            }
        }
        if (extension.isEmpty()) {
            return pattern;
        }

        LOG.warn("Pattern {} was not maximal, extending it with {}", pattern, extension);
        TreeSet<Point> extended = new TreeSet<>(pattern.getPoints());
        extended.addAll(extension);
        return new Pattern(new ArrayList<>(extended));
    }

    private boolean translatedByAll(Point point, List<Vector> translators) {
        for (Vector translator : translators) {
            if (!translator.isZero() && !pointSet.contains(point.translate(translator))) {
                return false;
            }
        }
        return true;
    }
}
