package gr.imsi.athenarc.posemir.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Vector;

/**
 * Matches translated, unscaled copies of a query pattern. Every point of the query must land
 * exactly on a point of the point set for a translation to count. Occurrences are made of the
 * matched points of the point set themselves.
 */
public class ExactMatcher implements PatternMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ExactMatcher.class);

    @Override
    public void findOccurrences(Pattern query, PointSet pointSet, Consumer<Pattern> sink) {
        Preconditions.checkNotNull(sink, "Sink must not be null");
        forEachMatch(query, pointSet, (translator, occurrence) -> sink.accept(occurrence));
    }

    /**
     * Returns every vector that maps the whole query into the point set, in ascending order.
     * The query's first point is the anchor: each point of the set is tried as its image.
     */
    public List<Vector> findTranslators(Pattern query, PointSet pointSet) {
        List<Vector> translators = new ArrayList<>();
        forEachMatch(query, pointSet, (translator, occurrence) -> translators.add(translator));
        return translators;
    }

    private void forEachMatch(Pattern query, PointSet pointSet, BiConsumer<Vector, Pattern> onMatch) {
        Preconditions.checkNotNull(query, "Query pattern must not be null");
        Preconditions.checkNotNull(pointSet, "Point set must not be null");
        if (query.size() > pointSet.size()) {
            LOG.debug("Query of {} points is larger than the point set of {} points", query.size(), pointSet.size());
            return;
        }

        Point anchor = query.getFirst();
        int matches = 0;
        for (Point target : pointSet) {
            Vector translator = target.subtract(anchor);
            Optional<Pattern> occurrence = occurrenceAt(query, target, translator, pointSet);
            if (occurrence.isPresent()) {
                matches++;
                onMatch.accept(translator, occurrence.get());
            }
        }
        LOG.debug("Found {} occurrences of a {} point query", matches, query.size());
    }

    /**
     * Returns the points of the set that the translated query lands on, in query order, or empty
     * if one of them is missing. The anchor's image is the target itself.
     */
    private Optional<Pattern> occurrenceAt(Pattern query, Point target, Vector translator, PointSet pointSet) {
        List<Point> members = new ArrayList<>(query.size());
        members.add(target);
        for (int i = 1; i < query.size(); i++) {
            int index = pointSet.indexOf(query.get(i).translate(translator));
            if (index < 0) {
                return Optional.empty();
            }
            members.add(pointSet.get(index));
        }
        return Optional.of(new Pattern(members));
    }
}
