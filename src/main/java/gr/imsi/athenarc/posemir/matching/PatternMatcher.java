package gr.imsi.athenarc.posemir.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.PointSet;

/**
 * Finds the occurrences of a query pattern in a point set.
 */
public interface PatternMatcher {

    /**
     * Passes every occurrence of the query in the point set to the sink, on the calling thread,
     * as soon as it is found.
     */
    void findOccurrences(Pattern query, PointSet pointSet, Consumer<Pattern> sink);

    default List<Pattern> findOccurrences(Pattern query, PointSet pointSet) {
        List<Pattern> occurrences = new ArrayList<>();
        findOccurrences(query, pointSet, occurrences::add);
        return occurrences;
    }
}
