package gr.imsi.athenarc.posemir.manager;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.posemir.discovery.SiatecC;
import gr.imsi.athenarc.posemir.discovery.TecAlgorithm;
import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Tec;
import gr.imsi.athenarc.posemir.matching.ExactMatcher;
import gr.imsi.athenarc.posemir.query.DiscoveryQuery;
import gr.imsi.athenarc.posemir.query.DiscoveryQueryResults;
import gr.imsi.athenarc.posemir.query.MatchQuery;
import gr.imsi.athenarc.posemir.query.MatchQueryResults;
import gr.imsi.athenarc.posemir.query.Query;
import gr.imsi.athenarc.posemir.query.QueryResults;

/**
 * Runs discovery and match queries against one point set. The point set is read only, so a
 * manager may serve queries from several threads.
 */
public class QueryManager {
    private static final Logger LOG = LoggerFactory.getLogger(QueryManager.class);

    private final PointSet pointSet;
    private final String pieceName;
    private final ExactMatcher matcher;

    // Private constructor used by builder
    private QueryManager(PointSet pointSet, String pieceName, ExactMatcher matcher) {
        this.pointSet = pointSet;
        this.pieceName = pieceName;
        this.matcher = matcher;
    }

    /**
     * Execute a query based on its type.
     *
     * @param query the query to execute
     * @return the result of the query execution
     */
    public QueryResults executeQuery(Query query) {
        Preconditions.checkNotNull(query, "Query must not be null");
        LOG.info("Executing {} query on '{}' ({} points)", query.getType(), pieceName, pointSet.size());

        switch (query.getType()) {
            case DISCOVERY:
                return executeDiscoveryQuery((DiscoveryQuery) query);
            case MATCH:
                return executeMatchQuery((MatchQuery) query);
            default:
                throw new UnsupportedOperationException("Unsupported query type: " + query.getType());
        }
    }

    public DiscoveryQueryResults executeDiscoveryQuery(DiscoveryQuery query) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Tec> tecs = createAlgorithm(query).computeTecs(pointSet);

        DiscoveryQueryResults results = new DiscoveryQueryResults();
        results.setTecs(tecs);
        results.setExecutionTime(stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOG.info("Discovered {} TECs in {} ms", tecs.size(), results.getExecutionTime());
        return results;
    }

    /**
     * Streams the TECs of a discovery query to the sink instead of collecting them.
     *
     * @return the number of TECs passed to the sink
     */
    public int streamDiscoveryQuery(DiscoveryQuery query, Consumer<Tec> sink) {
        Preconditions.checkNotNull(sink, "Sink must not be null");
        int[] count = {0};
        createAlgorithm(query).computeTecsToOutput(pointSet, tec -> {
            count[0]++;
            sink.accept(tec);
        });
        return count[0];
    }

    public MatchQueryResults executeMatchQuery(MatchQuery query) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        Pattern pattern = query.getPattern();
        List<Pattern> occurrences = matcher.findOccurrences(pattern, pointSet);

        MatchQueryResults results = new MatchQueryResults(pattern);
        results.setOccurrences(occurrences);
        results.setExecutionTime(stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOG.info("Found {} occurrences of a {} point query in {} ms", occurrences.size(), pattern.size(), results.getExecutionTime());
        return results;
    }

    private TecAlgorithm createAlgorithm(DiscoveryQuery query) {
        return new SiatecC(query.getMaxIoi(), matcher);
    }

    public PointSet getPointSet() {
        return pointSet;
    }

    public String getPieceName() {
        return pieceName;
    }

    /**
     * Creates a new builder for QueryManager
     * @param pointSet The point set queries run against
     * @return A new builder instance
     */
    public static Builder builder(PointSet pointSet) {
        return new Builder(pointSet);
    }

    /**
     * Builder class for QueryManager
     */
    public static class Builder {
        private final PointSet pointSet;
        private String pieceName = "piece";
        private ExactMatcher matcher = new ExactMatcher();

        public Builder(PointSet pointSet) {
            Preconditions.checkNotNull(pointSet, "Point set must not be null");
            Preconditions.checkArgument(!pointSet.isEmpty(), "Point set must not be empty");
            this.pointSet = pointSet;
        }

        public Builder withPieceName(String pieceName) {
            this.pieceName = pieceName;
            return this;
        }

        public Builder withMatcher(ExactMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public QueryManager build() {
            return new QueryManager(pointSet, pieceName, matcher);
        }
    }
}
