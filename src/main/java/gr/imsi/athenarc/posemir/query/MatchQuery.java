package gr.imsi.athenarc.posemir.query;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.posemir.domain.Pattern;

/**
 * Asks for every exact translated occurrence of a pattern in the point set.
 */
public class MatchQuery implements Query {

    private final Pattern pattern;

    public MatchQuery(Pattern pattern) {
        this.pattern = Preconditions.checkNotNull(pattern, "Query pattern must not be null");
    }

    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public QueryType getType() {
        return QueryType.MATCH;
    }

    @Override
    public String toString() {
        return "MatchQuery{" + pattern.size() + " points}";
    }
}
