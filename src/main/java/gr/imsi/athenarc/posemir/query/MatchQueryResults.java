package gr.imsi.athenarc.posemir.query;

import java.util.ArrayList;
import java.util.List;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.PatternOccurrences;

public class MatchQueryResults implements QueryResults {

    private final Pattern query;
    private List<Pattern> occurrences = new ArrayList<>();
    private long executionTime;

    public MatchQueryResults(Pattern query) {
        this.query = query;
    }

    public Pattern getQuery() {
        return query;
    }

    public void setOccurrences(List<Pattern> occurrences) {
        this.occurrences = occurrences;
    }

    public List<Pattern> getOccurrences() {
        return occurrences;
    }

    public void setExecutionTime(long executionTime) {
        this.executionTime = executionTime;
    }

    @Override
    public long getExecutionTime() {
        return executionTime;
    }

    @Override
    public int getResultCount() {
        return occurrences.size();
    }

    public PatternOccurrences toPatternOccurrences(String piece, String source) {
        return PatternOccurrences.of(piece, source, query, occurrences);
    }
}
