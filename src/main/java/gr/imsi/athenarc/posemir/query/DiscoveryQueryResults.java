package gr.imsi.athenarc.posemir.query;

import java.util.ArrayList;
import java.util.List;

import gr.imsi.athenarc.posemir.domain.PatternOccurrences;
import gr.imsi.athenarc.posemir.domain.Tec;

public class DiscoveryQueryResults implements QueryResults {

    private List<Tec> tecs = new ArrayList<>();
    private long executionTime;

    public void setTecs(List<Tec> tecs) {
        this.tecs = tecs;
    }

    public List<Tec> getTecs() {
        return tecs;
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
        return tecs.size();
    }

    public List<PatternOccurrences> toPatternOccurrences(String piece, String source) {
        List<PatternOccurrences> result = new ArrayList<>(tecs.size());
        for (Tec tec : tecs) {
            result.add(tec.toPatternOccurrences(piece, source));
        }
        return result;
    }
}
