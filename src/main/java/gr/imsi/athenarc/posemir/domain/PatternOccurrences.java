package gr.imsi.athenarc.posemir.domain;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A pattern along with all of its other occurrences in a piece, labelled with where the
 * pattern came from (an analyst, an algorithm).
 */
public class PatternOccurrences {

    private final String piece;
    private final String label;
    private final String source;
    private final Pattern pattern;
    private final ImmutableList<Pattern> occurrences;

    public PatternOccurrences(String piece, String label, String source, Pattern pattern, List<Pattern> occurrences) {
        Preconditions.checkNotNull(pattern, "Pattern must not be null");
        Preconditions.checkNotNull(occurrences, "Occurrences must not be null");
        this.piece = piece;
        this.label = label;
        this.source = source;
        this.pattern = pattern;
        this.occurrences = ImmutableList.copyOf(occurrences);
    }

    /**
     * Wraps the occurrences reported by a matcher for the given query. The query itself is the
     * pattern and is not repeated among the occurrences.
     */
    public static PatternOccurrences of(String piece, String source, Pattern query, List<Pattern> matches) {
        List<Pattern> occurrences = new ArrayList<>(matches.size());
        for (Pattern match : matches) {
            if (!match.equals(query)) {
                occurrences.add(match);
            }
        }
        return new PatternOccurrences(piece, "", source, query, occurrences);
    }

    public String getPiece() {
        return piece;
    }

    public String getLabel() {
        return label;
    }

    public String getSource() {
        return source;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<Pattern> getOccurrences() {
        return occurrences;
    }

    /**
     * Returns the number of patterns including the pattern itself.
     */
    public int size() {
        return occurrences.size() + 1;
    }

    /**
     * Index 0 is the pattern, the occurrences follow.
     */
    public Pattern get(int index) {
        if (index == 0) {
            return pattern;
        }
        return occurrences.get(index - 1);
    }

    public List<Pattern> toList() {
        List<Pattern> all = new ArrayList<>(size());
        all.add(pattern);
        all.addAll(occurrences);
        return all;
    }

    @Override
    public String toString() {
        return String.format("PatternOccurrences[piece=%s, label=%s, source=%s, pattern=%s, occurrences=%d]",
            piece, label, source, pattern, occurrences.size());
    }
}
