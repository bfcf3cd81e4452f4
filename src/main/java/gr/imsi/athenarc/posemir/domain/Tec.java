package gr.imsi.athenarc.posemir.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Translational equivalence class: a pattern together with every vector under which it
 * occurs in a point set. The translators are kept distinct and in ascending order, and always
 * contain {@link Vector#ZERO} for the pattern itself.
 */
public class Tec {

    private final Pattern pattern;
    private final ImmutableList<Vector> translators;

    public Tec(Pattern pattern, Collection<Vector> translators) {
        Preconditions.checkNotNull(pattern, "TEC pattern must not be null");
        Preconditions.checkNotNull(translators, "TEC translators must not be null");
        TreeSet<Vector> sorted = new TreeSet<>(translators);
        sorted.add(Vector.ZERO);
        this.pattern = pattern;
        this.translators = ImmutableList.copyOf(sorted);
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<Vector> getTranslators() {
        return translators;
    }

    /**
     * Returns true if the pattern occurs only once, i.e. the zero vector is the only translator.
     */
    public boolean isTrivial() {
        return translators.size() == 1;
    }

    /**
     * Returns the pattern translated by each translator, in translator order. The first
     * occurrence is the pattern itself.
     */
    public List<Pattern> getOccurrences() {
        List<Pattern> occurrences = new ArrayList<>(translators.size());
        for (Vector translator : translators) {
            occurrences.add(pattern.translate(translator));
        }
        return occurrences;
    }

    /**
     * Returns the union of the points of all occurrences.
     */
    public PointSet getCoveredSet() {
        List<Point> covered = new ArrayList<>(pattern.size() * translators.size());
        for (Pattern occurrence : getOccurrences()) {
            covered.addAll(occurrence.getPoints());
        }
        return new PointSet(covered);
    }

    public PatternOccurrences toPatternOccurrences(String piece, String source) {
        List<Pattern> occurrences = getOccurrences();
        return new PatternOccurrences(piece, "", source, pattern, occurrences.subList(1, occurrences.size()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tec)) return false;
        Tec other = (Tec) o;
        return pattern.equals(other.pattern) && translators.equals(other.translators);
    }

    @Override
    public int hashCode() {
        return 31 * pattern.hashCode() + translators.hashCode();
    }

    @Override
    public String toString() {
        return String.format("TEC: %d points, %d translators, %s", pattern.size(), translators.size(), pattern);
    }
}
