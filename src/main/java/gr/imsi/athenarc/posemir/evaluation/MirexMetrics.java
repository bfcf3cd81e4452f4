package gr.imsi.athenarc.posemir.evaluation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.PatternOccurrences;
import gr.imsi.athenarc.posemir.domain.Point;

/**
 * Establishment, occurrence and three layer metrics of the MIREX 2017 "Discovery of Repeated Themes and Sections" task,
 * comparing discovered patterns against a ground truth.
 * Rows of every matrix correspond to the ground truth, columns to the discovered patterns.
 */
public final class MirexMetrics {

    private MirexMetrics() {
    }

    /**
     * Number of shared points divided by the size of the larger pattern.
     */
    public static double cardinalityScore(Pattern groundTruth, Pattern pattern) {
        return (double) commonPoints(groundTruth, pattern) / Math.max(groundTruth.size(), pattern.size());
    }

    /**
     * Cardinality scores between every occurrence of the ground truth and every occurrence of the
     * discovered pattern, the patterns themselves included as occurrence 0.
     */
    public static RealMatrix scoreMatrix(PatternOccurrences groundTruth, PatternOccurrences patterns) {
        RealMatrix scores = MatrixUtils.createRealMatrix(groundTruth.size(), patterns.size());
        for (int row = 0; row < groundTruth.size(); row++) {
            for (int col = 0; col < patterns.size(); col++) {
                scores.setEntry(row, col, cardinalityScore(groundTruth.get(row), patterns.get(col)));
            }
        }
        return scores;
    }

    public static RealMatrix establishmentMatrix(List<PatternOccurrences> groundTruth, List<PatternOccurrences> patterns) {
        Preconditions.checkArgument(!groundTruth.isEmpty() && !patterns.isEmpty(),
            "Establishment needs at least one ground truth pattern and one discovered pattern");
        RealMatrix establishment = MatrixUtils.createRealMatrix(groundTruth.size(), patterns.size());
        for (int row = 0; row < groundTruth.size(); row++) {
            for (int col = 0; col < patterns.size(); col++) {
                establishment.setEntry(row, col, max(scoreMatrix(groundTruth.get(row), patterns.get(col))));
            }
        }
        return establishment;
    }

    /**
     * Mean over the discovered patterns of their best establishment score.
     */
    public static double establishmentPrecision(RealMatrix establishment) {
        return meanOfColumnMaxima(establishment);
    }

    /**
     * Mean over the ground truth patterns of their best establishment score.
     */
    public static double establishmentRecall(RealMatrix establishment) {
        return meanOfRowMaxima(establishment);
    }

    public static double establishmentF1(RealMatrix establishment) {
        return f1(establishmentPrecision(establishment), establishmentRecall(establishment));
    }

    public static double f1(double precision, double recall) {
        if (precision + recall == 0.0) {
            return 0.0;
        }
        return (2 * precision * recall) / (precision + recall);
    }

    /**
     * F1 of the point overlap between two patterns, the first one being the reference.
     */
    public static double layerOneFScore(Pattern groundTruth, Pattern pattern) {
        double common = commonPoints(groundTruth, pattern);
        return f1(common / pattern.size(), common / groundTruth.size());
    }

    /**
     * F1 of the best layer one scores between the occurrences of two patterns.
     */
    public static double layerTwoFScore(PatternOccurrences groundTruth, PatternOccurrences patterns) {
        RealMatrix scores = MatrixUtils.createRealMatrix(groundTruth.size(), patterns.size());
        for (int row = 0; row < groundTruth.size(); row++) {
            for (int col = 0; col < patterns.size(); col++) {
                scores.setEntry(row, col, layerOneFScore(groundTruth.get(row), patterns.get(col)));
            }
        }
        return f1(meanOfColumnMaxima(scores), meanOfRowMaxima(scores));
    }

    public static RealMatrix layerTwoFScoreMatrix(List<PatternOccurrences> groundTruth, List<PatternOccurrences> patterns) {
        Preconditions.checkArgument(!groundTruth.isEmpty() && !patterns.isEmpty(),
            "Three layer scores need at least one ground truth pattern and one discovered pattern");
        RealMatrix scores = MatrixUtils.createRealMatrix(groundTruth.size(), patterns.size());
        for (int row = 0; row < groundTruth.size(); row++) {
            for (int col = 0; col < patterns.size(); col++) {
                scores.setEntry(row, col, layerTwoFScore(groundTruth.get(row), patterns.get(col)));
            }
        }
        return scores;
    }

    public static double threeLayerPrecision(RealMatrix layerTwoScores) {
        return meanOfColumnMaxima(layerTwoScores);
    }

    public static double threeLayerRecall(RealMatrix layerTwoScores) {
        return meanOfRowMaxima(layerTwoScores);
    }

    public static double threeLayerFScore(RealMatrix layerTwoScores) {
        return f1(threeLayerPrecision(layerTwoScores), threeLayerRecall(layerTwoScores));
    }

    /**
     * Returns the (ground truth, pattern) index pairs whose establishment score reaches the threshold.
     */
    public static List<int[]> occurrenceIndices(RealMatrix establishment, double threshold) {
        List<int[]> indices = new ArrayList<>();
        for (int row = 0; row < establishment.getRowDimension(); row++) {
            for (int col = 0; col < establishment.getColumnDimension(); col++) {
                if (establishment.getEntry(row, col) >= threshold) {
                    indices.add(new int[] {row, col});
                }
            }
        }
        return indices;
    }

    /**
     * Precision of finding the occurrences of the established patterns: for every discovered pattern
     * that establishes some ground truth pattern, the best precision of its occurrences, averaged.
     * Zero when nothing is established at the threshold.
     */
    public static double occurrencePrecision(List<PatternOccurrences> groundTruth, List<PatternOccurrences> patterns,
                                             double threshold) {
        List<int[]> indices = occurrenceIndices(establishmentMatrix(groundTruth, patterns), threshold);
        if (indices.isEmpty()) {
            return 0.0;
        }
        double[] best = new double[patterns.size()];
        boolean[] established = new boolean[patterns.size()];
        for (int[] index : indices) {
            RealMatrix scores = scoreMatrix(groundTruth.get(index[0]), patterns.get(index[1]));
            best[index[1]] = Math.max(best[index[1]], meanOfColumnMaxima(scores));
            established[index[1]] = true;
        }
        return meanOfMarked(best, established);
    }

    /**
     * Recall counterpart of {@link #occurrencePrecision(List, List, double)}, averaged over the
     * established ground truth patterns.
     */
    public static double occurrenceRecall(List<PatternOccurrences> groundTruth, List<PatternOccurrences> patterns,
                                          double threshold) {
        List<int[]> indices = occurrenceIndices(establishmentMatrix(groundTruth, patterns), threshold);
        if (indices.isEmpty()) {
            return 0.0;
        }
        double[] best = new double[groundTruth.size()];
        boolean[] established = new boolean[groundTruth.size()];
        for (int[] index : indices) {
            RealMatrix scores = scoreMatrix(groundTruth.get(index[0]), patterns.get(index[1]));
            best[index[0]] = Math.max(best[index[0]], meanOfRowMaxima(scores));
            established[index[0]] = true;
        }
        return meanOfMarked(best, established);
    }

    private static double meanOfMarked(double[] values, boolean[] marked) {
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (marked[i]) {
                sum += values[i];
                count++;
            }
        }
        return sum / count;
    }

    private static double meanOfColumnMaxima(RealMatrix matrix) {
        double sum = 0.0;
        for (int col = 0; col < matrix.getColumnDimension(); col++) {
            sum += max(matrix.getColumn(col));
        }
        return sum / matrix.getColumnDimension();
    }

    private static double meanOfRowMaxima(RealMatrix matrix) {
        double sum = 0.0;
        for (int row = 0; row < matrix.getRowDimension(); row++) {
            sum += max(matrix.getRow(row));
        }
        return sum / matrix.getRowDimension();
    }

    private static int commonPoints(Pattern a, Pattern b) {
        Set<Point> common = new HashSet<>(a.getPoints());
        common.retainAll(new HashSet<>(b.getPoints()));
        return common.size();
    }

    private static double max(RealMatrix matrix) {
        double max = Double.NEGATIVE_INFINITY;
        for (int row = 0; row < matrix.getRowDimension(); row++) {
            max = Math.max(max, max(matrix.getRow(row)));
        }
        return max;
    }

    private static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }
}
