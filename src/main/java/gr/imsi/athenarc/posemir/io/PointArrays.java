package gr.imsi.athenarc.posemir.io;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.Tec;

/**
 * Converts between numeric row buffers and points.
 * <p>
 * Input rows hold at least three columns: column 2 is the raw onset, column 1 the pitch, and
 * column 0 (the rounded onset) is ignored. Output rows hold two columns: onset and pitch.
 */
public final class PointArrays {

    public static final int PITCH_COLUMN = 1;
    public static final int ONSET_COLUMN = 2;
    public static final int MIN_COLUMNS = 3;

    private PointArrays() {
    }

    public static List<Point> toPoints(double[][] rows) {
        Preconditions.checkNotNull(rows, "Point buffer must not be null");
        Preconditions.checkArgument(rows.length > 0, "Point buffer must not be empty");
        int columns = rows[0] == null ? 0 : rows[0].length;
        Preconditions.checkArgument(columns >= MIN_COLUMNS, "Point buffer needs at least %s columns, got %s", MIN_COLUMNS, columns);

        List<Point> points = new ArrayList<>(rows.length);
        for (int i = 0; i < rows.length; i++) {
            double[] row = rows[i];
            Preconditions.checkArgument(row != null && row.length == columns,
                "Row %s has %s columns, expected %s", i, row == null ? 0 : row.length, columns);
            double onset = row[ONSET_COLUMN];
            double pitch = row[PITCH_COLUMN];
            Preconditions.checkArgument(Double.isFinite(onset) && Double.isFinite(pitch),
                "Row %s has a non-finite coordinate (%s, %s)", i, onset, pitch);
            points.add(Point.of(onset, pitch));
        }
        return points;
    }

    public static double[][] toArray(Pattern pattern) {
        double[][] rows = new double[pattern.size()][2];
        for (int i = 0; i < pattern.size(); i++) {
            Point point = pattern.get(i);
            rows[i][0] = point.getRawOnset();
            rows[i][1] = point.getPitch();
        }
        return rows;
    }

    /**
     * Returns the TEC's pattern followed by one array per occurrence, the pattern itself included.
     */
    public static List<double[][]> toArrays(Tec tec) {
        List<double[][]> arrays = new ArrayList<>(tec.getTranslators().size() + 1);
        arrays.add(toArray(tec.getPattern()));
        for (Pattern occurrence : tec.getOccurrences()) {
            arrays.add(toArray(occurrence));
        }
        return arrays;
    }
}
