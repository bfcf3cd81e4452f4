package gr.imsi.athenarc.posemir.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;

/**
 * Reads points from delimited text files, one point per row. Lines starting with {@code #}
 * are comments.
 */
public class PointSetCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(PointSetCsvReader.class);

    private final int onsetColumn;
    private final int pitchColumn;
    private final int skipHeader;
    private final char delimiter;

    public PointSetCsvReader() {
        this(0, 1, 0, ',');
    }

    public PointSetCsvReader(int onsetColumn, int pitchColumn, int skipHeader, char delimiter) {
        Preconditions.checkArgument(onsetColumn >= 0 && pitchColumn >= 0, "Column indices must be non-negative");
        Preconditions.checkArgument(onsetColumn != pitchColumn, "Onset and pitch must come from different columns");
        Preconditions.checkArgument(skipHeader >= 0, "Number of header rows must be non-negative");
        this.onsetColumn = onsetColumn;
        this.pitchColumn = pitchColumn;
        this.skipHeader = skipHeader;
        this.delimiter = delimiter;
    }

    public PointSet readPointSet(Path path) throws IOException {
        return new PointSet(readPoints(path));
    }

    /**
     * Reads a pattern keeping the row order of the file.
     */
    public Pattern readPattern(Path path) throws IOException {
        List<Point> points = readPoints(path);
        try {
            return new Pattern(points);
        } catch (IllegalArgumentException e) {
            throw new PointSetFormatException("Invalid pattern in " + path + ": " + e.getMessage(), e);
        }
    }

    public List<Point> readPoints(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Point> points = readPoints(reader);
            LOG.info("Read {} points from {}", points.size(), path);
            return points;
        }
    }

    public List<Point> readPoints(Reader reader) {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(delimiter);
        settings.getFormat().setComment('#');
        settings.setNumberOfRowsToSkip(skipHeader);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setSkipEmptyLines(true);

        CsvParser parser = new CsvParser(settings);
        List<String[]> rows = parser.parseAll(reader);

        List<Point> points = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            points.add(toPoint(rows.get(i), i + skipHeader));
        }
        if (points.isEmpty()) {
            throw new PointSetFormatException("No points found");
        }
        return points;
    }

    private Point toPoint(String[] row, int rowIndex) {
        int required = Math.max(onsetColumn, pitchColumn) + 1;
        if (row.length < required) {
            throw new PointSetFormatException(String.format("Row %d has %d columns, expected at least %d", rowIndex, row.length, required));
        }
        try {
            return Point.of(parse(row[onsetColumn]), parse(row[pitchColumn]));
        } catch (IllegalArgumentException e) {
            throw new PointSetFormatException(String.format("Row %d is not a valid point: %s", rowIndex, e.getMessage()), e);
        }
    }

    private static double parse(String value) {
        if (value == null) {
            throw new NumberFormatException("empty value");
        }
        return Double.parseDouble(value.trim());
    }
}
