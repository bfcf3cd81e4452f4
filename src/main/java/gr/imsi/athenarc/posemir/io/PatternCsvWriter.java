package gr.imsi.athenarc.posemir.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Tec;

/**
 * Writes discovery and matching results as CSV, one point per row.
 */
public class PatternCsvWriter {

    /**
     * Writes each TEC's occurrences as rows of {@code tec, occurrence, onset, pitch}. Occurrence 0
     * is the pattern itself.
     */
    public void writeTecs(List<Tec> tecs, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            csvWriter.writeHeaders("tec", "occurrence", "onset", "pitch");
            for (int t = 0; t < tecs.size(); t++) {
                List<Pattern> occurrences = tecs.get(t).getOccurrences();
                for (int o = 0; o < occurrences.size(); o++) {
                    writePoints(csvWriter, occurrences.get(o), t, o);
                }
            }
            csvWriter.flush();
        }
    }

    /**
     * Writes matched occurrences as rows of {@code occurrence, onset, pitch}.
     */
    public void writeOccurrences(List<Pattern> occurrences, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            csvWriter.writeHeaders("occurrence", "onset", "pitch");
            for (int o = 0; o < occurrences.size(); o++) {
                for (Point point : occurrences.get(o)) {
                    csvWriter.writeRow(o, point.getRawOnset(), point.getPitch());
                }
            }
            csvWriter.flush();
        }
    }

    /**
     * Writes a point set as {@code onset, pitch} rows rounded to the given number of decimals.
     */
    public void writePointSet(PointSet pointSet, Path path, int decimalPlaces) throws IOException {
        String format = "%." + decimalPlaces + "f";
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            csvWriter.commentRow(" onset, pitch");
            for (Point point : pointSet) {
                csvWriter.writeRow(String.format(Locale.ROOT, format, point.getRawOnset()),
                    String.format(Locale.ROOT, format, point.getPitch()));
            }
            csvWriter.flush();
        }
    }

    private void writePoints(CsvWriter csvWriter, Pattern pattern, int tecIndex, int occurrenceIndex) {
        for (Point point : pattern) {
            csvWriter.writeRow(tecIndex, occurrenceIndex, point.getRawOnset(), point.getPitch());
        }
    }
}
