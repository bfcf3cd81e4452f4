package gr.imsi.athenarc.posemir.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.domain.Tec;
import gr.imsi.athenarc.posemir.domain.Vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PatternCsvWriterTest {

    @TempDir
    Path tempDir;

    private final PatternCsvWriter writer = new PatternCsvWriter();

    @Test
    public void testWriteTecs() throws IOException {
        Tec tec = new Tec(Pattern.of(Point.of(0, 60), Point.of(1, 62)), Arrays.asList(Vector.ZERO, Vector.of(4, 0)));
        Path file = tempDir.resolve("tecs.csv");
        writer.writeTecs(Collections.singletonList(tec), file);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(Arrays.asList(
            "tec,occurrence,onset,pitch",
            "0,0,0.0,60.0",
            "0,0,1.0,62.0",
            "0,1,4.0,60.0",
            "0,1,5.0,62.0"), lines);
    }

    @Test
    public void testWriteOccurrences() throws IOException {
        Path file = tempDir.resolve("occurrences.csv");
        writer.writeOccurrences(Arrays.asList(Pattern.of(Point.of(0.5, 60)), Pattern.of(Point.of(4.5, 60))), file);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(Arrays.asList("occurrence,onset,pitch", "0,0.5,60.0", "1,4.5,60.0"), lines);
    }

    @Test
    public void testWrittenPointSetCanBeReadBack() throws IOException {
        PointSet pointSet = PointSet.of(Point.of(0, 60), Point.of(0.25, 62), Point.of(4, 60.5));
        Path file = tempDir.resolve("points.csv");
        writer.writePointSet(pointSet, file, 2);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertTrue(lines.get(0).startsWith("#"));
        assertEquals("0.25,62.00", lines.get(2));
        assertEquals(pointSet, new PointSetCsvReader().readPointSet(file));
    }
}
