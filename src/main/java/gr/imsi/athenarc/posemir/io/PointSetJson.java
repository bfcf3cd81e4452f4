package gr.imsi.athenarc.posemir.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.PatternOccurrences;
import gr.imsi.athenarc.posemir.domain.Point;
import gr.imsi.athenarc.posemir.domain.PointSet;

/**
 * JSON representation of point sets and pattern occurrences. Points are written as
 * {@code [onset, pitch]} pairs under a {@code data} field.
 */
public class PointSetJson {

    private static final Logger LOG = LoggerFactory.getLogger(PointSetJson.class);

    private static final String REPRESENTATION = "point_set";

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public PointSet readPointSet(Path path) throws IOException {
        JsonNode root = mapper.readTree(path.toFile());
        PointSet pointSet = new PointSet(readData(root, path));
        LOG.info("Read point set '{}' of {} points from {}", root.path("piece_name").asText(""), pointSet.size(), path);
        return pointSet;
    }

    public void writePointSet(PointSet pointSet, String pieceName, Path path) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.put("piece_name", pieceName);
        root.put("representation", REPRESENTATION);
        root.set("data", toData(pointSet.getPoints()));
        mapper.writeValue(path.toFile(), root);
    }

    /**
     * Reads a single pattern, keeping the order of its points.
     */
    public Pattern readPattern(Path path) throws IOException {
        return toPattern(mapper.readTree(path.toFile()), path);
    }

    /**
     * Reads either a single pattern occurrences object or an array of them.
     */
    public List<PatternOccurrences> readPatternOccurrences(Path path) throws IOException {
        JsonNode root = mapper.readTree(path.toFile());
        List<PatternOccurrences> result = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode element : root) {
                result.add(toPatternOccurrences(element, path));
            }
        } else {
            result.add(toPatternOccurrences(root, path));
        }
        return result;
    }

    public void writePatternOccurrences(List<PatternOccurrences> patterns, Path path) throws IOException {
        ArrayNode root = mapper.createArrayNode();
        for (PatternOccurrences occurrences : patterns) {
            ObjectNode node = root.addObject();
            node.put("piece", occurrences.getPiece());
            node.set("pattern", toPatternNode(occurrences.getPattern(), occurrences.getLabel(), occurrences.getSource()));
            ArrayNode occurrenceNodes = node.putArray("occurrences");
            for (Pattern occurrence : occurrences.getOccurrences()) {
                occurrenceNodes.add(toPatternNode(occurrence, occurrences.getLabel(), occurrences.getSource()));
            }
        }
        mapper.writeValue(path.toFile(), root);
        LOG.info("Wrote {} patterns to {}", patterns.size(), path);
    }

    private PatternOccurrences toPatternOccurrences(JsonNode node, Path path) {
        JsonNode patternNode = node.path("pattern");
        Pattern pattern = toPattern(patternNode, path);
        List<Pattern> occurrences = new ArrayList<>();
        for (JsonNode occurrence : node.path("occurrences")) {
            occurrences.add(toPattern(occurrence, path));
        }
        return new PatternOccurrences(node.path("piece").asText(null), patternNode.path("label").asText(""),
            patternNode.path("source").asText(""), pattern, occurrences);
    }

    private Pattern toPattern(JsonNode node, Path path) {
        try {
            return new Pattern(readData(node, path));
        } catch (PointSetFormatException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new PointSetFormatException("Invalid pattern in " + path + ": " + e.getMessage(), e);
        }
    }

    private ObjectNode toPatternNode(Pattern pattern, String label, String source) {
        ObjectNode node = mapper.createObjectNode();
        node.put("label", label);
        node.put("source", source);
        node.put("representation", REPRESENTATION);
        node.put("dtype", "float");
        node.set("data", toData(pattern.getPoints()));
        return node;
    }

    private ArrayNode toData(List<Point> points) {
        ArrayNode data = mapper.createArrayNode();
        for (Point point : points) {
            data.addArray().add(point.getRawOnset()).add(point.getPitch());
        }
        return data;
    }

    private List<Point> readData(JsonNode node, Path path) {
        JsonNode data = node.path("data");
        if (!data.isArray() || data.size() == 0) {
            throw new PointSetFormatException("Missing or empty 'data' array in " + path);
        }
        List<Point> points = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            JsonNode row = data.get(i);
            if (!row.isArray() || row.size() < 2 || !row.get(0).isNumber() || !row.get(1).isNumber()) {
                throw new PointSetFormatException(String.format("Row %d of %s is not an [onset, pitch] pair", i, path));
            }
            try {
                points.add(Point.of(row.get(0).asDouble(), row.get(1).asDouble()));
            } catch (IllegalArgumentException e) {
                throw new PointSetFormatException(String.format("Row %d of %s is not a valid point: %s", i, path, e.getMessage()), e);
            }
        }
        return points;
    }
}
