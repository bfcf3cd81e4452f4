package gr.imsi.athenarc.posemir;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Preconditions;

import gr.imsi.athenarc.posemir.config.PosemirConfiguration;
import gr.imsi.athenarc.posemir.domain.Pattern;
import gr.imsi.athenarc.posemir.domain.PointSet;
import gr.imsi.athenarc.posemir.io.PatternCsvWriter;
import gr.imsi.athenarc.posemir.io.PointSetCsvReader;
import gr.imsi.athenarc.posemir.io.PointSetJson;
import gr.imsi.athenarc.posemir.manager.QueryManager;
import gr.imsi.athenarc.posemir.query.DiscoveryQuery;
import gr.imsi.athenarc.posemir.query.DiscoveryQueryResults;
import gr.imsi.athenarc.posemir.query.MatchQuery;
import gr.imsi.athenarc.posemir.query.MatchQueryResults;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final String SOURCE = "SIATEC-C";

    @Parameter(names = "-input", description = "Point set file (.csv or .json)", required = true)
    private String input;

    @Parameter(names = "-mode", description = "Mode: 'discover' (default) to find repeated patterns or 'match' to find occurrences of a query")
    private String mode = "discover";

    @Parameter(names = "-maxIoi", description = "Maximum onset difference of the point pairs that seed translators")
    private Double maxIoi;

    @Parameter(names = "-query", description = "Query pattern file (.csv or .json), required in match mode")
    private String query;

    @Parameter(names = "-out", description = "Output file (.csv or .json); results are only logged when missing")
    private String out;

    @Parameter(names = "-piece", description = "Name of the piece written to JSON output")
    private String piece;

    @Parameter(names = "-onsetColumn", description = "CSV column of the onset")
    private Integer onsetColumn;

    @Parameter(names = "-pitchColumn", description = "CSV column of the pitch")
    private Integer pitchColumn;

    @Parameter(names = "-skipHeader", description = "Number of CSV header rows to skip")
    private Integer skipHeader;

    @Parameter(names = "-delimiter", description = "CSV delimiter")
    private String delimiter;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) {
        System.exit(run(args));
    }

    /**
     * Parses the arguments and runs the requested mode.
     *
     * @return the process exit status
     */
    static int run(String... args) {
        Main main = new Main();
        JCommander jCommander = JCommander.newBuilder().addObject(main).build();
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            jCommander.usage();
            return 1;
        }
        if (main.help) {
            jCommander.usage();
            return 0;
        }
        try {
            main.execute(PosemirConfiguration.load());
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Failed to {} on {}: ", main.mode, main.input, e);
            return 1;
        }
    }

    void execute(PosemirConfiguration config) throws IOException {
        Preconditions.checkNotNull(input, "No input file specified.");
        String pieceName = piece != null ? piece : config.getPieceName();
        PointSet pointSet = readPointSet(Paths.get(input), config);
        QueryManager queryManager = QueryManager.builder(pointSet)
            .withPieceName(pieceName)
            .build();

        String selectedMode = mode.toLowerCase(Locale.ROOT);
        if ("discover".equals(selectedMode)) {
            double bound = maxIoi != null ? maxIoi : config.getMaxIoi();
            DiscoveryQueryResults results = queryManager.executeDiscoveryQuery(new DiscoveryQuery(bound));
            if (out != null) {
                writeDiscoveryResults(results, Paths.get(out), pieceName);
            }
        } else if ("match".equals(selectedMode)) {
            Preconditions.checkArgument(query != null, "You must define a query pattern (-query) in match mode.");
            Pattern pattern = readPattern(Paths.get(query), config);
            MatchQueryResults results = queryManager.executeMatchQuery(new MatchQuery(pattern));
            if (out != null) {
                writeMatchResults(results, Paths.get(out), pieceName);
            }
        } else {
            throw new IllegalArgumentException("Unknown mode: " + mode + " (expected 'discover' or 'match')");
        }
    }

    private PointSet readPointSet(Path path, PosemirConfiguration config) throws IOException {
        if (isJson(path)) {
            return new PointSetJson().readPointSet(path);
        }
        return csvReader(config).readPointSet(path);
    }

    private Pattern readPattern(Path path, PosemirConfiguration config) throws IOException {
        if (isJson(path)) {
            return new PointSetJson().readPattern(path);
        }
        return csvReader(config).readPattern(path);
    }

    private PointSetCsvReader csvReader(PosemirConfiguration config) {
        return new PointSetCsvReader(
            onsetColumn != null ? onsetColumn : config.getOnsetColumn(),
            pitchColumn != null ? pitchColumn : config.getPitchColumn(),
            skipHeader != null ? skipHeader : config.getSkipHeader(),
            delimiter != null && !delimiter.isEmpty() ? delimiter.charAt(0) : config.getDelimiter());
    }

    private void writeDiscoveryResults(DiscoveryQueryResults results, Path path, String pieceName) throws IOException {
        if (isJson(path)) {
            new PointSetJson().writePatternOccurrences(results.toPatternOccurrences(pieceName, SOURCE), path);
        } else {
            new PatternCsvWriter().writeTecs(results.getTecs(), path);
        }
        LOG.info("Wrote {} TECs to {}", results.getResultCount(), path);
    }

    private void writeMatchResults(MatchQueryResults results, Path path, String pieceName) throws IOException {
        if (isJson(path)) {
            new PointSetJson().writePatternOccurrences(
                Collections.singletonList(results.toPatternOccurrences(pieceName, "ExactMatcher")), path);
        } else {
            new PatternCsvWriter().writeOccurrences(results.getOccurrences(), path);
        }
        LOG.info("Wrote {} occurrences to {}", results.getResultCount(), path);
    }

    private static boolean isJson(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
