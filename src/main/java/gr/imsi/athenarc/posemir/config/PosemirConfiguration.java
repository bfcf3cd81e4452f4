package gr.imsi.athenarc.posemir.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Defaults for the command line, read from {@code application.properties} on the classpath.
 */
public class PosemirConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(PosemirConfiguration.class);

    public static final String RESOURCE = "/application.properties";

    private final double maxIoi;
    private final int onsetColumn;
    private final int pitchColumn;
    private final int skipHeader;
    private final char delimiter;
    private final String pieceName;

    private PosemirConfiguration(Builder builder) {
        this.maxIoi = builder.maxIoi;
        this.onsetColumn = builder.onsetColumn;
        this.pitchColumn = builder.pitchColumn;
        this.skipHeader = builder.skipHeader;
        this.delimiter = builder.delimiter;
        this.pieceName = builder.pieceName;
    }

    public double getMaxIoi() {
        return maxIoi;
    }

    public int getOnsetColumn() {
        return onsetColumn;
    }

    public int getPitchColumn() {
        return pitchColumn;
    }

    public int getSkipHeader() {
        return skipHeader;
    }

    public char getDelimiter() {
        return delimiter;
    }

    public String getPieceName() {
        return pieceName;
    }

    /**
     * Loads the configuration from the classpath, falling back to the builder defaults for
     * anything the properties file does not set.
     */
    public static PosemirConfiguration load() {
        Properties properties = new Properties();
        try (InputStream input = PosemirConfiguration.class.getResourceAsStream(RESOURCE)) {
            if (input == null) {
                LOG.warn("Unable to find {} in resources, using defaults", RESOURCE);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(properties);
    }

    public static PosemirConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String maxIoi = properties.getProperty("posemir.maxIoi");
        if (maxIoi != null) {
            builder.maxIoi(Double.parseDouble(maxIoi.trim()));
        }
        String onsetColumn = properties.getProperty("posemir.csv.onsetColumn");
        if (onsetColumn != null) {
            builder.onsetColumn(Integer.parseInt(onsetColumn.trim()));
        }
        String pitchColumn = properties.getProperty("posemir.csv.pitchColumn");
        if (pitchColumn != null) {
            builder.pitchColumn(Integer.parseInt(pitchColumn.trim()));
        }
        String skipHeader = properties.getProperty("posemir.csv.skipHeader");
        if (skipHeader != null) {
            builder.skipHeader(Integer.parseInt(skipHeader.trim()));
        }
        String delimiter = properties.getProperty("posemir.csv.delimiter");
        if (delimiter != null && !delimiter.isEmpty()) {
            builder.delimiter(delimiter.charAt(0));
        }
        String pieceName = properties.getProperty("posemir.pieceName");
        if (pieceName != null) {
            builder.pieceName(pieceName);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double maxIoi = 1.0;
        private int onsetColumn = 0;
        private int pitchColumn = 1;
        private int skipHeader = 0;
        private char delimiter = ',';
        private String pieceName = "piece";

        public Builder maxIoi(double maxIoi) {
            this.maxIoi = maxIoi;
            return this;
        }

        public Builder onsetColumn(int onsetColumn) {
            this.onsetColumn = onsetColumn;
            return this;
        }

        public Builder pitchColumn(int pitchColumn) {
            this.pitchColumn = pitchColumn;
            return this;
        }

        public Builder skipHeader(int skipHeader) {
            this.skipHeader = skipHeader;
            return this;
        }

        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder pieceName(String pieceName) {
            this.pieceName = pieceName;
            return this;
        }

        public PosemirConfiguration build() {
            Preconditions.checkArgument(Double.isFinite(maxIoi) && maxIoi >= 0, "Max IOI must be a non-negative number, got %s", maxIoi);
            return new PosemirConfiguration(this);
        }
    }
}
