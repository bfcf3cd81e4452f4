package gr.imsi.athenarc.posemir.config;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PosemirConfigurationTest {

    @Test
    public void testLoadFromClasspath() {
        PosemirConfiguration config = PosemirConfiguration.load();
        assertEquals(1.0, config.getMaxIoi());
        assertEquals(0, config.getOnsetColumn());
        assertEquals(1, config.getPitchColumn());
        assertEquals(',', config.getDelimiter());
    }

    @Test
    public void testPropertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty("posemir.maxIoi", " 2.5 ");
        properties.setProperty("posemir.csv.delimiter", ";");
        properties.setProperty("posemir.csv.skipHeader", "1");
        properties.setProperty("posemir.pieceName", "bach");

        PosemirConfiguration config = PosemirConfiguration.fromProperties(properties);
        assertEquals(2.5, config.getMaxIoi());
        assertEquals(';', config.getDelimiter());
        assertEquals(1, config.getSkipHeader());
        assertEquals("bach", config.getPieceName());
        assertEquals(1, config.getPitchColumn());
    }

    @Test
    public void testInvalidMaxIoi() {
        Properties properties = new Properties();
        properties.setProperty("posemir.maxIoi", "-1");
        assertThrows(IllegalArgumentException.class, () -> PosemirConfiguration.fromProperties(properties));
        assertThrows(IllegalArgumentException.class, () -> PosemirConfiguration.builder().maxIoi(Double.NaN).build());
    }
}
