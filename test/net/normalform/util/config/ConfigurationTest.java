package net.normalform.util.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.FileWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ConfigurationTest {

    @TempDir
    File tempDir;

    @Test
    public void testLayeredPrecedence() {
        Properties hi = new Properties();
        hi.setProperty("k", "high");
        Properties lo = new Properties();
        lo.setProperty("k", "low");
        lo.setProperty("only.low", "x");
        DynamicConfiguration conf = DynamicConfiguration.layered(
            new PropertiesConfiguration(hi), new PropertiesConfiguration(lo));
        assertEquals("high", conf.get("k"));
        assertEquals("x", conf.get("only.low"));
        assertNull(conf.get("missing"));
    }

    @Test
    public void testLocalDataAndCaching() {
        Properties src = new Properties();
        src.setProperty("k", "first");
        DynamicConfiguration conf = DynamicConfiguration.layered(
            new PropertiesConfiguration(src));
        assertNull(conf.getRaw("k"));
        assertEquals("first", conf.get("k"));
        src.setProperty("k", "second");
        // Cached.
        assertEquals("first", conf.get("k"));
        conf.remove("k");
        assertEquals("second", conf.get("k"));
        conf.put("k", "local");
        assertEquals("local", conf.get("k"));
        assertTrue(conf.getData().containsKey("k"));
    }

    @Test
    public void testSystemPropertySource() {
        String key = "normalform.test.configuration.probe";
        System.setProperty(key, "yes");
        try {
            assertEquals("yes", DynamicConfiguration.makeDefault().get(key));
        } finally {
            System.clearProperty(key);
        }
        assertEquals("NORMALFORM_FRESH_PREFIX",
                     DynamicConfiguration.envName("normalform.fresh.prefix"));
        assertNull(Configuration.NULL.get(key));
    }

    @Test
    public void testPropertiesFromFile() throws Exception {
        File file = new File(tempDir, "test.properties");
        Writer w = new FileWriter(file);
        try {
            w.write("normalform.fresh.prefix = Y\n");
        } finally {
            w.close();
        }
        PropertiesConfiguration conf = new PropertiesConfiguration(file);
        assertEquals("Y", conf.get("normalform.fresh.prefix"));
        assertThrows(UncheckedIOException.class,
            () -> new PropertiesConfiguration(new File(tempDir, "absent")));
    }

    @Test
    public void testPropertiesFromResource() {
        PropertiesConfiguration conf = PropertiesConfiguration.fromResource(
            "normalform-test.properties");
        assertNotNull(conf);
        assertEquals("N_", conf.get("normalform.fresh.prefix"));
        assertNull(PropertiesConfiguration.fromResource("absent.properties"));
    }

}
