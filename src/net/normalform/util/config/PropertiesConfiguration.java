package net.normalform.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        if (base == null)
            throw new NullPointerException("Properties may not be null");
        this.base = base;
    }
    public PropertiesConfiguration(File path) {
        this(loadProperties(path));
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static Properties loadProperties(File path) {
        try {
            InputStream in = new FileInputStream(path);
            try {
                return loadProperties(in);
            } finally {
                in.close();
            }
        } catch (IOException exc) {
            throw new UncheckedIOException("Could not read configuration " +
                "file " + path, exc);
        }
    }
    public static Properties loadProperties(InputStream in)
            throws IOException {
        Properties ret = new Properties();
        ret.load(in);
        return ret;
    }

    /**
     * Load a configuration from a class path resource.
     * Returns null if there is no such resource.
     */
    public static PropertiesConfiguration fromResource(String name) {
        InputStream in = PropertiesConfiguration.class.getClassLoader()
            .getResourceAsStream(name);
        if (in == null) return null;
        try {
            try {
                return new PropertiesConfiguration(loadProperties(in));
            } finally {
                in.close();
            }
        } catch (IOException exc) {
            throw new UncheckedIOException("Could not read configuration " +
                "resource " + name, exc);
        }
    }

}
