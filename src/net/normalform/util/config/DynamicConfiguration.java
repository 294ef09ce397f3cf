package net.normalform.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(envName(key));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public Map<String, String> getData() {
        return data;
    }

    /**
     * Look up key in the local data, or in the sources in the order they
     * were added.
     * Results (including misses) are cached in the local data.
     */
    public String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        String ret = null;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) break;
        }
        data.put(key, ret);
        return ret;
    }

    public String getRaw(String key) {
        return data.get(key);
    }

    public void put(String key, String value) {
        data.put(key, value);
    }

    public void remove(String key) {
        data.remove(key);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }

    public static String envName(String key) {
        return key.toUpperCase().replace(".", "_");
    }

    public static DynamicConfiguration makeDefault() {
        return layered(PROPERTY_SOURCE, ENV_SOURCE);
    }

    /**
     * Create a configuration consulting the given sources, earlier ones
     * taking precedence.
     */
    public static DynamicConfiguration layered(Configuration... sources) {
        DynamicConfiguration ret = new DynamicConfiguration();
        for (Configuration src : sources) ret.addSource(src);
        return ret;
    }

}
