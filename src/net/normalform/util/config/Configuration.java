package net.normalform.util.config;

/**
 * A string-to-string lookup of configuration values.
 * Keys are dotted lowercase names like "normalform.fresh.prefix"; a null
 * return value means "not configured".
 */
public interface Configuration {

    Configuration NULL = new DynamicConfiguration();

    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    String get(String key);

}
