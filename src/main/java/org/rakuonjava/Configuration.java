package org.rakuonjava;

/**
 * Central configuration class for the list runtime.
 * Contains the built-in defaults; {@link RuntimeConfiguration} may override the tunable ones
 * at startup.
 */
public final class Configuration {

    // Number of source elements handed to one parallel work unit
    public static final int defaultHyperBatch = 64;
    // Maximum number of work units running at the same time
    public static final int defaultHyperDegree = 4;

    // Classpath resource holding the runtime settings
    public static final String configResource = "rakuonjava.toml";

    // Prevent instantiation
    private Configuration() {
    }
}
