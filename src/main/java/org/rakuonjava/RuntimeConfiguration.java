package org.rakuonjava;

import org.tomlj.Toml;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runtime settings, read once from the TOML resource named by
 * {@link Configuration#configResource}:
 *
 * <pre>
 * [hyper]
 * batch = 64
 * degree = 4
 *
 * [debug]
 * seq = false
 * hyper = false
 * </pre>
 *
 * System properties {@code rakuonjava.hyper.batch} and {@code rakuonjava.hyper.degree}
 * override the file; {@code debug.seq} and {@code debug.hyper} switch diagnostics on.
 * Anything missing falls back to the constants in {@link Configuration}.
 */
public final class RuntimeConfiguration {

    private static volatile RuntimeConfiguration current;

    private final int hyperBatch;
    private final int hyperDegree;
    private final boolean debugSeq;
    private final boolean debugHyper;

    RuntimeConfiguration(int hyperBatch, int hyperDegree, boolean debugSeq, boolean debugHyper) {
        this.hyperBatch = hyperBatch;
        this.hyperDegree = hyperDegree;
        this.debugSeq = debugSeq;
        this.debugHyper = debugHyper;
    }

    /**
     * Returns the settings of this JVM, loading them on first use.
     */
    public static RuntimeConfiguration get() {
        RuntimeConfiguration config = current;
        if (config == null) {
            synchronized (RuntimeConfiguration.class) {
                config = current;
                if (config == null) {
                    config = load(Configuration.configResource);
                    current = config;
                }
            }
        }
        return config;
    }

    /**
     * Loads settings from a classpath resource. A missing resource gives the defaults.
     *
     * @param resourceName the resource to read
     * @return the settings
     * @throws IllegalStateException if the resource is not valid TOML
     */
    public static RuntimeConfiguration load(String resourceName) {
        ClassLoader loader = RuntimeConfiguration.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resourceName)) {
            if (in == null) {
                return fromToml(null, resourceName);
            }
            return fromToml(Toml.parse(in), resourceName);
        } catch (IOException e) {
            throw new UncheckedIOException("Can't read " + resourceName, e);
        }
    }

    /**
     * Parses settings from TOML text.
     */
    public static RuntimeConfiguration parse(String toml) {
        return fromToml(Toml.parse(toml), "<string>");
    }

    private static RuntimeConfiguration fromToml(TomlParseResult result, String sourceName) {
        long batch = Configuration.defaultHyperBatch;
        long degree = Configuration.defaultHyperDegree;
        boolean debugSeq = false;
        boolean debugHyper = false;

        if (result != null) {
            if (result.hasErrors()) {
                List<TomlParseError> errors = result.errors();
                throw new IllegalStateException("Invalid configuration in " + sourceName + ": "
                        + errors.stream().map(TomlParseError::toString).collect(Collectors.joining("; ")));
            }
            batch = result.getLong("hyper.batch", () -> Configuration.defaultHyperBatch);
            degree = result.getLong("hyper.degree", () -> Configuration.defaultHyperDegree);
            debugSeq = result.getBoolean("debug.seq", () -> false);
            debugHyper = result.getBoolean("debug.hyper", () -> false);
        }

        batch = Long.getLong("rakuonjava.hyper.batch", batch);
        degree = Long.getLong("rakuonjava.hyper.degree", degree);
        debugSeq = debugSeq || Boolean.getBoolean("debug.seq");
        debugHyper = debugHyper || Boolean.getBoolean("debug.hyper");

        if (batch < 1 || degree < 1 || batch > Integer.MAX_VALUE || degree > Integer.MAX_VALUE) {
            throw new IllegalStateException("Invalid hyper settings in " + sourceName
                    + ": batch=" + batch + ", degree=" + degree);
        }
        return new RuntimeConfiguration((int) batch, (int) degree, debugSeq, debugHyper);
    }

    public int getHyperBatch() {
        return hyperBatch;
    }

    public int getHyperDegree() {
        return hyperDegree;
    }

    public boolean isDebugSeq() {
        return debugSeq;
    }

    public boolean isDebugHyper() {
        return debugHyper;
    }

    @Override
    public String toString() {
        return "RuntimeConfiguration{hyperBatch=" + hyperBatch + ", hyperDegree=" + hyperDegree
                + ", debugSeq=" + debugSeq + ", debugHyper=" + debugHyper + "}";
    }
}
