package org.rakuonjava.runtime;

import org.rakuonjava.RuntimeConfiguration;

/**
 * Work distribution settings of a parallel sequence.
 *
 * @param batch  number of source elements handed to one work unit
 * @param degree maximum number of work units running at the same time
 */
public record HyperConfiguration(int batch, int degree) {

    public HyperConfiguration {
        if (batch < 1) {
            throw new IllegalArgumentException("batch must be at least 1, got " + batch);
        }
        if (degree < 1) {
            throw new IllegalArgumentException("degree must be at least 1, got " + degree);
        }
    }

    /**
     * @return the settings from {@link RuntimeConfiguration}
     */
    public static HyperConfiguration defaults() {
        RuntimeConfiguration config = RuntimeConfiguration.get();
        return new HyperConfiguration(config.getHyperBatch(), config.getHyperDegree());
    }
}
