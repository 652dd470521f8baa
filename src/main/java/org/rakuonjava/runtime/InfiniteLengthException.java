package org.rakuonjava.runtime;

import java.io.Serial;

/**
 * Thrown when an operation needs the full length of a lazy (possibly infinite) producer.
 */
public class InfiniteLengthException extends RakuRuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public InfiniteLengthException(String operation) {
        super("Cannot ." + operation + " a lazy list");
    }
}
